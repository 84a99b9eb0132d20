package org.eqlogic.signature;

import lombok.Getter;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.DuplicateOperationException;
import org.eqlogic.errors.IllTypedEquationException;
import org.eqlogic.errors.SortMismatchException;
import org.eqlogic.errors.UnknownSymbolException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 代表一个代数签名：已声明的排序和带类型的运算。
 * 签名只追加、不删除，已声明的运算永远有效，因此基于它验证过的推导不会失效。
 * 公理不在这里，而在独立的 {@link AxiomRegistry} 中，两者通过运算引用关联。
 * <p>
 * 读操作取读锁，声明操作取写锁。
 * @author Ayalyt
 */
public final class Signature {

    private static final Logger logger = LoggerFactory.getLogger(Signature.class);

    @Getter
    private final String name;
    private final Map<String, Sort> sorts = new LinkedHashMap<>();
    private final Map<String, Operation> operations = new LinkedHashMap<>();
    private Sort defaultSort;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Signature(String name) {
        this.name = Objects.requireNonNull(name, "Signature name cannot be null");
        logger.debug("创建 Signature: {}", name);
    }

    /**
     * 工厂方法：创建只有一个排序的签名，该排序同时作为默认排序。
     * @param name 签名名称。
     * @param sortName 唯一排序的名称。
     * @return Signature 实例。
     */
    public static Signature singleSorted(String name, String sortName) {
        Signature signature = new Signature(name);
        signature.declareSort(sortName);
        return signature;
    }

    /**
     * 工厂方法：通过组合已有签名来构造新签名（集合并，带冲突检测）。
     * 新签名按引用导入各基签名的排序和运算，之后可以继续声明新的运算；基签名本身不受影响。
     * 默认排序取第一个有默认排序的基签名。
     * @param name 新签名的名称。
     * @param bases 被导入的基签名。
     * @return 新的 Signature 实例。
     * @throws DuplicateOperationException 如果两个基签名中同名运算的类型不同。
     */
    public static Signature extending(String name, Signature... bases) {
        Signature signature = new Signature(name);
        for (Signature base : bases) {
            signature.importFrom(base);
        }
        logger.info("签名 {} 由 {} 组合而成，共 {} 个运算",
                name,
                Arrays.stream(bases).map(Signature::getName).collect(Collectors.toList()),
                signature.getOperations().size());
        return signature;
    }

    /**
     * 将另一个签名的排序和运算并入此签名。
     * 同名且同类型的运算视为同一个运算；同名但类型不同则冲突。
     * 冲突时此签名保持不变。
     * @throws DuplicateOperationException 如果存在同名但类型不同的运算。
     */
    public void importFrom(Signature base) {
        Objects.requireNonNull(base, "Base signature cannot be null");
        if (base == this) {
            return;
        }
        List<Sort> baseSorts = base.getSorts();
        List<Operation> baseOperations = base.getOperations();
        Optional<Sort> baseDefault = base.getDefaultSort();
        lock.writeLock().lock();
        try {
            for (Operation operation : baseOperations) {
                Operation existing = operations.get(operation.getName());
                if (existing != null && existing.conflictsWith(operation)) {
                    logger.error("合并签名 {} 时运算冲突: {} vs {}", base.getName(), existing, operation);
                    throw new DuplicateOperationException("运算 " + operation.getName() + " 在签名 "
                            + name + " 中已声明为 " + existing + "，与 " + operation + " 冲突");
                }
            }
            for (Sort sort : baseSorts) {
                sorts.putIfAbsent(sort.getName(), sort);
            }
            for (Operation operation : baseOperations) {
                operations.putIfAbsent(operation.getName(), operation);
            }
            if (defaultSort == null && baseDefault.isPresent()) {
                defaultSort = baseDefault.get();
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("签名 {} 导入了签名 {}", name, base.getName());
    }

    /**
     * 声明一个排序。重复声明同名排序返回已有的排序。
     * 第一个声明的排序成为默认排序。
     * @param sortName 排序名称。
     * @return 对应的 Sort。
     */
    public Sort declareSort(String sortName) {
        lock.writeLock().lock();
        try {
            Sort existing = sorts.get(sortName);
            if (existing != null) {
                logger.warn("排序 {} 已在签名 {} 中声明", sortName, name);
                return existing;
            }
            Sort sort = Sort.of(sortName);
            sorts.put(sortName, sort);
            if (defaultSort == null) {
                defaultSort = sort;
            }
            logger.info("签名 {} 声明了排序 {}", name, sort);
            return sort;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 在默认排序上声明一个运算（单排序签名的便捷方法）。
     * @param operationName 运算名称。
     * @param arity 元数。
     * @return 声明的 Operation。
     * @throws DuplicateOperationException 如果名称已被占用。
     * @throws IllegalStateException 如果签名还没有任何排序。
     */
    public Operation declareOperation(String operationName, int arity) {
        Sort sort = getDefaultSort().orElseThrow(() -> {
            logger.error("签名 {} 没有默认排序，无法声明运算 {}", name, operationName);
            return new IllegalStateException("签名 " + name + " 没有默认排序");
        });
        return declare(Operation.of(operationName, arity, sort));
    }

    public Operation declareOperation(String operationName, List<Sort> argumentSorts, Sort resultSort) {
        return declare(Operation.of(operationName, argumentSorts, resultSort));
    }

    public Operation declareConstant(String operationName) {
        return declareOperation(operationName, 0);
    }

    /**
     * 声明一个运算。
     * @param operation 要声明的运算。
     * @return 该运算。
     * @throws DuplicateOperationException 如果名称已被占用。
     * @throws SortMismatchException 如果运算引用了未声明的排序。
     */
    public Operation declare(Operation operation) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        lock.writeLock().lock();
        try {
            if (operations.containsKey(operation.getName())) {
                logger.error("运算 {} 已在签名 {} 中声明", operation.getName(), name);
                throw new DuplicateOperationException("运算 " + operation.getName() + " 已在签名 " + name + " 中声明");
            }
            List<Sort> referenced = new ArrayList<>(operation.getArgumentSorts());
            referenced.add(operation.getResultSort());
            for (Sort sort : referenced) {
                if (!sort.equals(sorts.get(sort.getName()))) {
                    logger.error("运算 {} 引用了未声明的排序 {}", operation.getName(), sort);
                    throw new SortMismatchException("运算 " + operation.getName() + " 引用了未声明的排序 " + sort);
                }
            }
            operations.put(operation.getName(), operation);
            logger.info("签名 {} 声明了运算 {}", name, operation);
            return operation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Operation> lookup(String operationName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(operations.get(operationName));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按名称获取运算。
     * @throws UnknownSymbolException 如果运算不存在。
     */
    public Operation require(String operationName) {
        return lookup(operationName).orElseThrow(() -> {
            logger.error("签名 {} 中不存在运算 {}", name, operationName);
            return new UnknownSymbolException("签名 " + name + " 中不存在运算 " + operationName);
        });
    }

    public Optional<Sort> lookupSort(String sortName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sorts.get(sortName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Sort> getDefaultSort() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(defaultSort);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(Operation operation) {
        return lookup(operation.getName()).map(operation::equals).orElse(false);
    }

    public boolean containsSort(Sort sort) {
        return lookupSort(sort.getName()).map(sort::equals).orElse(false);
    }

    public List<Operation> getOperations() {
        lock.readLock().lock();
        try {
            return List.copyOf(operations.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Sort> getSorts() {
        lock.readLock().lock();
        try {
            return List.copyOf(sorts.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 检查项在此签名下是否良构：每个运算都已声明，参数个数和参数排序都与声明一致，
     * 变量的排序都已声明。
     * @param term 要检查的项。
     * @throws IllTypedEquationException 如果项不是良构的，消息中给出第一个问题。
     */
    public void checkWellFormed(Term term) {
        findIllFormedness(term).ifPresent(reason -> {
            logger.error("项 {} 在签名 {} 下不是良构的: {}", term, name, reason);
            throw new IllTypedEquationException("项 " + term + " 在签名 " + name + " 下不是良构的: " + reason);
        });
    }

    public boolean isWellFormed(Term term) {
        return findIllFormedness(term).isEmpty();
    }

    private Optional<String> findIllFormedness(Term term) {
        if (term instanceof Variable) {
            Variable variable = (Variable) term;
            return containsSort(variable.getSort())
                    ? Optional.empty()
                    : Optional.of("变量 " + variable + " 的排序 " + variable.getSort() + " 未声明");
        }
        Application application = (Application) term;
        Operation operation = application.getOperation();
        if (!contains(operation)) {
            return Optional.of("运算 " + operation + " 未声明");
        }
        if (application.getArity() != operation.getArity()) {
            return Optional.of("运算 " + operation.getName() + " 需要 " + operation.getArity()
                    + " 个参数，实际有 " + application.getArity() + " 个");
        }
        for (int i = 0; i < application.getArity(); i++) {
            Term argument = application.getArgument(i);
            Sort expected = operation.getArgumentSorts().get(i);
            if (!argument.getSort().equals(expected)) {
                return Optional.of("运算 " + operation.getName() + " 的第 " + i + " 个参数应为排序 "
                        + expected + "，实际为 " + argument.getSort());
            }
            Optional<String> nested = findIllFormedness(argument);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Signature(" + name + ", sorts=" + getSorts() + ", operations=" + getOperations() + ")";
    }
}
