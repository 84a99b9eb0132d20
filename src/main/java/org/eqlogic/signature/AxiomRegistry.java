package org.eqlogic.signature;

import org.eqlogic.core.Operation;
import org.eqlogic.derivation.DerivationChain;
import org.eqlogic.errors.DuplicateEquationException;
import org.eqlogic.errors.IllTypedEquationException;
import org.eqlogic.errors.SortMismatchException;
import org.eqlogic.errors.UnknownSymbolException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 公理与引理的注册表，只追加、不删除。
 * 条目一旦登记就不可变，因此已验证的推导链永远不会被事后推翻。
 * <p>
 * 条目按名称索引，同时按左右两侧的根运算索引，以便按模式查找。
 * 写操作（登记公理、假设、引理）互斥；读操作可以并发。
 * <p>
 * 通过 {@link #extend(Signature)} 可以得到子作用域：子作用域能看到父作用域的全部条目，
 * 可以登记局部假设和引理，但不会修改父作用域。
 * @author Ayalyt
 */
public final class AxiomRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AxiomRegistry.class);

    // 根运算为变量时的索引键
    private static final String WILDCARD = "*";

    private final Signature signature;
    private final AxiomRegistry parent;
    // 父子作用域共享同一计数器，序号在整个作用域链上单调递增
    private final AtomicLong sequence;

    private final Map<String, RegisteredEquation> entries = new LinkedHashMap<>();
    private final Map<Side, Map<String, List<RegisteredEquation>>> patternIndex = new EnumMap<>(Side.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public AxiomRegistry(Signature signature) {
        this(signature, null, new AtomicLong(0));
    }

    private AxiomRegistry(Signature signature, AxiomRegistry parent, AtomicLong sequence) {
        this.signature = Objects.requireNonNull(signature, "Signature cannot be null");
        this.parent = parent;
        this.sequence = sequence;
        for (Side side : Side.values()) {
            patternIndex.put(side, new LinkedHashMap<>());
        }
    }

    public Signature getSignature() {
        return signature;
    }

    public Optional<AxiomRegistry> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * 创建子作用域。子签名必须包含父签名的全部运算，通常由 {@link Signature#extending} 得到。
     * @param extendedSignature 子作用域使用的签名。
     * @return 新的子注册表。
     */
    public AxiomRegistry extend(Signature extendedSignature) {
        Objects.requireNonNull(extendedSignature, "Extended signature cannot be null");
        for (Operation operation : signature.getOperations()) {
            if (!extendedSignature.contains(operation)) {
                logger.error("签名 {} 没有包含父签名的运算 {}", extendedSignature.getName(), operation);
                throw new IllegalArgumentException("签名 " + extendedSignature.getName()
                        + " 没有包含父签名 " + signature.getName() + " 的运算 " + operation);
            }
        }
        logger.info("从签名 {} 的注册表扩展出子作用域，签名 {}", signature.getName(), extendedSignature.getName());
        return new AxiomRegistry(extendedSignature, this, sequence);
    }

    public AxiomRegistry extend() {
        return extend(signature);
    }

    /**
     * 登记一条公理。
     * @param name 公理名称，在作用域链上唯一。
     * @param equation 公理等式。
     * @return 登记后的 Axiom。
     * @throws IllTypedEquationException 如果某一侧在当前签名下不是良构的。
     * @throws SortMismatchException 如果两侧排序不同。
     * @throws DuplicateEquationException 如果名称已被占用。
     */
    public Axiom declareAxiom(String name, Equation equation) {
        validate(equation);
        lock.writeLock().lock();
        try {
            checkNameAvailable(name);
            Axiom axiom = new Axiom(name, equation, sequence.getAndIncrement());
            admit(axiom);
            logger.info("登记公理 {}: {}", name, equation);
            return axiom;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 用文本登记公理，例如 {@code "mul(e, a) = a"}。
     * 变量名只能是一个小写字母加可选的数字和撇号，其余未声明的标识符被拒绝。
     * @throws IllTypedEquationException 如果文本引用了签名中不存在的符号。
     */
    public Axiom declareAxiom(String name, String equationText) {
        return declareAxiom(name, parseStrict(equationText));
    }

    /**
     * 在子作用域中登记局部假设。
     * @throws IllegalStateException 如果在根作用域上调用。
     */
    public Hypothesis assume(String name, Equation equation) {
        if (parent == null) {
            logger.error("假设 {} 只能在扩展出来的子作用域中登记", name);
            throw new IllegalStateException("假设只能在扩展出来的子作用域中登记: " + name);
        }
        validate(equation);
        lock.writeLock().lock();
        try {
            checkNameAvailable(name);
            Hypothesis hypothesis = new Hypothesis(name, equation, sequence.getAndIncrement());
            admit(hypothesis);
            logger.info("登记假设 {}: {}", name, equation);
            return hypothesis;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Hypothesis assume(String name, String equationText) {
        return assume(name, parseStrict(equationText));
    }

    /**
     * 按严格模式解析等式文本：引用未声明符号的等式是不良构的。
     * @throws IllTypedEquationException 如果文本引用了签名中不存在的符号。
     */
    private Equation parseStrict(String equationText) {
        try {
            return new TermParser(signature).strict().parseEquation(equationText);
        } catch (UnknownSymbolException e) {
            logger.error("等式 '{}' 引用了未声明的符号: {}", equationText, e.getMessage());
            throw new IllTypedEquationException("等式 '" + equationText + "' 不是良构的: " + e.getMessage(), e);
        }
    }

    /**
     * 登记一条已验证的引理。只应由推导验证器在验证成功后调用。
     * 同名同等式的引理已经存在时，不再追加，返回携带新推导链的引理对象。
     * @param name 引理名称。
     * @param equation 被证明的等式。
     * @param derivation 证明它的推导链。
     * @return 引理。
     * @throws DuplicateEquationException 如果名称已被另一条不同的等式占用。
     */
    public Lemma registerLemma(String name, Equation equation, DerivationChain derivation) {
        validate(equation);
        lock.writeLock().lock();
        try {
            Optional<RegisteredEquation> existing = lookup(name);
            if (existing.isPresent()) {
                RegisteredEquation entry = existing.get();
                if (!entry.getEquation().equals(equation)) {
                    logger.error("名称 {} 已被 {} 占用", name, entry);
                    throw new DuplicateEquationException("名称 " + name + " 已被 " + entry + " 占用");
                }
                logger.info("引理 {} 已存在，本次验证不再重复登记", name);
                return new Lemma(name, equation, entry.getSequence(), derivation);
            }
            Lemma lemma = new Lemma(name, equation, sequence.getAndIncrement(), derivation);
            admit(lemma);
            logger.info("登记引理 {}: {}（推导 {} 步）", name, equation, derivation.length());
            return lemma;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 检查等式能否登记：两侧在当前签名下良构，且排序一致。
     */
    public void validate(Equation equation) {
        Objects.requireNonNull(equation, "Equation cannot be null");
        signature.checkWellFormed(equation.getLhs());
        signature.checkWellFormed(equation.getRhs());
        if (!equation.isSortConsistent()) {
            logger.error("等式 {} 两侧排序不同: {} vs {}", equation, equation.getLhs().getSort(), equation.getRhs().getSort());
            throw new SortMismatchException("等式 " + equation + " 两侧排序不同: "
                    + equation.getLhs().getSort() + " vs " + equation.getRhs().getSort());
        }
    }

    private void checkNameAvailable(String name) {
        Objects.requireNonNull(name, "Equation name cannot be null");
        Optional<RegisteredEquation> existing = lookup(name);
        if (existing.isPresent()) {
            logger.error("名称 {} 已被 {} 占用", name, existing.get());
            throw new DuplicateEquationException("名称 " + name + " 已被 " + existing.get() + " 占用");
        }
    }

    private void admit(RegisteredEquation entry) {
        entries.put(entry.getName(), entry);
        for (Side side : Side.values()) {
            patternIndex.get(side)
                    .computeIfAbsent(indexKey(side.of(entry.getEquation())), k -> new ArrayList<>())
                    .add(entry);
        }
    }

    private static String indexKey(Term term) {
        return term instanceof Application ? ((Application) term).getOperation().getName() : WILDCARD;
    }

    /**
     * 按名称查找条目，先查本作用域，再查父作用域。
     */
    public Optional<RegisteredEquation> lookup(String name) {
        lock.readLock().lock();
        try {
            RegisteredEquation entry = entries.get(name);
            if (entry != null) {
                return Optional.of(entry);
            }
        } finally {
            lock.readLock().unlock();
        }
        return parent == null ? Optional.empty() : parent.lookup(name);
    }

    /**
     * 按名称查找序号小于 bound 的条目。
     * 推导验证用它保证只引用验证开始前已经登记的条目。
     */
    public Optional<RegisteredEquation> lookupBefore(String name, long bound) {
        return lookup(name).filter(entry -> entry.getSequence() < bound);
    }

    /**
     * @return 下一个将被分配的序号；所有已登记条目的序号都小于它。
     */
    public long currentSequence() {
        return sequence.get();
    }

    /**
     * 按某一侧的根运算查找条目，包括父作用域中的条目。
     * @param side 查找左侧还是右侧。
     * @param operation 根运算。
     * @return 该侧根运算为 operation 的条目，按登记顺序。
     */
    public List<RegisteredEquation> findByPattern(Side side, Operation operation) {
        return collectIndexed(side, operation.getName());
    }

    /**
     * 查找某一侧可能在根部匹配给定项的条目：根运算相同的，以及该侧是变量的。
     */
    public List<RegisteredEquation> findCandidates(Side side, Term term) {
        List<RegisteredEquation> result = new ArrayList<>();
        if (term instanceof Application) {
            result.addAll(collectIndexed(side, ((Application) term).getOperation().getName()));
        }
        result.addAll(collectIndexed(side, WILDCARD));
        result.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
        return result;
    }

    private List<RegisteredEquation> collectIndexed(Side side, String key) {
        List<RegisteredEquation> result = new ArrayList<>();
        if (parent != null) {
            result.addAll(parent.collectIndexed(side, key));
        }
        lock.readLock().lock();
        try {
            result.addAll(patternIndex.get(side).getOrDefault(key, Collections.emptyList()));
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    /**
     * @return 作用域链上的全部条目，父作用域的在前，各自按登记顺序。
     */
    public List<RegisteredEquation> getEntries() {
        List<RegisteredEquation> result = new ArrayList<>();
        if (parent != null) {
            result.addAll(parent.getEntries());
        }
        lock.readLock().lock();
        try {
            result.addAll(entries.values());
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableList(result);
    }

    public List<RegisteredEquation> getEntries(EquationKind kind) {
        return getEntries().stream()
                .filter(entry -> entry.getKind() == kind)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<RegisteredEquation> getAxioms() {
        return getEntries(EquationKind.AXIOM);
    }

    public List<RegisteredEquation> getLemmas() {
        return getEntries(EquationKind.LEMMA);
    }

    public int size() {
        return getEntries().size();
    }

    @Override
    public String toString() {
        return "AxiomRegistry(" + signature.getName() + ", " + size() + " entries)";
    }
}
