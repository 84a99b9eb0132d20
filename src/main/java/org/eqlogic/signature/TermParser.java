package org.eqlogic.signature;

import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.TermSyntaxException;
import org.eqlogic.errors.UnknownSymbolException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 按签名解析项的文本形式，例如 {@code mul(inv(x), x)}。
 * <ul>
 *   <li>签名中声明过的标识符是运算应用，常量可以省略括号；</li>
 *   <li>其余标识符是变量，排序取 {@link #withVariable} 指定的排序，否则取签名的默认排序。</li>
 * </ul>
 * 标识符由字母、数字、下划线和撇号组成，不能以数字开头。
 * <p>
 * 严格模式（{@link #strict()}）下，未声明的标识符只有在用 {@link #withVariable} 指定过，
 * 或形如 {@code x}、{@code a1}、{@code b'}（一个小写字母加可选的数字和撇号）时才是变量，
 * 其余一律视为未知符号，避免把拼错的常量当成全称变量。
 * @author Ayalyt
 */
public final class TermParser {

    private static final Logger logger = LoggerFactory.getLogger(TermParser.class);

    private final Signature signature;
    private static final Pattern VARIABLE_NAME = Pattern.compile("[a-z][0-9]*'*");

    private final Map<String, Sort> variableSorts = new HashMap<>();
    private boolean strict;

    private String input;
    private int pos;

    public TermParser(Signature signature) {
        this.signature = Objects.requireNonNull(signature, "Signature cannot be null");
    }

    /**
     * 指定某个变量名的排序（多排序签名中使用）。
     * @return this，便于链式调用。
     */
    public TermParser withVariable(String name, Sort sort) {
        variableSorts.put(Objects.requireNonNull(name), Objects.requireNonNull(sort));
        return this;
    }

    /**
     * 切换到严格模式。
     * @return this，便于链式调用。
     */
    public TermParser strict() {
        this.strict = true;
        return this;
    }

    /**
     * 解析单个项。
     * @throws TermSyntaxException 如果文本不合语法。
     * @throws UnknownSymbolException 如果未声明的标识符后面跟着参数列表，或在严格模式下不是变量名。
     */
    public Term parse(String text) {
        begin(text);
        Term term = parseTerm();
        expectEnd();
        logger.debug("解析项 '{}' 得到 {}", text, term);
        return term;
    }

    /**
     * 解析形如 {@code lhs = rhs} 的等式。
     */
    public Equation parseEquation(String text) {
        begin(text);
        Term lhs = parseTerm();
        skipWhitespace();
        expect('=');
        Term rhs = parseTerm();
        expectEnd();
        Equation equation = Equation.of(lhs, rhs);
        logger.debug("解析等式 '{}' 得到 {}", text, equation);
        return equation;
    }

    private void begin(String text) {
        this.input = Objects.requireNonNull(text, "Text cannot be null");
        this.pos = 0;
    }

    private Term parseTerm() {
        skipWhitespace();
        int start = pos;
        String identifier = parseIdentifier();
        skipWhitespace();
        Optional<Operation> operation = signature.lookup(identifier);
        boolean hasArguments = peek() == '(';

        if (operation.isEmpty()) {
            if (hasArguments) {
                logger.error("签名 {} 中不存在运算 {}", signature.getName(), identifier);
                throw new UnknownSymbolException("签名 " + signature.getName() + " 中不存在运算 " + identifier);
            }
            if (strict && !variableSorts.containsKey(identifier) && !VARIABLE_NAME.matcher(identifier).matches()) {
                logger.error("签名 {} 中不存在符号 {}，它也不是变量名", signature.getName(), identifier);
                throw new UnknownSymbolException("签名 " + signature.getName() + " 中不存在符号 " + identifier
                        + "，它也不是变量名");
            }
            return Variable.of(identifier, variableSort(identifier, start));
        }

        List<Term> arguments = new ArrayList<>();
        if (hasArguments) {
            expect('(');
            skipWhitespace();
            if (peek() != ')') {
                arguments.add(parseTerm());
                skipWhitespace();
                while (peek() == ',') {
                    expect(',');
                    arguments.add(parseTerm());
                    skipWhitespace();
                }
            }
            expect(')');
        }
        if (arguments.size() != operation.get().getArity()) {
            throw new TermSyntaxException(start, "运算 " + identifier + " 需要 "
                    + operation.get().getArity() + " 个参数，实际有 " + arguments.size() + " 个");
        }
        return Application.of(operation.get(), arguments);
    }

    private Sort variableSort(String name, int offset) {
        Sort sort = variableSorts.get(name);
        if (sort != null) {
            return sort;
        }
        return signature.getDefaultSort().orElseThrow(() ->
                new TermSyntaxException(offset, "无法确定变量 " + name + " 的排序：签名没有默认排序"));
    }

    private String parseIdentifier() {
        int start = pos;
        if (pos >= input.length() || !isIdentifierStart(input.charAt(pos))) {
            throw new TermSyntaxException(pos, "此处应为标识符，实际为 " + describe(peek()));
        }
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw new TermSyntaxException(pos, "此处应为 '" + expected + "'，实际为 " + describe(peek()));
        }
        pos++;
    }

    private void expectEnd() {
        skipWhitespace();
        if (pos != input.length()) {
            throw new TermSyntaxException(pos, "多余的输入: " + input.substring(pos));
        }
    }

    private static String describe(int c) {
        return c == -1 ? "EOF" : "'" + (char) c + "'";
    }
}
