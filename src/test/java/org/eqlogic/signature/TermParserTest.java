package org.eqlogic.signature;

import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.errors.TermSyntaxException;
import org.eqlogic.errors.UnknownSymbolException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermParserTest {

    private static Signature signature;
    private static Sort g, bool;
    private static Operation mul, inv, e, ePrime, isE;

    @BeforeAll
    static void setUp() {
        signature = Signature.singleSorted("Group", "G");
        g = signature.getDefaultSort().orElseThrow();
        bool = signature.declareSort("Bool");
        mul = signature.declareOperation("mul", 2);
        inv = signature.declareOperation("inv", 1);
        e = signature.declareConstant("e");
        ePrime = signature.declareConstant("e'");
        isE = signature.declareOperation("isE", List.of(g), bool);
    }

    @Test
    @DisplayName("解析嵌套的项，未声明的标识符是默认排序的变量")
    void testParseNestedTerm() {
        Term parsed = new TermParser(signature).parse("mul(inv(a), mul(e, e'))");
        Variable a = Variable.of("a", g);
        Term expected = Application.of(mul, Application.of(inv, a), Application.of(mul, Application.of(e), Application.of(ePrime)));
        assertEquals(expected, parsed);
    }

    @Test
    @DisplayName("解析等式")
    void testParseEquation() {
        Equation eq = new TermParser(signature).parseEquation("mul(inv(a), a) = e");
        Variable a = Variable.of("a", g);
        assertAll(
                () -> assertEquals(Application.of(mul, Application.of(inv, a), a), eq.getLhs()),
                () -> assertEquals(Application.of(e), eq.getRhs())
        );
    }

    @Test
    @DisplayName("可以为变量指定非默认排序")
    void testVariableWithExplicitSort() {
        Term parsed = new TermParser(signature).withVariable("p", bool).parse("p");
        assertEquals(Variable.of("p", bool), parsed);
    }

    @Test
    @DisplayName("严格模式：未声明的标识符必须是变量名或显式指定的变量")
    void testStrictMode() {
        assertAll(
                () -> assertThrows(UnknownSymbolException.class, () -> new TermParser(signature).strict().parse("mul(ee, a)")),
                () -> assertThrows(UnknownSymbolException.class, () -> new TermParser(signature).strict().parse("elem")),
                () -> assertEquals(Variable.of("x1", g), new TermParser(signature).strict().parse("x1")),
                () -> assertEquals(Variable.of("b'", g), new TermParser(signature).strict().parse("b'")),
                () -> assertEquals(Variable.of("elem", g),
                        new TermParser(signature).withVariable("elem", g).strict().parse("elem")),
                () -> assertEquals(Variable.of("ee", g), new TermParser(signature).parse("ee"), "非严格模式下仍是变量")
        );
    }

    @Test
    @DisplayName("语法错误和未知运算")
    void testErrors() {
        TermParser parser = new TermParser(signature);
        assertAll(
                () -> assertThrows(UnknownSymbolException.class, () -> parser.parse("div(a, b)")),
                () -> assertThrows(TermSyntaxException.class, () -> parser.parse("mul(a)")),
                () -> assertThrows(TermSyntaxException.class, () -> parser.parse("mul(a, b")),
                () -> assertThrows(TermSyntaxException.class, () -> parser.parse("mul(a, b) c")),
                () -> assertThrows(TermSyntaxException.class, () -> parser.parseEquation("mul(a, b)"))
        );
    }
}
