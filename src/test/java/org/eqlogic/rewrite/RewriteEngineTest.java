package org.eqlogic.rewrite;

import org.eqlogic.core.Operation;
import org.eqlogic.errors.IllTypedEquationException;
import org.eqlogic.errors.PositionOutOfBoundsException;
import org.eqlogic.errors.UnificationFailedException;
import org.eqlogic.errors.UnknownEquationException;
import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Substitution;
import org.eqlogic.expressions.Term;
import org.eqlogic.expressions.Variable;
import org.eqlogic.signature.RegisteredEquation;
import org.eqlogic.theories.GroupTheory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.eqlogic.theories.GroupTheory.*;
import static org.junit.jupiter.api.Assertions.*;

class RewriteEngineTest {

    private GroupTheory group;
    private RewriteEngine engine;
    private Variable a, x;

    @BeforeEach
    void setUp() {
        group = new GroupTheory();
        engine = new RewriteEngine(group.getRegistry());
        a = Variable.of("a", group.getSort());
        x = Variable.of("x", group.getSort());
    }

    @Nested
    @DisplayName("单步重写")
    class ApplyStepTests {

        @Test
        @DisplayName("从左到右：mul(e, x) → x")
        void testForwardAtRoot() {
            Term result = engine.applyStep(group.mul(group.e(), x), DerivationStep.forward(LEFT_IDENTITY, Position.ROOT));
            assertEquals(x, result);
        }

        @Test
        @DisplayName("在内部位置重写，其余部分不变")
        void testForwardAtInnerPosition() {
            Term term = group.mul(x, group.mul(group.inv(x), x));
            Term result = engine.applyStep(term, DerivationStep.forward(LEFT_INVERSE, Position.of(1)));
            assertEquals(group.mul(x, group.e()), result);
        }

        @Test
        @DisplayName("从右到左时，由代换给出匹配无法确定的变量")
        void testBackwardWithHint() {
            Term result = engine.applyStep(group.e(),
                    DerivationStep.backward(LEFT_INVERSE, Position.ROOT, Substitution.of(a, group.inv(x))));
            assertEquals(group.mul(group.inv(group.inv(x)), group.inv(x)), result);
        }

        @Test
        @DisplayName("从右到左且没有给出代换时，未确定的变量原样保留")
        void testBackwardWithoutHintKeepsVariable() {
            Term result = engine.applyStep(group.e(), DerivationStep.backward(LEFT_INVERSE, Position.ROOT));
            assertEquals(group.mul(group.inv(a), a), result);
        }

        @Test
        @DisplayName("错误情况：未知等式、越界位置、不匹配的模式")
        void testFailures() {
            Term term = group.mul(group.e(), x);
            assertAll(
                    () -> assertThrows(UnknownEquationException.class,
                            () -> engine.applyStep(term, DerivationStep.forward("rightInverse", Position.ROOT))),
                    () -> assertThrows(PositionOutOfBoundsException.class,
                            () -> engine.applyStep(term, DerivationStep.forward(LEFT_IDENTITY, Position.of(1, 0)))),
                    () -> assertThrows(UnificationFailedException.class,
                            () -> engine.applyStep(term, DerivationStep.forward(LEFT_INVERSE, Position.ROOT))),
                    () -> assertThrows(UnificationFailedException.class,
                            () -> engine.applyStep(term, DerivationStep.forward(LEFT_IDENTITY, Position.ROOT, Substitution.of(a, group.e()))),
                            "代换与子项不一致时匹配失败")
            );
        }

        @Test
        @DisplayName("每条公理在根位置把自身左侧重写为右侧")
        void testEveryAxiomRewritesItsOwnLhs() {
            List<RegisteredEquation> axioms = group.getRegistry().getAxioms();
            assertEquals(3, axioms.size());
            for (RegisteredEquation axiom : axioms) {
                Equation eq = axiom.getEquation();
                assertEquals(eq.getRhs(), engine.applyStep(eq.getLhs(), DerivationStep.forward(axiom.getName(), Position.ROOT)),
                        axiom.getName());
            }
        }

        @Test
        @DisplayName("代换引入签名之外的运算时，重写结果不良构")
        void testIllFormedHintRejected() {
            Operation div = Operation.of("div", 2, group.getSort());
            DerivationStep step = DerivationStep.backward(LEFT_INVERSE, Position.ROOT, Substitution.of(a, Application.of(div, x, x)));
            assertThrows(IllTypedEquationException.class, () -> engine.applyStep(group.e(), step));
        }

        @Test
        @DisplayName("只能引用序号小于上界的条目")
        void testSequenceBound() {
            Term term = group.mul(group.e(), x);
            DerivationStep step = DerivationStep.forward(LEFT_IDENTITY, Position.ROOT);
            long leftIdentitySequence = group.getRegistry().lookup(LEFT_IDENTITY).orElseThrow().getSequence();

            assertAll(
                    () -> assertThrows(UnknownEquationException.class, () -> engine.applyStep(term, step, leftIdentitySequence)),
                    () -> assertEquals(x, engine.applyStep(term, step, leftIdentitySequence + 1))
            );
        }
    }

    @Nested
    @DisplayName("列出可用的重写")
    class RewritesAtTests {

        @Test
        @DisplayName("左单位元在 mul(e, mul(e, x)) 中从左到右可用于根和位置 1")
        void testRewritesAt() {
            Term term = group.mul(group.e(), group.mul(group.e(), x));
            List<Rewrite> rewrites = engine.rewritesAt(term, LEFT_IDENTITY);
            List<Rewrite> forward = rewrites.stream()
                    .filter(r -> r.getStep().getDirection() == Direction.LEFT_TO_RIGHT)
                    .collect(Collectors.toList());

            assertAll(
                    () -> assertEquals(2, forward.size()),
                    () -> assertEquals(Position.ROOT, forward.get(0).getStep().getPosition()),
                    () -> assertEquals(group.mul(group.e(), x), forward.get(0).getResult()),
                    () -> assertEquals(Position.of(1), forward.get(1).getStep().getPosition()),
                    () -> assertEquals(group.mul(group.e(), x), forward.get(1).getResult()),
                    () -> assertEquals(term.positions().size(), rewrites.size() - forward.size(),
                            "右侧是变量，从右到左在每个位置都可用")
            );
        }

        @Test
        @DisplayName("列出的步骤可以直接重放")
        void testRewritesAreReplayable() {
            Term term = group.mul(group.inv(x), x);
            for (Rewrite rewrite : engine.rewritesAt(term, LEFT_INVERSE)) {
                assertEquals(rewrite.getResult(), engine.applyStep(term, rewrite.getStep()));
            }
        }
    }
}
