package org.eqlogic.instance;

import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.derivation.DerivationChain;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Variable;
import org.eqlogic.rewrite.DerivationStep;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.Lemma;
import org.eqlogic.signature.Signature;
import org.eqlogic.theories.GroupTheory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstanceCheckerTest {

    private GroupTheory group;
    private AxiomRegistry registry;
    private Sort g;
    private Operation mul, inv, e;
    private InstanceChecker checker;

    @BeforeEach
    void setUp() {
        group = new GroupTheory();
        registry = group.getRegistry();
        Signature signature = group.getSignature();
        g = group.getSort();
        mul = signature.require("mul");
        inv = signature.require("inv");
        e = signature.require("e");
        checker = new InstanceChecker();
    }

    private ConcreteInstance.Builder<Integer> z3Builder() {
        return ConcreteInstance.<Integer>builder("Z/3")
                .carrier(g, Carrier.finite(0, 1, 2))
                .binary(mul, (p, q) -> (p + q) % 3)
                .unary(inv, p -> (3 - p) % 3)
                .constant(e, 0);
    }

    private ConcreteInstance<Integer> integers() {
        return ConcreteInstance.<Integer>builder("ℤ")
                .carrier(g, Carrier.infinite("ℤ"))
                .binary(mul, Integer::sum)
                .unary(inv, p -> -p)
                .constant(e, 0)
                .build();
    }

    @Nested
    @DisplayName("有限载体：穷举检查")
    class FiniteCarrierTests {

        @Test
        @DisplayName("模 3 加法满足群公理")
        void testCyclicGroupAccepted() {
            InstanceCheckResult<Integer> result = checker.check(z3Builder().build(), registry);
            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.ACCEPTED, result.getStatus()),
                    () -> assertTrue(result.getAxiom().isEmpty())
            );
        }

        @Test
        @DisplayName("错误的逆元表：报告左逆元公理和第一个反例 a = 1")
        void testAxiomViolationWitness() {
            ConcreteInstance<Integer> broken = z3Builder().unary(inv, p -> p).build();
            InstanceCheckResult<Integer> result = checker.check(broken, registry);

            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.AXIOM_VIOLATION, result.getStatus()),
                    () -> assertEquals(GroupTheory.LEFT_INVERSE, result.getAxiom().orElseThrow().getName()),
                    () -> assertEquals(Map.of(Variable.of("a", g), 1), result.getWitness())
            );
        }

        @Test
        @DisplayName("不取模的加法跑出载体：报告闭包问题")
        void testClosureViolation() {
            ConcreteInstance<Integer> open = z3Builder().binary(mul, Integer::sum).build();
            InstanceCheckResult<Integer> result = checker.check(open, registry);

            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.CLOSURE_VIOLATION, result.getStatus()),
                    () -> assertEquals(mul, result.getOperation().orElseThrow()),
                    () -> assertEquals(List.of(1, 2), result.getArguments())
            );
        }

        @Test
        @DisplayName("赋值个数超过上限时拒绝枚举")
        void testAssignmentBudget() {
            InstanceChecker limited = new InstanceChecker(InstanceCheckerOptions.defaults().withMaxAssignments(10));
            assertThrows(IllegalStateException.class, () -> limited.check(z3Builder().build(), registry));
            assertThrows(IllegalArgumentException.class, () -> InstanceCheckerOptions.defaults().withMaxAssignments(0));
        }
    }

    @Nested
    @DisplayName("实例不完整")
    class IncompleteTests {

        @Test
        @DisplayName("缺少运算实现")
        void testMissingOperation() {
            ConcreteInstance<Integer> partial = ConcreteInstance.<Integer>builder("partial")
                    .carrier(g, Carrier.finite(0))
                    .binary(mul, (p, q) -> 0)
                    .constant(e, 0)
                    .build();
            assertThrows(IncompleteInstanceException.class, () -> checker.check(partial, registry));
        }

        @Test
        @DisplayName("实现的元数与运算不符")
        void testArityMismatch() {
            ConcreteInstance<Integer> wrong = z3Builder().operation(inv, 2, args -> 0).build();
            assertThrows(IncompleteInstanceException.class, () -> checker.check(wrong, registry));
        }

        @Test
        @DisplayName("缺少载体")
        void testMissingCarrier() {
            ConcreteInstance<Integer> noCarrier = ConcreteInstance.<Integer>builder("none")
                    .binary(mul, (p, q) -> 0)
                    .unary(inv, p -> 0)
                    .constant(e, 0)
                    .build();
            assertThrows(IncompleteInstanceException.class, () -> checker.check(noCarrier, registry));
        }
    }

    @Nested
    @DisplayName("无穷载体：证书")
    class InfiniteCarrierTests {

        @Test
        @DisplayName("没有证书的公理报告 MISSING_CERTIFICATE")
        void testMissingCertificate() {
            InstanceCheckResult<Integer> result = checker.check(integers(), registry);
            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.MISSING_CERTIFICATE, result.getStatus()),
                    () -> assertEquals(GroupTheory.ASSOCIATIVITY, result.getAxiom().orElseThrow().getName())
            );
        }

        @Test
        @DisplayName("基础理论没有被实例满足时，引理不能卸载公理：ℤ 上的减法不是右逆元的模型")
        void testDerivationCertificateRequiresBaseModel() {
            Lemma rightInverse = group.proveRightInverse();
            ConcreteInstance<Integer> subtraction = ConcreteInstance.<Integer>builder("ℤ-")
                    .carrier(g, Carrier.infinite("ℤ"))
                    .binary(mul, (p, q) -> p - q)
                    .unary(inv, p -> -p)
                    .constant(e, 0)
                    .build();

            AxiomRegistry other = new AxiomRegistry(Signature.extending("RightInverse", group.getSignature()));
            other.declareAxiom("rightInverse", "mul(x, inv(x)) = e");

            InstanceCheckResult<Integer> result = checker.check(subtraction, other,
                    List.of(new DerivationCertificate("rightInverse", rightInverse, registry)));
            assertAll(
                    () -> assertFalse(result.isAccepted()),
                    () -> assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus()),
                    () -> assertTrue(result.getDetail().contains("不是基础理论"), result.getDetail())
            );
        }

        @Test
        @DisplayName("用被检查的注册表中由公理一步推出的引理卸载该公理是循环论证")
        void testCircularDerivationCertificate() {
            Equation assoc = registry.lookup(GroupTheory.ASSOCIATIVITY).orElseThrow().getEquation();
            Lemma copy = group.getVerifier().verify("assocCopy",
                    DerivationChain.builder(assoc.getLhs())
                            .then(DerivationStep.forward(GroupTheory.ASSOCIATIVITY, Position.ROOT), assoc.getRhs())
                            .build(),
                    assoc);
            ConcreteInstance<Integer> notAGroup = ConcreteInstance.<Integer>builder("ℤ, inv = id")
                    .carrier(g, Carrier.infinite("ℤ"))
                    .binary(mul, Integer::sum)
                    .unary(inv, p -> p)
                    .constant(e, 0)
                    .build();

            InstanceCheckResult<Integer> result = checker.check(notAGroup, registry,
                    List.of(new DerivationCertificate(GroupTheory.ASSOCIATIVITY, copy, registry)));
            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus()),
                    () -> assertEquals(GroupTheory.ASSOCIATIVITY, result.getAxiom().orElseThrow().getName())
            );
        }

        @Test
        @DisplayName("引理必须登记在证书给出的基础理论中")
        void testLemmaNotInBaseRegistry() {
            Lemma rightInverse = group.proveRightInverse();
            AxiomRegistry unrelated = new AxiomRegistry(Signature.extending("Unrelated", group.getSignature()));
            AxiomRegistry other = new AxiomRegistry(Signature.extending("RightInverse", group.getSignature()));
            other.declareAxiom("rightInverse", "mul(x, inv(x)) = e");

            InstanceCheckResult<Integer> result = checker.check(integers(), other,
                    List.of(new DerivationCertificate("rightInverse", rightInverse, unrelated)));
            assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus());
        }

        @Test
        @DisplayName("引理与公理不符时证明义务未卸载")
        void testMismatchedDerivationCertificate() {
            Lemma rightInverse = group.proveRightInverse();

            AxiomRegistry other = new AxiomRegistry(Signature.extending("RightIdentity", group.getSignature()));
            other.declareAxiom("rightIdentity", "mul(x, e) = x");

            InstanceCheckResult<Integer> result = checker.check(integers(), other,
                    List.of(new DerivationCertificate("rightIdentity", rightInverse, registry)));
            assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus());
        }

        @Test
        @DisplayName("同一公理的多个证书被拒绝")
        void testDuplicateCertificates() {
            Lemma rightInverse = group.proveRightInverse();
            List<AxiomCertificate> certificates = List.of(
                    new DerivationCertificate("rightInverse", rightInverse, registry),
                    new DerivationCertificate("rightInverse", rightInverse, registry));
            assertThrows(IllegalArgumentException.class, () -> checker.check(integers(), registry, certificates));
        }

        @Test
        @DisplayName("无变量的公理即使载体无穷也直接计算")
        void testGroundAxiomEvaluated() {
            AxiomRegistry other = new AxiomRegistry(Signature.extending("Idempotent", group.getSignature()));
            other.declareAxiom("eInverse", "inv(e) = e");
            assertTrue(checker.check(integers(), other).isAccepted());
        }
    }
}
