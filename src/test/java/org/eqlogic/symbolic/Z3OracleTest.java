package org.eqlogic.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import org.eqlogic.core.Operation;
import org.eqlogic.core.Sort;
import org.eqlogic.derivation.DerivationChain;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.expressions.Equation;
import org.eqlogic.expressions.Position;
import org.eqlogic.expressions.Variable;
import org.eqlogic.instance.AxiomCertificate;
import org.eqlogic.instance.Carrier;
import org.eqlogic.instance.ConcreteInstance;
import org.eqlogic.instance.DerivationCertificate;
import org.eqlogic.instance.InstanceCheckResult;
import org.eqlogic.instance.InstanceChecker;
import org.eqlogic.instance.SmtCertificate;
import org.eqlogic.rewrite.DerivationStep;
import org.eqlogic.signature.AxiomRegistry;
import org.eqlogic.signature.Lemma;
import org.eqlogic.signature.RegisteredEquation;
import org.eqlogic.signature.Signature;
import org.eqlogic.signature.TermParser;
import org.eqlogic.theories.GroupTheory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class Z3OracleTest {

    private Z3Oracle oracle;
    private GroupTheory group;
    private Sort g;
    private Operation mul, inv, e;
    private Z3Encoding additive;

    @BeforeEach
    void setUp() {
        oracle = new Z3Oracle();
        group = new GroupTheory();
        Signature signature = group.getSignature();
        g = group.getSort();
        mul = signature.require("mul");
        inv = signature.require("inv");
        e = signature.require("e");
        additive = new Z3Encoding()
                .addition(mul)
                .negation(inv)
                .integerConstant(e, 0);
    }

    @AfterEach
    void tearDown() {
        oracle.close();
    }

    private ConcreteInstance<Integer> integers() {
        return ConcreteInstance.<Integer>builder("ℤ")
                .carrier(g, Carrier.infinite("ℤ"))
                .binary(mul, Integer::sum)
                .unary(inv, p -> -p)
                .constant(e, 0)
                .build();
    }

    private List<AxiomCertificate> certificatesFor(AxiomRegistry registry, Z3Encoding encoding) {
        return registry.getAxioms().stream()
                .map(axiom -> new SmtCertificate(axiom.getName(), oracle, encoding))
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("有效性检查")
    class ValidityTests {

        @Test
        @DisplayName("整数加法满足结合律")
        void testAssociativityValid() {
            Equation assoc = group.getRegistry().lookup(GroupTheory.ASSOCIATIVITY).orElseThrow().getEquation();
            BoolExpr claim = additive.encode(assoc, oracle.getVarManager());

            Z3Oracle.Verdict verdict = oracle.checkValid(claim, assoc.getVariables());
            assertAll(
                    () -> assertTrue(verdict.isValid()),
                    () -> assertTrue(verdict.getCounterexample().isEmpty())
            );
        }

        @Test
        @DisplayName("x + x = x 不成立，反例给出每个变量的取值")
        void testInvalidWithCounterexample() {
            Equation claim = new TermParser(group.getSignature()).parseEquation("mul(x, x) = x");
            Z3Oracle.Verdict verdict = oracle.checkValid(additive.encode(claim, oracle.getVarManager()), claim.getVariables());

            assertAll(
                    () -> assertEquals(Z3Oracle.OracleResult.INVALID, verdict.getResult()),
                    () -> assertTrue(verdict.getCounterexample().containsKey(Variable.of("x", g))),
                    () -> assertNotEquals("0", verdict.getCounterexample().get(Variable.of("x", g)))
            );
        }

        @Test
        @DisplayName("没有 Z3 翻译的运算")
        void testMissingEncoder() {
            Z3Encoding partial = new Z3Encoding().addition(mul);
            Equation leftInverse = group.getRegistry().lookup(GroupTheory.LEFT_INVERSE).orElseThrow().getEquation();
            assertAll(
                    () -> assertTrue(partial.covers(mul)),
                    () -> assertFalse(partial.covers(inv)),
                    () -> assertThrows(IncompleteInstanceException.class,
                            () -> partial.encode(leftInverse, oracle.getVarManager()))
            );
        }

        @Test
        @DisplayName("超时时间必须为正")
        void testTimeoutValidation() {
            assertThrows(IllegalArgumentException.class, () -> new Z3Oracle(0));
        }
    }

    @Nested
    @DisplayName("用 SmtCertificate 检查无穷实例")
    class CertificateTests {

        @Test
        @DisplayName("整数加法构成群")
        void testIntegersAccepted() {
            AxiomRegistry registry = group.getRegistry();
            InstanceCheckResult<Integer> result = new InstanceChecker()
                    .check(integers(), registry, certificatesFor(registry, additive));
            assertTrue(result.isAccepted(), result.toString());
        }

        @Test
        @DisplayName("不成立的公理被反驳")
        void testFalseAxiomRefuted() {
            AxiomRegistry registry = new AxiomRegistry(Signature.extending("LeftZero", group.getSignature()));
            registry.declareAxiom("leftZero", "mul(a, b) = a");

            InstanceCheckResult<Integer> result = new InstanceChecker()
                    .check(integers(), registry, certificatesFor(registry, additive));
            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.AXIOM_VIOLATION, result.getStatus()),
                    () -> assertEquals("leftZero", result.getAxiom().orElseThrow().getName())
            );
        }

        @Test
        @DisplayName("整数加法满足群公理，因此右逆元可由群论中的引理卸载")
        void testDerivationCertificateWithVerifiedBase() {
            AxiomRegistry groupRegistry = group.getRegistry();
            Lemma rightInverse = group.proveRightInverse();
            AxiomRegistry registry = new AxiomRegistry(Signature.extending("RightInverse", group.getSignature()));
            registry.declareAxiom("rightInverse", "mul(x, inv(x)) = e");

            DerivationCertificate certificate = new DerivationCertificate("rightInverse", rightInverse,
                    groupRegistry, certificatesFor(groupRegistry, additive));
            InstanceCheckResult<Integer> result = new InstanceChecker().check(integers(), registry, List.of(certificate));
            assertTrue(result.isAccepted(), result.toString());
        }

        @Test
        @DisplayName("整数减法不满足结合律，群论中的引理不能为它卸载右逆元")
        void testDerivationCertificateWithRefutedBase() {
            AxiomRegistry groupRegistry = group.getRegistry();
            Lemma rightInverse = group.proveRightInverse();
            AxiomRegistry registry = new AxiomRegistry(Signature.extending("RightInverse", group.getSignature()));
            registry.declareAxiom("rightInverse", "mul(x, inv(x)) = e");

            ConcreteInstance<Integer> subtraction = ConcreteInstance.<Integer>builder("ℤ-")
                    .carrier(g, Carrier.infinite("ℤ"))
                    .binary(mul, (p, q) -> p - q)
                    .unary(inv, p -> -p)
                    .constant(e, 0)
                    .build();
            Z3Encoding encoding = new Z3Encoding()
                    .operation(mul, (ctx, args) -> ctx.mkSub((ArithExpr) args.get(0), (ArithExpr) args.get(1)))
                    .negation(inv)
                    .integerConstant(e, 0);

            DerivationCertificate certificate = new DerivationCertificate("rightInverse", rightInverse,
                    groupRegistry, certificatesFor(groupRegistry, encoding));
            InstanceCheckResult<Integer> result = new InstanceChecker().check(subtraction, registry, List.of(certificate));
            assertAll(
                    () -> assertFalse(result.isAccepted()),
                    () -> assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus()),
                    () -> assertTrue(result.getDetail().contains(GroupTheory.ASSOCIATIVITY), result.getDetail())
            );
        }

        @Test
        @DisplayName("基础理论中由公理一步推出的引理不能替未通过检查的公理作证")
        void testOneStepLemmasDoNotCoverBrokenInverse() {
            AxiomRegistry base = group.getRegistry();
            ConcreteInstance<Integer> identityInverse = ConcreteInstance.<Integer>builder("ℤ, inv = id")
                    .carrier(g, Carrier.infinite("ℤ"))
                    .binary(mul, Integer::sum)
                    .unary(inv, p -> p)
                    .constant(e, 0)
                    .build();
            Z3Encoding encoding = new Z3Encoding()
                    .addition(mul)
                    .operation(inv, (ctx, args) -> args.get(0))
                    .integerConstant(e, 0);

            AxiomRegistry copy = new AxiomRegistry(Signature.extending("GroupCopy", group.getSignature()));
            List<AxiomCertificate> certificates = new ArrayList<>();
            for (RegisteredEquation axiom : base.getAxioms()) {
                Equation equation = axiom.getEquation();
                Lemma lemma = group.getVerifier().verify(axiom.getName() + "Copy",
                        DerivationChain.builder(equation.getLhs())
                                .then(DerivationStep.forward(axiom.getName(), Position.ROOT), equation.getRhs())
                                .build(),
                        equation);
                copy.declareAxiom(axiom.getName(), equation);
                certificates.add(new DerivationCertificate(axiom.getName(), lemma, base, certificatesFor(base, encoding)));
            }

            InstanceCheckResult<Integer> result = new InstanceChecker().check(identityInverse, copy, certificates);
            assertAll(
                    () -> assertFalse(result.isAccepted()),
                    () -> assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus()),
                    () -> assertTrue(result.getDetail().contains(GroupTheory.LEFT_INVERSE), result.getDetail())
            );
        }

        @Test
        @DisplayName("翻译不完整时证明义务未卸载")
        void testIncompleteEncodingUndischarged() {
            AxiomRegistry registry = group.getRegistry();
            Z3Encoding partial = new Z3Encoding().addition(mul);

            InstanceCheckResult<Integer> result = new InstanceChecker()
                    .check(integers(), registry, certificatesFor(registry, partial));
            assertAll(
                    () -> assertEquals(InstanceCheckResult.Status.UNDISCHARGED_OBLIGATION, result.getStatus()),
                    () -> assertEquals(GroupTheory.LEFT_IDENTITY, result.getAxiom().orElseThrow().getName())
            );
        }
    }
}
