package org.eqlogic.theories;

import org.eqlogic.expressions.Application;
import org.eqlogic.expressions.Equation;
import org.eqlogic.instance.InstanceCheckResult;
import org.eqlogic.instance.InstanceChecker;
import org.eqlogic.signature.EquationKind;
import org.eqlogic.signature.Lemma;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GroupTheoryTest {

    private GroupTheory group;

    @BeforeEach
    void setUp() {
        group = new GroupTheory();
    }

    @Test
    @DisplayName("由三条公理推出全部引理")
    void testProveAll() {
        List<Lemma> lemmas = group.proveAll();

        assertAll(
                () -> assertEquals(List.of(GroupTheory.RIGHT_INVERSE, GroupTheory.RIGHT_IDENTITY,
                                GroupTheory.DOUBLE_INVERSE, GroupTheory.IDENTITY_UNIQUE),
                        lemmas.stream().map(Lemma::getName).collect(Collectors.toList())),
                () -> assertTrue(lemmas.stream().allMatch(Lemma::isProven)),
                () -> assertEquals(List.of(7, 4, 5, 2),
                        lemmas.stream().map(Lemma::getLength).collect(Collectors.toList())),
                () -> assertEquals(3, group.getRegistry().getLemmas().size(), "单位元唯一性登记在子作用域中")
        );
    }

    @Test
    @DisplayName("单位元唯一性证明的是 e' = e，假设不进入根注册表")
    void testIdentityUnique() {
        group.proveRightInverse();
        group.proveRightIdentity();
        Lemma unique = group.proveIdentityUnique();

        assertAll(
                () -> assertEquals("e' = e", unique.getEquation().toString()),
                () -> assertTrue(group.getRegistry().lookup(GroupTheory.OTHER_IDENTITY).isEmpty()),
                () -> assertTrue(group.getRegistry().lookup(GroupTheory.IDENTITY_UNIQUE).isEmpty()),
                () -> assertTrue(group.getRegistry().getEntries(EquationKind.HYPOTHESIS).isEmpty())
        );
    }

    @Test
    @DisplayName("双重逆元的等式")
    void testDoubleInverseGoal() {
        group.proveRightInverse();
        group.proveRightIdentity();
        Lemma lemma = group.proveDoubleInverse();
        Equation goal = lemma.getEquation();
        assertAll(
                () -> assertInstanceOf(Application.class, goal.getLhs()),
                () -> assertEquals("inv(inv(x))", goal.getLhs().toString()),
                () -> assertEquals("x", goal.getRhs().toString())
        );
    }

    @Test
    @DisplayName("Z/n 满足群公理")
    void testCyclicGroupsAreModels() {
        InstanceChecker checker = new InstanceChecker();
        for (int n = 1; n <= 5; n++) {
            InstanceCheckResult<Integer> result = checker.check(group.cyclic(n), group.getRegistry());
            assertTrue(result.isAccepted(), "Z/" + n + ": " + result);
        }
        assertThrows(IllegalArgumentException.class, () -> group.cyclic(0));
    }
}
