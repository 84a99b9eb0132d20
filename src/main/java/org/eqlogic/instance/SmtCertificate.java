package org.eqlogic.instance;

import com.microsoft.z3.BoolExpr;
import lombok.Getter;
import org.eqlogic.errors.IncompleteInstanceException;
import org.eqlogic.signature.RegisteredEquation;
import org.eqlogic.symbolic.Z3Encoding;
import org.eqlogic.symbolic.Z3Oracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 用 Z3 卸载证明义务的证书：把 ∀ vars. lhs = rhs 翻译为 Z3，检查其否定不可满足。
 * 翻译表必须如实反映实例中运算的含义，证书只检查翻译后的断言。
 * Oracle 由调用方创建并负责关闭。
 * @author Ayalyt
 */
@Getter
public final class SmtCertificate implements AxiomCertificate {

    private static final Logger logger = LoggerFactory.getLogger(SmtCertificate.class);

    private final String axiomName;
    private final Z3Oracle oracle;
    private final Z3Encoding encoding;

    public SmtCertificate(String axiomName, Z3Oracle oracle, Z3Encoding encoding) {
        this.axiomName = Objects.requireNonNull(axiomName, "Axiom name cannot be null");
        this.oracle = Objects.requireNonNull(oracle, "Oracle cannot be null");
        this.encoding = Objects.requireNonNull(encoding, "Encoding cannot be null");
    }

    @Override
    public <T> ObligationResult discharge(RegisteredEquation axiom, ObligationContext<T> context) {
        BoolExpr claim;
        try {
            claim = encoding.encode(axiom.getEquation(), oracle.getVarManager());
        } catch (IncompleteInstanceException e) {
            logger.warn("公理 {} 无法翻译为 Z3: {}", axiom.getName(), e.getMessage());
            return ObligationResult.inconclusive(e.getMessage());
        }
        Z3Oracle.Verdict verdict = oracle.checkValid(claim, axiom.getEquation().getVariables());
        switch (verdict.getResult()) {
            case VALID:
                return ObligationResult.discharged("Z3 证明 " + claim + " 恒成立");
            case INVALID:
                return ObligationResult.refuted("Z3 反例 " + verdict.getCounterexample());
            default:
                return ObligationResult.inconclusive("Z3 无法判定 " + claim);
        }
    }
}
