package org.eqlogic.instance;

import lombok.Getter;

import java.util.Objects;

/**
 * 证书对一条公理的证明义务给出的结论。
 */
@Getter
public final class ObligationResult {

    public enum Outcome {
        DISCHARGED,
        REFUTED,
        INCONCLUSIVE
    }

    private final Outcome outcome;
    private final String detail;

    private ObligationResult(Outcome outcome, String detail) {
        this.outcome = outcome;
        this.detail = Objects.requireNonNull(detail, "Detail cannot be null");
    }

    public static ObligationResult discharged(String detail) {
        return new ObligationResult(Outcome.DISCHARGED, detail);
    }

    /**
     * 找到了反例，公理在此实例中不成立。
     */
    public static ObligationResult refuted(String detail) {
        return new ObligationResult(Outcome.REFUTED, detail);
    }

    /**
     * 证书无法说明公理成立，但也没有反例。
     */
    public static ObligationResult inconclusive(String detail) {
        return new ObligationResult(Outcome.INCONCLUSIVE, detail);
    }

    public boolean isDischarged() {
        return outcome == Outcome.DISCHARGED;
    }

    @Override
    public String toString() {
        return outcome + ": " + detail;
    }
}
