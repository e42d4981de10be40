package com.ritbot.hft.strategy.model;

/**
 * Outcome of a limit check with the exposures it was based on.
 */
public record RiskDecision(
        boolean allowed,
        Rule rule,
        ExposureSnapshot current,
        ExposureSnapshot projected
) {

    public enum Rule {
        WITHIN_LIMITS,
        REDUCES_GROSS,
        REDUCES_NET,
        CURRENCY_EXEMPT,
        CASH_LIMIT,
        DENIED
    }

    public static RiskDecision allow(Rule rule, ExposureSnapshot current, ExposureSnapshot projected) {
        return new RiskDecision(true, rule, current, projected);
    }

    public static RiskDecision deny(Rule rule, ExposureSnapshot current, ExposureSnapshot projected) {
        return new RiskDecision(false, rule, current, projected);
    }
}
