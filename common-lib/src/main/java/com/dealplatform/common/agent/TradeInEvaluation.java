package com.dealplatform.common.agent;

/**
 * Result of the trade-in evaluation role.
 *
 * <p>{@code finalValue} always equals {@code baseValue + conditionAdjustment + loyaltyBonus}
 * clamped to be non-negative; {@link #expectedFinalValue} is the single place that rule lives.
 */
public record TradeInEvaluation(
    double baseValue,
    double conditionAdjustment,
    double loyaltyBonus,
    double finalValue,
    double confidence,
    String justification
) {

    /** Evaluation used when the client brings no trade-in vehicle. */
    public static TradeInEvaluation none() {
        return new TradeInEvaluation(0, 0, 0, 0, 1.0, "No trade-in vehicle");
    }

    public static double expectedFinalValue(double baseValue, double conditionAdjustment, double loyaltyBonus) {
        return Math.max(0.0, baseValue + conditionAdjustment + loyaltyBonus);
    }
}
