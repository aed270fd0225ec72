package tw.gc.basis.trader.model;

import tw.gc.basis.trader.enums.RiskCategory;
import tw.gc.basis.trader.enums.RiskLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category risk classification used for alerting. Never feeds back into the signal.
 */
public record RiskAssessment(Map<RiskCategory, Factor> factors) {

    public record Factor(RiskLevel level, String description) {
    }

    public RiskAssessment {
        EnumMap<RiskCategory, Factor> copy = new EnumMap<>(RiskCategory.class);
        copy.putAll(factors);
        factors = Collections.unmodifiableMap(copy);
    }

    public RiskLevel levelOf(RiskCategory category) {
        Factor factor = factors.get(category);
        return factor != null ? factor.level() : RiskLevel.LOW;
    }

    public long elevatedCount() {
        return factors.values().stream().filter(f -> f.level().isElevated()).count();
    }

    public boolean hasCritical() {
        return factors.values().stream().anyMatch(f -> f.level() == RiskLevel.CRITICAL);
    }

    /**
     * HIGH with three or more high/critical factors, MODERATE with at least one, LOW otherwise.
     */
    public RiskLevel overall() {
        long elevated = elevatedCount();
        if (elevated >= 3) {
            return RiskLevel.HIGH;
        }
        return elevated >= 1 ? RiskLevel.MODERATE : RiskLevel.LOW;
    }
}
