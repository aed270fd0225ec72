package tw.gc.basis.trader.model;

/**
 * Carry returns for a snapshot, all expressed as fractions (0.02 = 2%).
 */
public record ReturnMetrics(
        double basisAbsolute,
        double basisPercent,
        double monthlyBasis,
        double grossAnnualized,
        double netAnnualized,
        double leveragedReturn
) {
    public static ReturnMetrics zero() {
        return new ReturnMetrics(0, 0, 0, 0, 0, 0);
    }
}
