package tw.gc.basis.trader.services.backtest;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Trades and aggregate statistics of one backtest run. Returns, averages and
 * drawdown are fractions.
 */
@Data
@Builder
public class BacktestResult {

    /** Average losses smaller than this count as no losses */
    private static final double NEGLIGIBLE_LOSS = 0.0001;

    @Builder.Default
    private List<BacktestTrade> trades = new ArrayList<>();
    @Builder.Default
    private List<Double> equityCurve = new ArrayList<>();

    private double initialCapital;
    private double totalReturn;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private double avgWin;
    private double avgLoss;
    private double maxDrawdown;
    private double sharpeRatio;
    private LocalDate startDate;
    private LocalDate endDate;

    public double winRate() {
        return totalTrades == 0 ? 0.0 : (double) winningTrades / totalTrades;
    }

    /**
     * |avg win / avg loss|, infinite when there is no meaningful average loss.
     */
    public double profitFactor() {
        if (Math.abs(avgLoss) < NEGLIGIBLE_LOSS) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(avgWin / avgLoss);
    }

    public double finalCapital() {
        return initialCapital * (1 + totalReturn);
    }
}
