package tw.gc.basis.trader.services.backtest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.basis.trader.enums.TradeStatus;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One simulated basis trade: long one unit of spot, short the same size in futures.
 * Opened on an entry signal and closed exactly once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestTrade {

    private LocalDate entryDate;
    private double entrySpot;
    private double entryFutures;
    private double entryBasis;

    private LocalDate exitDate;
    private Double exitSpot;
    private Double exitFutures;
    private Double exitBasis;

    @Builder.Default
    private double positionSize = 1.0;
    private double fundingCost;
    private Double realizedPnl;
    @Builder.Default
    private TradeStatus status = TradeStatus.OPEN;

    /**
     * Close the trade and realize its P&L:
     * (exit spot - entry spot) + (entry futures - exit futures) - funding, all scaled by position size,
     * where funding accrues on the entry spot notional at the annual rate for the days held.
     */
    public void close(LocalDate date, double spot, double futures, TradeStatus closeStatus, double fundingCostAnnual) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Trade opened " + entryDate + " is already " + status);
        }
        if (!closeStatus.isTerminal()) {
            throw new IllegalArgumentException("Close status must be terminal, got " + closeStatus);
        }
        this.exitDate = date;
        this.exitSpot = spot;
        this.exitFutures = futures;
        this.exitBasis = futures - spot;
        this.status = closeStatus;

        double spotPnl = (spot - entrySpot) * positionSize;
        double futuresPnl = (entryFutures - futures) * positionSize;
        this.fundingCost = (fundingCostAnnual / 365.0) * holdingDays() * (entrySpot * positionSize);
        this.realizedPnl = spotPnl + futuresPnl - fundingCost;
    }

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    public long holdingDays() {
        return exitDate != null ? ChronoUnit.DAYS.between(entryDate, exitDate) : 0;
    }

    public long daysHeldAsOf(LocalDate date) {
        return ChronoUnit.DAYS.between(entryDate, date);
    }

    /**
     * Realized P&L relative to the entry notional, or {@code null} while open.
     */
    public Double returnPct() {
        if (realizedPnl == null || entrySpot * positionSize == 0) {
            return null;
        }
        return realizedPnl / (entrySpot * positionSize);
    }

    public Double annualizedReturn() {
        Double returnPct = returnPct();
        long days = holdingDays();
        if (returnPct == null || days <= 0) {
            return null;
        }
        return returnPct * (365.0 / days);
    }
}
