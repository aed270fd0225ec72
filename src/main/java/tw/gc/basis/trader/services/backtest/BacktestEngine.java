package tw.gc.basis.trader.services.backtest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.calculator.PerformanceMetrics;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.enums.TradeStatus;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.signal.SignalEngine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Replays the live signal logic over a historical series.
 *
 * <p>At most one trade is open at a time. While a trade is open, a stop loss or full exit
 * signal closes it (stopped out or closed), as does reaching the maximum holding period.
 * When flat, an entry signal opens a unit-size trade, possibly on the same day a previous
 * trade closed. A trade still open after the last snapshot is force-closed against it.
 *
 * <p>Each closed trade appends its P&L to an equity curve that starts at the account size;
 * drawdown, Sharpe ratio and total return are computed from that curve.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    public static final int DEFAULT_MAX_HOLDING_DAYS = 30;
    private static final double UNIT_POSITION_SIZE = 1.0;

    private final SignalEngine signalEngine;

    public BacktestResult run(List<MarketSnapshot> series, StrategyConfig config) {
        return run(series, config, DEFAULT_MAX_HOLDING_DAYS);
    }

    public BacktestResult run(List<MarketSnapshot> series, StrategyConfig config, int maxHoldingDays) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(config, "config");
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Backtest needs at least one data point");
        }
        if (maxHoldingDays <= 0) {
            throw new IllegalArgumentException("maxHoldingDays must be positive, got " + maxHoldingDays);
        }

        if (series.stream().anyMatch(s -> s.getAsOf() == null)) {
            throw new IllegalArgumentException("Every backtest snapshot needs an as-of date");
        }

        List<MarketSnapshot> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparing(MarketSnapshot::getAsOf));

        List<BacktestTrade> trades = new ArrayList<>();
        List<Double> equityCurve = new ArrayList<>();
        equityCurve.add(config.accountSize());

        BacktestTrade current = null;
        for (MarketSnapshot snapshot : ordered) {
            SignalDecision decision = signalEngine.generateSignal(snapshot, config);
            Signal signal = decision.signal();

            if (current != null) {
                TradeStatus exitStatus = exitStatus(signal, current.daysHeldAsOf(snapshot.getAsOf()), maxHoldingDays);
                if (exitStatus != null) {
                    closeTrade(current, snapshot, exitStatus, config, trades, equityCurve);
                    log.debug("Closed trade {} -> {} ({}): pnl {}", current.getEntryDate(), current.getExitDate(),
                            exitStatus, current.getRealizedPnl());
                    current = null;
                }
            }

            if (current == null && signal.isEntry()) {
                current = BacktestTrade.builder()
                        .entryDate(snapshot.getAsOf())
                        .entrySpot(snapshot.getSpotPrice())
                        .entryFutures(snapshot.getFuturesPrice())
                        .entryBasis(snapshot.basisAbsolute())
                        .positionSize(UNIT_POSITION_SIZE)
                        .build();
                log.debug("Opened trade {} on {}: {}", current.getEntryDate(), signal, decision.reason());
            }
        }

        if (current != null) {
            MarketSnapshot last = ordered.get(ordered.size() - 1);
            closeTrade(current, last, TradeStatus.FORCED_CLOSE, config, trades, equityCurve);
        }

        BacktestResult result = summarize(trades, equityCurve, config);
        result.setStartDate(ordered.get(0).getAsOf());
        result.setEndDate(ordered.get(ordered.size() - 1).getAsOf());

        log.info("📊 Backtest {} -> {}: {} trades, return {}%, max drawdown {}%, Sharpe {}",
                result.getStartDate(), result.getEndDate(), result.getTotalTrades(),
                String.format("%.2f", result.getTotalReturn() * 100),
                String.format("%.2f", result.getMaxDrawdown() * 100),
                String.format("%.2f", result.getSharpeRatio()));
        return result;
    }

    private static TradeStatus exitStatus(Signal signal, long holdingDays, int maxHoldingDays) {
        if (signal == Signal.STOP_LOSS) {
            return TradeStatus.STOPPED_OUT;
        }
        if (signal == Signal.FULL_EXIT || holdingDays >= maxHoldingDays) {
            return TradeStatus.CLOSED;
        }
        return null;
    }

    private static void closeTrade(BacktestTrade trade, MarketSnapshot snapshot, TradeStatus status,
                                   StrategyConfig config, List<BacktestTrade> trades, List<Double> equityCurve) {
        trade.close(snapshot.getAsOf(), snapshot.getSpotPrice(), snapshot.getFuturesPrice(), status,
                config.fundingCostAnnual());
        trades.add(trade);
        equityCurve.add(equityCurve.get(equityCurve.size() - 1) + trade.getRealizedPnl());
    }

    private static BacktestResult summarize(List<BacktestTrade> trades, List<Double> equityCurve, StrategyConfig config) {
        List<Double> winReturns = new ArrayList<>();
        List<Double> lossReturns = new ArrayList<>();
        for (BacktestTrade trade : trades) {
            double pnl = trade.getRealizedPnl();
            if (pnl > 0) {
                winReturns.add(trade.returnPct());
            } else if (pnl < 0) {
                lossReturns.add(trade.returnPct());
            }
        }

        List<Double> returns = PerformanceMetrics.returnsFromEquity(equityCurve);
        return BacktestResult.builder()
                .trades(trades)
                .equityCurve(equityCurve)
                .initialCapital(config.accountSize())
                .totalTrades(trades.size())
                .winningTrades(winReturns.size())
                .losingTrades(lossReturns.size())
                .avgWin(average(winReturns))
                .avgLoss(average(lossReturns))
                .totalReturn(PerformanceMetrics.totalReturn(equityCurve))
                .maxDrawdown(PerformanceMetrics.maxDrawdown(equityCurve))
                .sharpeRatio(PerformanceMetrics.sharpeRatio(returns))
                .build();
    }

    private static double average(List<Double> values) {
        return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
