package tw.gc.basis.trader.services.execution;

import lombok.extern.slf4j.Slf4j;
import tw.gc.basis.trader.AppConstants;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.enums.OrderSide;
import tw.gc.basis.trader.enums.OrderStatus;
import tw.gc.basis.trader.enums.OrderType;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.enums.TradeAction;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.OrderRequest;
import tw.gc.basis.trader.model.OrderResult;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.Position;
import tw.gc.basis.trader.model.PositionSizing;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.position.PositionTracker;
import tw.gc.basis.trader.services.positionsizing.PositionSizer;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns signals for one pair into orders.
 *
 * <p>The action follows from the signal and whether a position is open:
 * entries open a position only when flat, full exits and stop losses close an open one,
 * partial exits reduce an open one by half, and everything else is a no-op.
 *
 * <p>Before any order is sent the action passes the safety checks (size ceilings,
 * weekend guard, backwardation guard) and, unless auto-trade is on, a confirmation prompt.
 * Every decision and every leg result is written to the execution journal.
 *
 * <p>Signals for the same pair are handled one at a time.
 */
@Slf4j
public class ExecutionManager {

    private static final String TAG_ENTRY = "ENTRY";
    private static final String TAG_EXIT = "EXIT";
    private static final String TAG_PARTIAL_EXIT = "PARTIAL_EXIT";

    private final PairConfig pair;
    private final StrategyConfig strategy;
    private final PositionTracker tracker;
    private final OrderExecutor executor;
    private final PositionSizer positionSizer;
    private final ExecutionJournal journal;
    private final TradeConfirmation confirmation;
    private final TradingProperties.Execution settings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    public ExecutionManager(PairConfig pair, StrategyConfig strategy, PositionTracker tracker,
                            OrderExecutor executor, PositionSizer positionSizer, ExecutionJournal journal,
                            TradeConfirmation confirmation, TradingProperties.Execution settings, Clock clock) {
        this.pair = pair;
        this.strategy = strategy;
        this.tracker = tracker;
        this.executor = executor;
        this.positionSizer = positionSizer;
        this.journal = journal;
        this.confirmation = confirmation;
        this.settings = settings;
        this.clock = clock;
    }

    public PairConfig getPair() {
        return pair;
    }

    public PositionTracker getTracker() {
        return tracker;
    }

    public boolean connect() {
        return executor.connect();
    }

    public void disconnect() {
        executor.disconnect();
    }

    public TradeAction determineAction(Signal signal) {
        return TradeAction.resolve(signal, tracker.isOpen());
    }

    public ExecutionOutcome handleSignal(SignalDecision decision, MarketSnapshot snapshot) {
        lock.lock();
        try {
            return process(decision, snapshot);
        } finally {
            lock.unlock();
        }
    }

    private ExecutionOutcome process(SignalDecision decision, MarketSnapshot snapshot) {
        Signal signal = decision.signal();
        TradeAction action = determineAction(signal);

        if (action == TradeAction.NONE) {
            log.debug("[{}] Signal {} -> no action (position_open={})", pair.pairId(), signal, tracker.isOpen());
            return ExecutionOutcome.noAction(signal);
        }

        log.info("🎯 [{}] Signal {} -> action {}: {}", pair.pairId(), signal, action, decision.reason());

        PositionSizing sizing = positionSizer.size(snapshot, strategy);

        Optional<String> safetyError = safetyCheck(action, sizing, snapshot);
        if (safetyError.isPresent()) {
            log.warn("🛑 [{}] Safety check failed: {}", pair.pairId(), safetyError.get());
            Map<String, Object> payload = eventPayload(signal, action);
            payload.put("reason", safetyError.get());
            journal.record(ExecutionJournal.REJECTED, pair.pairId(), payload);
            return ExecutionOutcome.skipped(signal, action, ExecutionOutcome.Status.REJECTED, safetyError.get());
        }

        if (!settings.isAutoTrade()) {
            String summary = buildSummary(action, decision, sizing, snapshot);
            if (!confirmation.confirm(summary)) {
                log.info("🙅 [{}] Trade rejected by user", pair.pairId());
                journal.record(ExecutionJournal.USER_REJECTED, pair.pairId(), eventPayload(signal, action));
                return ExecutionOutcome.skipped(signal, action, ExecutionOutcome.Status.USER_REJECTED, "Rejected by user");
            }
        }

        if (!settings.isDryRun() && !executor.isConnected() && !executor.connect()) {
            log.error("❌ [{}] Broker connection failed - {} not executed", pair.pairId(), action);
            journal.record(ExecutionJournal.CONNECTION_FAILED, pair.pairId(), eventPayload(signal, action));
            return ExecutionOutcome.skipped(signal, action, ExecutionOutcome.Status.CONNECTION_FAILED, "Broker connection failed");
        }

        Map<String, Object> executing = eventPayload(signal, action);
        executing.put("reason", decision.reason());
        executing.put("sizing", sizingMap(sizing));
        executing.put("dry_run", settings.isDryRun());
        journal.record(ExecutionJournal.EXECUTING, pair.pairId(), executing);

        return switch (action) {
            case OPEN -> executeOpen(signal, sizing, snapshot);
            case CLOSE -> executeClose(signal, snapshot);
            case REDUCE -> executeReduce(signal, snapshot);
            case NONE -> ExecutionOutcome.noAction(signal);
        };
    }

    Optional<String> safetyCheck(TradeAction action, PositionSizing sizing, MarketSnapshot snapshot) {
        if (action == TradeAction.OPEN) {
            if (!sizing.hasSpotLeg()) {
                return Optional.of("No ETF price available - cannot size spot leg");
            }
            if (sizing.etfSharesOrZero() > settings.getMaxEtfShares()) {
                return Optional.of(String.format("ETF shares (%d) exceeds limit (%d)",
                        sizing.etfSharesOrZero(), settings.getMaxEtfShares()));
            }
            if (sizing.futuresContracts() > settings.getMaxFuturesContracts()) {
                return Optional.of(String.format("Futures contracts (%d) exceeds limit (%d)",
                        sizing.futuresContracts(), settings.getMaxFuturesContracts()));
            }
        }

        DayOfWeek today = LocalDate.now(clock).getDayOfWeek();
        if (today == DayOfWeek.SATURDAY || today == DayOfWeek.SUNDAY) {
            return Optional.of("Weekend detected (" + today + ") - markets closed");
        }

        if (action == TradeAction.OPEN && snapshot.monthlyBasis() < 0) {
            return Optional.of("Backwardation - refusing to open new position");
        }

        return Optional.empty();
    }

    private ExecutionOutcome executeOpen(Signal signal, PositionSizing sizing, MarketSnapshot snapshot) {
        int etfShares = sizing.etfSharesOrZero();
        int contracts = sizing.futuresContracts();

        OrderRequest etfRequest = order(OrderSide.BUY, pair.spotSymbol(), etfShares, snapshot.getEtfPrice(),
                TAG_ENTRY, "Basis trade entry - spot leg");
        log.info("[1/2] ETF entry: {}", etfRequest.describe());
        OrderResult etfResult = executor.submit(etfRequest);

        if (etfResult.getStatus() != OrderStatus.FILLED && etfResult.getStatus() != OrderStatus.PENDING) {
            log.error("❌ [{}] ETF leg {}: {} - aborting futures leg", pair.pairId(), etfResult.getStatus(), etfResult.getError());
            recordResult(ExecutionJournal.ENTRY_RESULT, etfResult, null);

            int stranded = etfResult.executedQuantity();
            if (stranded > 0) {
                tracker.updateOnEntry(stranded, priceOf(etfResult, snapshot.getEtfPrice()), 0, 0.0, snapshot.getFuturesExpiry());
                return outcome(signal, TradeAction.OPEN, ExecutionOutcome.Status.PARTIAL,
                        "Spot leg partially filled, futures leg not submitted", etfResult, null);
            }
            return outcome(signal, TradeAction.OPEN, ExecutionOutcome.Status.FAILED,
                    "Spot leg failed, futures leg not submitted", etfResult, null);
        }

        OrderRequest futuresRequest = order(OrderSide.SELL, pair.futuresSymbol(), contracts, snapshot.getFuturesPrice(),
                TAG_ENTRY, "Basis trade entry - futures leg");
        log.info("[2/2] Futures entry: {}", futuresRequest.describe());
        OrderResult futuresResult = executor.submit(futuresRequest);

        recordResult(ExecutionJournal.ENTRY_RESULT, etfResult, futuresResult);
        log.info("[{}] Entry ETF: {}, Futures: {}", pair.pairId(), etfResult.getStatus(), futuresResult.getStatus());

        if (settings.isDryRun()) {
            tracker.updateOnEntry(etfShares, priceOf(etfResult, snapshot.getEtfPrice()),
                    contracts, priceOf(futuresResult, snapshot.getFuturesPrice()), snapshot.getFuturesExpiry());
            return outcome(signal, TradeAction.OPEN, ExecutionOutcome.Status.COMPLETED, "Dry run entry recorded",
                    etfResult, futuresResult);
        }

        int filledShares = etfResult.executedQuantity();
        int filledContracts = futuresResult.executedQuantity();
        tracker.updateOnEntry(filledShares, priceOf(etfResult, snapshot.getEtfPrice()),
                filledContracts, priceOf(futuresResult, snapshot.getFuturesPrice()), snapshot.getFuturesExpiry());

        if (futuresResult.isFilled()) {
            return outcome(signal, TradeAction.OPEN, ExecutionOutcome.Status.COMPLETED, "Position opened",
                    etfResult, futuresResult);
        }
        log.error("❌ [{}] Futures leg {} ({}/{} contracts) - position is not fully hedged",
                pair.pairId(), futuresResult.getStatus(), filledContracts, contracts);
        return outcome(signal, TradeAction.OPEN, ExecutionOutcome.Status.PARTIAL,
                "Futures leg " + futuresResult.getStatus(), etfResult, futuresResult);
    }

    private ExecutionOutcome executeClose(Signal signal, MarketSnapshot snapshot) {
        Position position = tracker.getPosition();

        OrderResult etfResult = null;
        if (position.getEtfShares() > 0) {
            OrderRequest request = order(OrderSide.SELL, position.getEtfSymbol(), position.getEtfShares(),
                    snapshot.getEtfPrice(), TAG_EXIT, "Basis trade exit - spot leg");
            log.info("[1/2] ETF exit: {}", request.describe());
            etfResult = executor.submit(request);
        }

        OrderResult futuresResult = null;
        if (position.getFuturesContracts() > 0) {
            OrderRequest request = order(OrderSide.BUY, position.getFuturesSymbol(), position.getFuturesContracts(),
                    snapshot.getFuturesPrice(), TAG_EXIT, "Basis trade exit - futures leg");
            log.info("[2/2] Futures exit: {}", request.describe());
            futuresResult = executor.submit(request);
        }

        recordResult(ExecutionJournal.EXIT_RESULT, etfResult, futuresResult);

        if (settings.isDryRun() || allFilled(etfResult, futuresResult)) {
            tracker.clear();
            return outcome(signal, TradeAction.CLOSE, ExecutionOutcome.Status.COMPLETED, "Position closed",
                    etfResult, futuresResult);
        }
        return applyPartialReduction(signal, TradeAction.CLOSE, etfResult, futuresResult);
    }

    private ExecutionOutcome executeReduce(Signal signal, MarketSnapshot snapshot) {
        Position position = tracker.getPosition();
        int etfToSell = reduceQuantity(position.getEtfShares());
        int contractsToClose = reduceQuantity(position.getFuturesContracts());
        String pct = String.format(Locale.US, "%.0f%%", AppConstants.PARTIAL_EXIT_FRACTION * 100);

        OrderResult etfResult = null;
        if (etfToSell > 0) {
            OrderRequest request = order(OrderSide.SELL, position.getEtfSymbol(), etfToSell,
                    snapshot.getEtfPrice(), TAG_PARTIAL_EXIT, "Partial exit (" + pct + ") - spot leg");
            log.info("[1/2] Partial ETF exit: {}", request.describe());
            etfResult = executor.submit(request);
        }

        OrderResult futuresResult = null;
        if (contractsToClose > 0) {
            OrderRequest request = order(OrderSide.BUY, position.getFuturesSymbol(), contractsToClose,
                    snapshot.getFuturesPrice(), TAG_PARTIAL_EXIT, "Partial exit (" + pct + ") - futures leg");
            log.info("[2/2] Partial futures exit: {}", request.describe());
            futuresResult = executor.submit(request);
        }

        recordResult(ExecutionJournal.REDUCE_RESULT, etfResult, futuresResult);

        if (settings.isDryRun()) {
            tracker.updateOnPartialExit(etfToSell, contractsToClose);
            return outcome(signal, TradeAction.REDUCE, ExecutionOutcome.Status.COMPLETED, "Dry run reduction recorded",
                    etfResult, futuresResult);
        }
        return applyPartialReduction(signal, TradeAction.REDUCE, etfResult, futuresResult);
    }

    /**
     * Shrink the tracked position by what actually traded on each leg.
     */
    private ExecutionOutcome applyPartialReduction(Signal signal, TradeAction action,
                                                   OrderResult etfResult, OrderResult futuresResult) {
        int soldShares = etfResult != null ? etfResult.executedQuantity() : 0;
        int boughtContracts = futuresResult != null ? futuresResult.executedQuantity() : 0;

        if (soldShares == 0 && boughtContracts == 0) {
            log.error("❌ [{}] {} failed - nothing traded, position unchanged", pair.pairId(), action);
            return outcome(signal, action, ExecutionOutcome.Status.FAILED, "No leg traded", etfResult, futuresResult);
        }

        tracker.updateOnPartialExit(soldShares, boughtContracts);
        if (allFilled(etfResult, futuresResult)) {
            return outcome(signal, action, ExecutionOutcome.Status.COMPLETED, "Position reduced", etfResult, futuresResult);
        }
        log.warn("⚠️ [{}] {} only partially executed: {} shares, {} contracts", pair.pairId(), action, soldShares, boughtContracts);
        return outcome(signal, action, ExecutionOutcome.Status.PARTIAL, "Legs partially executed", etfResult, futuresResult);
    }

    private static int reduceQuantity(int quantity) {
        if (quantity <= 0) {
            return 0;
        }
        return Math.max(1, (int) (quantity * AppConstants.PARTIAL_EXIT_FRACTION));
    }

    private static boolean allFilled(OrderResult... results) {
        boolean any = false;
        for (OrderResult result : results) {
            if (result == null) {
                continue;
            }
            any = true;
            if (!result.isFilled()) {
                return false;
            }
        }
        return any;
    }

    private static double priceOf(OrderResult result, Double referencePrice) {
        if (result != null && result.getFillPrice() != null) {
            return result.getFillPrice();
        }
        return referencePrice != null ? referencePrice : 0.0;
    }

    /**
     * Build a leg order. Limit orders price buys above and sells below the reference,
     * rounded to cents; without a reference price the leg goes out as a market order.
     */
    OrderRequest order(OrderSide side, String symbol, int quantity, Double referencePrice, String tag, String reason) {
        OrderType type = OrderType.fromConfig(settings.getOrderType());
        Double limitPrice = null;
        if (type == OrderType.LIMIT && referencePrice != null && referencePrice > 0) {
            double offset = settings.getLimitOffsetPct();
            double raw = side == OrderSide.BUY ? referencePrice * (1 + offset) : referencePrice * (1 - offset);
            limitPrice = Math.round(raw * 100.0) / 100.0;
        } else {
            type = OrderType.MARKET;
        }
        return OrderRequest.builder()
                .side(side)
                .symbol(symbol)
                .quantity(quantity)
                .orderType(type)
                .limitPrice(limitPrice)
                .signal(tag)
                .reason(reason)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    private void recordResult(String event, OrderResult etfResult, OrderResult futuresResult) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("etf", etfResult != null ? etfResult.toJournalMap() : null);
        payload.put("futures", futuresResult != null ? futuresResult.toJournalMap() : null);
        journal.record(event, pair.pairId(), payload);
    }

    private static Map<String, Object> eventPayload(Signal signal, TradeAction action) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("signal", signal.name());
        payload.put("action", action.name());
        return payload;
    }

    private static Map<String, Object> sizingMap(PositionSizing sizing) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("etf_shares", sizing.etfShares());
        map.put("etf_value", sizing.spotValue());
        map.put("futures_contracts", sizing.futuresContracts());
        map.put("futures_units", sizing.futuresUnits());
        map.put("futures_value", sizing.futuresValue());
        map.put("total_exposure", sizing.totalExposure());
        map.put("delta_neutral", sizing.deltaNeutral());
        return map;
    }

    private ExecutionOutcome outcome(Signal signal, TradeAction action, ExecutionOutcome.Status status, String message,
                                     OrderResult etfResult, OrderResult futuresResult) {
        return new ExecutionOutcome(signal, action, status, message, etfResult, futuresResult);
    }

    String buildSummary(TradeAction action, SignalDecision decision, PositionSizing sizing, MarketSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        lines.add("Pair:          " + pair.pairId());
        lines.add("Signal:        " + decision.signal());
        lines.add("Reason:        " + decision.reason());
        lines.add("Action:        " + action);
        lines.add("Dry Run:       " + (settings.isDryRun() ? "YES" : "NO - LIVE"));
        lines.add("");
        lines.add(String.format(Locale.US, "Spot:          $%,.2f", snapshot.getSpotPrice()));
        lines.add(String.format(Locale.US, "Futures:       $%,.2f", snapshot.getFuturesPrice()));
        lines.add(String.format(Locale.US, "Monthly Basis: %6.2f%%", snapshot.monthlyBasis() * 100));
        lines.add("");

        Position position = tracker.getPosition();
        switch (action) {
            case OPEN -> {
                lines.add("ETF (" + pair.spotSymbol() + "):");
                lines.add(String.format(Locale.US, "  BUY %d shares (~$%,.2f)", sizing.etfSharesOrZero(), sizing.spotValue()));
                lines.add("Futures (" + pair.futuresSymbol() + "):");
                lines.add(String.format(Locale.US, "  SELL %d contracts (~$%,.2f)", sizing.futuresContracts(), sizing.futuresValue()));
            }
            case CLOSE -> {
                lines.add("Closing position:");
                lines.add("  SELL " + position.getEtfShares() + " " + position.getEtfSymbol() + " shares");
                lines.add("  BUY  " + position.getFuturesContracts() + " " + position.getFuturesSymbol() + " contracts");
            }
            case REDUCE -> {
                lines.add("Reducing position by half:");
                lines.add("  SELL " + reduceQuantity(position.getEtfShares()) + " " + position.getEtfSymbol() + " shares");
                lines.add("  BUY  " + reduceQuantity(position.getFuturesContracts()) + " " + position.getFuturesSymbol() + " contracts");
            }
            case NONE -> {
            }
        }
        return String.join("\n", lines);
    }
}
