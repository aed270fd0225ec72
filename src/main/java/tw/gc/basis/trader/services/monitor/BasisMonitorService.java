package tw.gc.basis.trader.services.monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.enums.RiskCategory;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.ReturnMetrics;
import tw.gc.basis.trader.model.RiskAssessment;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.execution.ExecutionManager;
import tw.gc.basis.trader.services.execution.ExecutionManagerFactory;
import tw.gc.basis.trader.services.execution.ExecutionOutcome;
import tw.gc.basis.trader.services.signal.SignalEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Polls every active pair on a fixed delay, evaluates the signal and risk, raises alerts
 * and hands alerting signals to the pair's execution manager.
 *
 * <p>Pairs are checked concurrently on a bounded worker pool; each pair owns its own
 * tracker and manager. A failing or unavailable pair is logged and skipped for that tick.
 * On shutdown in-flight checks are allowed to finish, brokers are disconnected and the
 * collected history is written to disk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BasisMonitorService {

    private static final DateTimeFormatter HISTORY_FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final TradingProperties tradingProperties;
    private final SignalEngine signalEngine;
    private final MarketSnapshotProvider snapshotProvider;
    private final ExecutionManagerFactory executionManagerFactory;
    private final AlertService alertService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, PairContext> contexts = new LinkedHashMap<>();
    private ExecutorService workers;

    @PostConstruct
    public void initialize() {
        StrategyConfig global = tradingProperties.getStrategy().toStrategyConfig();
        boolean executionEnabled = tradingProperties.getExecution().isEnabled();
        int historyLimit = tradingProperties.getMonitor().getHistoryLimit();

        for (PairConfig pair : tradingProperties.activePairs()) {
            StrategyConfig pairStrategy = global.forPair(pair);
            ExecutionManager manager = executionEnabled ? executionManagerFactory.create(pair, pairStrategy) : null;
            contexts.put(pair.pairId(), new PairContext(pair, pairStrategy, manager, historyLimit));
        }

        int poolSize = Math.max(1, Math.min(tradingProperties.getMonitor().getMaxWorkers(), contexts.size()));
        workers = Executors.newFixedThreadPool(poolSize);

        log.info("📡 Basis monitor ready: pairs={}, execution={}, dryRun={}, autoTrade={}",
                contexts.keySet(), executionEnabled,
                tradingProperties.getExecution().isDryRun(), tradingProperties.getExecution().isAutoTrade());
    }

    public Collection<PairContext> getContexts() {
        return Collections.unmodifiableCollection(contexts.values());
    }

    public Optional<PairContext> getContext(String pairId) {
        return Optional.ofNullable(contexts.get(pairId));
    }

    @Scheduled(fixedDelayString = "${trading.monitor.interval-ms:300000}", initialDelay = 5000)
    public void scheduledCycle() {
        if (!tradingProperties.getMonitor().isEnabled()) {
            return;
        }
        runCycle();
    }

    /**
     * Check every pair once and wait until all checks finished.
     */
    public void runCycle() {
        List<Future<?>> pending = new ArrayList<>();
        for (PairContext context : contexts.values()) {
            pending.add(workers.submit(() -> checkPairSafely(context)));
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Monitor cycle interrupted");
                return;
            } catch (ExecutionException e) {
                log.error("❌ Monitor task failed", e.getCause());
            }
        }
    }

    private void checkPairSafely(PairContext context) {
        try {
            checkPair(context);
        } catch (Exception e) {
            log.error("❌ [{}] Monitor check failed: {}", context.getPair().pairId(), e.getMessage(), e);
        }
    }

    /**
     * One tick for one pair. Returns the history entry recorded, or empty when no snapshot was available.
     */
    public Optional<Map<String, Object>> checkPair(PairContext context) {
        PairConfig pair = context.getPair();
        Optional<MarketSnapshot> maybeSnapshot = snapshotProvider.fetch(pair);
        if (maybeSnapshot.isEmpty()) {
            log.warn("⚠️ [{}] No market snapshot available - skipping tick", pair.pairId());
            return Optional.empty();
        }
        MarketSnapshot snapshot = maybeSnapshot.get();

        StrategyConfig strategy = context.getStrategy();
        SignalDecision decision = signalEngine.generateSignal(snapshot, strategy);
        ReturnMetrics returns = signalEngine.calculateReturns(snapshot, strategy);
        RiskAssessment risk = signalEngine.assessRisk(snapshot, strategy);

        log.info("🔍 [{}] spot={} futures={} monthly basis={}% -> {}", pair.pairId(),
                snapshot.getSpotPrice(), snapshot.getFuturesPrice(),
                String.format("%.2f", snapshot.monthlyBasis() * 100), decision);

        Map<String, Object> entry = historyEntry(pair, snapshot, decision, returns, risk);
        Signal previous = context.swapLastSignal(decision.signal());
        List<String> alerts = alertService.evaluate(pair.pairId(), previous, decision, risk);

        if (!alerts.isEmpty()) {
            alertService.publish(alerts);
            ExecutionManager manager = context.getExecutionManager();
            if (manager != null) {
                try {
                    ExecutionOutcome outcome = manager.handleSignal(decision, snapshot);
                    entry.put("execution", outcome.status().name());
                } catch (RuntimeException e) {
                    log.error("❌ [{}] Execution failed: {}", pair.pairId(), e.getMessage(), e);
                    entry.put("execution", "ERROR");
                }
            }
        }

        context.addHistory(entry);
        return Optional.of(entry);
    }

    private Map<String, Object> historyEntry(PairConfig pair, MarketSnapshot snapshot, SignalDecision decision,
                                             ReturnMetrics returns, RiskAssessment risk) {
        Map<String, Object> risks = new LinkedHashMap<>();
        for (Map.Entry<RiskCategory, RiskAssessment.Factor> factor : risk.factors().entrySet()) {
            risks.put(factor.getKey().name().toLowerCase(Locale.ROOT),
                    factor.getValue().level() + " - " + factor.getValue().description());
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", LocalDateTime.now(clock).toString());
        entry.put("pair_id", pair.pairId());
        entry.put("spot_price", snapshot.getSpotPrice());
        entry.put("futures_price", snapshot.getFuturesPrice());
        entry.put("futures_expiry", snapshot.getFuturesExpiry().toString());
        entry.put("days_to_expiry", snapshot.daysToExpiry());
        entry.put("monthly_basis", returns.monthlyBasis() * 100);
        entry.put("net_annualized_return", returns.netAnnualized() * 100);
        entry.put("signal", decision.signal().name());
        entry.put("signal_reason", decision.reason());
        entry.put("overall_risk", risk.overall().name());
        entry.put("risks", risks);
        return entry;
    }

    /**
     * Write every pair's history to {@code basis_history_YYYYMMDD.json} in the history directory.
     */
    public Path saveHistory() throws IOException {
        Map<String, List<Map<String, Object>>> combined = new LinkedHashMap<>();
        for (PairContext context : contexts.values()) {
            combined.put(context.getPair().pairId(), context.getHistory());
        }
        Path dir = Paths.get(tradingProperties.getMonitor().getHistoryDir());
        Files.createDirectories(dir);
        Path file = dir.resolve("basis_history_" + LocalDate.now(clock).format(HISTORY_FILE_DATE) + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), combined);
        log.info("💾 History saved to {}", file);
        return file;
    }

    @PreDestroy
    public void shutdown() {
        log.info("🛑 Basis monitor shutting down");
        if (workers != null) {
            workers.shutdown();
            long graceSeconds = tradingProperties.getExecution().getOrderTimeoutSeconds() * 2L + SHUTDOWN_GRACE_SECONDS;
            try {
                if (!workers.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                    log.warn("⚠️ Monitor workers still busy after {}s", graceSeconds);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (PairContext context : contexts.values()) {
            ExecutionManager manager = context.getExecutionManager();
            if (manager != null) {
                try {
                    manager.disconnect();
                } catch (RuntimeException e) {
                    log.error("❌ [{}] Disconnect failed: {}", context.getPair().pairId(), e.getMessage());
                }
            }
        }

        if (contexts.values().stream().allMatch(c -> c.getHistory().isEmpty())) {
            return;
        }
        try {
            saveHistory();
        } catch (IOException e) {
            log.error("❌ Failed to save monitor history", e);
        }
    }
}
