package tw.gc.basis.trader.services.monitor;

import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.execution.ExecutionManager;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Monitor state for one pair: its config, the last signal seen, a bounded history,
 * and the execution manager when execution is enabled.
 */
public class PairContext {

    private final PairConfig pair;
    private final StrategyConfig strategy;
    private final ExecutionManager executionManager;
    private final int historyLimit;
    private final Deque<Map<String, Object>> history = new ArrayDeque<>();
    private Signal lastSignal;

    public PairContext(PairConfig pair, StrategyConfig strategy, ExecutionManager executionManager, int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive, got " + historyLimit);
        }
        this.pair = pair;
        this.strategy = strategy;
        this.executionManager = executionManager;
        this.historyLimit = historyLimit;
    }

    public PairConfig getPair() {
        return pair;
    }

    public StrategyConfig getStrategy() {
        return strategy;
    }

    /**
     * @return the pair's execution manager, or {@code null} in monitor-only mode
     */
    public ExecutionManager getExecutionManager() {
        return executionManager;
    }

    /**
     * Record the new signal and return the previous one ({@code null} on the first tick).
     */
    public synchronized Signal swapLastSignal(Signal signal) {
        Signal previous = lastSignal;
        lastSignal = signal;
        return previous;
    }

    public synchronized Signal getLastSignal() {
        return lastSignal;
    }

    public synchronized void addHistory(Map<String, Object> entry) {
        history.addLast(entry);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    public synchronized List<Map<String, Object>> getHistory() {
        return new ArrayList<>(history);
    }
}
