package tw.gc.basis.trader.services.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.position.JsonFilePositionRepository;
import tw.gc.basis.trader.services.position.PositionTracker;
import tw.gc.basis.trader.services.positionsizing.PositionSizer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Locale;

/**
 * Builds the pair-scoped execution stack: one tracker and one manager per pair,
 * each with its own position state file.
 */
@Component
@RequiredArgsConstructor
public class ExecutionManagerFactory {

    private final TradingProperties tradingProperties;
    private final OrderExecutor orderExecutor;
    private final PositionSizer positionSizer;
    private final ExecutionJournal executionJournal;
    private final TradeConfirmation tradeConfirmation;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExecutionManager create(PairConfig pair, StrategyConfig pairStrategy) {
        PositionTracker tracker = new PositionTracker(
                pair, new JsonFilePositionRepository(positionStatePath(pair), objectMapper), clock);
        return new ExecutionManager(pair, pairStrategy, tracker, orderExecutor, positionSizer,
                executionJournal, tradeConfirmation, tradingProperties.getExecution(), clock);
    }

    Path positionStatePath(PairConfig pair) {
        String fileName = "position_state_" + pair.pairId().toLowerCase(Locale.ROOT) + ".json";
        return Paths.get(tradingProperties.getExecution().getStateDir(), fileName);
    }
}
