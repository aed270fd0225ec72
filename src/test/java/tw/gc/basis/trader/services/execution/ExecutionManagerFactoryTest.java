package tw.gc.basis.trader.services.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.basis.trader.config.AppConfig;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.StrategyConfig;
import tw.gc.basis.trader.services.positionsizing.PositionSizer;

import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ExecutionManagerFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void eachPairGetsItsOwnStateFile() {
        TradingProperties properties = new TradingProperties();
        properties.getExecution().setStateDir(tempDir.toString());
        ExecutionManagerFactory factory = new ExecutionManagerFactory(properties, mock(OrderExecutor.class),
                new PositionSizer(), mock(ExecutionJournal.class), mock(TradeConfirmation.class),
                new AppConfig().objectMapper(), Clock.systemUTC());
        PairConfig eth = new PairConfig("ETH", "ETHA", "MET", 0.5, 0.1);

        ExecutionManager manager = factory.create(eth, StrategyConfig.defaults().forPair(eth));

        assertThat(factory.positionStatePath(eth)).isEqualTo(tempDir.resolve("position_state_eth.json"));
        assertThat(factory.positionStatePath(PairConfig.btc())).isEqualTo(tempDir.resolve("position_state_btc.json"));
        assertThat(manager.getPair()).isEqualTo(eth);
        assertThat(manager.getTracker().getPairId()).isEqualTo("ETH");
        assertThat(manager.getTracker().isOpen()).isFalse();
    }
}
