package tw.gc.basis.trader.services.backtest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.StrategyConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs one backtest at startup when {@code trading.backtest.enabled=true}: loads the
 * configured CSV (or generates a sample series), runs the engine and writes the report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trading.backtest", name = "enabled", havingValue = "true")
public class BacktestRunner implements ApplicationRunner {

    private final TradingProperties tradingProperties;
    private final HistoricalDataLoader historicalDataLoader;
    private final SampleDataGenerator sampleDataGenerator;
    private final BacktestEngine backtestEngine;
    private final BacktestReportWriter reportWriter;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        BacktestResult result = runConfigured();
        log.info("\n{}", reportWriter.textReport(result));

        String outputFile = tradingProperties.getBacktest().getOutputFile();
        if (outputFile != null && !outputFile.isBlank()) {
            reportWriter.write(result, Paths.get(outputFile));
        }
    }

    BacktestResult runConfigured() throws IOException {
        TradingProperties.Backtest settings = tradingProperties.getBacktest();
        StrategyConfig config = tradingProperties.getStrategy().toStrategyConfig();
        PairConfig pair = tradingProperties.activePairs().stream().findFirst().orElse(PairConfig.btc());

        List<MarketSnapshot> series;
        if (settings.getDataFile() != null && !settings.getDataFile().isBlank()) {
            Path csv = Paths.get(settings.getDataFile());
            log.info("🔬 Backtesting {} on {}", pair.pairId(), csv);
            series = historicalDataLoader.load(csv, pair);
        } else {
            log.info("🔬 Backtesting {} on sample data {} to {} (seed {})", pair.pairId(),
                    settings.getSampleStart(), settings.getSampleEnd(), settings.getSampleSeed());
            series = sampleDataGenerator.generate(settings.getSampleStart(), settings.getSampleEnd(),
                    settings.getSampleBasePrice(), settings.getSampleSeed(), pair);
        }
        return backtestEngine.run(series, config, settings.getMaxHoldingDays());
    }
}
