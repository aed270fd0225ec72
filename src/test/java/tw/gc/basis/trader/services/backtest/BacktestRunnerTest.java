package tw.gc.basis.trader.services.backtest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import tw.gc.basis.trader.config.AppConfig;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.services.signal.SignalEngine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class BacktestRunnerTest {

    @TempDir
    Path tempDir;

    private TradingProperties properties;
    private BacktestRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        properties.getBacktest().setSampleStart(LocalDate.of(2024, 1, 1));
        properties.getBacktest().setSampleEnd(LocalDate.of(2024, 3, 31));
        runner = new BacktestRunner(properties, new HistoricalDataLoader(), new SampleDataGenerator(),
                new BacktestEngine(new SignalEngine()), new BacktestReportWriter(new AppConfig().objectMapper()));
    }

    @Test
    void runsOnSampleDataWhenNoFileConfigured() throws Exception {
        BacktestResult result = runner.runConfigured();

        assertThat(result.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(result.getEndDate()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(result.getInitialCapital()).isEqualTo(200_000);
        assertThat(result.getEquityCurve()).hasSize(result.getTotalTrades() + 1);
    }

    @Test
    void runsOnCsvAndWritesReport() throws Exception {
        Path csv = tempDir.resolve("basis.csv");
        Files.writeString(csv, "date,spot_price,futures_price,futures_expiry\n"
                + "2024-01-02,100000,102000,2024-02-01\n"
                + "2024-01-03,100100,102102,2024-02-02\n");
        Path output = tempDir.resolve("out").resolve("results.json");
        properties.getBacktest().setDataFile(csv.toString());
        properties.getBacktest().setOutputFile(output.toString());

        runner.run(new DefaultApplicationArguments());

        assertThat(output).exists();
        assertThat(Files.readString(output)).contains("\"forced_close\"");
    }
}
