package tw.gc.basis.trader.services.backtest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.basis.trader.config.AppConfig;
import tw.gc.basis.trader.enums.TradeStatus;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class BacktestReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private BacktestReportWriter writer;
    private BacktestResult result;

    @BeforeEach
    void setUp() {
        writer = new BacktestReportWriter(objectMapper);

        BacktestTrade trade = BacktestTrade.builder()
                .entryDate(LocalDate.of(2024, 1, 1))
                .entrySpot(100_000)
                .entryFutures(102_000)
                .entryBasis(2_000)
                .build();
        trade.close(LocalDate.of(2024, 1, 31), 101_000, 101_500, TradeStatus.CLOSED, 0.0365);

        result = BacktestResult.builder()
                .trades(new ArrayList<>(List.of(trade)))
                .equityCurve(new ArrayList<>(List.of(100_000.0, 101_200.0)))
                .initialCapital(100_000)
                .totalReturn(0.012)
                .totalTrades(1)
                .winningTrades(1)
                .avgWin(0.012)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void documentScalesPercentages() {
        Map<String, Object> document = writer.toDocument(result);

        Map<String, Object> summary = (Map<String, Object>) document.get("summary");
        assertThat((double) summary.get("total_return")).isCloseTo(1.2, within(1e-9));
        assertThat((double) summary.get("win_rate")).isEqualTo(100.0);
        assertThat((double) summary.get("final_capital")).isCloseTo(101_200, within(1e-6));
        assertThat((double) summary.get("profit_factor")).isInfinite();

        List<Map<String, Object>> trades = (List<Map<String, Object>>) document.get("trades");
        assertThat(trades).hasSize(1);
        assertThat(trades.get(0)).containsEntry("entry_date", "2024-01-01")
                .containsEntry("holding_days", 30L)
                .containsEntry("status", TradeStatus.CLOSED);
        assertThat((double) trades.get(0).get("return_pct")).isCloseTo(1.2, within(1e-9));
    }

    @Test
    void writesJsonFile() throws Exception {
        Path output = tempDir.resolve("backtest").resolve("backtest_results.json");

        writer.write(result, output);

        JsonNode json = objectMapper.readTree(output.toFile());
        assertThat(json.path("summary").path("total_trades").asInt()).isEqualTo(1);
        assertThat(json.path("trades").get(0).path("status").asText()).isEqualTo("closed");
        assertThat(json.path("trades").get(0).path("exit_date").asText()).isEqualTo("2024-01-31");
    }

    @Test
    void textReportListsHeadlineFigures() {
        String report = writer.textReport(result);

        assertThat(report).contains("BASIS TRADE BACKTEST RESULTS", "Total Return:         1.20%", "Win Rate:             100.0%");
    }
}
