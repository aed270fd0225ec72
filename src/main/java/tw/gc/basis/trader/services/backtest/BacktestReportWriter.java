package tw.gc.basis.trader.services.backtest;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders backtest results as the JSON output file and as a plain-text summary.
 * Percent fields in the JSON are scaled by 100.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestReportWriter {

    private final ObjectMapper objectMapper;

    public Map<String, Object> toDocument(BacktestResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("initial_capital", result.getInitialCapital());
        summary.put("final_capital", result.finalCapital());
        summary.put("total_return", result.getTotalReturn() * 100);
        summary.put("total_trades", result.getTotalTrades());
        summary.put("winning_trades", result.getWinningTrades());
        summary.put("losing_trades", result.getLosingTrades());
        summary.put("win_rate", result.winRate() * 100);
        summary.put("avg_win", result.getAvgWin() * 100);
        summary.put("avg_loss", result.getAvgLoss() * 100);
        summary.put("profit_factor", result.profitFactor());
        summary.put("max_drawdown", result.getMaxDrawdown() * 100);
        summary.put("sharpe_ratio", result.getSharpeRatio());
        summary.put("start_date", result.getStartDate() != null ? result.getStartDate().toString() : null);
        summary.put("end_date", result.getEndDate() != null ? result.getEndDate().toString() : null);

        List<Map<String, Object>> trades = new ArrayList<>();
        for (BacktestTrade trade : result.getTrades()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("entry_date", trade.getEntryDate().toString());
            row.put("exit_date", trade.getExitDate() != null ? trade.getExitDate().toString() : null);
            row.put("entry_basis", trade.getEntryBasis());
            row.put("exit_basis", trade.getExitBasis());
            row.put("holding_days", trade.holdingDays());
            row.put("realized_pnl", trade.getRealizedPnl());
            row.put("return_pct", scaled(trade.returnPct()));
            row.put("annualized_return", scaled(trade.annualizedReturn()));
            row.put("status", trade.getStatus());
            trades.add(row);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("summary", summary);
        document.put("trades", trades);
        return document;
    }

    public void write(BacktestResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), toDocument(result));
        log.info("💾 Backtest results written to {}", output);
    }

    public String textReport(BacktestResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("BASIS TRADE BACKTEST RESULTS\n");
        sb.append(String.format(Locale.US, "Period:               %s to %s%n", result.getStartDate(), result.getEndDate()));
        sb.append(String.format(Locale.US, "Initial Capital:      $%,.2f%n", result.getInitialCapital()));
        sb.append(String.format(Locale.US, "Final Capital:        $%,.2f%n", result.finalCapital()));
        sb.append(String.format(Locale.US, "Total Return:         %.2f%%%n", result.getTotalReturn() * 100));
        sb.append(String.format(Locale.US, "Total Trades:         %d%n", result.getTotalTrades()));
        sb.append(String.format(Locale.US, "Winning Trades:       %d%n", result.getWinningTrades()));
        sb.append(String.format(Locale.US, "Losing Trades:        %d%n", result.getLosingTrades()));
        sb.append(String.format(Locale.US, "Win Rate:             %.1f%%%n", result.winRate() * 100));
        sb.append(String.format(Locale.US, "Average Win:          %.2f%%%n", result.getAvgWin() * 100));
        sb.append(String.format(Locale.US, "Average Loss:         %.2f%%%n", result.getAvgLoss() * 100));
        sb.append(String.format(Locale.US, "Profit Factor:        %.2f%n", result.profitFactor()));
        sb.append(String.format(Locale.US, "Max Drawdown:         %.2f%%%n", result.getMaxDrawdown() * 100));
        sb.append(String.format(Locale.US, "Sharpe Ratio:         %.2f%n", result.getSharpeRatio()));
        return sb.toString();
    }

    private static Double scaled(Double fraction) {
        return fraction != null ? fraction * 100 : null;
    }
}
