package tw.gc.basis.trader.services.backtest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the historical basis CSV: {@code date, spot_price, futures_price, futures_expiry}
 * with ISO dates (date-times are truncated to their date). Column order is taken from the header.
 */
@Slf4j
@Component
public class HistoricalDataLoader {

    static final String DATE = "date";
    static final String SPOT_PRICE = "spot_price";
    static final String FUTURES_PRICE = "futures_price";
    static final String FUTURES_EXPIRY = "futures_expiry";

    private static final List<String> REQUIRED_COLUMNS = List.of(DATE, SPOT_PRICE, FUTURES_PRICE, FUTURES_EXPIRY);

    public List<MarketSnapshot> load(Path csv, PairConfig pair) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) {
                throw new IllegalArgumentException("CSV file is empty: " + csv);
            }
            Map<String, Integer> columns = indexColumns(header);
            for (String required : REQUIRED_COLUMNS) {
                if (!columns.containsKey(required)) {
                    throw new IllegalArgumentException("CSV " + csv + " is missing column '" + required + "'");
                }
            }

            List<MarketSnapshot> snapshots = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    snapshots.add(parseRow(line.split(",", -1), columns, pair));
                } catch (RuntimeException e) {
                    log.warn("⚠️ Skipping line {} of {}: {}", lineNumber, csv, e.getMessage());
                }
            }
            log.info("📥 Loaded {} data points from {}", snapshots.size(), csv);
            return snapshots;
        }
    }

    private static Map<String, Integer> indexColumns(String header) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = header.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            String name = names[i].trim().toLowerCase(Locale.ROOT);
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            columns.put(name, i);
        }
        return columns;
    }

    private static MarketSnapshot parseRow(String[] cells, Map<String, Integer> columns, PairConfig pair) {
        return MarketSnapshot.builder()
                .pairId(pair.pairId())
                .spotSymbol(pair.spotSymbol())
                .futuresSymbol(pair.futuresSymbol())
                .asOf(parseDate(cell(cells, columns, DATE)))
                .spotPrice(Double.parseDouble(cell(cells, columns, SPOT_PRICE)))
                .futuresPrice(Double.parseDouble(cell(cells, columns, FUTURES_PRICE)))
                .futuresExpiry(parseDate(cell(cells, columns, FUTURES_EXPIRY)))
                .build();
    }

    private static String cell(String[] cells, Map<String, Integer> columns, String column) {
        int index = columns.get(column);
        if (index >= cells.length) {
            throw new IllegalArgumentException("missing value for " + column);
        }
        return cells[index].trim();
    }

    static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value.replace(' ', 'T')).toLocalDate();
        }
    }
}
