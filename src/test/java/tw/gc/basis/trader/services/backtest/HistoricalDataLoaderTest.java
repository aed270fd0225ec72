package tw.gc.basis.trader.services.backtest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HistoricalDataLoaderTest {

    @TempDir
    Path tempDir;

    private final HistoricalDataLoader loader = new HistoricalDataLoader();

    private Path csv(String content) throws Exception {
        Path file = tempDir.resolve("basis.csv");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void loadsRowsByHeaderName() throws Exception {
        Path file = csv("""
                futures_expiry,date,spot_price,futures_price
                2024-01-26,2024-01-02,45000.5,45900
                2024-01-26,2024-01-03 16:00:00,45100,46000.25
                """);

        List<MarketSnapshot> snapshots = loader.load(file, PairConfig.btc());

        assertThat(snapshots).hasSize(2);
        MarketSnapshot first = snapshots.get(0);
        assertThat(first.getPairId()).isEqualTo("BTC");
        assertThat(first.getSpotSymbol()).isEqualTo("IBIT");
        assertThat(first.getAsOf()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(first.getSpotPrice()).isEqualTo(45000.5);
        assertThat(first.getFuturesExpiry()).isEqualTo(LocalDate.of(2024, 1, 26));
        assertThat(snapshots.get(1).getAsOf()).isEqualTo(LocalDate.of(2024, 1, 3));
    }

    @Test
    void skipsMalformedRows() throws Exception {
        Path file = csv("\uFEFFdate,spot_price,futures_price,futures_expiry\n"
                + "2024-01-02,45000,45900,2024-01-26\n"
                + "2024-01-03,not-a-price,45900,2024-01-26\n"
                + "\n"
                + "2024-01-04,45200\n"
                + "2024-01-05,45300,46200,2024-01-26\n");

        List<MarketSnapshot> snapshots = loader.load(file, PairConfig.btc());

        assertThat(snapshots).extracting(MarketSnapshot::getAsOf)
                .containsExactly(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5));
    }

    @Test
    void missingColumnIsRejected() throws Exception {
        Path file = csv("date,spot_price,futures_price\n2024-01-02,45000,45900\n");

        assertThatThrownBy(() -> loader.load(file, PairConfig.btc()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("futures_expiry");
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        Path file = csv("");

        assertThatThrownBy(() -> loader.load(file, PairConfig.btc()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseDateAcceptsDateTimes() {
        assertThat(HistoricalDataLoader.parseDate("2024-03-29T08:00:00")).isEqualTo(LocalDate.of(2024, 3, 29));
    }
}
