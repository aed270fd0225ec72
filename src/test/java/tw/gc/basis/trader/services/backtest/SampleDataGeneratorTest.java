package tw.gc.basis.trader.services.backtest;

import org.junit.jupiter.api.Test;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SampleDataGeneratorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 31);

    private final SampleDataGenerator generator = new SampleDataGenerator();

    @Test
    void oneSnapshotPerDay() {
        List<MarketSnapshot> series = generator.generate(START, END, 50_000, 42L, PairConfig.btc());

        assertThat(series).hasSize(91);
        assertThat(series.get(0).getAsOf()).isEqualTo(START);
        assertThat(series.get(90).getAsOf()).isEqualTo(END);
        assertThat(series).allSatisfy(s -> {
            assertThat(s.getSpotPrice()).isGreaterThanOrEqualTo(10_000);
            assertThat(s.basisPercent()).isGreaterThanOrEqualTo(-0.01 - 1e-12);
            assertThat(s.daysToExpiry()).isEqualTo(30);
        });
    }

    @Test
    void sameSeedSameSeries() {
        List<MarketSnapshot> a = generator.generate(START, END, 50_000, 7L, PairConfig.btc());
        List<MarketSnapshot> b = generator.generate(START, END, 50_000, 7L, PairConfig.btc());

        assertThat(a).isEqualTo(b);
    }

    @Test
    void rejectsReversedRange() {
        assertThatThrownBy(() -> generator.generate(END, START, 50_000, 42L, PairConfig.btc()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
