package tw.gc.basis.trader.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StrategyConfig")
class StrategyConfigTest {

    @Test
    void derivedAmounts() {
        StrategyConfig config = StrategyConfig.defaults();

        assertThat(config.spotTargetAmount()).isEqualTo(100_000);
        assertThat(config.futuresTargetAmount()).isEqualTo(100_000);
        assertThat(config.monthlyFundingCost()).isCloseTo(0.05 / 12, within(1e-15));
    }

    @Test
    @DisplayName("forPair scales the account and leaves the original untouched")
    void forPair() {
        StrategyConfig base = StrategyConfig.defaults();
        PairConfig pair = new PairConfig("ETH", "ETHA", "MET", 0.25, 0.1);

        StrategyConfig derived = base.forPair(pair);

        assertThat(derived.accountSize()).isEqualTo(50_000);
        assertThat(derived.contractSize()).isEqualTo(0.1);
        assertThat(base.accountSize()).isEqualTo(200_000);
        assertThat(base.contractSize()).isEqualTo(5.0);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> StrategyConfig.defaults().toBuilder().accountSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StrategyConfig.defaults().toBuilder().contractSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StrategyConfig.defaults().toBuilder().leverage(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pairValidation() {
        assertThatThrownBy(() -> new PairConfig(" ", "IBIT", "MBT", 1.0, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PairConfig("BTC", "IBIT", "MBT", 1.5, 0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
