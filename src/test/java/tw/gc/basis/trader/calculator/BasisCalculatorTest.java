package tw.gc.basis.trader.calculator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.basis.trader.model.ReturnMetrics;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BasisCalculator")
class BasisCalculatorTest {

    @Nested
    @DisplayName("Basis")
    class Basis {

        @Test
        @DisplayName("absolute and percent basis in contango")
        void contango() {
            assertThat(BasisCalculator.basisAbsolute(100_000, 102_000)).isEqualTo(2_000);
            assertThat(BasisCalculator.basisPercent(100_000, 102_000)).isCloseTo(0.02, within(1e-12));
            assertThat(BasisCalculator.isContango(100_000, 102_000)).isTrue();
            assertThat(BasisCalculator.isBackwardation(100_000, 102_000)).isFalse();
        }

        @Test
        @DisplayName("percent basis is zero for a non-positive spot price")
        void zeroSpot() {
            assertThat(BasisCalculator.basisPercent(0, 102_000)).isZero();
        }

        @Test
        @DisplayName("monthly and annualized basis scale by days to expiry")
        void timeNormalized() {
            assertThat(BasisCalculator.monthlyBasis(0.02, 60)).isCloseTo(0.01, within(1e-12));
            assertThat(BasisCalculator.annualizedBasis(0.02, 73)).isCloseTo(0.10, within(1e-12));
        }

        @Test
        @DisplayName("expired contracts produce zero time-normalized metrics")
        void expired() {
            assertThat(BasisCalculator.monthlyBasis(0.02, 0)).isZero();
            assertThat(BasisCalculator.annualizedBasis(0.02, -3)).isZero();
            assertThat(BasisCalculator.returns(100, 102, 0, 0.05, 1.0)).isEqualTo(ReturnMetrics.zero());
        }

        @Test
        @DisplayName("days to expiry counts calendar days")
        void daysToExpiry() {
            assertThat(BasisCalculator.daysToExpiry(LocalDate.of(2024, 3, 29), LocalDate.of(2024, 2, 28))).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("ETF discount")
    class EtfDiscount {

        @Test
        void discountAgainstNav() {
            assertThat(BasisCalculator.etfDiscountPremium(49.0, 50.0)).isCloseTo(-0.02, within(1e-12));
        }

        @Test
        void missingInputs() {
            assertThat(BasisCalculator.etfDiscountPremium(null, 50.0)).isNull();
            assertThat(BasisCalculator.etfDiscountPremium(49.0, 0.0)).isNull();
        }
    }

    @Test
    @DisplayName("returns are net of funding and scaled by leverage")
    void returns() {
        ReturnMetrics metrics = BasisCalculator.returns(100_000, 102_000, 73, 0.05, 2.0);

        assertThat(metrics.grossAnnualized()).isCloseTo(0.10, within(1e-9));
        assertThat(metrics.netAnnualized()).isCloseTo(0.05, within(1e-9));
        assertThat(metrics.leveragedReturn()).isCloseTo(0.10, within(1e-9));
    }
}
