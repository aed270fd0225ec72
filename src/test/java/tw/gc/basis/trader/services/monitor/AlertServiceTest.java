package tw.gc.basis.trader.services.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.basis.trader.enums.RiskCategory;
import tw.gc.basis.trader.enums.RiskLevel;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.model.RiskAssessment;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.services.telegram.TelegramService;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AlertService")
class AlertServiceTest {

    private static final RiskAssessment CALM = new RiskAssessment(Map.of(
            RiskCategory.BASIS, new RiskAssessment.Factor(RiskLevel.LOW, "Positive contango")));
    private static final RiskAssessment CRITICAL = new RiskAssessment(Map.of(
            RiskCategory.BASIS, new RiskAssessment.Factor(RiskLevel.CRITICAL, "Backwardation (negative carry)")));

    @Mock
    private TelegramService telegramService;

    private AlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new AlertService(telegramService);
    }

    @Test
    @DisplayName("exit signals alert on every tick")
    void exitsAlwaysAlert() {
        SignalDecision partial = new SignalDecision(Signal.PARTIAL_EXIT, "Elevated basis (>2.5% monthly) - partial exit");

        List<String> alerts = alertService.evaluate("BTC", Signal.PARTIAL_EXIT, partial, CALM);

        assertThat(alerts).containsExactly("[BTC] ↘️ PARTIAL EXIT SIGNAL: Elevated basis (>2.5% monthly) - partial exit");
    }

    @Test
    @DisplayName("entry signals alert only when the signal changes")
    void entriesAlertOnChange() {
        SignalDecision strong = new SignalDecision(Signal.STRONG_ENTRY, "Strong basis >1.0% monthly");

        assertThat(alertService.evaluate("BTC", null, strong, CALM)).hasSize(1).first().asString().contains("STRONG ENTRY SIGNAL");
        assertThat(alertService.evaluate("BTC", Signal.STRONG_ENTRY, strong, CALM)).isEmpty();
        assertThat(alertService.evaluate("BTC", Signal.STRONG_ENTRY,
                new SignalDecision(Signal.ACCEPTABLE_ENTRY, "Acceptable basis 0.5-1.0% monthly"), CALM))
                .singleElement().asString().contains("ACCEPTABLE ENTRY SIGNAL");
    }

    @Test
    void noEntryIsSilent() {
        assertThat(alertService.evaluate("BTC", null, new SignalDecision(Signal.NO_ENTRY, "Basis too low"), CALM)).isEmpty();
    }

    @Test
    @DisplayName("critical risks add their own alert")
    void criticalRisk() {
        SignalDecision stop = new SignalDecision(Signal.STOP_LOSS, "Backwardation detected - basis negative");

        List<String> alerts = alertService.evaluate("ETH", Signal.STOP_LOSS, stop, CRITICAL);

        assertThat(alerts).containsExactly(
                "[ETH] 🚨 STOP LOSS ALERT: Backwardation detected - basis negative",
                "[ETH] ⚠️ CRITICAL RISKS: basis");
    }

    @Test
    void publishSendsEachAlert() {
        alertService.publish(List.of("one", "two"));

        verify(telegramService).sendMessage("one");
        verify(telegramService).sendMessage("two");
    }
}
