package tw.gc.basis.trader.services.monitor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.enums.RiskCategory;
import tw.gc.basis.trader.enums.RiskLevel;
import tw.gc.basis.trader.enums.Signal;
import tw.gc.basis.trader.model.RiskAssessment;
import tw.gc.basis.trader.model.SignalDecision;
import tw.gc.basis.trader.services.telegram.TelegramService;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides which monitor observations deserve an alert and delivers them.
 *
 * <p>Exit and stop-loss signals alert on every tick; entry signals only when the signal
 * changed; any critical risk factor alerts on its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private static final Logger ALERTS = LoggerFactory.getLogger("ALERTS");

    private final TelegramService telegramService;

    public List<String> evaluate(String pairId, Signal previousSignal, SignalDecision decision, RiskAssessment risk) {
        List<String> alerts = new ArrayList<>();
        String tag = "[" + pairId + "]";
        Signal signal = decision.signal();
        boolean changed = signal != previousSignal;

        switch (signal) {
            case STOP_LOSS -> alerts.add(tag + " 🚨 STOP LOSS ALERT: " + decision.reason());
            case FULL_EXIT -> alerts.add(tag + " 📉 FULL EXIT SIGNAL: " + decision.reason());
            case PARTIAL_EXIT -> alerts.add(tag + " ↘️ PARTIAL EXIT SIGNAL: " + decision.reason());
            case STRONG_ENTRY -> {
                if (changed) {
                    alerts.add(tag + " 🟢 STRONG ENTRY SIGNAL: " + decision.reason());
                }
            }
            case ACCEPTABLE_ENTRY -> {
                if (changed) {
                    alerts.add(tag + " 🟡 ACCEPTABLE ENTRY SIGNAL: " + decision.reason());
                }
            }
            default -> {
            }
        }

        List<RiskCategory> critical = risk.factors().entrySet().stream()
                .filter(e -> e.getValue().level() == RiskLevel.CRITICAL)
                .map(Map.Entry::getKey)
                .toList();
        if (!critical.isEmpty()) {
            alerts.add(tag + " ⚠️ CRITICAL RISKS: " + critical.stream()
                    .map(c -> c.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", ")));
        }
        return alerts;
    }

    public void publish(List<String> alerts) {
        for (String alert : alerts) {
            ALERTS.warn(alert);
            log.warn(alert);
            telegramService.sendMessage(alert);
        }
    }
}
