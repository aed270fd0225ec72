package tw.gc.basis.trader.services.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tw.gc.basis.trader.calculator.ExpiryCalendar;
import tw.gc.basis.trader.config.TradingProperties;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Snapshots from the HTTP bridge's {@code /basis} endpoint.
 *
 * <p>Expected payload: {@code status}, {@code spot_price}, {@code futures_price},
 * {@code futures_expiry} (ISO date or YYYYMM contract month) and optionally
 * {@code etf_price}, {@code etf_nav}, {@code fear_greed} (0-100) and {@code open_interest}.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class BridgeMarketSnapshotSource implements MarketSnapshotSource {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    @Override
    public String name() {
        return "bridge";
    }

    @Override
    public Optional<MarketSnapshot> fetch(PairConfig pair) {
        try {
            String url = tradingProperties.getBridge().getUrl() + "/basis?pair={pair}";
            String json = restTemplate.getForObject(url, String.class, pair.pairId());
            if (json == null) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(json);
            if (!"ok".equalsIgnoreCase(node.path("status").asText("ok"))) {
                log.warn("⚠️ Bridge has no basis data for {}: {}", pair.pairId(), node.path("error").asText(""));
                return Optional.empty();
            }
            return Optional.of(toSnapshot(node, pair));
        } catch (Exception e) {
            log.warn("⚠️ Bridge basis fetch failed for {}: {}", pair.pairId(), e.getMessage());
            return Optional.empty();
        }
    }

    MarketSnapshot toSnapshot(JsonNode node, PairConfig pair) {
        double spot = node.path("spot_price").asDouble(0.0);
        double futures = node.path("futures_price").asDouble(0.0);
        String expiry = node.path("futures_expiry").asText("");
        if (spot <= 0 || futures <= 0 || expiry.isBlank()) {
            throw new IllegalArgumentException("incomplete basis payload");
        }

        Double fearGreed = optionalDouble(node, "fear_greed");
        return MarketSnapshot.builder()
                .pairId(pair.pairId())
                .spotSymbol(pair.spotSymbol())
                .futuresSymbol(pair.futuresSymbol())
                .spotPrice(spot)
                .futuresPrice(futures)
                .futuresExpiry(parseExpiry(expiry))
                .etfPrice(optionalDouble(node, "etf_price"))
                .etfNav(optionalDouble(node, "etf_nav"))
                .sentimentIndex(fearGreed != null ? fearGreed / 100.0 : null)
                .openInterest(optionalDouble(node, "open_interest"))
                .asOf(LocalDate.now(clock))
                .build();
    }

    private static LocalDate parseExpiry(String value) {
        if (value.contains("-")) {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        }
        return ExpiryCalendar.parseContractMonth(value);
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asDouble();
    }
}
