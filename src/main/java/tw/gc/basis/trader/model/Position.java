package tw.gc.basis.trader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Currently held two-leg position: long ETF shares against short futures contracts.
 * Serialized as the position state file with snake_case field names.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    @JsonProperty("etf_shares")
    private int etfShares;

    @JsonProperty("etf_symbol")
    private String etfSymbol;

    @JsonProperty("etf_entry_price")
    private double etfEntryPrice;

    @JsonProperty("futures_contracts")
    private int futuresContracts;

    @JsonProperty("futures_symbol")
    private String futuresSymbol;

    @JsonProperty("futures_entry_price")
    private double futuresEntryPrice;

    @JsonProperty("futures_expiry")
    private LocalDate futuresExpiry;

    @JsonProperty("opened_at")
    private LocalDateTime openedAt;

    public static Position empty(PairConfig pair) {
        return Position.builder()
                .etfSymbol(pair.spotSymbol())
                .futuresSymbol(pair.futuresSymbol())
                .build();
    }

    @JsonIgnore
    public boolean isOpen() {
        return etfShares > 0 || futuresContracts > 0;
    }

    @JsonIgnore
    public boolean isBalanced() {
        return etfShares > 0 && futuresContracts > 0;
    }
}
