package tw.gc.basis.trader.services.backtest;

import org.springframework.stereotype.Component;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic daily series for exercising the backtest without market data.
 * Spot follows a random walk with 2% daily volatility, basis is drawn around 1.5%
 * and the futures always expire 30 days out. Same seed, same series.
 */
@Component
public class SampleDataGenerator {

    private static final double DAILY_VOLATILITY = 0.02;
    private static final double PRICE_FLOOR = 10_000;
    private static final double MEAN_BASIS = 0.015;
    private static final double BASIS_VOLATILITY = 0.01;
    private static final double BASIS_FLOOR = -0.01;
    private static final int DAYS_TO_EXPIRY = 30;

    public List<MarketSnapshot> generate(LocalDate start, LocalDate end, double basePrice, long seed, PairConfig pair) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
        Random random = new Random(seed);
        List<MarketSnapshot> series = new ArrayList<>();
        double price = basePrice;

        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            price = Math.max(PRICE_FLOOR, price + random.nextGaussian() * DAILY_VOLATILITY * price);
            double basisPct = Math.max(BASIS_FLOOR, MEAN_BASIS + random.nextGaussian() * BASIS_VOLATILITY);

            series.add(MarketSnapshot.builder()
                    .pairId(pair.pairId())
                    .spotSymbol(pair.spotSymbol())
                    .futuresSymbol(pair.futuresSymbol())
                    .asOf(date)
                    .spotPrice(price)
                    .futuresPrice(price * (1 + basisPct))
                    .futuresExpiry(date.plusDays(DAYS_TO_EXPIRY))
                    .build());
        }
        return series;
    }
}
