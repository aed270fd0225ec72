package tw.gc.basis.trader.services.positionsizing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PositionSizing;
import tw.gc.basis.trader.model.StrategyConfig;

import static tw.gc.basis.trader.AppConstants.DELTA_NEUTRAL_TOLERANCE;

/**
 * Delta-neutral sizing for the two legs.
 *
 * <p>Futures contracts are indivisible, so the futures leg is sized first from the futures
 * target amount and its notional becomes the anchor. The ETF leg is then matched to that
 * notional, not to the original target.
 *
 * <p>The contract count never drops below 1. With a small account or a large contract size
 * this over-allocates relative to the target in exchange for a non-empty hedge.
 */
@Slf4j
@Service
public class PositionSizer {

    private static final int MIN_CONTRACTS = 1;

    public PositionSizing size(MarketSnapshot snapshot, StrategyConfig config) {
        double spotPrice = snapshot.getSpotPrice();
        if (spotPrice <= 0) {
            throw new IllegalArgumentException("spot price must be positive, got " + spotPrice);
        }

        double contractsNeeded = (config.futuresTargetAmount() / spotPrice) / config.contractSize();
        int contracts = Math.max(MIN_CONTRACTS, (int) Math.rint(contractsNeeded));
        double futuresUnits = contracts * config.contractSize();
        double futuresValue = futuresUnits * spotPrice;

        Integer etfShares = null;
        double spotValue = futuresValue;
        if (snapshot.hasEtfPrice()) {
            etfShares = (int) (futuresValue / snapshot.getEtfPrice());
            spotValue = etfShares * snapshot.getEtfPrice();
        }

        boolean deltaNeutral = Math.abs(spotValue - futuresValue) < DELTA_NEUTRAL_TOLERANCE;
        if (!deltaNeutral) {
            log.warn("⚠️ Legs not delta-neutral: spot ${} vs futures ${}",
                    String.format("%,.2f", spotValue), String.format("%,.2f", futuresValue));
        }

        return new PositionSizing(contractsNeeded, contracts, futuresUnits, futuresValue, etfShares, spotValue, deltaNeutral);
    }
}
