package tw.gc.basis.trader.services.monitor;

import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.util.Optional;

/**
 * A feed able to produce a normalized snapshot for a pair.
 */
public interface MarketSnapshotSource {

    String name();

    /**
     * @return the snapshot, or empty when this source has nothing for the pair right now
     */
    Optional<MarketSnapshot> fetch(PairConfig pair);
}
