package tw.gc.basis.trader.services.monitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.model.MarketSnapshot;
import tw.gc.basis.trader.model.PairConfig;

import java.util.List;
import java.util.Optional;

/**
 * Tries each snapshot source in order and returns the first snapshot produced.
 */
@Slf4j
@Component
public class MarketSnapshotProvider {

    private final List<MarketSnapshotSource> sources;

    public MarketSnapshotProvider(List<MarketSnapshotSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public Optional<MarketSnapshot> fetch(PairConfig pair) {
        for (MarketSnapshotSource source : sources) {
            try {
                Optional<MarketSnapshot> snapshot = source.fetch(pair);
                if (snapshot.isPresent()) {
                    log.debug("[{}] Snapshot from {}", pair.pairId(), source.name());
                    return snapshot;
                }
            } catch (RuntimeException e) {
                log.warn("⚠️ [{}] Source {} failed: {}", pair.pairId(), source.name(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
