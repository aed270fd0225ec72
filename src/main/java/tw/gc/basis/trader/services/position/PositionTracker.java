package tw.gc.basis.trader.services.position;

import lombok.extern.slf4j.Slf4j;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.Position;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Source of truth for one pair's open position.
 *
 * <p>Every mutation is persisted before the in-memory position is replaced, so the stored
 * state always matches the last acknowledged fill. {@link #getPosition()} returns a copy.
 */
@Slf4j
public class PositionTracker {

    private final PairConfig pair;
    private final PositionRepository repository;
    private final Clock clock;
    private volatile Position position;

    public PositionTracker(PairConfig pair, PositionRepository repository, Clock clock) {
        this.pair = pair;
        this.repository = repository;
        this.clock = clock;
        this.position = load();
    }

    private Position load() {
        Position loaded = repository.load().orElseGet(() -> Position.empty(pair));
        if (loaded.isOpen()) {
            log.info("📂 [{}] Loaded open position: {} {} shares, {} {} contracts",
                    pair.pairId(), loaded.getEtfShares(), loaded.getEtfSymbol(),
                    loaded.getFuturesContracts(), loaded.getFuturesSymbol());
            if (!loaded.isBalanced()) {
                log.warn("⚠️ [{}] Loaded position has only one leg", pair.pairId());
            }
        }
        return loaded;
    }

    public Position getPosition() {
        return position.toBuilder().build();
    }

    public boolean isOpen() {
        return position.isOpen();
    }

    public String getPairId() {
        return pair.pairId();
    }

    public synchronized void updateOnEntry(int etfShares, double etfPrice, int futuresContracts,
                                           double futuresPrice, LocalDate futuresExpiry) {
        Position updated = Position.builder()
                .etfShares(etfShares)
                .etfSymbol(pair.spotSymbol())
                .etfEntryPrice(etfPrice)
                .futuresContracts(futuresContracts)
                .futuresSymbol(pair.futuresSymbol())
                .futuresEntryPrice(futuresPrice)
                .futuresExpiry(futuresExpiry)
                .openedAt(LocalDateTime.now(clock))
                .build();
        persist(updated);
        log.info("📈 [{}] Position opened: {} {} @ {}, {} {} @ {}", pair.pairId(),
                etfShares, pair.spotSymbol(), etfPrice, futuresContracts, pair.futuresSymbol(), futuresPrice);
    }

    /**
     * Reduce both legs, flooring at zero. A position reduced to nothing is cleared.
     */
    public synchronized void updateOnPartialExit(int etfSharesSold, int contractsClosed) {
        Position reduced = position.toBuilder()
                .etfShares(Math.max(0, position.getEtfShares() - etfSharesSold))
                .futuresContracts(Math.max(0, position.getFuturesContracts() - contractsClosed))
                .build();
        if (!reduced.isOpen()) {
            clear();
            return;
        }
        persist(reduced);
        log.info("📉 [{}] Position reduced to {} shares, {} contracts",
                pair.pairId(), reduced.getEtfShares(), reduced.getFuturesContracts());
    }

    public synchronized void clear() {
        persist(Position.empty(pair));
        log.info("✅ [{}] Position cleared", pair.pairId());
    }

    private void persist(Position updated) {
        repository.save(updated);
        this.position = updated;
    }
}
