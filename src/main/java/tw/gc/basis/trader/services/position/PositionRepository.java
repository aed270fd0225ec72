package tw.gc.basis.trader.services.position;

import tw.gc.basis.trader.model.Position;

import java.util.Optional;

/**
 * Durable storage for one pair's position.
 */
public interface PositionRepository {

    /**
     * @return the stored position, or empty when nothing usable is stored
     */
    Optional<Position> load();

    /**
     * Persist the position. Returns only once the write is durable.
     *
     * @throws java.io.UncheckedIOException when the position could not be written
     */
    void save(Position position);
}
