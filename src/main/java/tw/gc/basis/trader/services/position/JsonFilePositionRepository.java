package tw.gc.basis.trader.services.position;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tw.gc.basis.trader.model.Position;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Position state kept in a single JSON file. Writes go to a temp file in the same
 * directory which then replaces the target, so a crash never leaves a half-written file.
 */
@Slf4j
public class JsonFilePositionRepository implements PositionRepository {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFilePositionRepository(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Optional<Position> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            Position position = objectMapper.readValue(path.toFile(), Position.class);
            return Optional.ofNullable(position);
        } catch (IOException e) {
            log.warn("⚠️ Failed to load position state from {}: {} - starting flat", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Position position) {
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            byte[] json = toJson(position);
            Path temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, json);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Position saved to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save position state to " + path, e);
        }
    }

    private byte[] toJson(Position position) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(position);
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
