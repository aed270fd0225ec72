package tw.gc.basis.trader.services.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.config.TradingProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only newline-delimited JSON log of execution decisions, shared by all pairs.
 * Each record is written with a single append so records never interleave.
 */
@Slf4j
@Component
public class ExecutionJournal {

    public static final String REJECTED = "REJECTED";
    public static final String USER_REJECTED = "USER_REJECTED";
    public static final String CONNECTION_FAILED = "CONNECTION_FAILED";
    public static final String EXECUTING = "EXECUTING";
    public static final String ENTRY_RESULT = "ENTRY_RESULT";
    public static final String EXIT_RESULT = "EXIT_RESULT";
    public static final String REDUCE_RESULT = "REDUCE_RESULT";

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public ExecutionJournal(TradingProperties tradingProperties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(tradingProperties.getExecution().getJournalFile()), objectMapper, clock);
    }

    public ExecutionJournal(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Append one event. Failures are logged and never propagate into the trading path.
     */
    public synchronized void record(String event, String pairId, Map<String, Object> payload) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", event);
        entry.putAll(payload);
        entry.put("pair_id", pairId);
        entry.put("logged_at", LocalDateTime.now(clock).toString());

        try {
            String line = objectMapper.writeValueAsString(entry) + "\n";
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (JsonProcessingException e) {
            log.error("❌ Could not serialize journal event {} for {}", event, pairId, e);
        } catch (IOException e) {
            log.error("❌ Could not append journal event {} to {}", event, path, e);
        }
    }
}
