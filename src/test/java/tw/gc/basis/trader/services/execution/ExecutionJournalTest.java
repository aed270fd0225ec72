package tw.gc.basis.trader.services.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.basis.trader.config.AppConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionJournalTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T15:00:00Z"), ZoneId.of("America/New_York"));

    @Test
    void appendsOneJsonLinePerEvent() throws Exception {
        Path file = tempDir.resolve("logs").resolve("execution_log.jsonl");
        ExecutionJournal journal = new ExecutionJournal(file, objectMapper, clock);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("signal", "STRONG_ENTRY");
        payload.put("action", "OPEN");
        journal.record(ExecutionJournal.EXECUTING, "BTC", payload);
        journal.record(ExecutionJournal.REJECTED, "ETH", Map.of("reason", "Weekend detected (SATURDAY) - markets closed"));

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.path("event").asText()).isEqualTo("EXECUTING");
        assertThat(first.path("action").asText()).isEqualTo("OPEN");
        assertThat(first.path("pair_id").asText()).isEqualTo("BTC");
        assertThat(first.path("logged_at").asText()).isEqualTo("2024-03-01T10:00");
        assertThat(objectMapper.readTree(lines.get(1)).path("reason").asText()).startsWith("Weekend");
    }

    @Test
    void recordsEndWithLineFeedOnly() throws Exception {
        Path file = tempDir.resolve("execution_log.jsonl");
        ExecutionJournal journal = new ExecutionJournal(file, objectMapper, clock);

        journal.record(ExecutionJournal.EXECUTING, "BTC", Map.of());
        journal.record(ExecutionJournal.EXIT_RESULT, "BTC", Map.of());

        String content = Files.readString(file);
        assertThat(content).doesNotContain("\r").endsWith("}\n");
        assertThat(content.split("\n")).hasSize(2);
    }

    @Test
    void writeFailureDoesNotThrow() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        ExecutionJournal journal = new ExecutionJournal(blocker.resolve("execution_log.jsonl"), objectMapper, clock);

        journal.record(ExecutionJournal.EXECUTING, "BTC", Map.of());

        assertThat(Files.isRegularFile(blocker)).isTrue();
    }
}
