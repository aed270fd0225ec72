package tw.gc.basis.trader.services.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Prompts on the terminal and waits for a yes/no answer.
 */
@Slf4j
@Component
public class ConsoleTradeConfirmation implements TradeConfirmation {

    private static final String RULE = "=".repeat(60);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleTradeConfirmation() {
        this(System.in, System.out);
    }

    ConsoleTradeConfirmation(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized boolean confirm(String summary) {
        out.println();
        out.println(RULE);
        out.println("TRADE EXECUTION CONFIRMATION");
        out.println(RULE);
        out.println(summary);
        out.println(RULE);
        out.print("Execute? (yes/no): ");
        out.flush();

        try {
            String answer = in.readLine();
            if (answer == null) {
                log.warn("⚠️ No console input available - treating as rejection");
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("yes") || normalized.equals("y");
        } catch (IOException e) {
            log.error("❌ Failed to read confirmation from console", e);
            return false;
        }
    }
}
