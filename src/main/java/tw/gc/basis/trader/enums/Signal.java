package tw.gc.basis.trader.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trading signal for the basis trade. Closed set; produced only by the signal engine.
 */
public enum Signal {
    STRONG_ENTRY,
    ACCEPTABLE_ENTRY,
    NO_ENTRY,
    PARTIAL_EXIT,
    FULL_EXIT,
    STOP_LOSS,
    HOLD;

    private static final Set<Signal> ENTRIES = EnumSet.of(STRONG_ENTRY, ACCEPTABLE_ENTRY);
    private static final Set<Signal> EXITS = EnumSet.of(FULL_EXIT, STOP_LOSS);

    public boolean isEntry() {
        return ENTRIES.contains(this);
    }

    /**
     * Signals that close the whole position (take profit or stop loss).
     */
    public boolean isFullExit() {
        return EXITS.contains(this);
    }
}
