package tw.gc.basis.trader.calculator;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Monthly futures expiry dates (last Friday of the contract month).
 */
public final class ExpiryCalendar {

    private static final DateTimeFormatter CONTRACT_MONTH = DateTimeFormatter.ofPattern("yyyyMM");
    /** Schedules extend past the range end so late dates still have a front month */
    private static final int SCHEDULE_LOOKAHEAD_DAYS = 60;

    private ExpiryCalendar() {
        throw new AssertionError("Utility class");
    }

    public static LocalDate lastFridayOfMonth(int year, int month) {
        return YearMonth.of(year, month).atEndOfMonth()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.FRIDAY));
    }

    /**
     * Every monthly expiry from the month of {@code start} through {@code end} plus the lookahead, ascending.
     */
    public static List<LocalDate> expirySchedule(LocalDate start, LocalDate end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        List<LocalDate> expiries = new ArrayList<>();
        YearMonth month = YearMonth.from(start);
        YearMonth last = YearMonth.from(end.plusDays(SCHEDULE_LOOKAHEAD_DAYS));
        while (!month.isAfter(last)) {
            expiries.add(lastFridayOfMonth(month.getYear(), month.getMonthValue()));
            month = month.plusMonths(1);
        }
        return expiries;
    }

    /**
     * Nearest expiry on or after {@code date}.
     */
    public static LocalDate frontMonthExpiry(LocalDate date) {
        Objects.requireNonNull(date, "date");
        LocalDate thisMonth = lastFridayOfMonth(date.getYear(), date.getMonthValue());
        if (!thisMonth.isBefore(date)) {
            return thisMonth;
        }
        YearMonth next = YearMonth.from(date).plusMonths(1);
        return lastFridayOfMonth(next.getYear(), next.getMonthValue());
    }

    /**
     * Parse a {@code YYYYMM} contract month (or a full {@code YYYYMMDD} date) to its expiry date.
     */
    public static LocalDate parseContractMonth(String contractMonth) {
        Objects.requireNonNull(contractMonth, "contractMonth");
        String value = contractMonth.trim();
        if (value.length() == 8) {
            return LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE);
        }
        if (value.length() != 6) {
            throw new IllegalArgumentException("Unsupported contract month: " + contractMonth);
        }
        YearMonth month = YearMonth.parse(value, CONTRACT_MONTH);
        return lastFridayOfMonth(month.getYear(), month.getMonthValue());
    }

    public static String contractMonth(LocalDate expiry) {
        return YearMonth.from(expiry).format(CONTRACT_MONTH);
    }
}
