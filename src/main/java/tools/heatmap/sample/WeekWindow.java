package tools.heatmap.sample;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 以周一为起点的一周范围，weekOffset 为 0 表示本周，-1 上周，1 下周。
 */
public final class WeekWindow {
    public static final DateTimeFormatter SHORT_FORMAT = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    public static final DateTimeFormatter DOTTED_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy.", Locale.ENGLISH);

    private final LocalDate start;

    private WeekWindow(LocalDate start) {
        this.start = start;
    }

    public static WeekWindow of(LocalDate today, int weekOffset) {
        LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new WeekWindow(monday.plusWeeks(weekOffset));
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return start.plusDays(6);
    }

    public String format(DateTimeFormatter formatter) {
        return formatter.format(start) + " - " + formatter.format(getEnd());
    }
}
