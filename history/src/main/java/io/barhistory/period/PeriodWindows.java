package io.barhistory.period;

import io.barhistory.core.Period;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Window boundaries used when resampling, all in UTC.
 * <ul>
 *   <li>Intraday targets: a bar stamped {@code t} (its closing instant) falls in the window closing at the next
 *       multiple of the period length, {@code t} included.</li>
 *   <li>Calendar targets: the calendar day, ISO week (Monday to Sunday), month, quarter or year containing
 *       {@code t}; the window is stamped at 00:00 of its last day.</li>
 * </ul>
 */
public final class PeriodWindows {
    private PeriodWindows() {}

    /** Closing timestamp (epoch seconds) of the {@code target} window holding {@code t}. */
    public static long windowClose(long t, Period target) {
        if (target.isIntraday()) {
            long n = target.nominalSeconds();
            return Math.floorDiv(t + n - 1, n) * n;
        }
        LocalDate d = toDate(t);
        LocalDate last = switch (target) {
            case DAILY -> d;
            case WEEKLY -> d.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
            case MONTHLY -> d.with(TemporalAdjusters.lastDayOfMonth());
            case QUARTERLY -> {
                int lastMonth = ((d.getMonthValue() - 1) / 3) * 3 + 3;
                yield LocalDate.of(d.getYear(), lastMonth, 1).with(TemporalAdjusters.lastDayOfMonth());
            }
            case YEARLY -> d.with(TemporalAdjusters.lastDayOfYear());
            default -> throw new IllegalArgumentException("not a calendar period: " + target);
        };
        return last.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    /**
     * Timestamp where a source sampled at {@code period} would put its bar following {@code t}. Daily bars skip
     * weekends and US equity holidays.
     */
    public static long nextSlot(long t, Period period) {
        if (period.isIntraday()) return t + period.nominalSeconds();
        LocalDate d = toDate(t);
        LocalDate next = switch (period) {
            case DAILY -> TradingCalendars.nextTradingDay(d);
            case WEEKLY -> d.plusWeeks(1);
            case MONTHLY -> d.plusMonths(1);
            case QUARTERLY -> d.plusMonths(3);
            case YEARLY -> d.plusYears(1);
            default -> throw new IllegalArgumentException("not a calendar period: " + period);
        };
        return next.atStartOfDay(ZoneOffset.UTC).toEpochSecond() + (t - d.atStartOfDay(ZoneOffset.UTC).toEpochSecond());
    }

    /**
     * Whether the {@code target} window closing at {@code windowClose}, whose last known bar is {@code lastTs},
     * is fully covered: the source's next slot already belongs to a later window.
     */
    public static boolean isComplete(long lastTs, Period sourcePeriod, long windowClose, Period target) {
        return windowClose(nextSlot(lastTs, sourcePeriod), target) != windowClose;
    }

    static LocalDate toDate(long t) {
        return Instant.ofEpochSecond(t).atZone(ZoneOffset.UTC).toLocalDate();
    }
}
