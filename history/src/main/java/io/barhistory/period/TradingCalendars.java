package io.barhistory.period;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;

/**
 * US equity trading calendar used to tell whether a daily source has more bars to come in a window: weekends
 * plus the NYSE full-day holidays.
 */
final class TradingCalendars {
    private TradingCalendars() {}

    static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    static boolean isTradingDay(LocalDate d) {
        return isWeekday(d) && !isHoliday(d);
    }

    static LocalDate nextTradingDay(LocalDate d) {
        LocalDate next = d.plusDays(1);
        while (!isTradingDay(next)) next = next.plusDays(1);
        return next;
    }

    // simplified NYSE calendar: observed fixed dates, floating Mondays, Thanksgiving, Good Friday
    static boolean isHoliday(LocalDate d) {
        if (observed(d, Month.JANUARY, 1) || observed(d, Month.JUNE, 19)
                || observed(d, Month.JULY, 4) || observed(d, Month.DECEMBER, 25)) {
            return true;
        }
        return nth(d, Month.JANUARY, DayOfWeek.MONDAY, 3)
                || nth(d, Month.FEBRUARY, DayOfWeek.MONDAY, 3)
                || last(d, Month.MAY, DayOfWeek.MONDAY)
                || nth(d, Month.SEPTEMBER, DayOfWeek.MONDAY, 1)
                || nth(d, Month.NOVEMBER, DayOfWeek.THURSDAY, 4)
                || d.equals(easterSunday(d.getYear()).minusDays(2));
    }

    // Saturday dates move to Friday, Sunday dates to Monday; a Saturday New Year is not observed in December
    private static boolean observed(LocalDate d, Month month, int day) {
        LocalDate date = LocalDate.of(d.getYear(), month, day);
        switch (date.getDayOfWeek()) {
            case SATURDAY -> date = date.minusDays(1);
            case SUNDAY -> date = date.plusDays(1);
            default -> { }
        }
        return d.equals(date);
    }

    private static boolean nth(LocalDate d, Month month, DayOfWeek dow, int n) {
        return d.getMonth() == month && d.getDayOfWeek() == dow && (d.getDayOfMonth() + 6) / 7 == n;
    }

    private static boolean last(LocalDate d, Month month, DayOfWeek dow) {
        return d.getMonth() == month && d.getDayOfWeek() == dow && d.getDayOfMonth() + 7 > d.lengthOfMonth();
    }

    // anonymous Gregorian computus
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int h = (19 * a + b - b / 4 - (b - (b + 8) / 25 + 1) / 3 + 15) % 30;
        int l = (32 + 2 * (b % 4) + 2 * (c / 4) - h - c % 4) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = (h + l - 7 * m + 114) % 31 + 1;
        return LocalDate.of(year, month, day);
    }
}
