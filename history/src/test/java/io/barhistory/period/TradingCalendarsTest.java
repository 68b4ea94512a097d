package io.barhistory.period;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class TradingCalendarsTest {
    private static LocalDate d(String iso) { return LocalDate.parse(iso); }

    @Test
    void us_equity_holidays_of_2024() {
        for (String h : new String[]{"2024-01-01", "2024-01-15", "2024-02-19", "2024-03-29", "2024-05-27",
                "2024-06-19", "2024-07-04", "2024-09-02", "2024-11-28", "2024-12-25"}) {
            assertTrue(TradingCalendars.isHoliday(d(h)), h);
            assertFalse(TradingCalendars.isTradingDay(d(h)), h);
        }
        assertTrue(TradingCalendars.isTradingDay(d("2024-03-28")));
        assertFalse(TradingCalendars.isTradingDay(d("2024-03-30")));
    }

    @Test
    void weekend_dates_are_observed_on_the_nearest_weekday() {
        assertTrue(TradingCalendars.isHoliday(d("2021-07-05")));
        assertTrue(TradingCalendars.isHoliday(d("2021-12-24")));
        assertTrue(TradingCalendars.isHoliday(d("2023-01-02")));
        assertFalse(TradingCalendars.isHoliday(d("2021-12-31")));
    }

    @Test
    void easter_dates() {
        assertEquals(d("2024-03-31"), TradingCalendars.easterSunday(2024));
        assertEquals(d("2025-04-20"), TradingCalendars.easterSunday(2025));
    }
}
