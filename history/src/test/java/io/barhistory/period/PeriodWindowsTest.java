package io.barhistory.period;

import io.barhistory.core.Period;
import org.junit.jupiter.api.Test;

import static io.barhistory.core.TestBars.at;
import static io.barhistory.core.TestBars.day;
import static org.junit.jupiter.api.Assertions.*;

public class PeriodWindowsTest {
    @Test
    void intraday_windows_close_on_the_next_multiple() {
        assertEquals(at("2024-01-02T10:05:00"), PeriodWindows.windowClose(at("2024-01-02T10:03:00"), Period.FIVE_MINS));
        assertEquals(at("2024-01-02T10:05:00"), PeriodWindows.windowClose(at("2024-01-02T10:05:00"), Period.FIVE_MINS));
        assertEquals(at("2024-01-02T11:00:00"), PeriodWindows.windowClose(at("2024-01-02T10:01:00"), Period.ONE_HOUR));
    }

    @Test
    void calendar_windows_are_stamped_on_their_last_day() {
        assertEquals(day("2024-01-03"), PeriodWindows.windowClose(at("2024-01-03T15:30:00"), Period.DAILY));
        assertEquals(day("2024-01-07"), PeriodWindows.windowClose(day("2024-01-03"), Period.WEEKLY));
        assertEquals(day("2024-01-07"), PeriodWindows.windowClose(day("2024-01-07"), Period.WEEKLY));
        assertEquals(day("2024-02-29"), PeriodWindows.windowClose(day("2024-02-10"), Period.MONTHLY));
        assertEquals(day("2024-06-30"), PeriodWindows.windowClose(day("2024-05-10"), Period.QUARTERLY));
        assertEquals(day("2024-12-31"), PeriodWindows.windowClose(day("2024-03-01"), Period.YEARLY));
    }

    @Test
    void daily_next_slot_skips_the_weekend() {
        assertEquals(day("2024-01-08"), PeriodWindows.nextSlot(day("2024-01-05"), Period.DAILY));
        assertEquals(day("2024-01-03"), PeriodWindows.nextSlot(day("2024-01-02"), Period.DAILY));
        assertEquals(at("2024-01-02T10:06:00"), PeriodWindows.nextSlot(at("2024-01-02T10:05:00"), Period.ONE_MIN));
    }

    @Test
    void window_is_complete_once_the_next_slot_leaves_it() {
        long week = day("2024-01-07");
        assertTrue(PeriodWindows.isComplete(day("2024-01-05"), Period.DAILY, week, Period.WEEKLY));
        assertFalse(PeriodWindows.isComplete(day("2024-01-04"), Period.DAILY, week, Period.WEEKLY));
        assertTrue(PeriodWindows.isComplete(day("2024-01-31"), Period.DAILY, day("2024-01-31"), Period.MONTHLY));
    }

    @Test
    void daily_next_slot_skips_exchange_holidays() {
        assertEquals(day("2024-01-16"), PeriodWindows.nextSlot(day("2024-01-12"), Period.DAILY));
        assertEquals(day("2024-04-01"), PeriodWindows.nextSlot(day("2024-03-28"), Period.DAILY));
        assertEquals(day("2024-12-26"), PeriodWindows.nextSlot(day("2024-12-24"), Period.DAILY));
    }

    @Test
    void good_friday_week_ending_on_thursday_is_complete() {
        assertTrue(PeriodWindows.isComplete(day("2024-03-28"), Period.DAILY, day("2024-03-31"), Period.WEEKLY));
        assertFalse(PeriodWindows.isComplete(day("2024-03-27"), Period.DAILY, day("2024-03-31"), Period.WEEKLY));
    }
}
