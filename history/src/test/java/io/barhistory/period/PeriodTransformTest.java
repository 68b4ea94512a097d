package io.barhistory.period;

import io.barhistory.core.Bar;
import io.barhistory.core.Field;
import io.barhistory.core.History;
import io.barhistory.core.HistoryException;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;
import io.barhistory.core.TestBars;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static io.barhistory.core.TestBars.day;
import static org.junit.jupiter.api.Assertions.*;

public class PeriodTransformTest {
    static History daily(int count) {
        List<Bar> bars = TestBars.weekdays("2024-01-01", count, 10);
        int n = bars.size();
        long[] ts = new long[n];
        double[] o = new double[n], h = new double[n], l = new double[n], c = new double[n];
        long[] v = new long[n];
        for (int i = 0; i < n; i++) {
            Bar b = bars.get(i);
            ts[i] = b.timestamp(); o[i] = b.open(); h[i] = b.high(); l[i] = b.low(); c[i] = b.close(); v[i] = b.volume();
        }
        return new History(Period.DAILY, Field.of(Field.OPEN, Field.HIGH, Field.LOW, Field.CLOSE, Field.VOLUME),
                ts, o, h, l, c, v, null, RetCode.SUCCESS, List.of());
    }

    @Test
    void allocate_new_leaves_the_source_untouched() throws Exception {
        History h = daily(10);
        History weekly = PeriodTransform.transformPeriod(h, Period.WEEKLY, Set.of(), true);
        assertNotSame(h, weekly);
        assertEquals(Period.WEEKLY, weekly.period());
        assertEquals(2, weekly.nbBars());
        assertEquals(day("2024-01-14"), weekly.timestamp()[1]);
        assertEquals(Period.DAILY, h.period());
        assertEquals(10, h.nbBars());
    }

    @Test
    void in_place_transform_replaces_the_content() throws Exception {
        History h = daily(10);
        History same = PeriodTransform.transformPeriod(h, Period.WEEKLY, Set.of(), false);
        assertSame(h, same);
        assertEquals(Period.WEEKLY, h.period());
        assertEquals(2, h.nbBars());
        assertEquals(4000L, h.volume()[1]);
    }

    @Test
    void incomplete_trailing_window_follows_the_flag() throws Exception {
        assertEquals(1, PeriodTransform.transformPeriod(daily(8), Period.WEEKLY, Set.of(), true).nbBars());
        assertEquals(2, PeriodTransform.transformPeriod(daily(8), Period.WEEKLY,
                EnumSet.of(HistoryFlag.ALLOW_INCOMPLETE_PRICE_BARS), true).nbBars());
    }

    @Test
    void same_period_copies_only_when_asked() throws Exception {
        History h = daily(3);
        assertSame(h, PeriodTransform.transformPeriod(h, Period.DAILY, Set.of(), false));
        History copy = PeriodTransform.transformPeriod(h, Period.DAILY, Set.of(), true);
        assertNotSame(h, copy);
        assertNotSame(h.close(), copy.close());
        assertArrayEquals(h.close(), copy.close());
        assertNull(copy.openInterest());
    }

    @Test
    void finer_period_is_bad_param() {
        HistoryException e = assertThrows(HistoryException.class,
                () -> PeriodTransform.transformPeriod(daily(3), Period.ONE_HOUR, Set.of(), true));
        assertEquals(RetCode.BAD_PARAM, e.retCode());
    }
}
