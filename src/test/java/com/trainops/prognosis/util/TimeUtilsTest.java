package com.trainops.prognosis.util;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class TimeUtilsTest {

    @Test
    public void conversions () {
        assertEquals(TimeUtils.hm(9, 13), TimeUtils.fromLocalTime(LocalTime.of(9, 13)));
        assertEquals(NO_TIME, TimeUtils.fromLocalTime(null));
        assertFalse(TimeUtils.isSet(NO_TIME));
        assertEquals("09:13", TimeUtils.timeToString(TimeUtils.hm(9, 13) + 59));
        assertEquals("24:05", TimeUtils.timeToString(TimeUtils.hm(24, 5)));
        assertEquals("", TimeUtils.timeToString(NO_TIME));
        assertEquals("+3", TimeUtils.deltaToString(180));
        assertEquals("-1", TimeUtils.deltaToString(-60));
        assertEquals("+0", TimeUtils.deltaToString(0));
    }

}
