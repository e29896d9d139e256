package com.sortableid.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SortableRate")
class SortableRateTest {

    @ParameterizedTest(name = "{0} at {1} expects {2} per bucket")
    @CsvSource({
        "HUNDRED_PER_MICROSECOND, MICROSECOND, 100",
        "HUNDRED_PER_MICROSECOND, MILLISECOND, 100000",
        "ONE_PER_MICROSECOND, NANOSECOND, 0",
        "TEN_PER_NANOSECOND, NANOSECOND, 10",
        "TEN_PER_MILLISECOND, SECOND, 10000",
        "HUNDRED_PER_SECOND, MILLISECOND, 0",
        "ONE_PER_SECOND, DAY, 86400",
        "ONE_PER_SECOND, MONTH, 2592000",
        "TEN_PER_NANOSECOND, YEAR, 315360000000000000"
    })
    void expectedPerBucketShouldUseConversionTable(SortableRate rate, TimeGranularity granularity, String expected) {
        assertEquals(new BigInteger(expected), rate.expectedPerBucket(granularity));
    }

    @Test
    @DisplayName("fromLabel should resolve external labels")
    void fromLabelShouldResolveLabels() {
        assertEquals(SortableRate.HUNDRED_PER_MICROSECOND, SortableRate.fromLabel("100_per_microsecond").orElseThrow());
        assertEquals(SortableRate.ONE_PER_SECOND, SortableRate.fromLabel("one_per_second").orElseThrow());
        assertTrue(SortableRate.fromLabel("1000_per_second").isEmpty());
    }
}
