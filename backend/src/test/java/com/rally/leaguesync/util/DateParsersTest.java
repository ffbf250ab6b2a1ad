package com.rally.leaguesync.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateParsersTest {

    @Test
    void parsesEverySourceFormat() {
        LocalDate expected = LocalDate.of(2025, 1, 5);
        assertThat(DateParsers.parse("05-Jan-25")).contains(expected);
        assertThat(DateParsers.parse("05-JAN-25")).contains(expected);
        assertThat(DateParsers.parse("01/05/2025")).contains(expected);
        assertThat(DateParsers.parse("1/5/2025")).contains(expected);
        assertThat(DateParsers.parse("2025-01-05")).contains(expected);
    }

    @Test
    void unparseableOrBlankIsEmpty() {
        assertThat(DateParsers.parse("not a date")).isEmpty();
        assertThat(DateParsers.parse("")).isEmpty();
        assertThat(DateParsers.parse(null)).isEmpty();
    }
}
