/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.function.Function;

import org.junit.Test;

public class StringsTest {

    @Test
    public void splitShouldSkipBlankItemsAndKeepOrder() {
        assertThat(Strings.setOfTrimmed(" b , a,, b ,c ", Function.identity())).containsExactly("b", "a", "c");
        assertThat(Strings.setOfTrimmed(null, Function.identity())).isEmpty();
        assertThat(Strings.listOfTrimmed("a, a ,b", Function.identity())).containsExactly("a", "a", "b");
    }

    @Test
    public void shouldJoinValues() {
        assertThat(Strings.join("; ", Arrays.asList(1, 2, 3), Object::toString)).isEqualTo("1; 2; 3");
        assertThat(Strings.join(",", null, Object::toString)).isEmpty();
    }

    @Test
    public void shouldFormatDuration() {
        assertThat(Strings.duration(0)).isEqualTo("00:00:00.000");
        assertThat(Strings.duration(3_723_045)).isEqualTo("01:02:03.045");
    }

    @Test
    public void shouldDetectBlankStrings() {
        assertThat(Strings.isNullOrEmpty(null)).isTrue();
        assertThat(Strings.isNullOrEmpty(" ")).isFalse();
        assertThat(Strings.isNullOrBlank(" ")).isTrue();
        assertThat(Strings.isNullOrBlank("x")).isFalse();
    }
}
