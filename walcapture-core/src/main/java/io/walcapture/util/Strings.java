/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * String-related utility methods.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Generate the ordered set of values in a comma-separated list, with each element trimmed and blank elements
     * skipped.
     *
     * @param input the input string; may be null
     * @param factory the factory for creating items from the trimmed strings; may not be null, may return null to skip
     * @return the set of objects included in the list, in input order; never null
     */
    public static <T> Set<T> setOfTrimmed(String input, Function<String, T> factory) {
        if (input == null) {
            return Collections.emptySet();
        }
        Set<T> matches = new LinkedHashSet<>();
        for (String item : input.split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            T obj = factory.apply(trimmed);
            if (obj != null) {
                matches.add(obj);
            }
        }
        return matches;
    }

    /**
     * Same as {@link #setOfTrimmed(String, Function)} but keeping duplicates.
     *
     * @param input the input string; may be null
     * @param factory the factory for creating items from the trimmed strings; may not be null
     * @return the list of objects included in the input; never null
     */
    public static <T> List<T> listOfTrimmed(String input, Function<String, T> factory) {
        if (input == null) {
            return Collections.emptyList();
        }
        List<T> items = new ArrayList<>();
        for (String item : input.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(factory.apply(trimmed));
            }
        }
        return items;
    }

    /**
     * Create a string representation of the given values, joined by the delimiter.
     *
     * @param delimiter the characters used to separate the values; may not be null
     * @param values the values; may be null
     * @param conversion the function converting each value to a string; may not be null
     * @return the joined string; never null
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values, Function<T, String> conversion) {
        StringBuilder sb = new StringBuilder();
        if (values != null) {
            boolean first = true;
            for (T value : values) {
                if (!first) {
                    sb.append(delimiter);
                }
                sb.append(conversion.apply(value));
                first = false;
            }
        }
        return sb.toString();
    }

    /**
     * For the given duration in milliseconds, obtain a readable representation of the form {@code HHH:MM:SS.mmm}.
     *
     * @param durationInMillis the duration in milliseconds
     * @return the readable duration; never null
     */
    public static String duration(long durationInMillis) {
        long seconds = durationInMillis / 1000;
        long s = seconds % 60;
        long m = (seconds / 60) % 60;
        long h = (seconds / (60 * 60));
        long q = durationInMillis % 1000;

        StringBuilder result = new StringBuilder(15);
        if (h < 10) {
            result.append('0');
        }
        result.append(h).append(':');
        if (m < 10) {
            result.append('0');
        }
        result.append(m).append(':');
        if (s < 10) {
            result.append('0');
        }
        result.append(s).append('.');
        if (q < 10) {
            result.append("00");
        }
        else if (q < 100) {
            result.append('0');
        }
        result.append(q);
        return result.toString();
    }

    /**
     * Check if the string is empty or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is empty or null
     */
    public static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    /**
     * Check if the string is blank or null.
     *
     * @param str the string to check
     * @return {@code true} if the string is blank or null
     */
    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
