/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.walcapture.WalCaptureException;

/**
 * Details about an invalid {@link Configuration}. Raised before any database connection is opened.
 *
 * @see Configuration#validateAndRecord(Iterable, java.util.function.Consumer)
 */
public class InvalidConfigurationException extends WalCaptureException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    /**
     * Create an exception with a message and the problems found in the configuration.
     *
     * @param message the message; may not be null
     * @param problems the descriptions of every problem found; may not be null
     */
    public InvalidConfigurationException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }

    public InvalidConfigurationException(String message) {
        this(message, Collections.emptyList());
    }

    /**
     * Get the descriptions of the problems.
     *
     * @return the immutable list of problems; never null
     */
    public List<String> problems() {
        return problems;
    }
}
