/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities related to threads, timers and threading.
 */
public class Threads {

    private static final String THREAD_NAME_PREFIX = "walcapture-";
    private static final Logger LOGGER = LoggerFactory.getLogger(Threads.class);

    /**
     * Measures the amount time that has elapsed since the last {@link #reset() reset}.
     */
    public interface TimeSince {
        /**
         * Reset the elapsed time to 0.
         */
        void reset();

        /**
         * Get the time that has elapsed since the last call to {@link #reset() reset}.
         *
         * @return the number of milliseconds
         */
        long elapsedTime();
    }

    /**
     * Expires after defined time period.
     */
    public interface Timer {

        /**
         * @return true if current time is greater than start time plus requested time period
         */
        boolean expired();

        Duration remaining();
    }

    private Threads() {
    }

    /**
     * Obtain a {@link TimeSince} that uses the given clock to record the time elapsed.
     *
     * @param clock the clock; may not be null
     * @return the {@link TimeSince} object; never null
     */
    public static TimeSince timeSince(Clock clock) {
        return new TimeSince() {
            private long lastTimeInMillis;

            @Override
            public void reset() {
                lastTimeInMillis = clock.currentTimeInMillis();
            }

            @Override
            public long elapsedTime() {
                long elapsed = clock.currentTimeInMillis() - lastTimeInMillis;
                return elapsed <= 0L ? 0L : elapsed;
            }
        };
    }

    /**
     * Obtain a {@link Timer} that uses the given clock to indicate that a pre-defined time period expired.
     *
     * @param clock the clock; may not be null
     * @param time a time interval to expire
     * @return the {@link Timer} object; never null
     */
    public static Timer timer(Clock clock, Duration time) {
        final TimeSince start = timeSince(clock);
        start.reset();

        return new Timer() {

            @Override
            public boolean expired() {
                return start.elapsedTime() >= time.toMillis();
            }

            @Override
            public Duration remaining() {
                return time.minus(start.elapsedTime(), ChronoUnit.MILLIS);
            }
        };
    }

    /**
     * A {@link Timer} that has already expired, used to request an immediate action on the next check.
     *
     * @return the expired timer; never null
     */
    public static Timer expiredTimer() {
        return new Timer() {
            @Override
            public boolean expired() {
                return true;
            }

            @Override
            public Duration remaining() {
                return Duration.ZERO;
            }
        };
    }

    /**
     * Returns a thread factory that creates threads named {@code walcapture-<component>-<instance>-<thread-name>}.
     *
     * @param component the class owning the threads
     * @param instanceName the identifier to differentiate between instances, e.g. the replication slot
     * @param name the name of the thread
     * @param indexed true if the thread name should be appended with an index
     * @param daemon true if the thread should be a daemon thread
     * @return the thread factory setting the correct name
     */
    public static ThreadFactory threadFactory(Class<?> component, String instanceName, String name, boolean indexed, boolean daemon) {
        LOGGER.info("Requested thread factory for {}, id = {} named = {}", component.getSimpleName(), instanceName, name);

        return new ThreadFactory() {
            private final AtomicInteger index = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                StringBuilder threadName = new StringBuilder(THREAD_NAME_PREFIX)
                        .append(component.getSimpleName().toLowerCase())
                        .append('-')
                        .append(instanceName)
                        .append('-')
                        .append(name);
                if (indexed) {
                    threadName.append('-').append(index.getAndIncrement());
                }
                LOGGER.info("Creating thread {}", threadName);
                final Thread t = new Thread(r, threadName.toString());
                t.setDaemon(daemon);
                return t;
            }
        };
    }

    public static ExecutorService newSingleThreadExecutor(Class<?> component, String instanceName, String name, boolean daemon) {
        return Executors.newSingleThreadExecutor(threadFactory(component, instanceName, name, false, daemon));
    }

    public static ExecutorService newSingleThreadExecutor(Class<?> component, String instanceName, String name) {
        return newSingleThreadExecutor(component, instanceName, name, false);
    }
}
