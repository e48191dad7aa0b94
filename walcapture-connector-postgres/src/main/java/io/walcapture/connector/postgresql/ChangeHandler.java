/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture.connector.postgresql;

/**
 * Receives every captured change, one at a time and in commit order, on the thread that called
 * {@link WalCaptureEngine#run(ChangeHandler)}.
 */
@FunctionalInterface
public interface ChangeHandler {

    enum Signal {
        CONTINUE,
        STOP
    }

    /**
     * @param change the change; never null
     * @return whether the engine should go on delivering changes
     * @throws Exception to stop the engine with an error
     */
    Signal handle(ChangeEvent change) throws Exception;
}
