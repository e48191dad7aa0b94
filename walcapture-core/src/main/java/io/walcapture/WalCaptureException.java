/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walcapture;

/**
 * Base exception raised by the capture engine. Every failure that terminates a run surfaces to the caller as an
 * instance of this type or one of its subclasses.
 *
 */
public class WalCaptureException extends RuntimeException {

    private static final long serialVersionUID = 4409152046716361712L;

    public WalCaptureException() {
    }

    public WalCaptureException(String message) {
        super(message);
    }

    public WalCaptureException(Throwable cause) {
        super(cause);
    }

    public WalCaptureException(String message, Throwable cause) {
        super(message, cause);
    }

    public WalCaptureException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }

}
