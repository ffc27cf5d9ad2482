package com.entity.network.lock;

import com.entity.network.core.exception.NetworkAnalyticsException;

/**
 * A scope lock was not granted, either because another writer held it past the
 * timeout or because the waiting thread was interrupted.
 */
public class LockAcquisitionException extends NetworkAnalyticsException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
