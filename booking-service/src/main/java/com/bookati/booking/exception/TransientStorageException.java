package com.bookati.booking.exception;

import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;

/**
 * Infrastructure failure during an all-or-nothing booking write. Nothing was committed, so the
 * caller may resubmit the same request.
 */
public class TransientStorageException extends BusinessException {

    public TransientStorageException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_STORAGE, message, cause);
    }
}
