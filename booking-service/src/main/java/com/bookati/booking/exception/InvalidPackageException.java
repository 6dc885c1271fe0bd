package com.bookati.booking.exception;

import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;

public class InvalidPackageException extends BusinessException {

    public InvalidPackageException(String message) {
        super(ErrorCode.INVALID_PACKAGE, message);
    }
}
