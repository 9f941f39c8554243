package com.rtbhouse.rangesets.impl.errors;

import com.rtbhouse.rangesets.api.RangeSetsException;

public class BadIndexException extends RangeSetsException {

    private static final long serialVersionUID = 1L;

    public BadIndexException(String message, Throwable cause) {
        super(message, cause);
    }

    public BadIndexException(String message) {
        super(message);
    }

    public BadIndexException(Throwable cause) {
        super(cause);
    }
}
