package com.rtbhouse.rangesets.impl.errors;

import com.rtbhouse.rangesets.api.RangeSetsException;

public class InvariantViolationException extends RangeSetsException {

    private static final long serialVersionUID = 1L;

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(Throwable cause) {
        super(cause);
    }
}
