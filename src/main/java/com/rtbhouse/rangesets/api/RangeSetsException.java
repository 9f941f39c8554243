package com.rtbhouse.rangesets.api;

public class RangeSetsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RangeSetsException(String message, Throwable cause) {
        super(message, cause);
    }

    public RangeSetsException(String message) {
        super(message);
    }

    public RangeSetsException(Throwable cause) {
        super(cause);
    }

}
