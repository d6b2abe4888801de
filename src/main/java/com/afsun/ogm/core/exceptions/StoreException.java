package com.afsun.ogm.core.exceptions;

/**
 * 图存储访问异常
 */
public class StoreException extends OgmException {

    public StoreException(String errorCode, String message, Object... args) {
        super(errorCode, format(message, args), null, extractThrowable(args));
    }

    protected StoreException(String errorCode, String message, String suggestion, Throwable cause) {
        super(errorCode, message, suggestion, cause);
    }

    /**
     * 是否为可重试的瞬时故障
     */
    public boolean isRetryable() {
        return false;
    }
}
