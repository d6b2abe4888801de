package com.afsun.ogm.core.exceptions;

/**
 * 远程图存储不可用（连接失败、会话过期等）
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Object... args) {
        super("STORE_UNAVAILABLE", format(message, args),
                "稍后重新调用 commit()，未提交的修改仍被保留", extractThrowable(args));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
