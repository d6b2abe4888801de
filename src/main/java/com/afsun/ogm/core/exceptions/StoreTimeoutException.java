package com.afsun.ogm.core.exceptions;

/**
 * 远程图存储操作超时
 */
public class StoreTimeoutException extends StoreException {

    public StoreTimeoutException(String message, Object... args) {
        super("STORE_TIMEOUT", format(message, args),
                "检查 ogm.neo4j.timeout 配置后重新调用 commit()", extractThrowable(args));
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
