package com.afsun.ogm.core.exceptions;

import lombok.Getter;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.helpers.MessageFormatter;

/**
 * 对象图映射异常基类
 * 提供统一的错误码、错误详情和建议解决方案
 *
 * @author afsun
 */
@Getter
public class OgmException extends RuntimeException {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误详情
     */
    private final String errorDetail;

    /**
     * 建议解决方案
     */
    private final String suggestion;

    public OgmException(String message) {
        this("OGM_ERROR", message, null, (Throwable) null);
    }

    public OgmException(String message, Throwable cause) {
        this("OGM_ERROR", message, null, cause);
    }

    public OgmException(String errorCode, String message, String suggestion) {
        this(errorCode, message, suggestion, (Throwable) null);
    }

    public OgmException(String errorCode, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorDetail = message;
        this.suggestion = suggestion;
    }

    /**
     * 获取格式化的错误信息
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode).append("] ").append(errorDetail);
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\n建议: ").append(suggestion);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }

    /**
     * 按 SLF4J 占位符格式化消息，最后一个参数若为异常则不参与格式化
     */
    protected static String format(String message, Object... args) {
        return MessageFormatter.arrayFormat(message, trimLastThrowable(args)).getMessage();
    }

    protected static Throwable extractThrowable(Object[] args) {
        if (ArrayUtils.isEmpty(args)) {
            return null;
        }
        Object last = args[args.length - 1];
        if (last instanceof Throwable) {
            return (Throwable) last;
        }
        return null;
    }

    static Object[] trimLastThrowable(Object[] argumentArray) {
        if (ArrayUtils.isEmpty(argumentArray)) {
            return argumentArray;
        }
        if (extractThrowable(argumentArray) == null) {
            return argumentArray;
        }
        return ArrayUtils.remove(argumentArray, argumentArray.length - 1);
    }
}
