package com.afsun.ogm.core.schema;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/**
 * 节点属性的标量类型
 */
public enum PropertyKind {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE;

    /**
     * 判断值是否属于该标量类型，null 视为合法（表示删除属性）
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case STRING:
                return value instanceof String;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case DATE:
                return value instanceof LocalDate
                        || value instanceof LocalDateTime
                        || value instanceof OffsetDateTime
                        || value instanceof ZonedDateTime;
            default:
                return false;
        }
    }
}
