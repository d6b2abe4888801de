package com.afsun.ogm.core.schema;

/**
 * 删除实体时对该关系的处理策略
 */
public enum CascadePolicy {
    /**
     * 不处理，存在关系时由存储抛出 ReferentialIntegrityException
     */
    NONE,
    /**
     * 自动解除关联
     */
    DETACH,
    /**
     * 同时删除关联实体
     */
    DELETE
}
