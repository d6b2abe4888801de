package com.afsun.ogm.core.schema;

import lombok.Data;

/**
 * 属性映射：属性名 -> 标量类型 -> 图属性名
 */
@Data
public class PropertyDescriptor {
    private final String name;
    private final PropertyKind kind;
    private final String graphName;
}
