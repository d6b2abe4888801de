package com.afsun.ogm.core;

import lombok.Getter;

import java.util.Map;

/**
 * 关联集合已知的一条已持久化关系
 */
@Getter
class Link {
    private final Long relationshipHandle;
    private final Entity target;
    private final Map<String, Object> properties;

    Link(Long relationshipHandle, Entity target, Map<String, Object> properties) {
        this.relationshipHandle = relationshipHandle;
        this.target = target;
        this.properties = properties;
    }
}
