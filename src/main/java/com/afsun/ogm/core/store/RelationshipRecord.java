package com.afsun.ogm.core.store;

import lombok.Data;

import java.util.Map;

/**
 * 关系记录，otherEnd 为相对查询节点的另一端
 */
@Data
public class RelationshipRecord {
    private final Long handle;
    private final String type;
    private final Long from;
    private final Long to;
    private final Long otherEnd;
    private final Map<String, Object> properties;
}
