package com.afsun.ogm.core.store;

import lombok.Data;

import java.util.Map;

@Data
public class StoreStatistics {
    private final String storeType;
    private final long nodeCount;
    private final long relationshipCount;
    /**
     * 标签 -> 节点数
     */
    private final Map<String, Long> labels;
}
