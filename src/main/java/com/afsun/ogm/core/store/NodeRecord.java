package com.afsun.ogm.core.store;

import lombok.Data;

import java.util.Map;

@Data
public class NodeRecord {
    private final Long handle;
    private final String label;
    private final Map<String, Object> properties;
}
