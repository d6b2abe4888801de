package com.afsun.ogm.core.schema;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一个应用类型的映射描述：标签、属性表、关系表（均含继承自父类型的条目）
 */
@Getter
public class EntityType {

    private final String name;
    private final EntityType parent;
    private final Map<String, PropertyDescriptor> properties;
    private final Map<String, RelationshipDescriptor> relationships;
    private final Map<String, PropertyDescriptor> propertiesByGraphName;
    private final Set<String> uniqueProperties;
    private final Set<String> requiredProperties;

    EntityType(String name, EntityType parent,
               Map<String, PropertyDescriptor> properties,
               Map<String, RelationshipDescriptor> relationships,
               Set<String> uniqueProperties,
               Set<String> requiredProperties) {
        this.name = name;
        this.parent = parent;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
        this.uniqueProperties = Collections.unmodifiableSet(new LinkedHashSet<>(uniqueProperties));
        this.requiredProperties = Collections.unmodifiableSet(new LinkedHashSet<>(requiredProperties));
        Map<String, PropertyDescriptor> byGraphName = new LinkedHashMap<>();
        for (PropertyDescriptor p : properties.values()) {
            byGraphName.put(p.getGraphName(), p);
        }
        this.propertiesByGraphName = Collections.unmodifiableMap(byGraphName);
    }

    /**
     * 图中的节点标签，与类型名一致
     */
    public String getLabel() {
        return name;
    }

    public PropertyDescriptor property(String propertyName) {
        return properties.get(propertyName);
    }

    public RelationshipDescriptor relationship(String relationshipName) {
        return relationships.get(relationshipName);
    }

    public PropertyDescriptor propertyByGraphName(String graphName) {
        return propertiesByGraphName.get(graphName);
    }

    public Collection<RelationshipDescriptor> relationshipList() {
        return relationships.values();
    }

    /**
     * 给定属性值中缺少（为空）的必填属性
     */
    public List<String> missingRequired(Map<String, Object> values) {
        List<String> missing = new ArrayList<>();
        for (String name : requiredProperties) {
            if (values.get(name) == null) {
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * 是否为给定类型本身或其子类型
     */
    public boolean isSubtypeOf(EntityType other) {
        for (EntityType t = this; t != null; t = t.parent) {
            if (t == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
