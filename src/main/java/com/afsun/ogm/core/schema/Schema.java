package com.afsun.ogm.core.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已校验的、不可变的类型映射表。运行期只做查表，不再重复校验
 *
 * @author afsun
 */
public class Schema {

    private final Map<String, EntityType> types;

    Schema(Map<String, EntityType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    /**
     * 按类型名（即节点标签）查找类型
     *
     * @throws IllegalArgumentException 类型未声明
     */
    public EntityType type(String name) {
        EntityType type = types.get(name);
        if (type == null) {
            throw new IllegalArgumentException("未声明的类型: " + name);
        }
        return type;
    }

    public EntityType findType(String name) {
        return types.get(name);
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    public Collection<EntityType> types() {
        return types.values();
    }

    /**
     * 返回给定类型及其全部子类型
     */
    public List<EntityType> subtypesOf(EntityType type) {
        List<EntityType> result = new ArrayList<>();
        for (EntityType t : types.values()) {
            if (t.isSubtypeOf(type)) {
                result.add(t);
            }
        }
        return result;
    }
}
