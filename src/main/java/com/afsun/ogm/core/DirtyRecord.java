package com.afsun.ogm.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单个实体自上次同步以来的修改：变更的属性名与成员变化的关系名。
 * 记录存在即表示实体为脏，新建实体的记录可以为空。
 */
public class DirtyRecord {

    /**
     * 首次标记的顺序，提交时按此顺序处理
     */
    @Getter
    private final long sequence;
    private final Set<String> properties = new LinkedHashSet<>();
    private final Set<String> associations = new LinkedHashSet<>();

    DirtyRecord(long sequence) {
        this.sequence = sequence;
    }

    void markProperty(String name) {
        properties.add(name);
    }

    void markAssociation(String name) {
        associations.add(name);
    }

    public Set<String> getProperties() {
        return Collections.unmodifiableSet(properties);
    }

    public Set<String> getAssociations() {
        return Collections.unmodifiableSet(associations);
    }

    /**
     * 属性名与关系名的并集
     */
    public Set<String> names() {
        Set<String> all = new LinkedHashSet<>(properties);
        all.addAll(associations);
        return all;
    }

    DirtyRecord copy() {
        DirtyRecord copy = new DirtyRecord(sequence);
        copy.properties.addAll(properties);
        copy.associations.addAll(associations);
        return copy;
    }
}
