package com.afsun.ogm.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * 脏状态记录表。对实体只持有弱引用：应用不再引用的实体可以被回收，其脏记录随之消失。
 * 会话内单线程使用。
 *
 * @author afsun
 */
public class ChangeTracker {

    private final Map<Entity, DirtyRecord> records = new WeakHashMap<>();

    private long sequence = 0;

    /**
     * 标记实体的属性或关系为已修改，重复标记只记录一次
     */
    public void markDirty(Entity entity, String attributeName) {
        DirtyRecord record = recordOf(entity);
        if (entity.getType().relationship(attributeName) != null) {
            record.markAssociation(attributeName);
        } else {
            record.markProperty(attributeName);
        }
    }

    /**
     * 登记新建实体：即使没有任何属性也需要在提交时创建节点
     */
    public void markNew(Entity entity) {
        recordOf(entity);
    }

    public boolean isDirty(Entity entity) {
        return records.containsKey(entity);
    }

    public Set<String> dirtyNames(Entity entity) {
        DirtyRecord record = records.get(entity);
        return record == null ? Collections.emptySet() : record.names();
    }

    /**
     * 当前全部脏记录的副本，按首次标记顺序排列
     */
    public Map<Entity, DirtyRecord> snapshot() {
        List<Map.Entry<Entity, DirtyRecord>> entries = new ArrayList<>(records.entrySet());
        entries.sort((a, b) -> Long.compare(a.getValue().getSequence(), b.getValue().getSequence()));
        Map<Entity, DirtyRecord> result = new LinkedHashMap<>();
        for (Map.Entry<Entity, DirtyRecord> e : entries) {
            result.put(e.getKey(), e.getValue().copy());
        }
        return result;
    }

    public void clear(Entity entity) {
        records.remove(entity);
    }

    public void clearAll() {
        records.clear();
    }

    public int size() {
        return records.size();
    }

    private DirtyRecord recordOf(Entity entity) {
        return records.computeIfAbsent(entity, k -> new DirtyRecord(++sequence));
    }
}
