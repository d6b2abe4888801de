package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.OgmException;
import com.afsun.ogm.core.schema.EntityType;
import com.afsun.ogm.core.store.NodeRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话级身份映射：每个节点句柄对应唯一的实体实例。
 * 未登记的句柄在 resolve 时从图存储读取并构造实体。
 *
 * @author afsun
 */
@Slf4j
public class IdentityMap {

    private final Session session;

    private final Map<Long, Entity> entities = new HashMap<>();

    IdentityMap(Session session) {
        this.session = session;
    }

    /**
     * 返回句柄对应的实体，不存在时从图存储加载（只读属性，关系按需加载）
     */
    public Entity resolve(Long handle) {
        Entity existing = entities.get(handle);
        if (existing != null) {
            return existing;
        }
        NodeRecord record = session.getStore().fetchNode(handle);
        EntityType type = session.getSchema().findType(record.getLabel());
        if (type == null) {
            throw new OgmException("UNKNOWN_LABEL", "节点 " + handle + " 的标签 " + record.getLabel() + " 未在 Schema 中声明",
                    "在 SchemaBuilder 中声明该类型");
        }
        Entity entity = new Entity(session, type);
        entity.hydrate(record.getProperties());
        entity.assignHandle(handle);
        entities.put(handle, entity);
        log.debug("加载实体 {}", entity);
        return entity;
    }

    /**
     * 将新持久化的实体绑定到存储分配的句柄
     */
    public void register(Entity entity, Long handle) {
        Entity existing = entities.get(handle);
        if (existing != null && existing != entity) {
            throw new IllegalStateException("句柄 " + handle + " 已绑定到 " + existing);
        }
        entity.assignHandle(handle);
        entities.put(handle, entity);
    }

    public Entity evict(Long handle) {
        return entities.remove(handle);
    }

    public Entity lookup(Long handle) {
        return entities.get(handle);
    }

    public boolean contains(Long handle) {
        return entities.containsKey(handle);
    }

    public List<Entity> entities() {
        return new ArrayList<>(entities.values());
    }

    public int size() {
        return entities.size();
    }

    void clear() {
        entities.clear();
    }
}
