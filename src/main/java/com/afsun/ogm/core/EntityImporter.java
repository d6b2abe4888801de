package com.afsun.ogm.core;

import com.afsun.ogm.core.schema.EntityType;
import com.afsun.ogm.core.schema.RelationshipDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 将其他会话（可以绑定其他存储）中的实体及其关联的实体递归复制到当前会话。
 * 按 {@link EqualityStrategy} 找到已存在的实体时直接复用，不再导入它的关联。
 *
 * @author afsun
 */
@Slf4j
class EntityImporter {

    private final Session session;
    private final EqualityStrategy strategy;

    /**
     * 源实体 -> 当前会话中的实体，同一次导入中每个源实体只处理一次
     */
    private final Map<Entity, Entity> imported = new IdentityHashMap<>();

    EntityImporter(Session session, EqualityStrategy strategy) {
        this.session = session;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    Entity importEntity(Entity source) {
        Entity done = imported.get(source);
        if (done != null) {
            return done;
        }
        EntityType type = session.getSchema().type(source.getType().getName());
        Entity existing = find(source, type);
        if (existing != null) {
            log.debug("导入 {}: 复用已存在的 {}", source, existing);
            imported.put(source, existing);
            return existing;
        }

        Entity copy = session.create(type.getName(), source.getProperties());
        imported.put(source, copy);
        for (RelationshipDescriptor relationship : type.relationshipList()) {
            if (source.getType().relationship(relationship.getName()) == null) {
                continue;
            }
            for (Entity member : source.association(relationship.getName())) {
                Entity target = importEntity(member);
                AssociationCollection collection = copy.association(relationship.getName());
                if (!collection.contains(target)) {
                    collection.link(target, -1);
                }
            }
        }
        log.debug("导入 {} 为 {}", source, copy);
        return copy;
    }

    private Entity find(Entity source, EntityType type) {
        Map<String, Object> values = source.getProperties();
        switch (strategy) {
            case IDENTITY:
                if (source.getSession() == session) {
                    return source;
                }
                if (source.getHandle() != null && source.getSession().getStore() == session.getStore()
                        && !session.isPendingDeletion(source.getHandle())) {
                    return session.resolve(source.getHandle());
                }
                return null;
            case VALUE:
                return sameValues(type, values);
            case VALID_VALUE:
                return sameKeys(type, values, type.getRequiredProperties());
            case UNIQUE:
                return sameKeys(type, values, type.getUniqueProperties());
            default:
                throw new IllegalStateException("未知比较方式: " + strategy);
        }
    }

    private Entity sameValues(EntityType type, Map<String, Object> values) {
        for (Entity candidate : session.findAll(type.getName(), values)) {
            if (candidate.getProperties().equals(values)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * 按 keys 中的属性比较，源实体缺少其中任何一个时退回按全部属性比较
     */
    private Entity sameKeys(EntityType type, Map<String, Object> values, Collection<String> keys) {
        if (keys.isEmpty()) {
            return sameValues(type, values);
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        for (String key : keys) {
            Object value = values.get(key);
            if (value == null) {
                return sameValues(type, values);
            }
            filter.put(key, value);
        }
        List<Entity> candidates = session.findAll(type.getName(), filter);
        return candidates.isEmpty() ? null : candidates.get(0);
    }
}
