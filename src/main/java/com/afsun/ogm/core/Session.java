package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.schema.CascadePolicy;
import com.afsun.ogm.core.schema.EntityType;
import com.afsun.ogm.core.schema.PropertyDescriptor;
import com.afsun.ogm.core.schema.RelationshipDescriptor;
import com.afsun.ogm.core.schema.Schema;
import com.afsun.ogm.core.store.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * 一个工作单元：持有身份映射与脏状态记录，绑定到一个图存储。
 * 会话内状态只允许单线程修改；多个会话可以并发访问同一个图存储。
 *
 * @author afsun
 */
@Slf4j
public class Session implements AutoCloseable {

    private final String id;
    private final Schema schema;
    private final GraphStore store;
    private final IdentityMap identityMap;
    private final ChangeTracker changeTracker;
    private final SyncEngine syncEngine;

    /**
     * 已在会话中删除、等待提交时删除节点的实体
     */
    private final Map<Long, Entity> pendingDeletes = new LinkedHashMap<>();

    /**
     * 会话中新建、尚未持久化的实体（弱引用，供查询时匹配）
     */
    private final Set<Entity> transients = Collections.newSetFromMap(new WeakHashMap<>());

    private boolean open = true;

    public Session(String id, Schema schema, GraphStore store) {
        this.id = id;
        this.schema = schema;
        this.store = store;
        this.identityMap = new IdentityMap(this);
        this.changeTracker = new ChangeTracker();
        this.syncEngine = new SyncEngine(this);
        log.info("打开会话 {}, 存储: {}", id, store.getClass().getSimpleName());
    }

    // ===== 实体 =====

    public Entity create(String typeName) {
        return create(typeName, Collections.emptyMap());
    }

    /**
     * 新建一个尚未持久化的实体，提交时创建对应节点
     */
    public Entity create(String typeName, Map<String, Object> properties) {
        checkOpen();
        EntityType type = schema.type(typeName);
        Entity entity = new Entity(this, type);
        try {
            for (Map.Entry<String, Object> e : properties.entrySet()) {
                entity.set(e.getKey(), e.getValue());
            }
        } catch (RuntimeException e) {
            changeTracker.clear(entity);
            entity.changeState(EntityState.DETACHED);
            throw e;
        }
        changeTracker.markNew(entity);
        transients.add(entity);
        return entity;
    }

    /**
     * 按句柄取实体，同一会话内总是同一个实例
     *
     * @throws DetachedEntityException 该节点已在本会话中删除
     */
    public Entity resolve(Long handle) {
        checkOpen();
        if (pendingDeletes.containsKey(handle)) {
            throw new DetachedEntityException("节点 {} 已在会话 {} 中删除", handle, id);
        }
        return identityMap.resolve(handle);
    }

    /**
     * 查找给定类型（含子类型）中属性全部等于 filter 的实体。
     * 会话中已修改的实体按内存中的值匹配，未提交的新建实体也参与匹配。
     */
    public List<Entity> findAll(String typeName, Map<String, Object> filter) {
        checkOpen();
        EntityType type = schema.type(typeName);
        Map<String, Object> criteria = filter == null ? Collections.emptyMap() : filter;
        List<Entity> result = new ArrayList<>();
        for (EntityType candidate : schema.subtypesOf(type)) {
            for (Long handle : store.findNodes(candidate.getLabel(), toGraphFilter(candidate, criteria))) {
                if (pendingDeletes.containsKey(handle)) {
                    continue;
                }
                Entity entity = identityMap.resolve(handle);
                if (!changeTracker.isDirty(entity) || matches(entity, criteria)) {
                    addOnce(result, entity);
                }
            }
        }
        for (Entity entity : identityMap.entities()) {
            if (changeTracker.isDirty(entity) && entity.getType().isSubtypeOf(type) && matches(entity, criteria)) {
                addOnce(result, entity);
            }
        }
        for (Entity entity : new ArrayList<>(transients)) {
            if (entity.getState() == EntityState.TRANSIENT && entity.getType().isSubtypeOf(type)
                    && matches(entity, criteria)) {
                addOnce(result, entity);
            }
        }
        return result;
    }

    public Optional<Entity> findOne(String typeName, Map<String, Object> filter) {
        List<Entity> all = findAll(typeName, filter);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * 按类型的唯一属性查找实体，找不到时新建。类型未声明唯一属性时以全部给定属性匹配
     */
    public Entity findOrCreate(String typeName, Map<String, Object> properties) {
        EntityType type = schema.type(typeName);
        Map<String, Object> keys = new LinkedHashMap<>();
        for (String unique : type.getUniqueProperties()) {
            if (properties.containsKey(unique)) {
                keys.put(unique, properties.get(unique));
            }
        }
        if (keys.isEmpty()) {
            keys.putAll(properties);
        }
        Optional<Entity> existing = findOne(typeName, keys);
        if (existing.isPresent()) {
            return existing.get();
        }
        return create(typeName, properties);
    }

    /**
     * 把另一个会话中的实体连同其关联的实体复制到本会话，已存在的实体（按 strategy 判断）直接复用。
     * 新复制的实体为未持久化状态，提交时写入本会话的存储。
     */
    public Entity importEntity(Entity source, EqualityStrategy strategy) {
        checkOpen();
        if (source == null) {
            throw new IllegalArgumentException("导入的实体不能为空");
        }
        Entity result = new EntityImporter(this, strategy).importEntity(source);
        log.debug("会话 {} 导入 {} -> {}", id, source, result);
        return result;
    }

    /**
     * 删除实体。未持久化的实体直接解除所有关联；已持久化的实体按各关系的级联策略处理，
     * 节点在提交时删除。
     */
    public void delete(Entity entity) {
        checkOpen();
        checkOwned(entity);
        if (entity.getState() == EntityState.DELETED) {
            return;
        }
        if (entity.getState() == EntityState.DETACHED) {
            throw new DetachedEntityException("{} 已脱离会话, 不能删除", entity);
        }
        boolean wasTransient = entity.isTransient();
        // 状态变为 DELETED 之前加载受影响的集合，之后不再从存储读取
        List<AssociationCollection> affected = new ArrayList<>();
        for (RelationshipDescriptor relationship : entity.getType().relationshipList()) {
            if (!wasTransient && relationship.getCascade() == CascadePolicy.NONE) {
                continue;
            }
            AssociationCollection collection = entity.association(relationship.getName());
            collection.ensureLoaded();
            affected.add(collection);
        }
        entity.changeState(EntityState.DELETED);
        List<Entity> cascaded = new ArrayList<>();
        for (AssociationCollection collection : affected) {
            RelationshipDescriptor relationship = collection.getDescriptor();
            for (Entity target : collection.toList()) {
                collection.detach(target);
                if (relationship.getCascade() == CascadePolicy.DELETE) {
                    cascaded.add(target);
                }
            }
        }
        if (wasTransient) {
            changeTracker.clear(entity);
            transients.remove(entity);
        } else {
            identityMap.evict(entity.getHandle());
            pendingDeletes.put(entity.getHandle(), entity);
        }
        log.debug("删除实体 {}, 级联 {} 个", entity, cascaded.size());
        for (Entity target : cascaded) {
            delete(target);
        }
    }

    /**
     * 将实体移出会话，之后对它的修改会失败。未提交的修改随之丢弃
     */
    public void evict(Entity entity) {
        checkOpen();
        checkOwned(entity);
        if (entity.getHandle() != null) {
            identityMap.evict(entity.getHandle());
        } else if (entity.getState() == EntityState.TRANSIENT) {
            // 未持久化的实体不会写入存储，先从对端集合中移除
            for (RelationshipDescriptor relationship : entity.getType().relationshipList()) {
                AssociationCollection collection = entity.association(relationship.getName());
                for (Entity target : collection.toList()) {
                    collection.detach(target);
                }
            }
        }
        changeTracker.clear(entity);
        transients.remove(entity);
        entity.changeState(EntityState.DETACHED);
    }

    /**
     * 从存储重新读取属性并丢弃已缓存的关联
     *
     * @throws IllegalStateException 实体存在未提交的修改或尚未持久化
     */
    public void refresh(Entity entity) {
        checkOpen();
        checkOwned(entity);
        if (entity.getState() != EntityState.MANAGED) {
            throw new IllegalStateException(entity + " 状态为 " + entity.getState() + ", 不能刷新");
        }
        if (changeTracker.isDirty(entity)) {
            throw new IllegalStateException(entity + " 存在未提交的修改, 不能刷新");
        }
        entity.hydrate(store.fetchNode(entity.getHandle()).getProperties());
        entity.invalidateAssociations();
    }

    public boolean isDirty(Entity entity) {
        return changeTracker.isDirty(entity);
    }

    public List<Entity> dirtyEntities() {
        return new ArrayList<>(changeTracker.snapshot().keySet());
    }

    public EntityState state(Entity entity) {
        return entity.getState();
    }

    // ===== 生命周期 =====

    /**
     * 将会话中的全部修改写入图存储
     */
    public CommitResult commit() {
        checkOpen();
        return syncEngine.commit();
    }

    /**
     * 丢弃会话缓存，所有实体变为脱离状态。不影响已提交的存储数据
     */
    @Override
    public void close() {
        if (!open) {
            return;
        }
        int discarded = changeTracker.size();
        for (Entity entity : identityMap.entities()) {
            entity.changeState(EntityState.DETACHED);
        }
        for (Entity entity : new ArrayList<>(transients)) {
            entity.changeState(EntityState.DETACHED);
        }
        identityMap.clear();
        changeTracker.clearAll();
        transients.clear();
        pendingDeletes.clear();
        open = false;
        if (discarded > 0) {
            log.warn("关闭会话 {}, 丢弃 {} 个未提交的实体修改", id, discarded);
        } else {
            log.info("关闭会话 {}", id);
        }
    }

    public boolean isOpen() {
        return open;
    }

    public boolean isPendingDeletion(Long handle) {
        return pendingDeletes.containsKey(handle);
    }

    public String getId() {
        return id;
    }

    public Schema getSchema() {
        return schema;
    }

    public GraphStore getStore() {
        return store;
    }

    public IdentityMap getIdentityMap() {
        return identityMap;
    }

    public ChangeTracker getChangeTracker() {
        return changeTracker;
    }

    Entity pendingDeletion(Long handle) {
        return pendingDeletes.get(handle);
    }

    Map<Long, Entity> pendingDeletes() {
        return pendingDeletes;
    }

    private void checkOpen() {
        if (!open) {
            throw new DetachedEntityException("会话 {} 已关闭", id);
        }
    }

    private void checkOwned(Entity entity) {
        if (entity.getSession() != this) {
            throw new DetachedEntityException("{} 不属于会话 {}", entity, id);
        }
    }

    private static Map<String, Object> toGraphFilter(EntityType type, Map<String, Object> filter) {
        Map<String, Object> graphFilter = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : filter.entrySet()) {
            PropertyDescriptor descriptor = type.property(e.getKey());
            if (descriptor == null) {
                throw new IllegalArgumentException(type.getName() + " 未声明属性: " + e.getKey());
            }
            graphFilter.put(descriptor.getGraphName(), e.getValue());
        }
        return graphFilter;
    }

    private static boolean matches(Entity entity, Map<String, Object> filter) {
        for (Map.Entry<String, Object> e : filter.entrySet()) {
            if (!Objects.equals(entity.getProperties().get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static void addOnce(List<Entity> result, Entity entity) {
        for (Entity existing : result) {
            if (existing == entity) {
                return;
            }
        }
        result.add(entity);
    }

    @Override
    public String toString() {
        return "Session(" + id + ")";
    }
}
