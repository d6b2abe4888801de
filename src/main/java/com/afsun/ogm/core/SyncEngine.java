package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.exceptions.RequiredPropertyException;
import com.afsun.ogm.core.schema.Cardinality;
import com.afsun.ogm.core.schema.RelationshipDescriptor;
import com.afsun.ogm.core.store.Direction;
import com.afsun.ogm.core.store.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提交引擎：把会话中的脏状态转换为最少的图存储操作。
 *
 * <p>操作顺序：
 * <ol>
 *     <li>校验必填属性与关联成员，失败时不执行任何存储操作</li>
 *     <li>为新建实体创建节点并登记句柄</li>
 *     <li>只写入已修改的属性</li>
 *     <li>比较脏关联与其已知的持久化关系，先创建新关系，再删除过期关系</li>
 *     <li>删除会话中已删除实体的节点</li>
 * </ol>
 * 成功后清除参与实体的脏记录；失败时保留脏记录并抛出原异常，调用方可以再次提交。
 * 非事务存储上已完成的操作会反映在会话状态中，重试不会重复执行；
 * 事务存储回滚后，会话状态按 {@link CommitJournal} 恢复。
 *
 * @author afsun
 */
@Slf4j
class SyncEngine {

    private final Session session;

    SyncEngine(Session session) {
        this.session = session;
    }

    CommitResult commit() {
        long startTime = System.currentTimeMillis();
        CommitResult result = new CommitResult("CM-" + startTime);
        Map<Entity, DirtyRecord> dirty = session.getChangeTracker().snapshot();
        if (dirty.isEmpty() && session.pendingDeletes().isEmpty()) {
            log.debug("会话 {} 没有需要提交的修改", session.getId());
            return result;
        }

        validate(dirty);

        GraphStore store = session.getStore();
        CommitJournal journal = new CommitJournal();
        try {
            store.executeInTransaction(() -> apply(store, dirty, journal, result));
        } catch (RuntimeException e) {
            if (store.supportsTransactions()) {
                journal.rollback();
            }
            log.warn("提交失败, traceId: {}, 会话 {} 的 {} 个脏实体保持不变: {}",
                    result.getTraceId(), session.getId(), dirty.size(), e.getMessage());
            throw e;
        }

        for (Entity entity : dirty.keySet()) {
            session.getChangeTracker().clear(entity);
        }
        result.setElapsedMillis(System.currentTimeMillis() - startTime);
        log.info("提交完成, traceId: {}, 节点 +{} ~{} -{}, 关系 +{} -{}, 耗时: {}ms",
                result.getTraceId(), result.getNodesCreated(), result.getNodesUpdated(), result.getNodesDeleted(),
                result.getRelationshipsCreated(), result.getRelationshipsDeleted(), result.getElapsedMillis());
        return result;
    }

    /**
     * 写入存储前的校验：必填属性已赋值，关联成员均未脱离会话
     */
    private void validate(Map<Entity, DirtyRecord> dirty) {
        for (Map.Entry<Entity, DirtyRecord> e : dirty.entrySet()) {
            Entity entity = e.getKey();
            if (entity.getState() != EntityState.DELETED) {
                List<String> missing = entity.getType().missingRequired(entity.getProperties());
                if (!missing.isEmpty()) {
                    throw new RequiredPropertyException(entity, entity.getType().getName(), missing);
                }
            }
            for (String name : e.getValue().getAssociations()) {
                AssociationCollection collection = entity.association(name);
                if (!collection.isLoaded()) {
                    continue;
                }
                for (Entity member : collection.members) {
                    if (member.getState() == EntityState.DETACHED) {
                        throw new DetachedEntityException("{}.{} 引用了已脱离会话的实体 {}", entity, name, member);
                    }
                }
            }
        }
    }

    private void apply(GraphStore store, Map<Entity, DirtyRecord> dirty, CommitJournal journal, CommitResult result) {
        Set<Entity> created = createNodes(store, dirty, journal, result);
        updateNodes(store, dirty, created, result);
        syncRelationships(store, dirty, journal, result);
        deleteNodes(store, journal, result);
    }

    // ===== 节点 =====

    private Set<Entity> createNodes(GraphStore store, Map<Entity, DirtyRecord> dirty, CommitJournal journal,
                                    CommitResult result) {
        IdentityMap identityMap = session.getIdentityMap();
        Set<Entity> created = new HashSet<>();
        for (Entity entity : dirty.keySet()) {
            if (entity.getState() != EntityState.TRANSIENT) {
                continue;
            }
            Long handle = store.createNode(entity.getType().getLabel(), entity.graphProperties());
            identityMap.register(entity, handle);
            journal.record(() -> {
                identityMap.evict(handle);
                entity.revertToTransient();
            });
            created.add(entity);
            result.setNodesCreated(result.getNodesCreated() + 1);
        }
        return created;
    }

    private void updateNodes(GraphStore store, Map<Entity, DirtyRecord> dirty, Set<Entity> created,
                             CommitResult result) {
        for (Map.Entry<Entity, DirtyRecord> e : dirty.entrySet()) {
            Entity entity = e.getKey();
            if (entity.getState() != EntityState.MANAGED || e.getValue().getProperties().isEmpty()) {
                continue;
            }
            if (created.contains(entity)) {
                continue;
            }
            store.updateNode(entity.getHandle(), entity.graphProperties(e.getValue().getProperties()));
            result.setNodesUpdated(result.getNodesUpdated() + 1);
        }
    }

    private void deleteNodes(GraphStore store, CommitJournal journal, CommitResult result) {
        Map<Long, Entity> pending = session.pendingDeletes();
        for (Map.Entry<Long, Entity> e : new ArrayList<>(pending.entrySet())) {
            Long handle = e.getKey();
            Entity entity = e.getValue();
            store.deleteNode(handle);
            pending.remove(handle);
            journal.record(() -> pending.put(handle, entity));
            result.setNodesDeleted(result.getNodesDeleted() + 1);
        }
    }

    // ===== 关系 =====

    private void syncRelationships(GraphStore store, Map<Entity, DirtyRecord> dirty, CommitJournal journal,
                                   CommitResult result) {
        Map<EdgeKey, DesiredEdge> desired = new LinkedHashMap<>();
        Map<Long, ExistingEdge> existing = new LinkedHashMap<>();
        for (Map.Entry<Entity, DirtyRecord> e : dirty.entrySet()) {
            Entity entity = e.getKey();
            if (entity.getHandle() == null) {
                continue;
            }
            for (String name : e.getValue().getAssociations()) {
                AssociationCollection collection = entity.association(name);
                if (!collection.isLoaded()) {
                    continue;
                }
                collectExisting(collection, existing);
                collectDesired(collection, desired);
            }
        }
        if (desired.isEmpty() && existing.isEmpty()) {
            return;
        }

        Map<EdgeKey, Deque<ExistingEdge>> existingByKey = new LinkedHashMap<>();
        for (ExistingEdge edge : existing.values()) {
            existingByKey.computeIfAbsent(edge.key, k -> new ArrayDeque<>()).add(edge);
        }
        Set<Long> kept = new HashSet<>();
        List<DesiredEdge> toCreate = new ArrayList<>();
        for (DesiredEdge edge : desired.values()) {
            Deque<ExistingEdge> candidates = existingByKey.get(edge.key);
            if (candidates == null || candidates.isEmpty()) {
                toCreate.add(edge);
                continue;
            }
            ExistingEdge unchanged = findUnchanged(candidates, edge.properties);
            if (unchanged != null) {
                candidates.remove(unchanged);
                kept.add(unchanged.handle);
            } else {
                ExistingEdge match = candidates.poll();
                Map<String, Object> merged = new LinkedHashMap<>(match.properties);
                merged.putAll(edge.properties);
                // 序号变化：存储不支持修改关系属性，以新关系替换
                edge.properties.clear();
                edge.properties.putAll(merged);
                toCreate.add(edge);
            }
        }

        for (DesiredEdge edge : toCreate) {
            Long handle = store.createRelationship(edge.key.type, edge.key.from, edge.key.to, edge.properties);
            for (Side side : edge.sides) {
                Link link = new Link(handle, side.target, new LinkedHashMap<>(edge.properties));
                side.collection.persisted.add(link);
                journal.record(() -> side.collection.persisted.remove(link));
            }
            result.setRelationshipsCreated(result.getRelationshipsCreated() + 1);
        }
        for (ExistingEdge edge : existing.values()) {
            if (kept.contains(edge.handle)) {
                continue;
            }
            store.deleteRelationship(edge.handle);
            for (Side side : edge.sides) {
                forgetLink(side.collection, edge.handle, journal);
            }
            result.setRelationshipsDeleted(result.getRelationshipsDeleted() + 1);
        }
    }

    /**
     * 已有关系中属性覆盖后不变的一条，没有时返回 null
     */
    private static ExistingEdge findUnchanged(Deque<ExistingEdge> candidates, Map<String, Object> properties) {
        for (ExistingEdge candidate : candidates) {
            Map<String, Object> merged = new LinkedHashMap<>(candidate.properties);
            merged.putAll(properties);
            if (merged.equals(candidate.properties)) {
                return candidate;
            }
        }
        return null;
    }

    private void collectExisting(AssociationCollection collection, Map<Long, ExistingEdge> existing) {
        for (Link link : collection.persisted) {
            ExistingEdge edge = existing.get(link.getRelationshipHandle());
            if (edge == null) {
                edge = new ExistingEdge(link.getRelationshipHandle(), keyOf(collection, link.getTarget()),
                        link.getProperties());
                existing.put(link.getRelationshipHandle(), edge);
            }
            addSides(edge.sides, collection, link.getTarget());
        }
    }

    private void collectDesired(AssociationCollection collection, Map<EdgeKey, DesiredEdge> desired) {
        RelationshipDescriptor descriptor = collection.getDescriptor();
        List<Long> ordinals = descriptor.getCardinality() == Cardinality.ORDERED_LIST ? ordinals(collection) : null;
        for (int i = 0; i < collection.members.size(); i++) {
            Entity member = collection.members.get(i);
            if (member.getHandle() == null) {
                throw new DetachedEntityException("{}.{} 引用了未持久化的实体 {}",
                        collection.getOwner(), descriptor.getName(), member);
            }
            EdgeKey key = keyOf(collection, member);
            DesiredEdge edge = desired.computeIfAbsent(key, DesiredEdge::new);
            if (ordinals != null) {
                edge.properties.put(descriptor.orderProperty(), ordinals.get(i));
            }
            addSides(edge.sides, collection, member);
        }
    }

    /**
     * 为有序列表的成员分配序号：已有序号仍保持递增时沿用，否则接续前一个序号，尽量少替换关系
     */
    private static List<Long> ordinals(AssociationCollection collection) {
        String orderKey = collection.getDescriptor().orderProperty();
        List<Long> result = new ArrayList<>();
        long last = -1;
        for (Entity member : collection.members) {
            Long current = null;
            for (Link link : collection.persisted) {
                if (link.getTarget() == member) {
                    Object value = link.getProperties().get(orderKey);
                    if (value instanceof Number) {
                        current = ((Number) value).longValue();
                    }
                    break;
                }
            }
            long ordinal = current != null && current > last ? current : last + 1;
            result.add(ordinal);
            last = ordinal;
        }
        return result;
    }

    private static EdgeKey keyOf(AssociationCollection collection, Entity other) {
        RelationshipDescriptor descriptor = collection.getDescriptor();
        Long self = collection.getOwner().getHandle();
        if (descriptor.getDirection() == Direction.INCOMING) {
            return new EdgeKey(descriptor.getRelationshipType(), other.getHandle(), self);
        }
        return new EdgeKey(descriptor.getRelationshipType(), self, other.getHandle());
    }

    /**
     * 一条关系出现在本端集合以及（已加载的）逆向集合中
     */
    private static void addSides(List<Side> sides, AssociationCollection collection, Entity other) {
        addSide(sides, collection, other);
        RelationshipDescriptor descriptor = collection.getDescriptor();
        if (descriptor.isBidirectional() && other.getState() != EntityState.DETACHED) {
            AssociationCollection inverse = other.association(descriptor.getInverse().getName());
            if (inverse.isLoaded()) {
                addSide(sides, inverse, collection.getOwner());
            }
        }
    }

    private static void addSide(List<Side> sides, AssociationCollection collection, Entity target) {
        for (Side side : sides) {
            if (side.collection == collection) {
                return;
            }
        }
        sides.add(new Side(collection, target));
    }

    private static void forgetLink(AssociationCollection collection, Long handle, CommitJournal journal) {
        List<Link> persisted = collection.persisted;
        for (int i = 0; i < persisted.size(); i++) {
            Link link = persisted.get(i);
            if (link.getRelationshipHandle().equals(handle)) {
                persisted.remove(i);
                int index = i;
                journal.record(() -> persisted.add(index, link));
                return;
            }
        }
    }

    private static final class Side {
        final AssociationCollection collection;
        final Entity target;

        Side(AssociationCollection collection, Entity target) {
            this.collection = collection;
            this.target = target;
        }
    }

    private static final class DesiredEdge {
        final EdgeKey key;
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<Side> sides = new ArrayList<>();

        DesiredEdge(EdgeKey key) {
            this.key = key;
        }
    }

    private static final class ExistingEdge {
        final Long handle;
        final EdgeKey key;
        final Map<String, Object> properties;
        final List<Side> sides = new ArrayList<>();

        ExistingEdge(Long handle, EdgeKey key, Map<String, Object> properties) {
            this.handle = handle;
            this.key = key;
            this.properties = properties;
        }
    }
}
