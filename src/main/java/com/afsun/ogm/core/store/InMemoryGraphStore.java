package com.afsun.ogm.core.store;

import com.afsun.ogm.core.exceptions.ReferentialIntegrityException;
import com.afsun.ogm.core.exceptions.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存图存储（独立模式的默认后端）
 * 节点和关系以单调递增的句柄为键保存在哈希表中，节点保留出入边邻接表，
 * 查找为 O(1)，关系枚举为 O(度数)。
 * 写操作持有写锁互斥执行，读操作共享读锁，可被多个会话并发访问。
 *
 * @author afsun
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    public static final String STORE_TYPE = "memory";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Long, StoredNode> nodes = new HashMap<>();

    private final Map<Long, StoredRelationship> relationships = new HashMap<>();

    private final Map<String, Set<Long>> nodesByLabel = new HashMap<>();

    /**
     * 节点与关系共用的句柄序列，仅在写锁内递增
     */
    private long sequence = 0;

    @Override
    public Long createNode(String label, Map<String, Object> properties) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("节点标签不能为空");
        }
        Map<String, Object> props = copyProperties(properties);
        lock.writeLock().lock();
        try {
            Long handle = ++sequence;
            nodes.put(handle, new StoredNode(label, props));
            nodesByLabel.computeIfAbsent(label, k -> new LinkedHashSet<>()).add(handle);
            log.debug("创建节点 {}:{} 属性={}", handle, label, props.keySet());
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateNode(Long handle, Map<String, Object> properties) {
        if (properties == null || properties.isEmpty()) {
            return;
        }
        for (Object value : properties.values()) {
            checkScalar(value);
        }
        lock.writeLock().lock();
        try {
            StoredNode node = requireNode(handle);
            for (Map.Entry<String, Object> e : properties.entrySet()) {
                if (e.getValue() == null) {
                    node.properties.remove(e.getKey());
                } else {
                    node.properties.put(e.getKey(), e.getValue());
                }
            }
            log.debug("更新节点 {} 属性={}", handle, properties.keySet());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteNode(Long handle) {
        lock.writeLock().lock();
        try {
            StoredNode node = requireNode(handle);
            int degree = node.outgoing.size() + node.incoming.size();
            if (degree > 0) {
                throw new ReferentialIntegrityException(handle, degree);
            }
            nodes.remove(handle);
            Set<Long> sameLabel = nodesByLabel.get(node.label);
            if (sameLabel != null) {
                sameLabel.remove(handle);
            }
            log.debug("删除节点 {}", handle);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Long createRelationship(String type, Long from, Long to, Map<String, Object> properties) {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("关系类型不能为空");
        }
        Map<String, Object> props = copyProperties(properties);
        lock.writeLock().lock();
        try {
            StoredNode fromNode = requireNode(from);
            StoredNode toNode = requireNode(to);
            Long handle = ++sequence;
            relationships.put(handle, new StoredRelationship(type, from, to, props));
            fromNode.outgoing.add(handle);
            toNode.incoming.add(handle);
            log.debug("创建关系 {} ({})-[:{}]->({})", handle, from, type, to);
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteRelationship(Long handle) {
        lock.writeLock().lock();
        try {
            StoredRelationship rel = relationships.remove(handle);
            if (rel == null) {
                throw new StoreException("RELATIONSHIP_NOT_FOUND", "关系不存在: {}", handle);
            }
            StoredNode fromNode = nodes.get(rel.from);
            if (fromNode != null) {
                fromNode.outgoing.remove(handle);
            }
            StoredNode toNode = nodes.get(rel.to);
            if (toNode != null) {
                toNode.incoming.remove(handle);
            }
            log.debug("删除关系 {} ({})-[:{}]->({})", handle, rel.from, rel.type, rel.to);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public NodeRecord fetchNode(Long handle) {
        lock.readLock().lock();
        try {
            StoredNode node = requireNode(handle);
            return new NodeRecord(handle, node.label, new LinkedHashMap<>(node.properties));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RelationshipRecord> fetchRelationships(Long handle, String type, Direction direction) {
        lock.readLock().lock();
        try {
            StoredNode node = requireNode(handle);
            List<RelationshipRecord> result = new ArrayList<>();
            if (direction == Direction.OUTGOING || direction == Direction.BOTH) {
                collect(node.outgoing, type, handle, result);
            }
            if (direction == Direction.INCOMING || direction == Direction.BOTH) {
                collect(node.incoming, type, handle, result);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Long> findNodes(String label, Map<String, Object> filter) {
        lock.readLock().lock();
        try {
            Collection<Long> candidates;
            if (label == null) {
                candidates = nodes.keySet();
            } else {
                candidates = nodesByLabel.getOrDefault(label, Collections.emptySet());
            }
            List<Long> result = new ArrayList<>();
            for (Long handle : candidates) {
                if (matches(nodes.get(handle).properties, filter)) {
                    result.add(handle);
                }
            }
            Collections.sort(result);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StoreStatistics statistics() {
        lock.readLock().lock();
        try {
            Map<String, Long> labels = new LinkedHashMap<>();
            nodesByLabel.forEach((label, handles) -> {
                if (!handles.isEmpty()) {
                    labels.put(label, (long) handles.size());
                }
            });
            return new StoreStatistics(STORE_TYPE, nodes.size(), relationships.size(), labels);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void collect(Set<Long> relHandles, String type, Long self, List<RelationshipRecord> result) {
        for (Long relHandle : relHandles) {
            StoredRelationship rel = relationships.get(relHandle);
            if (type != null && !type.equals(rel.type)) {
                continue;
            }
            Long otherEnd = self.equals(rel.from) ? rel.to : rel.from;
            result.add(new RelationshipRecord(relHandle, rel.type, rel.from, rel.to, otherEnd,
                    new LinkedHashMap<>(rel.properties)));
        }
    }

    private static boolean matches(Map<String, Object> properties, Map<String, Object> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, Object> e : filter.entrySet()) {
            if (!Objects.equals(properties.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private StoredNode requireNode(Long handle) {
        StoredNode node = handle == null ? null : nodes.get(handle);
        if (node == null) {
            throw new StoreException("NODE_NOT_FOUND", "节点不存在: {}", handle);
        }
        return node;
    }

    private static Map<String, Object> copyProperties(Map<String, Object> properties) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (properties != null) {
            for (Map.Entry<String, Object> e : properties.entrySet()) {
                if (e.getValue() != null) {
                    checkScalar(e.getValue());
                    copy.put(e.getKey(), e.getValue());
                }
            }
        }
        return copy;
    }

    private static void checkScalar(Object value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Temporal) {
            return;
        }
        throw new IllegalArgumentException("属性值必须为标量: " + value.getClass().getName());
    }

    private static final class StoredNode {
        final String label;
        final Map<String, Object> properties;
        final Set<Long> outgoing = new LinkedHashSet<>();
        final Set<Long> incoming = new LinkedHashSet<>();

        StoredNode(String label, Map<String, Object> properties) {
            this.label = label;
            this.properties = properties;
        }
    }

    private static final class StoredRelationship {
        final String type;
        final Long from;
        final Long to;
        final Map<String, Object> properties;

        StoredRelationship(String type, Long from, Long to, Map<String, Object> properties) {
            this.type = type;
            this.from = from;
            this.to = to;
            this.properties = properties;
        }
    }
}
