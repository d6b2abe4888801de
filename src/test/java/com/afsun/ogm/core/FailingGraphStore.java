package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.StoreUnavailableException;
import com.afsun.ogm.core.store.Direction;
import com.afsun.ogm.core.store.GraphStore;
import com.afsun.ogm.core.store.InMemoryGraphStore;
import com.afsun.ogm.core.store.NodeRecord;
import com.afsun.ogm.core.store.RelationshipRecord;
import com.afsun.ogm.core.store.StoreStatistics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用存储：包装内存存储，在指定的第 n 次写操作时抛出 StoreUnavailableException，并统计各类写操作次数。
 * transactional 为 true 时模拟事务存储，失败后撤销本次事务中已完成的创建与更新。
 */
class FailingGraphStore implements GraphStore {

    private final InMemoryGraphStore delegate = new InMemoryGraphStore();
    private final boolean transactional;
    private final Map<String, Integer> calls = new HashMap<>();
    private String failingOperation;
    private int failAt;

    private boolean inTransaction;
    private final List<Runnable> undo = new ArrayList<>();

    FailingGraphStore(boolean transactional) {
        this.transactional = transactional;
    }

    /**
     * 下一次执行到第 nth 次 operation 时失败一次
     */
    void failOn(String operation, int nth) {
        this.failingOperation = operation;
        this.failAt = count(operation) + nth;
    }

    int count(String operation) {
        return calls.getOrDefault(operation, 0);
    }

    InMemoryGraphStore getDelegate() {
        return delegate;
    }

    private void call(String operation) {
        int n = calls.merge(operation, 1, Integer::sum);
        if (operation.equals(failingOperation) && n == failAt) {
            failingOperation = null;
            throw new StoreUnavailableException("模拟故障: {} 第 {} 次调用", operation, n);
        }
    }

    @Override
    public Long createNode(String label, Map<String, Object> properties) {
        call("createNode");
        Long handle = delegate.createNode(label, properties);
        if (inTransaction) {
            undo.add(() -> delegate.deleteNode(handle));
        }
        return handle;
    }

    @Override
    public void updateNode(Long handle, Map<String, Object> properties) {
        call("updateNode");
        if (inTransaction) {
            Map<String, Object> before = new HashMap<>();
            Map<String, Object> current = delegate.fetchNode(handle).getProperties();
            for (String key : properties.keySet()) {
                before.put(key, current.get(key));
            }
            undo.add(() -> delegate.updateNode(handle, before));
        }
        delegate.updateNode(handle, properties);
    }

    @Override
    public void deleteNode(Long handle) {
        call("deleteNode");
        delegate.deleteNode(handle);
    }

    @Override
    public Long createRelationship(String type, Long from, Long to, Map<String, Object> properties) {
        call("createRelationship");
        Long handle = delegate.createRelationship(type, from, to, properties);
        if (inTransaction) {
            undo.add(() -> delegate.deleteRelationship(handle));
        }
        return handle;
    }

    @Override
    public void deleteRelationship(Long handle) {
        call("deleteRelationship");
        delegate.deleteRelationship(handle);
    }

    @Override
    public NodeRecord fetchNode(Long handle) {
        return delegate.fetchNode(handle);
    }

    @Override
    public List<RelationshipRecord> fetchRelationships(Long handle, String type, Direction direction) {
        return delegate.fetchRelationships(handle, type, direction);
    }

    @Override
    public List<Long> findNodes(String label, Map<String, Object> filter) {
        return delegate.findNodes(label, filter);
    }

    @Override
    public StoreStatistics statistics() {
        return delegate.statistics();
    }

    @Override
    public boolean supportsTransactions() {
        return transactional;
    }

    @Override
    public void executeInTransaction(Runnable work) {
        if (!transactional) {
            work.run();
            return;
        }
        inTransaction = true;
        undo.clear();
        try {
            work.run();
        } catch (RuntimeException e) {
            for (int i = undo.size() - 1; i >= 0; i--) {
                undo.get(i).run();
            }
            throw e;
        } finally {
            inTransaction = false;
            undo.clear();
        }
    }
}
