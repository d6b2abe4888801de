package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.exceptions.TypeMismatchException;
import com.afsun.ogm.core.schema.Cardinality;
import com.afsun.ogm.core.schema.RelationshipDescriptor;
import com.afsun.ogm.core.store.RelationshipRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * 关系的一端。成员在首次访问时从图存储加载并缓存；
 * 修改先校验再同时作用于两端，并登记到 {@link ChangeTracker}，只在提交时写入存储。
 *
 * @author afsun
 */
@Slf4j
public abstract class AssociationCollection implements Iterable<Entity> {

    protected final Entity owner;
    protected final RelationshipDescriptor descriptor;

    /**
     * 当前内存中的成员（按引用唯一）
     */
    final List<Entity> members = new ArrayList<>();

    /**
     * 最近一次已知的存储状态，提交时据此计算差异
     */
    final List<Link> persisted = new ArrayList<>();

    private boolean loaded;

    AssociationCollection(Entity owner, RelationshipDescriptor descriptor) {
        this.owner = owner;
        this.descriptor = descriptor;
    }

    static AssociationCollection create(Entity owner, RelationshipDescriptor descriptor) {
        switch (descriptor.getCardinality()) {
            case SINGLE:
                return new SingleReference(owner, descriptor);
            case ORDERED_LIST:
                return new OrderedAssociation(owner, descriptor);
            case UNORDERED_SET:
                return new UnorderedAssociation(owner, descriptor);
            default:
                throw new IllegalStateException("未知基数: " + descriptor.getCardinality());
        }
    }

    public Entity getOwner() {
        return owner;
    }

    public RelationshipDescriptor getDescriptor() {
        return descriptor;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public List<Entity> toList() {
        ensureLoaded();
        return Collections.unmodifiableList(new ArrayList<>(members));
    }

    public int size() {
        ensureLoaded();
        return members.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean contains(Entity entity) {
        ensureLoaded();
        return indexOf(entity) >= 0;
    }

    @Override
    public Iterator<Entity> iterator() {
        return toList().iterator();
    }

    /**
     * 丢弃缓存并重新从存储加载。存在未提交的成员变化时不允许刷新
     */
    public void refresh() {
        if (owner.getSession().getChangeTracker().dirtyNames(owner).contains(descriptor.getName())) {
            throw new IllegalStateException(owner + "." + descriptor.getName() + " 存在未提交的修改, 不能刷新");
        }
        invalidate();
        ensureLoaded();
    }

    // ===== 加载 =====

    void ensureLoaded() {
        if (loaded) {
            return;
        }
        Session session = owner.getSession();
        if (!session.isOpen()) {
            throw new DetachedEntityException("{} 所属会话已关闭, 无法加载关系 {}", owner, descriptor.getName());
        }
        // 已提交删除的实体在存储中不存在，视为空集合
        boolean removed = owner.getState() == EntityState.DELETED && !session.isPendingDeletion(owner.getHandle());
        if (owner.getHandle() != null && !removed) {
            load(session);
        }
        loaded = true;
    }

    private void load(Session session) {
        List<RelationshipRecord> records = new ArrayList<>(session.getStore().fetchRelationships(
                owner.getHandle(), descriptor.getRelationshipType(), descriptor.getDirection()));
        String orderKey = descriptor.orderProperty();
        if (orderKey != null) {
            records.sort(Comparator.comparingLong((RelationshipRecord r) -> ordinal(r, orderKey))
                    .thenComparing(RelationshipRecord::getHandle));
        } else {
            records.sort(Comparator.comparing(RelationshipRecord::getHandle));
        }
        for (RelationshipRecord record : records) {
            // 会话中已删除但尚未提交的一端仍以原实例出现，以便解除关联
            Entity other = session.isPendingDeletion(record.getOtherEnd())
                    ? session.pendingDeletion(record.getOtherEnd())
                    : session.getIdentityMap().resolve(record.getOtherEnd());
            if (!other.getType().isSubtypeOf(descriptor.getTarget())) {
                log.warn("忽略关系 {}: {} 不是 {} 的目标类型 {}",
                        record.getHandle(), other, descriptor, descriptor.getTargetTypeName());
                continue;
            }
            persisted.add(new Link(record.getHandle(), other, record.getProperties()));
            if (descriptor.getCardinality() == Cardinality.SINGLE && !members.isEmpty()) {
                log.warn("{}.{} 为单引用, 但存储中存在多条关系, 忽略 {}", owner, descriptor.getName(), record.getHandle());
                continue;
            }
            members.add(other);
        }
        log.debug("加载关联 {}.{} 成员数={}", owner, descriptor.getName(), members.size());
    }

    private static long ordinal(RelationshipRecord record, String key) {
        Object value = record.getProperties().get(key);
        return value instanceof Number ? ((Number) value).longValue() : Long.MAX_VALUE;
    }

    void invalidate() {
        loaded = false;
        members.clear();
        persisted.clear();
    }

    // ===== 变更协议 =====

    /**
     * 将 target 关联到本端，index 为 -1 时追加到末尾。
     * 单引用端原有的目标、以及逆向单引用端原有的关联会被自动解除。
     *
     * @return 成员是否发生变化
     */
    final boolean link(Entity target, int index) {
        owner.checkWritable();
        validateTarget(target);
        ensureLoaded();
        if (indexOf(target) >= 0) {
            if (descriptor.getCardinality() == Cardinality.ORDERED_LIST) {
                throw new IllegalArgumentException(owner + "." + descriptor.getName() + " 已包含 " + target + ", 有序列表不允许重复");
            }
            return false;
        }
        if (index < -1 || index > members.size()) {
            throw new IndexOutOfBoundsException("插入位置 " + index + " 超出范围, 当前大小 " + members.size());
        }

        // 先加载所有受影响的集合，再统一修改，避免加载失败时留下半条关联
        AssociationCollection inverse = inverseOf(target);
        Entity displacedTarget = null;
        AssociationCollection displacedTargetSide = null;
        if (descriptor.getCardinality() == Cardinality.SINGLE && !members.isEmpty()) {
            displacedTarget = members.get(0);
            displacedTargetSide = inverseOf(displacedTarget);
        }
        Entity displacedOwner = null;
        AssociationCollection displacedOwnerSide = null;
        if (inverse != null && inverse.descriptor.getCardinality() == Cardinality.SINGLE && !inverse.members.isEmpty()) {
            displacedOwner = inverse.members.get(0);
            displacedOwnerSide = displacedOwner.association(descriptor.getName());
            displacedOwnerSide.ensureLoaded();
        }

        if (displacedTarget != null) {
            rawRemove(displacedTarget);
            if (displacedTargetSide != null) {
                displacedTargetSide.rawRemove(owner);
                mark(displacedTarget, displacedTargetSide.descriptor.getName());
            }
        }
        if (displacedOwner != null) {
            inverse.rawRemove(displacedOwner);
            displacedOwnerSide.rawRemove(target);
            mark(displacedOwner, descriptor.getName());
        }
        if (index == -1) {
            members.add(target);
        } else {
            members.add(index, target);
        }
        mark(owner, descriptor.getName());
        if (inverse != null) {
            inverse.members.add(owner);
            mark(target, inverse.descriptor.getName());
        }
        return true;
    }

    /**
     * 解除与 target 的关联（两端同时解除）
     *
     * @return 成员是否发生变化
     */
    final boolean unlink(Entity target) {
        owner.checkWritable();
        return detach(target);
    }

    /**
     * 不校验本端可写性的解除关联，删除实体时使用
     */
    boolean detach(Entity target) {
        ensureLoaded();
        if (indexOf(target) < 0) {
            return false;
        }
        AssociationCollection inverse = inverseOf(target);
        rawRemove(target);
        mark(owner, descriptor.getName());
        if (inverse != null) {
            inverse.rawRemove(owner);
            mark(target, inverse.descriptor.getName());
        }
        return true;
    }

    /**
     * 仅替换本端顺序（不影响逆向端成员），newOrder 必须是当前成员的一个排列
     */
    final boolean reorderMembers(List<Entity> newOrder) {
        owner.checkWritable();
        ensureLoaded();
        if (newOrder.size() != members.size()) {
            throw new IllegalArgumentException("新顺序的大小 " + newOrder.size() + " 与当前成员数 " + members.size() + " 不一致");
        }
        List<Entity> remaining = new ArrayList<>(members);
        for (Entity e : newOrder) {
            if (!removeByIdentity(remaining, e)) {
                throw new IllegalArgumentException("新顺序不是当前成员的排列: " + e);
            }
        }
        boolean same = true;
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) != newOrder.get(i)) {
                same = false;
                break;
            }
        }
        if (same) {
            return false;
        }
        members.clear();
        members.addAll(newOrder);
        mark(owner, descriptor.getName());
        return true;
    }

    private void validateTarget(Entity target) {
        if (target == null) {
            throw new IllegalArgumentException(owner + "." + descriptor.getName() + " 的目标不能为空");
        }
        if (target.getSession() != owner.getSession()) {
            throw new DetachedEntityException("{} 不属于 {} 所在的会话", target, owner);
        }
        if (target.getState() == EntityState.DELETED || target.getState() == EntityState.DETACHED) {
            throw new DetachedEntityException("不能关联状态为 {} 的实体 {}", target.getState(), target);
        }
        if (!target.getType().isSubtypeOf(descriptor.getTarget())) {
            throw new TypeMismatchException("{}.{} 需要 {} 类型的目标, 实际为 {}",
                    owner.getType().getName(), descriptor.getName(), descriptor.getTargetTypeName(),
                    target.getType().getName());
        }
    }

    /**
     * 目标实体上的逆向集合（已加载），单向关系返回 null
     */
    private AssociationCollection inverseOf(Entity target) {
        if (!descriptor.isBidirectional()) {
            return null;
        }
        AssociationCollection inverse = target.association(descriptor.getInverse().getName());
        inverse.ensureLoaded();
        return inverse;
    }

    private void rawRemove(Entity entity) {
        removeByIdentity(members, entity);
    }

    int indexOf(Entity entity) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i) == entity) {
                return i;
            }
        }
        return -1;
    }

    private static boolean removeByIdentity(List<Entity> list, Entity entity) {
        for (Iterator<Entity> it = list.iterator(); it.hasNext(); ) {
            if (it.next() == entity) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    private static void mark(Entity entity, String name) {
        if (entity.getState() != EntityState.DETACHED) {
            entity.getSession().getChangeTracker().markDirty(entity, name);
        }
    }

    @Override
    public String toString() {
        return owner + "." + descriptor.getName() + (loaded ? members.toString() : "[未加载]");
    }
}
