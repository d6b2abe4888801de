package com.afsun.ogm.core;

import com.afsun.ogm.core.schema.RelationshipDescriptor;

import java.util.List;

/**
 * 有序列表关联。成员不可重复，顺序在提交后通过关系上的序号属性保留
 */
public class OrderedAssociation extends AssociationCollection {

    OrderedAssociation(Entity owner, RelationshipDescriptor descriptor) {
        super(owner, descriptor);
    }

    public Entity get(int index) {
        ensureLoaded();
        return members.get(index);
    }

    public int indexOfMember(Entity entity) {
        ensureLoaded();
        return indexOf(entity);
    }

    public void append(Entity entity) {
        link(entity, -1);
    }

    public void insert(int index, Entity entity) {
        link(entity, index);
    }

    public boolean remove(Entity entity) {
        return unlink(entity);
    }

    /**
     * 按给定顺序重排，newOrder 必须是当前成员的排列
     */
    public void reorder(List<Entity> newOrder) {
        reorderMembers(newOrder);
    }
}
