package com.afsun.ogm.core;

import com.afsun.ogm.core.schema.RelationshipDescriptor;

/**
 * 无序集合关联，按实体唯一；重复添加或移除不存在的成员不产生脏记录
 */
public class UnorderedAssociation extends AssociationCollection {

    UnorderedAssociation(Entity owner, RelationshipDescriptor descriptor) {
        super(owner, descriptor);
    }

    public boolean add(Entity entity) {
        return link(entity, -1);
    }

    public boolean discard(Entity entity) {
        return unlink(entity);
    }
}
