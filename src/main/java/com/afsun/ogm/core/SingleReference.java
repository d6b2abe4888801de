package com.afsun.ogm.core;

import com.afsun.ogm.core.schema.RelationshipDescriptor;

/**
 * 单引用关联：持有零个或一个目标
 */
public class SingleReference extends AssociationCollection {

    SingleReference(Entity owner, RelationshipDescriptor descriptor) {
        super(owner, descriptor);
    }

    public Entity get() {
        ensureLoaded();
        return members.isEmpty() ? null : members.get(0);
    }

    /**
     * 替换引用，null 表示解除。旧目标与新目标的逆向集合同步更新
     */
    public void set(Entity target) {
        if (target == null) {
            owner.checkWritable();
            Entity current = get();
            if (current != null) {
                unlink(current);
            }
            return;
        }
        link(target, -1);
    }
}
