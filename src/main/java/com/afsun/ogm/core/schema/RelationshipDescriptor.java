package com.afsun.ogm.core.schema;

import com.afsun.ogm.core.store.Direction;
import lombok.Getter;

/**
 * 关系映射描述。target 与 inverse 在 {@link SchemaBuilder#build()} 校验时解析
 */
@Getter
public class RelationshipDescriptor {

    /**
     * 有序列表端的序号属性前缀，后接关系名
     */
    public static final String ORDER_PROPERTY_PREFIX = "_ogm_order_";

    private final String name;
    private final String targetTypeName;
    private final Cardinality cardinality;
    private final Direction direction;
    private final String relationshipType;
    private final String inverseName;
    private final CascadePolicy cascade;

    private EntityType declaringType;
    private EntityType target;
    private RelationshipDescriptor inverse;

    RelationshipDescriptor(String name, String targetTypeName, Cardinality cardinality, Direction direction,
                           String relationshipType, String inverseName, CascadePolicy cascade) {
        this.name = name;
        this.targetTypeName = targetTypeName;
        this.cardinality = cardinality;
        this.direction = direction;
        this.relationshipType = relationshipType;
        this.inverseName = inverseName;
        this.cascade = cascade;
    }

    void resolve(EntityType declaringType, EntityType target) {
        this.declaringType = declaringType;
        this.target = target;
    }

    void bindInverse(RelationshipDescriptor inverse) {
        this.inverse = inverse;
    }

    public boolean isBidirectional() {
        return inverse != null;
    }

    /**
     * 本端在关系属性中保存序号的键，非有序列表返回 null
     */
    public String orderProperty() {
        return cardinality == Cardinality.ORDERED_LIST ? ORDER_PROPERTY_PREFIX + name : null;
    }

    @Override
    public String toString() {
        return (declaringType == null ? "?" : declaringType.getName()) + "." + name
                + "(" + cardinality + " " + direction + " :" + relationshipType + " -> " + targetTypeName + ")";
    }
}
