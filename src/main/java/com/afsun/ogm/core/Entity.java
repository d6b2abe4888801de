package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.exceptions.TypeMismatchException;
import com.afsun.ogm.core.schema.Cardinality;
import com.afsun.ogm.core.schema.EntityType;
import com.afsun.ogm.core.schema.PropertyDescriptor;
import com.afsun.ogm.core.schema.RelationshipDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 映射到单个图节点的应用对象。
 * 属性保存在本地，关系通过按需加载的关联集合访问；同一会话内每个句柄只有一个实例。
 * 相等性为引用相等。
 *
 * @author afsun
 */
public class Entity {

    private final Session session;
    private final EntityType type;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, AssociationCollection> associations = new HashMap<>();
    private Long handle;
    private EntityState state;

    Entity(Session session, EntityType type) {
        this.session = session;
        this.type = type;
        this.state = EntityState.TRANSIENT;
    }

    public Session getSession() {
        return session;
    }

    public EntityType getType() {
        return type;
    }

    public Long getHandle() {
        return handle;
    }

    public EntityState getState() {
        return state;
    }

    public boolean isTransient() {
        return state == EntityState.TRANSIENT;
    }

    public Object get(String name) {
        requireProperty(name);
        return properties.get(name);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * 设置属性值，null 表示删除该属性。值未变化时不产生脏记录
     *
     * @throws TypeMismatchException 值的类型与声明不符
     * @throws DetachedEntityException 实体已删除或已脱离会话
     */
    public Entity set(String name, Object value) {
        checkWritable();
        PropertyDescriptor descriptor = requireProperty(name);
        if (!descriptor.getKind().accepts(value)) {
            throw new TypeMismatchException("{}.{} 需要 {} 类型的值, 实际为 {}",
                    type.getName(), name, descriptor.getKind(), value.getClass().getSimpleName());
        }
        if (Objects.equals(properties.get(name), value)) {
            return this;
        }
        if (value == null) {
            properties.remove(name);
        } else {
            properties.put(name, value);
        }
        session.getChangeTracker().markDirty(this, name);
        return this;
    }

    public SingleReference reference(String name) {
        return (SingleReference) association(name, Cardinality.SINGLE);
    }

    public OrderedAssociation orderedList(String name) {
        return (OrderedAssociation) association(name, Cardinality.ORDERED_LIST);
    }

    public UnorderedAssociation unorderedSet(String name) {
        return (UnorderedAssociation) association(name, Cardinality.UNORDERED_SET);
    }

    /**
     * 按关系名取关联集合（不触发加载）
     */
    public AssociationCollection association(String name) {
        AssociationCollection collection = associations.get(name);
        if (collection == null) {
            RelationshipDescriptor descriptor = type.relationship(name);
            if (descriptor == null) {
                throw new IllegalArgumentException(type.getName() + " 未声明关系: " + name);
            }
            collection = AssociationCollection.create(this, descriptor);
            associations.put(name, collection);
        }
        return collection;
    }

    private AssociationCollection association(String name, Cardinality expected) {
        AssociationCollection collection = association(name);
        Cardinality actual = collection.getDescriptor().getCardinality();
        if (actual != expected) {
            throw new IllegalArgumentException(type.getName() + "." + name + " 的基数为 " + actual + ", 不是 " + expected);
        }
        return collection;
    }

    private PropertyDescriptor requireProperty(String name) {
        PropertyDescriptor descriptor = type.property(name);
        if (descriptor == null) {
            if (type.relationship(name) != null) {
                throw new IllegalArgumentException(type.getName() + "." + name + " 是关系, 请通过关联集合访问");
            }
            throw new IllegalArgumentException(type.getName() + " 未声明属性: " + name);
        }
        return descriptor;
    }

    void checkWritable() {
        if (!session.isOpen()) {
            throw new DetachedEntityException("{} 所属会话已关闭", this);
        }
        if (state == EntityState.DELETED || state == EntityState.DETACHED) {
            throw new DetachedEntityException("{} 状态为 {}, 不能修改", this, state);
        }
    }

    // ===== 会话内部使用 =====

    /**
     * 以图属性名返回全部非空属性
     */
    Map<String, Object> graphProperties() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : properties.entrySet()) {
            result.put(type.property(e.getKey()).getGraphName(), e.getValue());
        }
        return result;
    }

    /**
     * 以图属性名返回给定属性的当前值，已删除的属性值为 null
     */
    Map<String, Object> graphProperties(Collection<String> names) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String name : names) {
            result.put(type.property(name).getGraphName(), properties.get(name));
        }
        return result;
    }

    /**
     * 用存储中读到的图属性覆盖本地属性，未映射的图属性忽略
     */
    void hydrate(Map<String, Object> graphProperties) {
        properties.clear();
        for (Map.Entry<String, Object> e : graphProperties.entrySet()) {
            PropertyDescriptor descriptor = type.propertyByGraphName(e.getKey());
            if (descriptor != null && e.getValue() != null) {
                properties.put(descriptor.getName(), e.getValue());
            }
        }
    }

    void assignHandle(Long handle) {
        this.handle = handle;
        this.state = EntityState.MANAGED;
    }

    void revertToTransient() {
        this.handle = null;
        this.state = EntityState.TRANSIENT;
    }

    void changeState(EntityState state) {
        this.state = state;
    }

    void invalidateAssociations() {
        for (AssociationCollection collection : associations.values()) {
            collection.invalidate();
        }
    }

    @Override
    public String toString() {
        return type.getName() + "#" + (handle == null ? "new" : handle) + properties;
    }
}
