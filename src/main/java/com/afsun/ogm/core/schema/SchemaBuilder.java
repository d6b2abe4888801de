package com.afsun.ogm.core.schema;

import com.afsun.ogm.core.exceptions.SchemaException;
import com.afsun.ogm.core.store.Direction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 类型声明入口。收集全部声明后在 {@link #build()} 中一次性校验并生成 {@link Schema}
 *
 * <pre>
 * Schema schema = new SchemaBuilder()
 *     .type("Series", t -> t.property("title", PropertyKind.STRING)
 *         .relationship("episodes", "Episode", Cardinality.ORDERED_LIST, Direction.INCOMING, "EPISODE_OF", "series"))
 *     .type("Episode", t -> t.property("number", PropertyKind.NUMBER)
 *         .relationship("series", "Series", Cardinality.SINGLE, Direction.OUTGOING, "EPISODE_OF", "episodes"))
 *     .build();
 * </pre>
 *
 * @author afsun
 */
@Slf4j
public class SchemaBuilder {

    private static final String RESERVED_PREFIX = "_ogm_";

    private final Map<String, TypeDeclaration> declarations = new LinkedHashMap<>();
    private final List<String> duplicateLabels = new ArrayList<>();

    public SchemaBuilder type(String name, Consumer<TypeDeclaration> spec) {
        TypeDeclaration declaration = new TypeDeclaration(name);
        spec.accept(declaration);
        if (declarations.containsKey(name)) {
            duplicateLabels.add(name);
        }
        declarations.put(name, declaration);
        return this;
    }

    public Schema build() {
        if (!duplicateLabels.isEmpty()) {
            throw new SchemaException("类型重复声明: {}", duplicateLabels);
        }
        // 1. 按继承顺序生成类型（父类型先于子类型）
        Map<String, EntityType> types = new LinkedHashMap<>();
        for (String name : declarations.keySet()) {
            buildType(name, types, new LinkedHashSet<>());
        }
        // 2. 解析关系的目标类型
        for (EntityType type : types.values()) {
            TypeDeclaration declaration = declarations.get(type.getName());
            for (RelationshipDescriptor rel : declaration.relationships.values()) {
                EntityType target = types.get(rel.getTargetTypeName());
                if (target == null) {
                    throw new SchemaException("{}.{} 的目标类型 {} 未声明",
                            type.getName(), rel.getName(), rel.getTargetTypeName());
                }
                rel.resolve(type, target);
            }
        }
        // 3. 校验逆关系
        for (EntityType type : types.values()) {
            for (RelationshipDescriptor rel : declarations.get(type.getName()).relationships.values()) {
                validateInverse(type, rel);
            }
        }
        log.info("Schema 构建完成, 类型数={}", types.size());
        return new Schema(types);
    }

    private EntityType buildType(String name, Map<String, EntityType> built, Set<String> visiting) {
        EntityType existing = built.get(name);
        if (existing != null) {
            return existing;
        }
        TypeDeclaration declaration = declarations.get(name);
        if (!visiting.add(name)) {
            throw new SchemaException("类型继承存在循环: {}", visiting);
        }
        EntityType parent = null;
        if (declaration.parentName != null) {
            if (!declarations.containsKey(declaration.parentName)) {
                throw new SchemaException("{} 的父类型 {} 未声明", name, declaration.parentName);
            }
            parent = buildType(declaration.parentName, built, visiting);
        }

        Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();
        Map<String, RelationshipDescriptor> relationships = new LinkedHashMap<>();
        Set<String> unique = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>();
        if (parent != null) {
            properties.putAll(parent.getProperties());
            relationships.putAll(parent.getRelationships());
            unique.addAll(parent.getUniqueProperties());
            required.addAll(parent.getRequiredProperties());
        }

        for (PropertyDescriptor p : declaration.properties.values()) {
            checkAttributeName(name, p.getName(), properties, relationships);
            checkReserved(name, p.getGraphName());
            for (PropertyDescriptor other : properties.values()) {
                if (other.getGraphName().equals(p.getGraphName())) {
                    throw new SchemaException("{}.{} 与 {}.{} 映射到同一图属性 {}",
                            name, p.getName(), name, other.getName(), p.getGraphName());
                }
            }
            properties.put(p.getName(), p);
        }
        for (RelationshipDescriptor r : declaration.relationships.values()) {
            checkAttributeName(name, r.getName(), properties, relationships);
            if (r.getCardinality() == null) {
                throw new SchemaException("{}.{} 未声明基数（SINGLE / ORDERED_LIST / UNORDERED_SET）", name, r.getName());
            }
            if (r.getDirection() != Direction.OUTGOING && r.getDirection() != Direction.INCOMING) {
                throw new SchemaException("{}.{} 的方向必须为 OUTGOING 或 INCOMING", name, r.getName());
            }
            if (r.getRelationshipType() == null || r.getRelationshipType().trim().isEmpty()) {
                throw new SchemaException("{}.{} 未声明关系类型", name, r.getName());
            }
            for (RelationshipDescriptor other : relationships.values()) {
                if (other.getRelationshipType().equals(r.getRelationshipType())
                        && other.getDirection() == r.getDirection()) {
                    throw new SchemaException("{}.{} 与 {}.{} 映射到同一关系 :{} ({})",
                            name, r.getName(), name, other.getName(), r.getRelationshipType(), r.getDirection());
                }
            }
            relationships.put(r.getName(), r);
        }
        for (String u : declaration.unique) {
            if (!properties.containsKey(u)) {
                throw new SchemaException("{} 的唯一属性 {} 未在属性中声明", name, u);
            }
            unique.add(u);
        }
        for (String r : declaration.required) {
            if (!properties.containsKey(r)) {
                throw new SchemaException("{} 的必填属性 {} 未在属性中声明", name, r);
            }
            required.add(r);
        }

        EntityType type = new EntityType(name, parent, properties, relationships, unique, required);
        built.put(name, type);
        visiting.remove(name);
        return type;
    }

    private void checkAttributeName(String typeName, String attribute,
                                    Map<String, PropertyDescriptor> properties,
                                    Map<String, RelationshipDescriptor> relationships) {
        if (attribute == null || attribute.trim().isEmpty()) {
            throw new SchemaException("{} 存在空的属性名", typeName);
        }
        checkReserved(typeName, attribute);
        if (properties.containsKey(attribute) || relationships.containsKey(attribute)) {
            throw new SchemaException("{}.{} 重复声明", typeName, attribute);
        }
    }

    private void checkReserved(String typeName, String name) {
        if (name.startsWith(RESERVED_PREFIX)) {
            throw new SchemaException("{}.{} 使用了保留前缀 {}", typeName, name, RESERVED_PREFIX);
        }
    }

    private void validateInverse(EntityType type, RelationshipDescriptor rel) {
        if (rel.getInverseName() == null) {
            return;
        }
        EntityType target = rel.getTarget();
        if (target == type && rel.getInverseName().equals(rel.getName())) {
            throw new SchemaException("{}.{} 不能作为自身的逆关系", type.getName(), rel.getName());
        }
        RelationshipDescriptor inverse = target.relationship(rel.getInverseName());
        if (inverse == null) {
            throw new SchemaException("{}.{} 的逆关系 {}.{} 不存在",
                    type.getName(), rel.getName(), target.getName(), rel.getInverseName());
        }
        if (!rel.getName().equals(inverse.getInverseName())) {
            throw new SchemaException("{}.{} 与 {}.{} 的逆关系声明不对称",
                    type.getName(), rel.getName(), target.getName(), inverse.getName());
        }
        if (!inverse.getRelationshipType().equals(rel.getRelationshipType())) {
            throw new SchemaException("{}.{} 与逆关系 {}.{} 的关系类型不一致: {} / {}",
                    type.getName(), rel.getName(), target.getName(), inverse.getName(),
                    rel.getRelationshipType(), inverse.getRelationshipType());
        }
        if (inverse.getDirection() != rel.getDirection().reverse()) {
            throw new SchemaException("{}.{} 与逆关系 {}.{} 的方向未镜像",
                    type.getName(), rel.getName(), target.getName(), inverse.getName());
        }
        if (!rel.getCardinality().mirrors(inverse.getCardinality())) {
            throw new SchemaException("{}.{} ({}) 与逆关系 {}.{} ({}) 基数不兼容",
                    type.getName(), rel.getName(), rel.getCardinality(),
                    target.getName(), inverse.getName(), inverse.getCardinality());
        }
        if (!type.isSubtypeOf(inverse.getTarget())) {
            throw new SchemaException("{}.{} 的目标类型 {} 不接受 {}",
                    target.getName(), inverse.getName(), inverse.getTargetTypeName(), type.getName());
        }
        rel.bindInverse(inverse);
    }

    /**
     * 单个类型的声明
     */
    public static class TypeDeclaration {
        private final String name;
        private String parentName;
        private final Map<String, PropertyDescriptor> properties = new LinkedHashMap<>();
        private final Map<String, RelationshipDescriptor> relationships = new LinkedHashMap<>();
        private final Set<String> unique = new LinkedHashSet<>();
        private final Set<String> required = new LinkedHashSet<>();

        TypeDeclaration(String name) {
            this.name = name;
        }

        public TypeDeclaration extendsType(String parent) {
            this.parentName = parent;
            return this;
        }

        public TypeDeclaration property(String propertyName, PropertyKind kind) {
            return property(propertyName, kind, propertyName);
        }

        public TypeDeclaration property(String propertyName, PropertyKind kind, String graphName) {
            if (kind == null) {
                throw new SchemaException("{}.{} 未声明标量类型", name, propertyName);
            }
            if (properties.containsKey(propertyName)) {
                throw new SchemaException("{}.{} 重复声明", name, propertyName);
            }
            properties.put(propertyName, new PropertyDescriptor(propertyName, kind, graphName));
            return this;
        }

        /**
         * 单向关系
         */
        public TypeDeclaration relationship(String relationshipName, String targetType, Cardinality cardinality,
                                            Direction direction, String relationshipType) {
            return relationship(relationshipName, targetType, cardinality, direction, relationshipType, null);
        }

        /**
         * 双向关系，inverseName 为目标类型上的逆关系名
         */
        public TypeDeclaration relationship(String relationshipName, String targetType, Cardinality cardinality,
                                            Direction direction, String relationshipType, String inverseName) {
            return relationship(relationshipName, targetType, cardinality, direction, relationshipType,
                    inverseName, CascadePolicy.NONE);
        }

        public TypeDeclaration relationship(String relationshipName, String targetType, Cardinality cardinality,
                                            Direction direction, String relationshipType, String inverseName,
                                            CascadePolicy cascade) {
            if (relationships.containsKey(relationshipName) || properties.containsKey(relationshipName)) {
                throw new SchemaException("{}.{} 重复声明", name, relationshipName);
            }
            relationships.put(relationshipName, new RelationshipDescriptor(relationshipName, targetType, cardinality,
                    direction, relationshipType, inverseName, cascade == null ? CascadePolicy.NONE : cascade));
            return this;
        }

        public TypeDeclaration unique(String... propertyNames) {
            for (String p : propertyNames) {
                unique.add(p);
            }
            return this;
        }

        /**
         * 必填属性：提交时值为空的实体不被视为该类型的有效实例，提交失败
         */
        public TypeDeclaration required(String... propertyNames) {
            for (String p : propertyNames) {
                required.add(p);
            }
            return this;
        }
    }
}
