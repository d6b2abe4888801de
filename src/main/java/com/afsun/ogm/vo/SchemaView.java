package com.afsun.ogm.vo;

import com.afsun.ogm.core.schema.EntityType;
import com.afsun.ogm.core.schema.PropertyDescriptor;
import com.afsun.ogm.core.schema.RelationshipDescriptor;
import com.afsun.ogm.core.schema.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema 查询结果
 *
 * @author afsun
 */
@Data
public class SchemaView {

    private List<TypeView> types = new ArrayList<>();

    public static SchemaView of(Schema schema) {
        SchemaView view = new SchemaView();
        for (EntityType type : schema.types()) {
            TypeView typeView = new TypeView();
            typeView.setName(type.getName());
            typeView.setParent(type.getParent() == null ? null : type.getParent().getName());
            typeView.setUniqueProperties(new ArrayList<>(type.getUniqueProperties()));
            typeView.setRequiredProperties(new ArrayList<>(type.getRequiredProperties()));
            for (PropertyDescriptor p : type.getProperties().values()) {
                PropertyView propertyView = new PropertyView();
                propertyView.setName(p.getName());
                propertyView.setKind(p.getKind().name());
                propertyView.setGraphName(p.getGraphName());
                typeView.getProperties().add(propertyView);
            }
            for (RelationshipDescriptor r : type.relationshipList()) {
                RelationshipView relationshipView = new RelationshipView();
                relationshipView.setName(r.getName());
                relationshipView.setTarget(r.getTargetTypeName());
                relationshipView.setCardinality(r.getCardinality().name());
                relationshipView.setDirection(r.getDirection().name());
                relationshipView.setRelationshipType(r.getRelationshipType());
                relationshipView.setInverse(r.getInverseName());
                relationshipView.setCascade(r.getCascade().name());
                typeView.getRelationships().add(relationshipView);
            }
            view.getTypes().add(typeView);
        }
        return view;
    }

    /**
     * 类型
     */
    @Data
    public static class TypeView {
        private String name;
        private String parent;
        private List<String> uniqueProperties = new ArrayList<>();
        private List<String> requiredProperties = new ArrayList<>();
        private List<PropertyView> properties = new ArrayList<>();
        private List<RelationshipView> relationships = new ArrayList<>();
    }

    /**
     * 属性
     */
    @Data
    public static class PropertyView {
        private String name;
        private String kind;
        private String graphName;
    }

    /**
     * 关系
     */
    @Data
    public static class RelationshipView {
        private String name;
        private String target;
        private String cardinality;
        private String direction;
        private String relationshipType;
        private String inverse;
        private String cascade;
    }
}
