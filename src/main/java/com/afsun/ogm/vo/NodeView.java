package com.afsun.ogm.vo;

import com.afsun.ogm.core.store.NodeRecord;
import com.afsun.ogm.core.store.RelationshipRecord;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 节点查询结果：节点属性及其全部关系
 *
 * @author afsun
 */
@Data
public class NodeView {

    private Long handle;

    private String label;

    private Map<String, Object> properties;

    private List<RelationshipRecord> relationships;

    public static NodeView of(NodeRecord node, List<RelationshipRecord> relationships) {
        NodeView view = new NodeView();
        view.setHandle(node.getHandle());
        view.setLabel(node.getLabel());
        view.setProperties(node.getProperties());
        view.setRelationships(relationships);
        return view;
    }
}
