package com.afsun.ogm.controller;

import com.afsun.ogm.core.schema.Schema;
import com.afsun.ogm.core.store.Direction;
import com.afsun.ogm.core.store.GraphStore;
import com.afsun.ogm.core.store.NodeRecord;
import com.afsun.ogm.core.store.StoreStatistics;
import com.afsun.ogm.vo.NodeView;
import com.afsun.ogm.vo.Response;
import com.afsun.ogm.vo.SchemaView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.annotation.Resource;

/**
 * 图存储只读查询接口
 * 提供存储统计、Schema 与单个节点的查看
 *
 * @author afsun
 */
@RestController
@RequestMapping("/ogm")
@Slf4j
public class OgmAdminController {

    @Resource
    private GraphStore graphStore;

    @Resource
    private Schema schema;

    /**
     * 存储统计：节点数、关系数、各标签节点数
     */
    @GetMapping("/store/statistics")
    public Response<StoreStatistics> statistics() {
        return Response.success(graphStore.statistics());
    }

    /**
     * 已声明的类型及其属性、关系
     */
    @GetMapping("/schema")
    public Response<SchemaView> schema() {
        return Response.success(SchemaView.of(schema));
    }

    /**
     * 按句柄查看节点及其关系
     *
     * @param handle 节点句柄
     */
    @GetMapping("/nodes/{handle}")
    public Response<NodeView> node(@PathVariable Long handle) {
        log.info("查询节点: {}", handle);
        NodeRecord node = graphStore.fetchNode(handle);
        return Response.success(NodeView.of(node, graphStore.fetchRelationships(handle, null, Direction.BOTH)));
    }
}
