package com.afsun.ogm.core.store;

import com.afsun.ogm.core.exceptions.ReferentialIntegrityException;
import com.afsun.ogm.core.exceptions.StoreException;

import java.util.List;
import java.util.Map;

/**
 * 图存储抽象：节点与关系的增删改查。句柄由存储分配，对调用方不透明
 *
 * <p>远程实现可能抛出 {@link com.afsun.ogm.core.exceptions.StoreUnavailableException} 或
 * {@link com.afsun.ogm.core.exceptions.StoreTimeoutException}，两者均可重试。
 *
 * @author afsun
 */
public interface GraphStore {

    /**
     * 创建节点
     *
     * @param label      节点标签
     * @param properties 属性（字符串键，标量值），null 值忽略
     * @return 新节点句柄
     */
    Long createNode(String label, Map<String, Object> properties);

    /**
     * 合并更新节点属性，值为 null 表示删除该属性
     */
    void updateNode(Long handle, Map<String, Object> properties);

    /**
     * 删除节点
     *
     * @throws ReferentialIntegrityException 仍有关系引用该节点
     */
    void deleteNode(Long handle);

    /**
     * 创建从 from 指向 to 的关系
     *
     * @return 新关系句柄
     */
    Long createRelationship(String type, Long from, Long to, Map<String, Object> properties);

    void deleteRelationship(Long handle);

    /**
     * 读取节点
     *
     * @throws StoreException 节点不存在（NODE_NOT_FOUND）
     */
    NodeRecord fetchNode(Long handle);

    /**
     * 枚举节点上给定类型与方向的关系，otherEnd 为相对 handle 的另一端
     */
    List<RelationshipRecord> fetchRelationships(Long handle, String type, Direction direction);

    /**
     * 按标签和属性等值条件查找节点
     *
     * @param label  标签，null 表示任意标签
     * @param filter 属性条件，空表示不过滤
     */
    List<Long> findNodes(String label, Map<String, Object> filter);

    StoreStatistics statistics();

    /**
     * 存储是否支持事务回滚：支持时一次提交中失败的操作会整体回滚
     */
    default boolean supportsTransactions() {
        return false;
    }

    /**
     * 在一个存储事务中执行一次提交的全部操作，不支持事务的存储直接执行
     */
    default void executeInTransaction(Runnable work) {
        work.run();
    }
}
