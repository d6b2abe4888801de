package com.afsun.ogm.core;

/**
 * 实体在会话中的生命周期状态。MANAGED 下是否有待提交修改由 {@link ChangeTracker} 判断
 */
public enum EntityState {
    /**
     * 新建，尚未分配句柄
     */
    TRANSIENT,
    /**
     * 已持久化并登记在身份映射中
     */
    MANAGED,
    /**
     * 已删除（终态），不可再修改
     */
    DELETED,
    /**
     * 已驱逐或所属会话已关闭
     */
    DETACHED
}
