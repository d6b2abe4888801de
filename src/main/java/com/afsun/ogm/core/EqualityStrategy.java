package com.afsun.ogm.core;

/**
 * 导入实体时判断目标会话中是否已存在同一实体的方式
 */
public enum EqualityStrategy {

    /**
     * 同一个节点：同一会话中的同一实例，或同一存储中的同一句柄
     */
    IDENTITY,

    /**
     * 全部属性相同
     */
    VALUE,

    /**
     * 必填属性相同，类型未声明必填属性时按全部属性比较
     */
    VALID_VALUE,

    /**
     * 唯一属性相同，类型未声明唯一属性时按全部属性比较
     */
    UNIQUE
}
