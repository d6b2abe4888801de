package com.afsun.ogm.core.schema;

/**
 * 关联一端的基数形态，必须在声明中显式给出
 */
public enum Cardinality {
    /**
     * 单引用（一对一 / 多对一）
     */
    SINGLE,
    /**
     * 有序列表，顺序以序号属性持久化
     */
    ORDERED_LIST,
    /**
     * 无序集合，按节点唯一
     */
    UNORDERED_SET;

    public boolean isMany() {
        return this != SINGLE;
    }

    /**
     * 两端基数是否可以互为逆关系：有序列表与无序集合不能配对
     */
    public boolean mirrors(Cardinality inverse) {
        return !((this == ORDERED_LIST && inverse == UNORDERED_SET)
                || (this == UNORDERED_SET && inverse == ORDERED_LIST));
    }
}
