package com.afsun.ogm.core.store;

/**
 * 关系方向（相对于出发节点）
 */
public enum Direction {
    OUTGOING,
    INCOMING,
    /**
     * 仅用于查询：出边与入边
     */
    BOTH;

    public Direction reverse() {
        switch (this) {
            case OUTGOING:
                return INCOMING;
            case INCOMING:
                return OUTGOING;
            default:
                return BOTH;
        }
    }
}
