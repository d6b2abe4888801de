package com.afsun.ogm.core;

import java.util.Objects;

/**
 * 图中一条关系的身份：类型与两端节点句柄。同一对节点之间同类型的关系视为同一条
 */
final class EdgeKey {
    final String type;
    final Long from;
    final Long to;

    EdgeKey(String type, Long from, Long to) {
        this.type = type;
        this.from = from;
        this.to = to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeKey)) return false;
        EdgeKey that = (EdgeKey) o;
        return Objects.equals(type, that.type)
                && Objects.equals(from, that.from)
                && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, from, to);
    }

    @Override
    public String toString() {
        return "(" + from + ")-[:" + type + "]->(" + to + ")";
    }
}
