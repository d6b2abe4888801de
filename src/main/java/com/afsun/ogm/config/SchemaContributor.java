package com.afsun.ogm.config;

import com.afsun.ogm.core.schema.SchemaBuilder;

/**
 * 向应用的 Schema 中声明类型。容器中的所有实现按顺序合并到同一个 {@link SchemaBuilder}
 */
@FunctionalInterface
public interface SchemaContributor {

    void contribute(SchemaBuilder builder);
}
