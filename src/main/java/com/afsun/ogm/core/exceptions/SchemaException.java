package com.afsun.ogm.core.exceptions;

/**
 * 模式声明错误，在构建 Schema 时抛出，属于启动期致命错误
 */
public class SchemaException extends OgmException {

    public SchemaException(String message, Object... args) {
        super("SCHEMA_ERROR", format(message, args), "检查类型声明中的关系、逆关系名称与属性映射");
    }
}
