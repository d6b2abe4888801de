package com.afsun.ogm.core.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * 提交时实体缺少类型声明的必填属性
 */
@Getter
public class RequiredPropertyException extends OgmException {

    private final String typeName;

    private final List<String> missingProperties;

    public RequiredPropertyException(Object entity, String typeName, List<String> missingProperties) {
        super("REQUIRED_PROPERTY",
                format("{} 缺少 {} 的必填属性 {}", entity, typeName, missingProperties),
                "为必填属性赋值后重新调用 commit()");
        this.typeName = typeName;
        this.missingProperties = missingProperties;
    }
}
