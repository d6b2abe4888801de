package com.afsun.ogm.core.exceptions;

/**
 * 修改时类型不匹配：属性值类型与声明不符，或关联目标类型与声明目标不兼容
 */
public class TypeMismatchException extends OgmException {

    public TypeMismatchException(String message, Object... args) {
        super("TYPE_MISMATCH", format(message, args), "使用与声明类型一致的值后重试");
    }
}
