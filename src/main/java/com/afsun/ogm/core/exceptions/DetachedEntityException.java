package com.afsun.ogm.core.exceptions;

/**
 * 对已删除、已驱逐或所属会话已关闭的实体进行修改
 */
public class DetachedEntityException extends OgmException {

    public DetachedEntityException(String message, Object... args) {
        super("DETACHED_ENTITY", format(message, args), "在打开的会话中重新 resolve 该实体");
    }
}
