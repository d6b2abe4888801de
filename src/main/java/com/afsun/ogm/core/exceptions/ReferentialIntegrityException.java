package com.afsun.ogm.core.exceptions;

import lombok.Getter;

/**
 * 删除节点时仍有关系引用该节点
 */
@Getter
public class ReferentialIntegrityException extends OgmException {

    private final Long handle;

    private final int remainingRelationships;

    public ReferentialIntegrityException(Long handle, int remainingRelationships) {
        super("REFERENTIAL_ERROR",
                format("节点 {} 仍被 {} 条关系引用，无法删除", handle, remainingRelationships),
                "先解除关联，或为关系配置级联策略");
        this.handle = handle;
        this.remainingRelationships = remainingRelationships;
    }
}
