package com.afsun.ogm.core;

import lombok.Data;

/**
 * 一次提交写入存储的操作统计
 */
@Data
public class CommitResult {

    /**
     * 追踪ID
     */
    private final String traceId;

    private int nodesCreated;
    private int nodesUpdated;
    private int nodesDeleted;
    private int relationshipsCreated;
    private int relationshipsDeleted;

    /**
     * 耗时（毫秒）
     */
    private long elapsedMillis;

    public int getOperationCount() {
        return nodesCreated + nodesUpdated + nodesDeleted + relationshipsCreated + relationshipsDeleted;
    }

    public boolean isEmpty() {
        return getOperationCount() == 0;
    }
}
