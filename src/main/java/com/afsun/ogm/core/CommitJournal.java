package com.afsun.ogm.core;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 一次提交中对会话内部状态所做修改的撤销记录。
 * 事务型存储回滚后按相反顺序执行，使会话状态与存储重新一致。
 */
class CommitJournal {

    private final Deque<Runnable> undo = new ArrayDeque<>();

    void record(Runnable action) {
        undo.push(action);
    }

    void rollback() {
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
    }

    int size() {
        return undo.size();
    }
}
