package com.newsroom.newsletter.model;

/** ワーカー 1 周分の結果。次の待機時間の判定に使う。 */
public enum ExecutionOutcome {
    TASK_COMPLETED,
    EMPTY_QUEUE,
    POSTPONED_TASKS
}
