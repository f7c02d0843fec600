package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.conversation.model.valobj.Turn;

/**
 * 一次 Agent 调用的结果。
 *
 * @param status 调用状态
 * @param agentName 被调用的 Agent
 * @param turn 成功时追加的发言
 * @param message 非成功时的说明
 */
public record StepOutcome(Status status, String agentName, Turn turn, String message) {

    public enum Status {
        REPLIED,
        FAILED,
        CANCELED,
        BUDGET_EXHAUSTED
    }

    public static StepOutcome replied(String agentName, Turn turn) {
        return new StepOutcome(Status.REPLIED, agentName, turn, null);
    }

    public static StepOutcome failed(String agentName, String message) {
        return new StepOutcome(Status.FAILED, agentName, null, message);
    }

    public static StepOutcome canceled(String agentName, String message) {
        return new StepOutcome(Status.CANCELED, agentName, null, message);
    }

    public static StepOutcome budgetExhausted(String agentName, String message) {
        return new StepOutcome(Status.BUDGET_EXHAUSTED, agentName, null, message);
    }

    public boolean isReplied() {
        return status == Status.REPLIED;
    }

    public String reply() {
        return turn == null ? null : turn.content();
    }
}
