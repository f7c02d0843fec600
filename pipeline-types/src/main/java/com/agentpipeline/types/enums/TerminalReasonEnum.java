package com.agentpipeline.types.enums;

/**
 * 流水线运行终止原因枚举。
 */
public enum TerminalReasonEnum {
    COMPLETED,
    MAX_ROUNDS_EXCEEDED,
    AGENT_FAILED,
    ROUTING_FAILED,
    CANCELED;

    /**
     * 是否为失败结局（不产出有效 Agent 内容）。
     */
    public boolean isFailure() {
        return this == AGENT_FAILED || this == ROUTING_FAILED || this == CANCELED;
    }
}
