package com.agentpipeline.types.exception;

import com.agentpipeline.types.enums.ResponseCode;

/**
 * Agent 后端调用失败（网络错误、响应格式错误、后端上报的工具执行错误）。
 * <p>
 * 编排层不做重试，统一转换为 AGENT_FAILED 终止原因。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
public class AgentInvocationException extends AppException {

    private static final long serialVersionUID = 8120933416205571034L;

    /** 调用失败的 Agent 名称 */
    private final String agentName;

    public AgentInvocationException(String agentName, String message) {
        super(ResponseCode.AGENT_INVOCATION_ERROR.getCode(), message);
        this.agentName = agentName;
    }

    public AgentInvocationException(String agentName, String message, Throwable cause) {
        super(ResponseCode.AGENT_INVOCATION_ERROR.getCode(), message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
