package com.agentpipeline.domain.agent.adapter.runtime;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;

/**
 * Agent 句柄：对某个已配置 Agent 的不透明调用能力。
 * <p>
 * 句柄可以把会话视图转换成其后端需要的任意结构，编排层不关心该结构。
 * 重试（如有）由后端自行负责。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
public interface IAgentHandle {

    /**
     * @return 句柄对应的 Agent 名称
     */
    String getName();

    /**
     * 基于会话视图生成回复。
     *
     * @param transcript 对该 Agent 可见的只读会话视图
     * @return 回复文本
     * @throws com.agentpipeline.types.exception.AgentInvocationException 后端调用失败或响应非法
     */
    String invoke(ConversationView transcript);
}
