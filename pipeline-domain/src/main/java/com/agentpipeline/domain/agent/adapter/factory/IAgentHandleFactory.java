package com.agentpipeline.domain.agent.adapter.factory;

import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;

/**
 * Agent 句柄工厂接口，每种后端一个实现。
 * <p>
 * 由 {@link com.agentpipeline.domain.agent.service.AgentHandleRegistry} 按 {@link #backend()} 收集。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
public interface IAgentHandleFactory {

    /**
     * @return 后端标识，与 AgentSpec.backend 对应
     */
    String backend();

    /**
     * 根据 Agent 配置创建句柄。
     *
     * @param spec 已校验的 Agent 配置
     * @return 新的句柄实例，每次运行独立
     * @throws com.agentpipeline.types.exception.PipelineConfigurationException 配置无法落到该后端时
     */
    IAgentHandle create(AgentSpec spec);
}
