package com.agentpipeline.domain.agent.service;

import com.agentpipeline.domain.agent.adapter.factory.IAgentHandleFactory;
import com.agentpipeline.domain.agent.adapter.gateway.IHumanInputGateway;
import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Agent 后端注册表：按 AgentSpec.backend 选择句柄工厂。
 * <p>
 * 新增后端只需注册一个 {@link IAgentHandleFactory} Bean，编排层无需改动。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Service
public class AgentHandleRegistry {

    private final Map<String, IAgentHandleFactory> factories;
    private final IHumanInputGateway humanInputGateway;

    public AgentHandleRegistry(List<IAgentHandleFactory> factories,
                               @Nullable IHumanInputGateway humanInputGateway) {
        Map<String, IAgentHandleFactory> indexed = new LinkedHashMap<>();
        if (factories != null) {
            for (IAgentHandleFactory factory : factories) {
                IAgentHandleFactory previous = indexed.putIfAbsent(factory.backend(), factory);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate agent backend registration: " + factory.backend());
                }
            }
        }
        this.factories = Collections.unmodifiableMap(indexed);
        this.humanInputGateway = humanInputGateway;
        log.info("AGENT_BACKENDS_REGISTERED backends={}, humanInputGateway={}",
                this.factories.keySet(), humanInputGateway == null ? "none" : humanInputGateway.getClass().getSimpleName());
    }

    /**
     * 为 Agent 配置创建句柄。
     *
     * @throws PipelineConfigurationException 后端未注册或 human_input 无可用网关
     */
    public IAgentHandle create(AgentSpec spec) {
        IAgentHandleFactory factory = factories.get(spec.getBackend());
        if (factory == null) {
            throw new PipelineConfigurationException(
                    "Unknown backend '" + spec.getBackend() + "' for agent '" + spec.getName()
                            + "', registered backends: " + factories.keySet());
        }
        IAgentHandle handle = factory.create(spec);
        if (!spec.isHumanInput()) {
            return handle;
        }
        if (humanInputGateway == null) {
            throw new PipelineConfigurationException(
                    "Agent '" + spec.getName() + "' requires human input but no human input gateway is available");
        }
        return new HumanReviewAgentHandle(handle, humanInputGateway);
    }

    public boolean supports(String backend) {
        return backend != null && factories.containsKey(backend);
    }

    public Set<String> registeredBackends() {
        return factories.keySet();
    }
}
