package com.agentpipeline.domain.pipeline.model.valobj;

import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 解析完成的流水线：配置 + 本次运行独占的 Agent 句柄。
 */
public final class ResolvedPipeline {

    private final PipelineSpec spec;
    private final Map<String, AgentSpec> agents;
    private final Map<String, IAgentHandle> handles;

    public ResolvedPipeline(PipelineSpec spec, Map<String, AgentSpec> agents, Map<String, IAgentHandle> handles) {
        this.spec = spec;
        this.agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        this.handles = Collections.unmodifiableMap(new LinkedHashMap<>(handles));
    }

    public PipelineSpec getSpec() {
        return spec;
    }

    public AgentSpec agent(String name) {
        return agents.get(name);
    }

    public IAgentHandle handle(String name) {
        return handles.get(name);
    }

    public Map<String, AgentSpec> getAgents() {
        return agents;
    }
}
