package com.agentpipeline.domain.pipeline.service;

import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.agent.service.AgentHandleRegistry;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.ResolvedPipeline;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 流水线解析：在调用任何 Agent 之前完成全部配置校验并构造句柄。
 */
@Service
public class PipelineResolutionDomainService {

    private final AgentHandleRegistry agentHandleRegistry;

    public PipelineResolutionDomainService(AgentHandleRegistry agentHandleRegistry) {
        this.agentHandleRegistry = agentHandleRegistry;
    }

    public ResolvedPipeline resolve(PipelineSpec spec, AgentRoster roster) {
        if (spec == null) {
            throw new PipelineConfigurationException("Pipeline spec cannot be null");
        }
        spec.validate();
        if (roster == null) {
            throw new PipelineConfigurationException("Agent roster cannot be null");
        }
        List<String> names = spec.distinctAgents();
        List<String> missing = names.stream()
                .filter(name -> !roster.contains(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new PipelineConfigurationException(
                    "Pipeline '" + spec.getName() + "' references unknown agents: " + missing);
        }

        Map<String, AgentSpec> agents = new LinkedHashMap<>();
        for (String name : names) {
            AgentSpec agentSpec = roster.find(name);
            agentSpec.validate();
            agents.put(name, agentSpec);
        }
        // 所有句柄构造成功后才开始运行
        Map<String, IAgentHandle> handles = new LinkedHashMap<>();
        for (AgentSpec agentSpec : agents.values()) {
            handles.put(agentSpec.getName(), agentHandleRegistry.create(agentSpec));
        }
        return new ResolvedPipeline(spec, agents, handles);
    }
}
