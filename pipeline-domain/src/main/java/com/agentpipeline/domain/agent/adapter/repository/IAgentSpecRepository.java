package com.agentpipeline.domain.agent.adapter.repository;

import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;

import java.util.List;

/**
 * Agent 配置仓储接口，返回已校验的只读配置。
 */
public interface IAgentSpecRepository {

    AgentSpec findByName(String name);

    List<AgentSpec> findAll();

    AgentRoster loadRoster();
}
