package com.agentpipeline.domain.agent.model.valobj;

import com.agentpipeline.types.exception.PipelineConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 只读 Agent 名册，名称唯一，保持声明顺序。
 * <p>
 * 加载后不再修改，多个并发运行可以无锁共享。
 * </p>
 */
public final class AgentRoster {

    private static final AgentRoster EMPTY = new AgentRoster(Collections.emptyMap());

    private final Map<String, AgentSpec> agents;

    private AgentRoster(Map<String, AgentSpec> agents) {
        this.agents = agents;
    }

    public static AgentRoster empty() {
        return EMPTY;
    }

    /**
     * 由 Agent 配置集合构建名册。
     *
     * @throws PipelineConfigurationException 名称重复时
     */
    public static AgentRoster of(Collection<AgentSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return EMPTY;
        }
        Map<String, AgentSpec> indexed = new LinkedHashMap<>();
        for (AgentSpec spec : specs) {
            if (spec == null) {
                continue;
            }
            if (indexed.putIfAbsent(spec.getName(), spec) != null) {
                throw new PipelineConfigurationException("Duplicate agent name in roster: " + spec.getName());
            }
        }
        return new AgentRoster(Collections.unmodifiableMap(indexed));
    }

    public AgentSpec find(String name) {
        return name == null ? null : agents.get(name);
    }

    public boolean contains(String name) {
        return name != null && agents.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(agents.keySet());
    }

    public List<AgentSpec> all() {
        return new ArrayList<>(agents.values());
    }

    public int size() {
        return agents.size();
    }
}
