package com.agentpipeline.infrastructure.repository.agent;

import com.agentpipeline.domain.agent.adapter.repository.IAgentSpecRepository;
import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.infrastructure.config.SpecFileReader;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于配置目录的 Agent 仓储，启动时一次性加载为只读名册。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class AgentSpecRepositoryImpl implements IAgentSpecRepository {

    private final SpecFileReader specFileReader;
    private final Path agentsDir;
    private volatile AgentRoster roster = AgentRoster.empty();

    public AgentSpecRepositoryImpl(SpecFileReader specFileReader,
                                   @Value("${agent-pipeline.config.agents-dir:config/agents}") String agentsDir) {
        this.specFileReader = specFileReader;
        this.agentsDir = Paths.get(agentsDir);
    }

    @PostConstruct
    public void load() {
        List<AgentSpec> specs = new ArrayList<>();
        for (Path file : specFileReader.listSpecFiles(agentsDir)) {
            specs.add(specFileReader.readAgent(file));
        }
        this.roster = AgentRoster.of(specs);
        log.info("AGENT_SPECS_LOADED dir={}, count={}, agents={}",
                agentsDir.toAbsolutePath(), roster.size(), roster.names());
    }

    @Override
    public AgentSpec findByName(String name) {
        return roster.find(name);
    }

    @Override
    public List<AgentSpec> findAll() {
        return roster.all();
    }

    @Override
    public AgentRoster loadRoster() {
        return roster;
    }
}
