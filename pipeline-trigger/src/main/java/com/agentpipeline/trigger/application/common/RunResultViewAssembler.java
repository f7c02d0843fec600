package com.agentpipeline.trigger.application.common;

import com.agentpipeline.api.dto.AgentSummaryDTO;
import com.agentpipeline.api.dto.ChatExchangeDTO;
import com.agentpipeline.api.dto.PipelineRunResponseDTO;
import com.agentpipeline.api.dto.PipelineSummaryDTO;
import com.agentpipeline.api.dto.TurnDTO;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.agent.model.valobj.ToolBinding;
import com.agentpipeline.domain.conversation.model.valobj.ChatExchange;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 运行结果与配置摘要的视图装配器。
 */
@Component
public class RunResultViewAssembler {

    public PipelineRunResponseDTO toRunResponse(RunResult result) {
        PipelineRunResponseDTO dto = new PipelineRunResponseDTO();
        dto.setPipeline(result.getPipelineName());
        dto.setStrategy(result.getStrategy() == null ? null : result.getStrategy().getCode());
        dto.setReason(result.getReason() == null ? null : result.getReason().name());
        dto.setSuccessful(result.isSuccessful());
        dto.setContent(result.getContent());
        dto.setAgentName(result.getAgentName());
        dto.setTurns(result.getTranscript().stream()
                .map(this::toTurn)
                .collect(Collectors.toList()));
        return dto;
    }

    public AgentSummaryDTO toAgentSummary(AgentSpec spec) {
        AgentSummaryDTO dto = new AgentSummaryDTO();
        dto.setName(spec.getName());
        dto.setBackend(spec.getBackend());
        dto.setProvider(spec.getLlm().getProvider());
        dto.setModel(spec.getLlm().getModel());
        dto.setMaxTurns(spec.getMaxTurns());
        dto.setHumanInput(spec.isHumanInput());
        dto.setTools(spec.getTools().stream().map(ToolBinding::getName).collect(Collectors.toList()));
        return dto;
    }

    public PipelineSummaryDTO toPipelineSummary(PipelineSpec spec) {
        PipelineSummaryDTO dto = new PipelineSummaryDTO();
        dto.setName(spec.getName());
        dto.setStrategy(spec.getStrategy().getCode());
        dto.setAgents(spec.getAgents());
        dto.setMaxRounds(spec.getMaxRounds());
        dto.setSupervisorAgent(spec.getSupervisorAgent());
        dto.setSupervisorMode(spec.getSupervisorMode() == null ? null : spec.getSupervisorMode().getCode());
        return dto;
    }

    public List<ChatExchange> toExchanges(List<ChatExchangeDTO> history) {
        if (history == null) {
            return Collections.emptyList();
        }
        return history.stream()
                .filter(Objects::nonNull)
                .map(item -> new ChatExchange(item.getUser(), item.getAssistant()))
                .collect(Collectors.toList());
    }

    private TurnDTO toTurn(Turn turn) {
        TurnDTO dto = new TurnDTO();
        dto.setIndex(turn.index());
        dto.setSpeaker(turn.speaker());
        dto.setContent(turn.content());
        dto.setCreatedAt(turn.createdAt());
        return dto;
    }
}
