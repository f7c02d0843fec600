package com.agentpipeline.trigger.http;

import com.agentpipeline.api.dto.HealthDTO;
import com.agentpipeline.api.response.Response;
import com.agentpipeline.domain.agent.adapter.repository.IAgentSpecRepository;
import com.agentpipeline.domain.agent.service.AgentHandleRegistry;
import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

/**
 * 健康检查。
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final IAgentSpecRepository agentSpecRepository;
    private final IPipelineSpecRepository pipelineSpecRepository;
    private final AgentHandleRegistry agentHandleRegistry;

    public HealthController(IAgentSpecRepository agentSpecRepository,
                            IPipelineSpecRepository pipelineSpecRepository,
                            AgentHandleRegistry agentHandleRegistry) {
        this.agentSpecRepository = agentSpecRepository;
        this.pipelineSpecRepository = pipelineSpecRepository;
        this.agentHandleRegistry = agentHandleRegistry;
    }

    @GetMapping
    public Response<HealthDTO> health() {
        HealthDTO dto = new HealthDTO();
        dto.setStatus("UP");
        dto.setAgents(agentSpecRepository.findAll().size());
        dto.setPipelines(pipelineSpecRepository.findAll().size());
        dto.setBackends(new ArrayList<>(agentHandleRegistry.registeredBackends()));
        return Response.<HealthDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(dto)
                .build();
    }
}
