package com.agentpipeline.trigger.http;

import com.agentpipeline.api.dto.AgentRunRequestDTO;
import com.agentpipeline.api.dto.AgentSummaryDTO;
import com.agentpipeline.api.dto.PipelineRunResponseDTO;
import com.agentpipeline.api.response.Response;
import com.agentpipeline.domain.agent.adapter.repository.IAgentSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.trigger.application.command.PipelineRunCommandService;
import com.agentpipeline.trigger.application.common.RunResultViewAssembler;
import com.agentpipeline.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent API：名册查询与单 Agent 运行。
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final IAgentSpecRepository agentSpecRepository;
    private final PipelineRunCommandService pipelineRunCommandService;
    private final RunResultViewAssembler runResultViewAssembler;

    public AgentController(IAgentSpecRepository agentSpecRepository,
                           PipelineRunCommandService pipelineRunCommandService,
                           RunResultViewAssembler runResultViewAssembler) {
        this.agentSpecRepository = agentSpecRepository;
        this.pipelineRunCommandService = pipelineRunCommandService;
        this.runResultViewAssembler = runResultViewAssembler;
    }

    @GetMapping
    public Response<List<AgentSummaryDTO>> listAgents() {
        List<AgentSummaryDTO> data = agentSpecRepository.findAll().stream()
                .map(runResultViewAssembler::toAgentSummary)
                .collect(Collectors.toList());
        return Response.<List<AgentSummaryDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    @PostMapping("/{name}/runs")
    public Response<PipelineRunResponseDTO> runAgent(@PathVariable("name") String name,
                                                     @RequestBody AgentRunRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getMessage())) {
            return Response.<PipelineRunResponseDTO>builder()
                    .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                    .info("message 不能为空")
                    .build();
        }
        RunResult result = pipelineRunCommandService.runAgent(name, request.getMessage(), request.getTimeoutSeconds());
        return Response.<PipelineRunResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(runResultViewAssembler.toRunResponse(result))
                .build();
    }
}
