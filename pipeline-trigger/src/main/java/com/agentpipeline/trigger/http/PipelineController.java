package com.agentpipeline.trigger.http;

import com.agentpipeline.api.dto.PipelineRunRequestDTO;
import com.agentpipeline.api.dto.PipelineRunResponseDTO;
import com.agentpipeline.api.dto.PipelineSummaryDTO;
import com.agentpipeline.api.response.Response;
import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.trigger.application.command.PipelineRunCommandService;
import com.agentpipeline.trigger.application.common.RunResultViewAssembler;
import com.agentpipeline.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
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
 * 流水线 API。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipelines")
public class PipelineController {

    private final IPipelineSpecRepository pipelineSpecRepository;
    private final PipelineRunCommandService pipelineRunCommandService;
    private final RunResultViewAssembler runResultViewAssembler;

    public PipelineController(IPipelineSpecRepository pipelineSpecRepository,
                              PipelineRunCommandService pipelineRunCommandService,
                              RunResultViewAssembler runResultViewAssembler) {
        this.pipelineSpecRepository = pipelineSpecRepository;
        this.pipelineRunCommandService = pipelineRunCommandService;
        this.runResultViewAssembler = runResultViewAssembler;
    }

    @GetMapping
    public Response<List<PipelineSummaryDTO>> listPipelines() {
        List<PipelineSummaryDTO> data = pipelineSpecRepository.findAll().stream()
                .map(runResultViewAssembler::toPipelineSummary)
                .collect(Collectors.toList());
        return success(data);
    }

    @PostMapping("/{name}/runs")
    public Response<PipelineRunResponseDTO> runPipeline(@PathVariable("name") String name,
                                                        @RequestBody PipelineRunRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getTask())) {
            return illegal("task 不能为空");
        }
        log.info("PIPELINE_RUN_ACCEPTED pipeline={}, historySize={}, timeoutSeconds={}",
                name, request.getHistory() == null ? 0 : request.getHistory().size(), request.getTimeoutSeconds());
        RunResult result = pipelineRunCommandService.runPipeline(name, request.getTask(),
                runResultViewAssembler.toExchanges(request.getHistory()), request.getTimeoutSeconds());
        return success(runResultViewAssembler.toRunResponse(result));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }
}
