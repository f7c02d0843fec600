package com.agentpipeline.test;

import com.agentpipeline.domain.conversation.model.valobj.ChatExchange;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.trigger.application.command.PipelineRunCommandService;
import com.agentpipeline.trigger.application.common.RunResultViewAssembler;
import com.agentpipeline.trigger.http.GlobalApiExceptionHandler;
import com.agentpipeline.trigger.http.PipelineController;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import com.agentpipeline.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PipelineControllerTest {

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;
    private IPipelineSpecRepository pipelineSpecRepository;
    private PipelineRunCommandService pipelineRunCommandService;

    @BeforeEach
    public void setUp() {
        this.pipelineSpecRepository = mock(IPipelineSpecRepository.class);
        this.pipelineRunCommandService = mock(PipelineRunCommandService.class);
        PipelineController controller = new PipelineController(pipelineSpecRepository,
                pipelineRunCommandService, new RunResultViewAssembler());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Test
    public void shouldListConfiguredPipelines() throws Exception {
        when(pipelineSpecRepository.findAll()).thenReturn(List.of(PipelineSpec.builder()
                .name("review-loop")
                .agent("writer")
                .agent("critic")
                .strategy(StrategyTypeEnum.GROUP_CHAT)
                .maxRounds(3)
                .build()));

        mockMvc.perform(get("/api/v1/pipelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data[0].name").value("review-loop"))
                .andExpect(jsonPath("$.data[0].strategy").value("group_chat"))
                .andExpect(jsonPath("$.data[0].agents[1]").value("critic"))
                .andExpect(jsonPath("$.data[0].maxRounds").value(3));
    }

    @Test
    public void shouldRunPipelineAndReturnTranscript() throws Exception {
        RunResult result = RunResult.builder()
                .pipelineName("research-and-write")
                .strategy(StrategyTypeEnum.SEQUENTIAL)
                .reason(TerminalReasonEnum.COMPLETED)
                .content("final article")
                .agentName("writer")
                .turn(new Turn(0, "researcher", "notes", LocalDateTime.now()))
                .turn(new Turn(1, "writer", "final article", LocalDateTime.now()))
                .build();
        when(pipelineRunCommandService.runPipeline(eq("research-and-write"), eq("write about tea"), anyList(), eq(60L)))
                .thenReturn(result);
        String payload = objectMapper.writeValueAsString(Map.of(
                "task", "write about tea",
                "timeoutSeconds", 60,
                "history", List.of(Map.of("user", "hi", "assistant", "hello"))));

        mockMvc.perform(post("/api/v1/pipelines/{name}/runs", "research-and-write")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.reason").value("COMPLETED"))
                .andExpect(jsonPath("$.data.successful").value(true))
                .andExpect(jsonPath("$.data.content").value("final article"))
                .andExpect(jsonPath("$.data.agentName").value("writer"))
                .andExpect(jsonPath("$.data.turns.length()").value(2))
                .andExpect(jsonPath("$.data.turns[0].speaker").value("researcher"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatExchange>> history = ArgumentCaptor.forClass(List.class);
        verify(pipelineRunCommandService).runPipeline(eq("research-and-write"), eq("write about tea"),
                history.capture(), eq(60L));
        assertEquals(List.of(new ChatExchange("hi", "hello")), history.getValue());
    }

    @Test
    public void shouldReturnFailedRunWithinSuccessEnvelope() throws Exception {
        RunResult result = RunResult.builder()
                .pipelineName("help-desk")
                .strategy(StrategyTypeEnum.SUPERVISOR)
                .reason(TerminalReasonEnum.ROUTING_FAILED)
                .content("Supervisor 'router' chose unknown specialist 'nobody'")
                .build();
        when(pipelineRunCommandService.runPipeline(eq("help-desk"), eq("reset my password"), anyList(), isNull()))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/pipelines/{name}/runs", "help-desk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\":\"reset my password\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.reason").value("ROUTING_FAILED"))
                .andExpect(jsonPath("$.data.successful").value(false))
                .andExpect(jsonPath("$.data.turns.length()").value(0));
    }

    @Test
    public void shouldRejectBlankTask() throws Exception {
        mockMvc.perform(post("/api/v1/pipelines/{name}/runs", "help-desk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\":\"  \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()))
                .andExpect(jsonPath("$.info").value("task 不能为空"));

        verify(pipelineRunCommandService, never()).runPipeline(any(), any(), any(), any());
    }

    @Test
    public void shouldMapUnknownPipelineToNotFound() throws Exception {
        when(pipelineRunCommandService.runPipeline(eq("ghost"), eq("hi"), anyList(), isNull()))
                .thenThrow(new AppException(ResponseCode.NOT_FOUND.getCode(), "流水线不存在: ghost"));

        mockMvc.perform(post("/api/v1/pipelines/{name}/runs", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"task\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("流水线不存在: ghost"));
    }
}
