package com.agentpipeline.test.domain;

import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.model.valobj.CancellationSignal;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunOptions;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.domain.pipeline.service.PipelineEngine;
import com.agentpipeline.test.support.PipelineFixtures;
import com.agentpipeline.test.support.ScriptedAgentHandleFactory;
import com.agentpipeline.test.support.Scripts;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import com.agentpipeline.types.exception.AppException;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public class PipelineEngineTest {

    private ScriptedAgentHandleFactory factory;
    private PipelineEngine engine;

    @BeforeEach
    public void setUp() {
        factory = new ScriptedAgentHandleFactory()
                .script("a", () -> Scripts.wrapLatest("A"))
                .script("b", () -> Scripts.wrapLatest("B"))
                .reply("supervisor", "b");
        engine = PipelineFixtures.engine(factory);
    }

    @Test
    public void shouldRejectUnknownAgentBeforeAnyInvocation() {
        PipelineSpec spec = sequential("a", "ghost");

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(spec, "task", PipelineFixtures.roster("a", "b")));

        Assertions.assertTrue(ex.getMessage().contains("ghost"));
        Assertions.assertEquals(ResponseCode.CONFIGURATION_ERROR.getCode(), ex.getCode());
        Assertions.assertEquals(0, factory.totalInvocations());
    }

    @Test
    public void shouldRejectEmptyAgentList() {
        PipelineSpec spec = PipelineSpec.builder().name("empty").build();

        Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(spec, "task", PipelineFixtures.roster("a")));
    }

    @Test
    public void shouldRejectSupervisorPipelineWithoutSupervisorAgent() {
        PipelineSpec spec = supervisor(null, "a", "b");

        Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(spec, "task", PipelineFixtures.roster("a", "b")));
        Assertions.assertEquals(0, factory.totalInvocations());
    }

    @Test
    public void shouldRejectSupervisorOutsideAgentList() {
        PipelineSpec spec = supervisor("supervisor", "a", "b");

        Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(spec, "task", PipelineFixtures.roster("supervisor", "a", "b")));
        Assertions.assertEquals(0, factory.totalInvocations());
    }

    @Test
    public void shouldRejectSupervisorPipelineWithoutSpecialists() {
        PipelineSpec spec = supervisor("supervisor", "supervisor");

        Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(spec, "task", PipelineFixtures.roster("supervisor")));
    }

    @Test
    public void shouldRejectUnknownBackend() {
        AgentRoster roster = AgentRoster.of(List.of(
                PipelineFixtures.agent("a"),
                PipelineFixtures.agent("b").toBuilder().backend("autogen").build()));

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> engine.run(sequential("a", "b"), "task", roster));

        Assertions.assertTrue(ex.getMessage().contains("autogen"));
        Assertions.assertEquals(0, factory.totalInvocations());
    }

    @Test
    public void shouldRejectBlankTask() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> engine.run(sequential("a"), "  ", PipelineFixtures.roster("a")));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldProduceSameResultForSameScripts() {
        RunResult first = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"));
        RunResult second = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"));

        Assertions.assertEquals(first.getReason(), second.getReason());
        Assertions.assertEquals(first.getContent(), second.getContent());
        Assertions.assertEquals(render(first.getTranscript()), render(second.getTranscript()));
    }

    @Test
    public void shouldIsolateConcurrentRuns() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<RunResult>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String task = "task-" + i;
                futures.add(executor.submit(() ->
                        engine.run(sequential("a", "b"), task, PipelineFixtures.roster("a", "b"))));
            }
            for (int i = 0; i < futures.size(); i++) {
                RunResult result = futures.get(i).get(10, TimeUnit.SECONDS);
                Assertions.assertEquals(TerminalReasonEnum.COMPLETED, result.getReason());
                Assertions.assertEquals("B(A(task-" + i + "))", result.getContent());
                Assertions.assertEquals(2, result.getTranscript().size());
            }
        } finally {
            executor.shutdownNow();
        }
        Assertions.assertEquals(16, factory.totalInvocations());
    }

    @Test
    public void shouldReturnCanceledWhenSignalAlreadySet() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("operator abort");

        RunResult result = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"),
                RunOptions.builder().cancellationSignal(signal).build());

        Assertions.assertEquals(TerminalReasonEnum.CANCELED, result.getReason());
        Assertions.assertEquals("operator abort", result.getContent());
        Assertions.assertTrue(result.getTranscript().isEmpty());
        Assertions.assertEquals(0, factory.totalInvocations());
    }

    @Test
    public void shouldStopAtNextTurnBoundaryWhenCanceledMidRun() {
        CancellationSignal signal = new CancellationSignal();
        factory.script("a", () -> view -> {
            signal.cancel("stop requested");
            return "draft";
        });

        RunResult result = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"),
                RunOptions.builder().cancellationSignal(signal).build());

        Assertions.assertEquals(TerminalReasonEnum.CANCELED, result.getReason());
        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(1, result.getTranscript().size());
        Assertions.assertEquals("draft", result.getTranscript().get(0).content());
        Assertions.assertEquals(0, factory.invocations("b"));
    }

    @Test
    public void shouldEndWithMaxRoundsWhenAgentTurnBudgetIsExhausted() {
        factory.reply("writer", "draft").reply("critic", "revise");
        AgentRoster roster = AgentRoster.of(List.of(
                PipelineFixtures.agent("writer").toBuilder().maxTurns(2).build(),
                PipelineFixtures.agent("critic")));
        PipelineSpec spec = PipelineSpec.builder()
                .name("loop")
                .agent("writer")
                .agent("critic")
                .strategy(StrategyTypeEnum.GROUP_CHAT)
                .maxRounds(5)
                .build();

        RunResult result = engine.run(spec, "write it", roster);

        Assertions.assertEquals(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED, result.getReason());
        Assertions.assertEquals(2, factory.invocations("writer"));
        Assertions.assertEquals(5, result.getTranscript().size());
        Assertions.assertEquals("revise", result.getContent());
        Assertions.assertEquals("critic", result.getAgentName());
    }

    @Test
    public void shouldConvertUnexpectedExceptionToAgentFailed() {
        factory.script("a", () -> view -> {
            throw new IllegalStateException("connection reset");
        });

        RunResult result = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"));

        Assertions.assertEquals(TerminalReasonEnum.AGENT_FAILED, result.getReason());
        Assertions.assertEquals("Agent 'a' invocation failed: connection reset", result.getContent());
        Assertions.assertNull(result.getAgentName());
        Assertions.assertTrue(result.getTranscript().isEmpty());
    }

    @Test
    public void shouldTreatNullReplyAsFailure() {
        factory.script("b", () -> view -> null);

        RunResult result = engine.run(sequential("a", "b"), "task", PipelineFixtures.roster("a", "b"));

        Assertions.assertEquals(TerminalReasonEnum.AGENT_FAILED, result.getReason());
        Assertions.assertEquals(1, result.getTranscript().size());
    }

    @Test
    public void shouldRunSingleAgentAsImplicitPipeline() {
        RunResult result = engine.runAgent("b", "hello", PipelineFixtures.roster("a", "b"), RunOptions.defaults());

        Assertions.assertEquals(TerminalReasonEnum.COMPLETED, result.getReason());
        Assertions.assertEquals("agent:b", result.getPipelineName());
        Assertions.assertEquals("B(hello)", result.getContent());
        Assertions.assertEquals(0, factory.invocations("a"));
    }

    private static PipelineSpec sequential(String... agents) {
        return PipelineSpec.builder().name("chain").agents(List.of(agents)).build();
    }

    private static PipelineSpec supervisor(String supervisorAgent, String... agents) {
        return PipelineSpec.builder()
                .name("desk")
                .agents(List.of(agents))
                .strategy(StrategyTypeEnum.SUPERVISOR)
                .supervisorAgent(supervisorAgent)
                .build();
    }

    private static List<String> render(List<Turn> transcript) {
        return transcript.stream().map(turn -> turn.speaker() + ":" + turn.content()).collect(Collectors.toList());
    }
}
