package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.conversation.model.entity.Conversation;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.model.valobj.CancellationSignal;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.ResolvedPipeline;
import com.agentpipeline.domain.pipeline.model.valobj.RunOptions;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.domain.pipeline.model.valobj.TerminationCondition;
import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import com.agentpipeline.types.exception.AgentInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次运行的上下文：独占的会话、取消信号、终止条件与每个 Agent 的调用计数。
 * <p>
 * 所有 Agent 调用都经过 {@link #invoke(String, ConversationView)}，
 * 在回合边界统一处理取消、回合上限与调用失败。
 * </p>
 */
@Slf4j
public class RunContext {

    private final ResolvedPipeline pipeline;
    private final Conversation conversation = new Conversation();
    private final CancellationSignal cancellationSignal;
    private final TerminationCondition terminationCondition;
    private final Map<String, Integer> invocationCounts = new HashMap<>();

    public RunContext(ResolvedPipeline pipeline, RunOptions options) {
        this.pipeline = pipeline;
        this.cancellationSignal = options.getCancellationSignal() == null
                ? new CancellationSignal() : options.getCancellationSignal();
        this.terminationCondition = options.resolveTermination(pipeline.getSpec());
        if (options.getConversationObserver() != null) {
            options.getConversationObserver().accept(conversation);
        }
    }

    public PipelineSpec getSpec() {
        return pipeline.getSpec();
    }

    public ResolvedPipeline getPipeline() {
        return pipeline;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public boolean isCancelled() {
        return cancellationSignal.isCancelled() || Thread.currentThread().isInterrupted();
    }

    /**
     * 调用指定 Agent，成功时把回复追加到会话。
     */
    public StepOutcome invoke(String agentName, ConversationView view) {
        if (isCancelled()) {
            return StepOutcome.canceled(agentName, cancellationMessage());
        }
        AgentSpec agentSpec = pipeline.agent(agentName);
        int used = invocationCounts.getOrDefault(agentName, 0);
        if (agentSpec != null && used >= agentSpec.getMaxTurns()) {
            log.warn("PIPELINE_AGENT_TURNS_EXHAUSTED pipeline={}, agent={}, maxTurns={}",
                    getSpec().getName(), agentName, agentSpec.getMaxTurns());
            return StepOutcome.budgetExhausted(agentName,
                    "Agent '" + agentName + "' reached max_turns " + agentSpec.getMaxTurns());
        }
        invocationCounts.put(agentName, used + 1);

        IAgentHandle handle = pipeline.handle(agentName);
        String reply;
        try {
            reply = handle.invoke(view);
        } catch (AgentInvocationException e) {
            return failure(agentName, e.getMessage(), e);
        } catch (RuntimeException e) {
            return failure(agentName, "Agent '" + agentName + "' invocation failed: "
                    + StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName()), e);
        }
        if (reply == null) {
            return failure(agentName, "Agent '" + agentName + "' returned no reply", null);
        }
        Turn turn = conversation.append(agentName, reply);
        log.debug("PIPELINE_TURN pipeline={}, agent={}, index={}, length={}",
                getSpec().getName(), agentName, turn.index(), reply.length());
        return StepOutcome.replied(agentName, turn);
    }

    public boolean shouldTerminate(Turn latest) {
        return terminationCondition.isSatisfied(latest, conversation.fullView());
    }

    public RunResult finish(TerminalReasonEnum reason, String content, String agentName) {
        return RunResult.builder()
                .pipelineName(getSpec().getName())
                .strategy(getSpec().getStrategy())
                .reason(reason)
                .content(content)
                .agentName(reason.isFailure() ? null : agentName)
                .transcript(conversation.getTurns())
                .build();
    }

    public RunResult completed(Turn turn) {
        return finish(TerminalReasonEnum.COMPLETED, turn.content(), turn.speaker());
    }

    /**
     * 把非成功的调用结果转换为运行结果。
     */
    public RunResult fromOutcome(StepOutcome outcome) {
        switch (outcome.status()) {
            case CANCELED:
                return finish(TerminalReasonEnum.CANCELED, outcome.message(), null);
            case BUDGET_EXHAUSTED:
                Turn latest = latestAgentTurn();
                return latest == null
                        ? finish(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED, outcome.message(), null)
                        : finish(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED, latest.content(), latest.speaker());
            case FAILED:
                return finish(TerminalReasonEnum.AGENT_FAILED, outcome.message(), null);
            default:
                throw new IllegalArgumentException("outcome is not terminal: " + outcome.status());
        }
    }

    public Turn latestAgentTurn() {
        List<Turn> turns = conversation.getTurns();
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn turn = turns.get(i);
            if (!Constants.TASK_SPEAKER.equals(turn.speaker()) && !Constants.USER_SPEAKER.equals(turn.speaker())) {
                return turn;
            }
        }
        return null;
    }

    private StepOutcome failure(String agentName, String message, Exception cause) {
        if (isCancelled()) {
            return StepOutcome.canceled(agentName, cancellationMessage());
        }
        log.warn("PIPELINE_AGENT_FAILED pipeline={}, agent={}, error={}", getSpec().getName(), agentName, message, cause);
        return StepOutcome.failed(agentName, message);
    }

    private String cancellationMessage() {
        return StringUtils.defaultIfBlank(cancellationSignal.getReason(), "run canceled");
    }
}
