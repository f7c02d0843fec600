package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Supervisor 策略：由 supervisor 选择一个专家处理任务。
 * <p>
 * 单次模式：supervisor 路由一次，专家只看到任务并回复一次。
 * 多轮模式：每轮专家回复后重新咨询 supervisor，直到 done 标记或咨询次数达到 max_rounds。
 * 路由名称不合法时直接以 ROUTING_FAILED 结束，不做兜底选择。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Component
public class SupervisorPipelineStrategy implements IPipelineStrategy {

    @Override
    public StrategyTypeEnum type() {
        return StrategyTypeEnum.SUPERVISOR;
    }

    @Override
    public RunResult execute(String task, RunContext context) {
        PipelineSpec spec = context.getSpec();
        List<String> specialists = spec.specialistNames();
        List<AgentSpec> specialistSpecs = specialists.stream()
                .map(name -> context.getPipeline().agent(name))
                .collect(Collectors.toList());
        boolean multiRound = spec.getSupervisorMode().isMultiRound();
        String doneSentinel = multiRound ? StringUtils.trimToNull(spec.getDoneSentinel()) : null;
        String routingPrompt = SupervisorRoutingPromptBuilder.build(task, specialistSpecs, doneSentinel);

        context.getConversation().append(Constants.TASK_SPEAKER, task);
        int consultations = multiRound ? spec.getMaxRounds() : 1;
        Turn lastSpecialistTurn = null;
        for (int round = 1; round <= consultations; round++) {
            ConversationView routingView = context.getConversation().fullView()
                    .withAppended(Constants.USER_SPEAKER, routingPrompt);
            StepOutcome decision = context.invoke(spec.getSupervisorAgent(), routingView);
            if (!decision.isReplied()) {
                return stop(context, decision, lastSpecialistTurn);
            }
            String chosen = decision.reply().trim();
            if (doneSentinel != null && doneSentinel.equals(chosen)) {
                log.info("SUPERVISOR_DONE pipeline={}, round={}", spec.getName(), round);
                return context.completed(lastSpecialistTurn == null ? decision.turn() : lastSpecialistTurn);
            }
            if (!specialists.contains(chosen)) {
                log.warn("SUPERVISOR_ROUTING_FAILED pipeline={}, chosen={}, specialists={}",
                        spec.getName(), StringUtils.abbreviate(chosen, 80), specialists);
                return context.finish(TerminalReasonEnum.ROUTING_FAILED,
                        "Supervisor '" + spec.getSupervisorAgent() + "' chose unknown specialist '" + chosen
                                + "', expected one of " + specialists,
                        null);
            }
            log.info("SUPERVISOR_ROUTED pipeline={}, round={}, chosen={}", spec.getName(), round, chosen);

            ConversationView specialistView = multiRound
                    ? context.getConversation().fullView()
                    : context.getConversation().firstView();
            StepOutcome answer = context.invoke(chosen, specialistView);
            if (!answer.isReplied()) {
                return stop(context, answer, lastSpecialistTurn);
            }
            lastSpecialistTurn = answer.turn();
        }
        if (!multiRound) {
            return context.completed(lastSpecialistTurn);
        }
        return context.finish(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED,
                lastSpecialistTurn.content(), lastSpecialistTurn.speaker());
    }

    /**
     * 回合上限耗尽时以最近一次专家回复作为结果，supervisor 的路由回复不作为结果内容。
     */
    private RunResult stop(RunContext context, StepOutcome outcome, Turn lastSpecialistTurn) {
        if (outcome.status() == StepOutcome.Status.BUDGET_EXHAUSTED && lastSpecialistTurn != null) {
            return context.finish(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED,
                    lastSpecialistTurn.content(), lastSpecialistTurn.speaker());
        }
        return context.fromOutcome(outcome);
    }
}
