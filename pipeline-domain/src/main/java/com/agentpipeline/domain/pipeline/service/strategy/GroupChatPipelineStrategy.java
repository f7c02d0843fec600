package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 群聊策略：共享会话上按声明顺序轮流发言。
 * <p>
 * 每条发言后求值终止条件；未命中则在 max_rounds 个完整回合后结束。
 * </p>
 */
@Slf4j
@Component
public class GroupChatPipelineStrategy implements IPipelineStrategy {

    @Override
    public StrategyTypeEnum type() {
        return StrategyTypeEnum.GROUP_CHAT;
    }

    @Override
    public RunResult execute(String task, RunContext context) {
        context.getConversation().append(Constants.TASK_SPEAKER, task);
        List<String> agents = context.getSpec().getAgents();
        int maxRounds = context.getSpec().getMaxRounds();
        for (int round = 1; round <= maxRounds; round++) {
            for (String agentName : agents) {
                StepOutcome outcome = context.invoke(agentName, context.getConversation().fullView());
                if (!outcome.isReplied()) {
                    return context.fromOutcome(outcome);
                }
                if (context.shouldTerminate(outcome.turn())) {
                    log.debug("GROUP_CHAT_TERMINATED pipeline={}, round={}, agent={}",
                            context.getSpec().getName(), round, agentName);
                    return context.completed(outcome.turn());
                }
            }
        }
        Turn latest = context.getConversation().latest();
        return context.finish(TerminalReasonEnum.MAX_ROUNDS_EXCEEDED, latest.content(), latest.speaker());
    }
}
