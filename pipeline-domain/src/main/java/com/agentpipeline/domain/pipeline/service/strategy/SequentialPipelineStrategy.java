package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 顺序策略：按声明顺序依次调用，每个 Agent 只看到上一个的输出。
 * <p>
 * 任务本身不写入会话，会话长度等于已回复的 Agent 数。
 * </p>
 */
@Component
public class SequentialPipelineStrategy implements IPipelineStrategy {

    @Override
    public StrategyTypeEnum type() {
        return StrategyTypeEnum.SEQUENTIAL;
    }

    @Override
    public RunResult execute(String task, RunContext context) {
        ConversationView input = ConversationView.ofMessage(Constants.TASK_SPEAKER, task);
        Turn last = null;
        for (String agentName : context.getSpec().getAgents()) {
            StepOutcome outcome = context.invoke(agentName, input);
            if (!outcome.isReplied()) {
                return context.fromOutcome(outcome);
            }
            last = outcome.turn();
            input = ConversationView.of(List.of(last));
        }
        return context.completed(last);
    }
}
