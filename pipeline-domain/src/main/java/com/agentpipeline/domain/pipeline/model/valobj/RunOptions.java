package com.agentpipeline.domain.pipeline.model.valobj;

import com.agentpipeline.domain.conversation.model.entity.Conversation;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.function.Consumer;

/**
 * 单次运行的调用方选项。
 */
@Getter
@Builder
public class RunOptions {

    /** 调用方提供的终止条件，为空时按流水线配置决定 */
    private final TerminationCondition terminationCondition;

    @Builder.Default
    private final CancellationSignal cancellationSignal = new CancellationSignal();

    /** 运行开始时接收本次运行的会话，调用方可在其他线程读取快照 */
    private final Consumer<Conversation> conversationObserver;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }

    public TerminationCondition resolveTermination(PipelineSpec spec) {
        if (terminationCondition != null) {
            return terminationCondition;
        }
        if (StringUtils.isNotBlank(spec.getTerminationSentinel())) {
            return TerminationCondition.sentinel(spec.getTerminationSentinel());
        }
        return TerminationCondition.never();
    }
}
