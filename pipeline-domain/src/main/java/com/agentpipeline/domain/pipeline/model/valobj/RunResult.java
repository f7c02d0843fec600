package com.agentpipeline.domain.pipeline.model.valobj;

import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 流水线运行结果：最终内容、终止原因与完整会话快照。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Getter
@Builder
@ToString(exclude = "transcript")
public class RunResult {

    private final String pipelineName;

    private final StrategyTypeEnum strategy;

    private final TerminalReasonEnum reason;

    /** 最终内容；失败时为错误信息 */
    private final String content;

    /** 产出最终内容的 Agent，失败结果为空 */
    private final String agentName;

    @Singular("turn")
    private final List<Turn> transcript;

    public boolean isSuccessful() {
        return reason != null && !reason.isFailure();
    }
}
