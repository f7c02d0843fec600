package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.types.enums.StrategyTypeEnum;

/**
 * 编排策略：决定下一个发言的 Agent、它看到的输入以及何时终止。
 * <p>
 * 实现必须把所有结束情形表达为 {@link RunResult} 的终止原因，不向外抛出 Agent 调用异常。
 * </p>
 */
public interface IPipelineStrategy {

    StrategyTypeEnum type();

    RunResult execute(String task, RunContext context);
}
