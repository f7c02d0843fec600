package com.agentpipeline.domain.pipeline.service;

import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.ResolvedPipeline;
import com.agentpipeline.domain.pipeline.model.valobj.RunOptions;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.domain.pipeline.service.strategy.IPipelineStrategy;
import com.agentpipeline.domain.pipeline.service.strategy.RunContext;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.exception.AppException;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线引擎：解析配置、构造句柄、选择策略并把所有结束情形整理为 {@link RunResult}。
 * <p>
 * 引擎本身无状态，每次运行拥有独立的会话与句柄，可被多个线程并发调用。
 * 配置错误在任何 Agent 被调用前以 {@link PipelineConfigurationException} 抛出；
 * 运行期的失败、取消与轮数耗尽都体现在 RunResult.reason 上。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Service
public class PipelineEngine {

    private final PipelineResolutionDomainService resolutionService;
    private final Map<StrategyTypeEnum, IPipelineStrategy> strategies;

    public PipelineEngine(PipelineResolutionDomainService resolutionService,
                          List<IPipelineStrategy> strategies) {
        this.resolutionService = resolutionService;
        Map<StrategyTypeEnum, IPipelineStrategy> indexed = new EnumMap<>(StrategyTypeEnum.class);
        for (IPipelineStrategy strategy : strategies) {
            if (indexed.putIfAbsent(strategy.type(), strategy) != null) {
                throw new IllegalStateException("Duplicate pipeline strategy registration: " + strategy.type());
            }
        }
        this.strategies = Collections.unmodifiableMap(indexed);
    }

    public RunResult run(PipelineSpec spec, String task, AgentRoster roster) {
        return run(spec, task, roster, RunOptions.defaults());
    }

    public RunResult run(PipelineSpec spec, String task, AgentRoster roster, RunOptions options) {
        if (StringUtils.isBlank(task)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "task cannot be blank");
        }
        ResolvedPipeline resolved = resolutionService.resolve(spec, roster);
        IPipelineStrategy strategy = strategies.get(spec.getStrategy());
        if (strategy == null) {
            throw new PipelineConfigurationException("No strategy registered for " + spec.getStrategy().getCode());
        }
        RunContext context = new RunContext(resolved, options == null ? RunOptions.defaults() : options);

        long startedAt = System.currentTimeMillis();
        log.info("PIPELINE_RUN_START pipeline={}, strategy={}, agents={}, taskLength={}",
                spec.getName(), spec.getStrategy().getCode(), spec.getAgents(), task.length());
        RunResult result = strategy.execute(task, context);
        log.info("PIPELINE_RUN_FINISH pipeline={}, strategy={}, reason={}, agent={}, turns={}, costMs={}",
                spec.getName(), spec.getStrategy().getCode(), result.getReason(), result.getAgentName(),
                result.getTranscript().size(), System.currentTimeMillis() - startedAt);
        return result;
    }

    /**
     * 以单步顺序流水线运行一个 Agent。
     */
    public RunResult runAgent(String agentName, String message, AgentRoster roster, RunOptions options) {
        return run(PipelineSpec.singleAgent(agentName), message, roster, options);
    }
}
