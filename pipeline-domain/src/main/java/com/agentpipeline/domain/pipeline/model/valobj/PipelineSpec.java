package com.agentpipeline.domain.pipeline.model.valobj;

import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.SupervisorModeEnum;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 流水线配置值对象：参与的 Agent、编排策略与终止参数。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class PipelineSpec {

    public static final int DEFAULT_MAX_ROUNDS = 10;
    public static final String SINGLE_AGENT_PREFIX = "agent:";

    private final String name;

    /** 按声明顺序的 Agent 名称 */
    @Singular
    private final List<String> agents;

    @Builder.Default
    private final StrategyTypeEnum strategy = StrategyTypeEnum.SEQUENTIAL;

    /** group_chat 的回合上限 / supervisor 多轮模式的咨询上限 */
    @Builder.Default
    private final int maxRounds = DEFAULT_MAX_ROUNDS;

    /** supervisor 策略下负责路由的 Agent */
    private final String supervisorAgent;

    @Builder.Default
    private final SupervisorModeEnum supervisorMode = SupervisorModeEnum.SINGLE_SHOT;

    /** supervisor 多轮模式下表示完成的回复 */
    private final String doneSentinel;

    /** group_chat 下表示完成的回复 */
    private final String terminationSentinel;

    /**
     * 单 Agent 运行使用的隐式流水线。
     */
    public static PipelineSpec singleAgent(String agentName) {
        return PipelineSpec.builder()
                .name(SINGLE_AGENT_PREFIX + agentName)
                .agent(agentName)
                .strategy(StrategyTypeEnum.SEQUENTIAL)
                .build();
    }

    /**
     * 结构校验，不涉及名册。
     */
    public void validate() {
        if (StringUtils.isBlank(name)) {
            throw new PipelineConfigurationException("Pipeline name cannot be empty");
        }
        if (agents.isEmpty()) {
            throw new PipelineConfigurationException("Pipeline '" + name + "' must declare at least one agent");
        }
        for (String agent : agents) {
            if (StringUtils.isBlank(agent)) {
                throw new PipelineConfigurationException("Pipeline '" + name + "' contains a blank agent name");
            }
        }
        if (strategy == null) {
            throw new PipelineConfigurationException("Pipeline '" + name + "' strategy cannot be null");
        }
        if (maxRounds < 1) {
            throw new PipelineConfigurationException("Pipeline '" + name + "' max_rounds must be positive: " + maxRounds);
        }
        if (strategy != StrategyTypeEnum.SUPERVISOR) {
            return;
        }
        if (StringUtils.isBlank(supervisorAgent)) {
            throw new PipelineConfigurationException(
                    "Pipeline '" + name + "' requires supervisor_agent when strategy is 'supervisor'");
        }
        if (!agents.contains(supervisorAgent)) {
            throw new PipelineConfigurationException(
                    "Pipeline '" + name + "' supervisor_agent '" + supervisorAgent + "' is not one of its agents");
        }
        if (specialistNames().isEmpty()) {
            throw new PipelineConfigurationException(
                    "Pipeline '" + name + "' requires at least one specialist besides the supervisor");
        }
        if (supervisorMode == null) {
            throw new PipelineConfigurationException("Pipeline '" + name + "' supervisor_mode cannot be null");
        }
    }

    /**
     * 去重后的 Agent 名称，保持首次出现的顺序。
     */
    public List<String> distinctAgents() {
        return new ArrayList<>(new LinkedHashSet<>(agents));
    }

    /**
     * supervisor 之外的专家 Agent，按声明顺序去重。
     */
    public List<String> specialistNames() {
        Set<String> names = new LinkedHashSet<>(agents);
        if (supervisorAgent != null) {
            names.remove(supervisorAgent);
        }
        return new ArrayList<>(names);
    }
}
