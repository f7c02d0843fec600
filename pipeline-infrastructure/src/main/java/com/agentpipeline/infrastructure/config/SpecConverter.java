package com.agentpipeline.infrastructure.config;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.agent.model.valobj.LlmSpec;
import com.agentpipeline.domain.agent.model.valobj.ToolBinding;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.infrastructure.config.po.AgentConfigPO;
import com.agentpipeline.infrastructure.config.po.LlmConfigPO;
import com.agentpipeline.infrastructure.config.po.PipelineConfigPO;
import com.agentpipeline.infrastructure.config.po.ToolConfigPO;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.SupervisorModeEnum;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 配置文件结构到领域值对象的转换，缺省值在此补齐。
 */
@Component
public class SpecConverter {

    public AgentSpec toAgentSpec(AgentConfigPO po, String source) {
        AgentSpec.AgentSpecBuilder builder = AgentSpec.builder()
                .name(StringUtils.trimToNull(po.getName()))
                .instructions(po.getInstructions())
                .llm(toLlmSpec(po.getLlm()))
                .humanInput(Boolean.TRUE.equals(po.getHumanInput()));
        if (StringUtils.isNotBlank(po.getBackend())) {
            builder.backend(po.getBackend().trim());
        }
        if (po.getMaxTurns() != null) {
            builder.maxTurns(po.getMaxTurns());
        }
        if (po.getTools() != null) {
            for (ToolConfigPO tool : po.getTools()) {
                if (tool == null) {
                    throw new PipelineConfigurationException("Empty tool entry in " + source);
                }
                builder.tool(ToolBinding.builder()
                        .name(tool.getName())
                        .bean(tool.getBean())
                        .description(tool.getDescription())
                        .build());
            }
        }
        if (po.getExtra() != null) {
            builder.extra(po.getExtra());
        }
        return builder.build();
    }

    public PipelineSpec toPipelineSpec(PipelineConfigPO po, String source) {
        PipelineSpec.PipelineSpecBuilder builder = PipelineSpec.builder()
                .name(StringUtils.trimToNull(po.getName()))
                .supervisorAgent(StringUtils.trimToNull(po.getSupervisorAgent()))
                .doneSentinel(po.getDoneSentinel())
                .terminationSentinel(po.getTerminationSentinel());
        if (po.getAgents() != null) {
            builder.agents(po.getAgents());
        }
        if (StringUtils.isNotBlank(po.getStrategy())) {
            StrategyTypeEnum strategy = StrategyTypeEnum.fromCode(po.getStrategy());
            if (strategy == null) {
                throw new PipelineConfigurationException(
                        "Unsupported strategy '" + po.getStrategy() + "' in " + source
                                + ", expected sequential, group_chat or supervisor");
            }
            builder.strategy(strategy);
        }
        if (StringUtils.isNotBlank(po.getSupervisorMode())) {
            SupervisorModeEnum mode = SupervisorModeEnum.fromCode(po.getSupervisorMode());
            if (mode == null) {
                throw new PipelineConfigurationException(
                        "Unsupported supervisor_mode '" + po.getSupervisorMode() + "' in " + source
                                + ", expected single_shot or multi_round");
            }
            builder.supervisorMode(mode);
        }
        if (po.getMaxRounds() != null) {
            builder.maxRounds(po.getMaxRounds());
        }
        return builder.build();
    }

    private LlmSpec toLlmSpec(LlmConfigPO po) {
        LlmSpec.LlmSpecBuilder builder = LlmSpec.builder();
        if (po == null) {
            return builder.build();
        }
        builder.provider(StringUtils.trimToNull(po.getProvider()));
        if (StringUtils.isNotBlank(po.getModel())) {
            builder.model(po.getModel().trim());
        }
        if (po.getTemperature() != null) {
            builder.temperature(po.getTemperature());
        }
        builder.maxTokens(po.getMaxTokens());
        return builder.build();
    }
}
