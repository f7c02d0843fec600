package com.agentpipeline.domain.agent.model.valobj;

import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 模型连接参数值对象。
 * <p>
 * provider 对应 Spring 容器中的 ChatModel Bean 名称，为空时使用默认 ChatModel；
 * 凭证由 ChatModel Bean 自身持有，不出现在此处。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class LlmSpec {

    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final double DEFAULT_TEMPERATURE = 0.1D;

    /** ChatModel Bean 名称 */
    private final String provider;

    /** 模型名称 */
    @Builder.Default
    private final String model = DEFAULT_MODEL;

    /** 采样温度，0.0 ~ 2.0 */
    @Builder.Default
    private final Double temperature = DEFAULT_TEMPERATURE;

    /** 最大输出 token 数，为空表示不限制 */
    private final Integer maxTokens;

    public void validate(String agentName) {
        if (temperature != null && (temperature < 0D || temperature > 2D)) {
            throw new PipelineConfigurationException(
                    "Agent '" + agentName + "' temperature must be between 0.0 and 2.0: " + temperature);
        }
        if (maxTokens != null && maxTokens < 1) {
            throw new PipelineConfigurationException(
                    "Agent '" + agentName + "' max_tokens must be positive: " + maxTokens);
        }
    }
}
