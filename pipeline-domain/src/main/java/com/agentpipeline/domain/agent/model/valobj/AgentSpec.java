package com.agentpipeline.domain.agent.model.valobj;

import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Agent 静态配置值对象。
 * <p>
 * 配置加载后不可变，由名册持有，流水线按名称引用。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AgentSpec {

    public static final int DEFAULT_MAX_TURNS = 10;

    /** 名册内唯一的 Agent 名称 */
    private final String name;

    /** 后端标识（如 'spring_ai'） */
    @Builder.Default
    private final String backend = Constants.DEFAULT_BACKEND;

    /** 系统提示词 / 角色指令 */
    private final String instructions;

    /** 模型参数 */
    @Builder.Default
    private final LlmSpec llm = LlmSpec.builder().build();

    /** 工具绑定 */
    @Singular
    private final List<ToolBinding> tools;

    /** 单次运行内该 Agent 最多被调用的次数 */
    @Builder.Default
    private final int maxTurns = DEFAULT_MAX_TURNS;

    /** 是否在每次回复后交由人工审阅 */
    private final boolean humanInput;

    /** 后端特定的透传参数 */
    @Singular("extraOption")
    private final Map<String, Object> extra;

    /**
     * 校验配置是否有效。
     */
    public void validate() {
        if (StringUtils.isBlank(name)) {
            throw new PipelineConfigurationException("Agent name cannot be empty");
        }
        if (StringUtils.isBlank(backend)) {
            throw new PipelineConfigurationException("Agent '" + name + "' backend cannot be empty");
        }
        if (StringUtils.isBlank(instructions)) {
            throw new PipelineConfigurationException("Agent '" + name + "' instructions cannot be empty");
        }
        if (maxTurns < 1) {
            throw new PipelineConfigurationException("Agent '" + name + "' max_turns must be positive: " + maxTurns);
        }
        if (llm == null) {
            throw new PipelineConfigurationException("Agent '" + name + "' llm config cannot be null");
        }
        llm.validate(name);
        for (ToolBinding tool : tools) {
            tool.validate(name);
        }
    }

    public boolean isExtraEnabled(String key) {
        Object value = extra.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
