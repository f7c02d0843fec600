package com.agentpipeline.domain.agent.model.valobj;

import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Agent 工具绑定：按名称引用后端可解析的工具（Spring Bean 工具名）。
 */
@Getter
@Builder
@ToString
public class ToolBinding {

    /** 工具名称 */
    private final String name;

    /** 工具 Bean 名称，为空时与 name 相同 */
    private final String bean;

    /** 面向模型的工具描述 */
    private final String description;

    public String resolveToolName() {
        return StringUtils.defaultIfBlank(bean, name);
    }

    public void validate(String agentName) {
        if (StringUtils.isBlank(name)) {
            throw new PipelineConfigurationException("Agent '" + agentName + "' declares a tool without name");
        }
    }
}
