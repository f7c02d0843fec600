package com.agentpipeline.infrastructure.config.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Agent 配置文件结构（YAML / JSON，snake_case）。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentConfigPO {

    private String name;

    private String backend;

    private String instructions;

    private LlmConfigPO llm;

    private List<ToolConfigPO> tools;

    @JsonProperty("human_input")
    private Boolean humanInput;

    @JsonProperty("max_turns")
    private Integer maxTurns;

    private Map<String, Object> extra;
}
