package com.agentpipeline.infrastructure.config.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Agent 配置文件中的 llm 段。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmConfigPO {

    private String provider;

    private String model;

    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;
}
