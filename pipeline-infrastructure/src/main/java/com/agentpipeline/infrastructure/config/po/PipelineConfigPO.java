package com.agentpipeline.infrastructure.config.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 流水线配置文件结构（YAML / JSON，snake_case）。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfigPO {

    private String name;

    private List<String> agents;

    private String strategy;

    @JsonProperty("max_rounds")
    private Integer maxRounds;

    @JsonProperty("supervisor_agent")
    private String supervisorAgent;

    @JsonProperty("supervisor_mode")
    private String supervisorMode;

    @JsonProperty("done_sentinel")
    private String doneSentinel;

    @JsonProperty("termination_sentinel")
    private String terminationSentinel;
}
