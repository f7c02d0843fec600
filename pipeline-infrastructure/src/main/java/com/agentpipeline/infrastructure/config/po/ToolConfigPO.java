package com.agentpipeline.infrastructure.config.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Agent 配置文件中的工具绑定。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolConfigPO {

    private String name;

    private String bean;

    private String description;
}
