package com.agentpipeline.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Agent 摘要 DTO。
 */
@Data
public class AgentSummaryDTO {

    private String name;
    private String backend;
    private String provider;
    private String model;
    private Integer maxTurns;
    private Boolean humanInput;
    private List<String> tools;
}
