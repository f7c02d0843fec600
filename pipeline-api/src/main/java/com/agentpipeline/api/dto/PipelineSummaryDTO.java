package com.agentpipeline.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 流水线摘要 DTO。
 */
@Data
public class PipelineSummaryDTO {

    private String name;
    private String strategy;
    private List<String> agents;
    private Integer maxRounds;
    private String supervisorAgent;
    private String supervisorMode;
}
