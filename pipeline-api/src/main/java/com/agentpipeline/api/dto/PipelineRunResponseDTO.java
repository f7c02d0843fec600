package com.agentpipeline.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 流水线运行结果 DTO。
 */
@Data
public class PipelineRunResponseDTO {

    private String pipeline;
    private String strategy;
    /** COMPLETED / MAX_ROUNDS_EXCEEDED / AGENT_FAILED / ROUTING_FAILED / CANCELED */
    private String reason;
    private Boolean successful;
    private String content;
    private String agentName;
    private List<TurnDTO> turns;
}
