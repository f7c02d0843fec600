package com.agentpipeline.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 健康检查 DTO。
 */
@Data
public class HealthDTO {

    private String status;
    private Integer agents;
    private Integer pipelines;
    private List<String> backends;
}
