package com.agentpipeline.api.dto;

import lombok.Data;

/**
 * 单 Agent 运行请求 DTO。
 */
@Data
public class AgentRunRequestDTO {

    private String message;

    private Long timeoutSeconds;
}
