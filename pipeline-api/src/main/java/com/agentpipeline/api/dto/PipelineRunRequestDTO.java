package com.agentpipeline.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 流水线运行请求 DTO。
 */
@Data
public class PipelineRunRequestDTO {

    private String task;

    /** 此前的问答，用于多轮对话延续 */
    private List<ChatExchangeDTO> history;

    /** 运行超时（秒），为空使用默认值 */
    private Long timeoutSeconds;
}
