package com.agentpipeline.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话发言 DTO。
 */
@Data
public class TurnDTO {

    private Integer index;
    private String speaker;
    private String content;
    private LocalDateTime createdAt;
}
