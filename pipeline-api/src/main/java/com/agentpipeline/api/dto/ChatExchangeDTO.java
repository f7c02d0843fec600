package com.agentpipeline.api.dto;

import lombok.Data;

/**
 * 一轮历史问答 DTO。
 */
@Data
public class ChatExchangeDTO {

    private String user;

    private String assistant;
}
