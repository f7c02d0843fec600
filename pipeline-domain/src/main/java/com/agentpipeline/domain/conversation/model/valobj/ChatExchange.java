package com.agentpipeline.domain.conversation.model.valobj;

/**
 * 多轮对话中已完成的一轮：用户消息与流水线最终回复。
 */
public record ChatExchange(String userMessage, String reply) {
}
