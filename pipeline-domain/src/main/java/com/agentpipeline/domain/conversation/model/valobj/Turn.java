package com.agentpipeline.domain.conversation.model.valobj;

import java.time.LocalDateTime;

/**
 * 会话中的一次发言。
 *
 * @param index 在会话中的位置，从 0 开始
 * @param speaker 发言方：Agent 名称，或 'task' / 'user'
 * @param content 文本内容
 * @param createdAt 追加时间
 */
public record Turn(int index, String speaker, String content, LocalDateTime createdAt) {

    public Turn {
        if (index < 0) {
            throw new IllegalArgumentException("turn index must be non-negative: " + index);
        }
        if (speaker == null || speaker.isBlank()) {
            throw new IllegalArgumentException("turn speaker cannot be blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("turn content cannot be null");
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
