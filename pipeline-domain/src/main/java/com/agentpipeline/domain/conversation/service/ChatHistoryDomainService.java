package com.agentpipeline.domain.conversation.service;

import com.agentpipeline.domain.conversation.model.valobj.ChatExchange;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 多轮对话延续：把此前的问答拼接进下一次运行的任务文本。
 * <p>
 * 流水线每次运行都从空会话开始，跨运行的上下文只能通过任务文本携带。
 * </p>
 */
@Slf4j
@Service
public class ChatHistoryDomainService {

    public static final int MAX_EXCHANGES = 20;

    public String composeTask(List<ChatExchange> history, String message) {
        if (history == null || history.isEmpty()) {
            return message;
        }
        int from = Math.max(0, history.size() - MAX_EXCHANGES);
        if (from > 0) {
            log.debug("CHAT_HISTORY_TRUNCATED total={}, kept={}", history.size(), MAX_EXCHANGES);
        }
        StringBuilder builder = new StringBuilder("Previous conversation:\n");
        for (ChatExchange exchange : history.subList(from, history.size())) {
            if (exchange == null) {
                continue;
            }
            builder.append("User: ").append(StringUtils.defaultString(exchange.userMessage())).append('\n');
            builder.append("Assistant: ").append(StringUtils.defaultString(exchange.reply())).append('\n');
        }
        builder.append('\n').append("Current message:\n").append(message);
        return builder.toString();
    }
}
