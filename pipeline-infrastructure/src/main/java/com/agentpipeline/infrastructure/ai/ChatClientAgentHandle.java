package com.agentpipeline.infrastructure.ai;

import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.types.exception.AgentInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * 基于 Spring AI ChatClient 的 Agent 句柄。
 */
@Slf4j
public class ChatClientAgentHandle implements IAgentHandle {

    private final String name;
    private final ChatClient chatClient;
    private final TranscriptMessageMapper messageMapper;

    public ChatClientAgentHandle(String name, ChatClient chatClient, TranscriptMessageMapper messageMapper) {
        this.name = name;
        this.chatClient = chatClient;
        this.messageMapper = messageMapper;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String invoke(ConversationView transcript) {
        if (transcript == null || transcript.isEmpty()) {
            throw new AgentInvocationException(name, "Agent '" + name + "' received an empty transcript");
        }
        List<Message> messages = messageMapper.toMessages(name, transcript);
        long startedAt = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt()
                    .messages(messages)
                    .call()
                    .content();
        } catch (AgentInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentInvocationException(name,
                    "Agent '" + name + "' backend call failed: " + e.getMessage(), e);
        }
        if (StringUtils.isBlank(content)) {
            throw new AgentInvocationException(name, "Agent '" + name + "' returned an empty response");
        }
        log.debug("AGENT_INVOKED agent={}, messages={}, replyLength={}, costMs={}",
                name, messages.size(), content.length(), System.currentTimeMillis() - startedAt);
        return content;
    }
}
