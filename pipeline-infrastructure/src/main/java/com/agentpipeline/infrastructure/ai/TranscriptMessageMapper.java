package com.agentpipeline.infrastructure.ai;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.types.common.Constants;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话视图到 Spring AI 消息列表的转换。
 * <p>
 * 以被调用 Agent 的视角映射：自己的发言为 assistant，任务与用户输入为 user，
 * 其他 Agent 的发言为带发言者前缀的 user 消息。
 * </p>
 */
@Component
public class TranscriptMessageMapper {

    public List<Message> toMessages(String agentName, ConversationView transcript) {
        List<Message> messages = new ArrayList<>(transcript.size());
        for (Turn turn : transcript.getTurns()) {
            String speaker = turn.speaker();
            if (speaker.equals(agentName)) {
                messages.add(new AssistantMessage(turn.content()));
            } else if (Constants.TASK_SPEAKER.equals(speaker) || Constants.USER_SPEAKER.equals(speaker)) {
                messages.add(new UserMessage(turn.content()));
            } else {
                messages.add(new UserMessage("[" + speaker + "]: " + turn.content()));
            }
        }
        return messages;
    }
}
