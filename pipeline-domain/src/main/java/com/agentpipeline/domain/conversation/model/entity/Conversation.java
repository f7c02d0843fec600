package com.agentpipeline.domain.conversation.model.entity;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 单次运行的会话实体，只允许追加。
 * <p>
 * 由一次运行独占写入；其他线程只能读取快照，例如超时后取回已完成的发言。
 * </p>
 */
public class Conversation {

    private final List<Turn> turns = new CopyOnWriteArrayList<>();

    /**
     * 追加一条发言，序号自动递增。
     */
    public Turn append(String speaker, String content) {
        Turn turn = new Turn(turns.size(), speaker, content, LocalDateTime.now());
        turns.add(turn);
        return turn;
    }

    public List<Turn> getTurns() {
        return List.copyOf(turns);
    }

    public int size() {
        return turns.size();
    }

    public Turn latest() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    public Turn first() {
        return turns.isEmpty() ? null : turns.get(0);
    }

    public ConversationView fullView() {
        return ConversationView.of(turns);
    }

    public ConversationView latestView() {
        Turn latest = latest();
        return latest == null ? ConversationView.empty() : ConversationView.of(List.of(latest));
    }

    public ConversationView firstView() {
        Turn first = first();
        return first == null ? ConversationView.empty() : ConversationView.of(List.of(first));
    }
}
