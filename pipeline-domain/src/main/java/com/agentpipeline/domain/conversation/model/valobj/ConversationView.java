package com.agentpipeline.domain.conversation.model.valobj;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 会话的只读视图，即 Agent 一次调用时能看到的全部内容。
 * <p>
 * 视图是快照，之后对会话的追加不会影响已交出的视图。
 * </p>
 */
public final class ConversationView {

    private static final ConversationView EMPTY = new ConversationView(Collections.emptyList());

    private final List<Turn> turns;

    private ConversationView(List<Turn> turns) {
        this.turns = turns;
    }

    public static ConversationView empty() {
        return EMPTY;
    }

    public static ConversationView of(List<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            return EMPTY;
        }
        return new ConversationView(List.copyOf(turns));
    }

    public static ConversationView ofMessage(String speaker, String content) {
        return new ConversationView(List.of(new Turn(0, speaker, content, LocalDateTime.now())));
    }

    /**
     * 返回追加了一条临时发言的新视图，原视图不变。
     */
    public ConversationView withAppended(String speaker, String content) {
        List<Turn> extended = new ArrayList<>(turns.size() + 1);
        extended.addAll(turns);
        extended.add(new Turn(turns.size(), speaker, content, LocalDateTime.now()));
        return new ConversationView(Collections.unmodifiableList(extended));
    }

    public List<Turn> getTurns() {
        return turns;
    }

    public Turn latest() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    /**
     * 以 "speaker: content" 逐行渲染，用于人工审阅展示。
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        for (Turn turn : turns) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(turn.speaker()).append(": ").append(turn.content());
        }
        return builder.toString();
    }
}
