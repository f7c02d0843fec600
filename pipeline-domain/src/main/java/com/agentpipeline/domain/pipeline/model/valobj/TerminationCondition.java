package com.agentpipeline.domain.pipeline.model.valobj;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.domain.conversation.model.valobj.Turn;

/**
 * 显式终止条件，每追加一条 Agent 发言后求值一次。
 */
@FunctionalInterface
public interface TerminationCondition {

    boolean isSatisfied(Turn latest, ConversationView transcript);

    static TerminationCondition never() {
        return (latest, transcript) -> false;
    }

    /**
     * 回复去除首尾空白后与标记完全相等时终止。
     */
    static TerminationCondition sentinel(String sentinel) {
        String expected = sentinel.trim();
        return (latest, transcript) -> latest != null && expected.equals(latest.content().trim());
    }
}
