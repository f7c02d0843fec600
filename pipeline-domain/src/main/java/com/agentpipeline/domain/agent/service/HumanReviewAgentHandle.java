package com.agentpipeline.domain.agent.service;

import com.agentpipeline.domain.agent.adapter.gateway.IHumanInputGateway;
import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * 人工审阅装饰句柄：草稿回复经操作员确认或替换后再进入会话。
 */
@Slf4j
class HumanReviewAgentHandle implements IAgentHandle {

    private final IAgentHandle delegate;
    private final IHumanInputGateway gateway;

    HumanReviewAgentHandle(IAgentHandle delegate, IHumanInputGateway gateway) {
        this.delegate = delegate;
        this.gateway = gateway;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public String invoke(ConversationView transcript) {
        String draft = delegate.invoke(transcript);
        String override = gateway.review(getName(), transcript, draft);
        if (StringUtils.isBlank(override)) {
            return draft;
        }
        log.info("HUMAN_INPUT_OVERRIDE agent={}, draftLength={}, overrideLength={}",
                getName(), StringUtils.length(draft), override.length());
        return override;
    }
}
