package com.agentpipeline.domain.agent.adapter.gateway;

import com.agentpipeline.domain.conversation.model.valobj.ConversationView;

/**
 * 人工输入网关：human_input 开启时，Agent 的草稿回复交由操作员审阅。
 */
public interface IHumanInputGateway {

    /**
     * 请求人工审阅。
     *
     * @param agentName Agent 名称
     * @param transcript Agent 本次看到的会话
     * @param draft Agent 草稿回复
     * @return 操作员给出的替换内容；返回空白表示采纳草稿
     */
    String review(String agentName, ConversationView transcript, String draft);
}
