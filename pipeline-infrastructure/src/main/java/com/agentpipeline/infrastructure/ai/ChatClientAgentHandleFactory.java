package com.agentpipeline.infrastructure.ai;

import com.agentpipeline.domain.agent.adapter.factory.IAgentHandleFactory;
import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.agent.model.valobj.LlmSpec;
import com.agentpipeline.domain.agent.model.valobj.ToolBinding;
import com.agentpipeline.types.common.Constants;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.api.Advisor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.resolution.ToolCallbackResolver;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * spring_ai 后端的 Agent 句柄工厂。
 * <p>
 * 负责：
 * <ul>
 *   <li>按 llm.provider 解析 ChatModel Bean，未配置时使用默认 ChatModel</li>
 *   <li>以 instructions 作为系统提示词构建 ChatClient</li>
 *   <li>通过 ToolCallbackResolver 校验工具绑定，无法解析的工具视为配置错误</li>
 *   <li>组装对话参数与 Advisor 链</li>
 * </ul>
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Component
public class ChatClientAgentHandleFactory implements IAgentHandleFactory {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ListableBeanFactory beanFactory;
    private final ToolCallbackResolver toolCallbackResolver;
    private final AgentAdvisorFactory advisorFactory;
    private final TranscriptMessageMapper messageMapper;

    public ChatClientAgentHandleFactory(ObjectProvider<ChatModel> chatModelProvider,
                                        ListableBeanFactory beanFactory,
                                        ToolCallbackResolver toolCallbackResolver,
                                        AgentAdvisorFactory advisorFactory,
                                        TranscriptMessageMapper messageMapper) {
        this.chatModelProvider = chatModelProvider;
        this.beanFactory = beanFactory;
        this.toolCallbackResolver = toolCallbackResolver;
        this.advisorFactory = advisorFactory;
        this.messageMapper = messageMapper;
    }

    @Override
    public String backend() {
        return Constants.DEFAULT_BACKEND;
    }

    @Override
    public IAgentHandle create(AgentSpec spec) {
        List<String> toolNames = resolveToolNames(spec);
        ChatModel chatModel = resolveChatModel(spec);

        ChatClient.Builder builder = ChatClient.builder(chatModel)
                .defaultSystem(spec.getInstructions())
                .defaultOptions(buildChatOptions(spec.getLlm(), toolNames));
        if (!toolNames.isEmpty()) {
            builder.defaultToolNames(toolNames.toArray(new String[0]));
        }
        List<Advisor> advisors = advisorFactory.buildAdvisors(spec);
        if (!advisors.isEmpty()) {
            builder.defaultAdvisors(advisors.toArray(new Advisor[0]));
        }
        log.debug("AGENT_HANDLE_CREATED agent={}, model={}, tools={}, advisors={}",
                spec.getName(), spec.getLlm().getModel(), toolNames, advisors.size());
        return new ChatClientAgentHandle(spec.getName(), builder.build(), messageMapper);
    }

    private OpenAiChatOptions buildChatOptions(LlmSpec llm, List<String> toolNames) {
        OpenAiChatOptions options = new OpenAiChatOptions();
        if (StringUtils.isNotBlank(llm.getModel())) {
            options.setModel(llm.getModel());
        }
        if (llm.getTemperature() != null) {
            options.setTemperature(llm.getTemperature());
        }
        if (llm.getMaxTokens() != null) {
            options.setMaxTokens(llm.getMaxTokens());
        }
        if (!toolNames.isEmpty()) {
            options.setToolNames(new LinkedHashSet<>(toolNames));
        }
        return options;
    }

    private List<String> resolveToolNames(AgentSpec spec) {
        Set<String> toolNames = new LinkedHashSet<>();
        for (ToolBinding tool : spec.getTools()) {
            String toolName = tool.resolveToolName();
            if (toolCallbackResolver.resolve(toolName) == null) {
                throw new PipelineConfigurationException(
                        "Agent '" + spec.getName() + "' references unknown tool '" + toolName + "'");
            }
            toolNames.add(toolName);
        }
        return new ArrayList<>(toolNames);
    }

    private ChatModel resolveChatModel(AgentSpec spec) {
        String provider = spec.getLlm().getProvider();
        if (StringUtils.isNotBlank(provider)) {
            if (!beanFactory.containsBean(provider)) {
                throw new PipelineConfigurationException(
                        "Agent '" + spec.getName() + "' references unknown ChatModel provider '" + provider + "'");
            }
            try {
                return beanFactory.getBean(provider, ChatModel.class);
            } catch (RuntimeException ex) {
                throw new PipelineConfigurationException(
                        "Bean '" + provider + "' for agent '" + spec.getName() + "' is not a ChatModel", ex);
            }
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new PipelineConfigurationException("No ChatModel available for agent '" + spec.getName() + "'");
        }
        return chatModel;
    }
}
