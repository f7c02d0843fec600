package com.agentpipeline.infrastructure.ai;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.chat.client.advisor.api.Advisor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring AI Advisor 工厂。
 * <p>
 * 根据 Agent 的 extra 配置构建 Advisor 链：
 * <ul>
 *   <li>log_requests：SimpleLoggerAdvisor，记录请求/响应</li>
 * </ul>
 * 会话记忆由编排层的会话视图提供，这里不挂载 ChatMemory 类 Advisor。
 * </p>
 */
@Component
public class AgentAdvisorFactory {

    public static final String LOG_REQUESTS_KEY = "log_requests";

    public List<Advisor> buildAdvisors(AgentSpec spec) {
        List<Advisor> advisors = new ArrayList<>();
        if (spec.isExtraEnabled(LOG_REQUESTS_KEY)) {
            advisors.add(new SimpleLoggerAdvisor());
        }
        return advisors;
    }
}
