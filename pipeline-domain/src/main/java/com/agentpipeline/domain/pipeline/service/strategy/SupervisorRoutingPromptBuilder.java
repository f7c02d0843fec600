package com.agentpipeline.domain.pipeline.service.strategy;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 生成 supervisor 路由提示词：列出可选专家及其指令摘要，要求只回复一个名称。
 */
final class SupervisorRoutingPromptBuilder {

    static final int INSTRUCTIONS_PREVIEW_LENGTH = 100;

    private SupervisorRoutingPromptBuilder() {
    }

    static String build(String task, List<AgentSpec> specialists, String doneSentinel) {
        StringBuilder prompt = new StringBuilder("You are a supervisor. Available specialists:\n");
        for (AgentSpec specialist : specialists) {
            prompt.append("- ").append(specialist.getName()).append(": ")
                    .append(StringUtils.left(StringUtils.normalizeSpace(specialist.getInstructions()),
                            INSTRUCTIONS_PREVIEW_LENGTH))
                    .append('\n');
        }
        prompt.append('\n').append("Task: ").append(task).append("\n\n");
        prompt.append("Reply with ONLY the name of the specialist that should handle this task.");
        if (StringUtils.isNotBlank(doneSentinel)) {
            prompt.append(" If the task is already complete, reply with ONLY '")
                    .append(doneSentinel.trim()).append("'.");
        }
        return prompt.toString();
    }
}
