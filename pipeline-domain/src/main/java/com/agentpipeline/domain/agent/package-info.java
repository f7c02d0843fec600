/**
 * Agent 领域 - 代理定义与运行时句柄
 *
 * <p>职责：Agent 的静态定义、名册（roster）以及按后端标识构造可调用的 Agent 句柄。</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>AgentSpec：Agent 的不可变配置（名称、后端、指令、模型、工具、回合上限）</li>
 *   <li>AgentRoster：一次加载得到的只读 Agent 集合，按名称唯一</li>
 *   <li>IAgentHandle：对某个后端的不透明调用能力，输入会话视图，输出回复文本</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.agentpipeline.domain.agent.service.AgentHandleRegistry} - 后端注册表，按 backend 选择句柄工厂</li>
 * </ul>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
package com.agentpipeline.domain.agent;
