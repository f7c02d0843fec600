package com.agentpipeline.types.common;

/**
 * 全局常量定义类。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** 初始任务回合的合成发言者 */
    public final static String TASK_SPEAKER = "task";

    /** 编排器/调用方注入消息的合成发言者 */
    public final static String USER_SPEAKER = "user";

    /** 默认 Agent 后端标识 */
    public final static String DEFAULT_BACKEND = "spring_ai";

}
