package com.agentpipeline.types.enums;

import lombok.Getter;

import java.util.Locale;

/**
 * 流水线编排策略枚举。
 */
@Getter
public enum StrategyTypeEnum {

    /** 顺序链式：上一个 Agent 的输出作为下一个 Agent 的唯一输入 */
    SEQUENTIAL("sequential"),

    /** 群聊：按声明顺序轮流发言，每个 Agent 看到完整会话 */
    GROUP_CHAT("group_chat"),

    /** 主管路由：supervisor 选择一个专家 Agent 处理任务 */
    SUPERVISOR("supervisor");

    private final String code;

    StrategyTypeEnum(String code) {
        this.code = code;
    }

    /**
     * 按配置文件中的取值解析策略，大小写与中划线不敏感。
     *
     * @return 匹配的策略，无法识别时返回 null
     */
    public static StrategyTypeEnum fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (StrategyTypeEnum value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
