package com.agentpipeline.types.enums;

import lombok.Getter;

import java.util.Locale;

/**
 * Supervisor 策略运行模式。
 */
@Getter
public enum SupervisorModeEnum {

    /** supervisor 只路由一次，被选中的专家只执行一次 */
    SINGLE_SHOT("single_shot"),

    /** 每轮重新咨询 supervisor，直到 done 标记或轮数上限 */
    MULTI_ROUND("multi_round");

    private final String code;

    SupervisorModeEnum(String code) {
        this.code = code;
    }

    public boolean isMultiRound() {
        return this == MULTI_ROUND;
    }

    public static SupervisorModeEnum fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SupervisorModeEnum value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
