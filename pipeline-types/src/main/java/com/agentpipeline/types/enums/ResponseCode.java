package com.agentpipeline.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 流水线或 Agent 配置错误 */
    CONFIGURATION_ERROR("0003", "配置错误"),

    /** Agent 后端调用失败 */
    AGENT_INVOCATION_ERROR("0004", "Agent 调用失败"),

    /** 资源不存在 */
    NOT_FOUND("0005", "资源不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
