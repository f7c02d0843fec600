package com.agentpipeline.types.exception;

import com.agentpipeline.types.enums.ResponseCode;

/**
 * 配置错误：未知 Agent、缺失或非法的 supervisor、空 Agent 列表、无法解析的配置文件等。
 * <p>
 * 在任何 Agent 被调用之前抛出，流水线不会部分执行。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
public class PipelineConfigurationException extends AppException {

    private static final long serialVersionUID = -6245178830519472271L;

    public PipelineConfigurationException(String message) {
        super(ResponseCode.CONFIGURATION_ERROR.getCode(), message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(ResponseCode.CONFIGURATION_ERROR.getCode(), message, cause);
    }
}
