package com.agentpipeline.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装。
 * <p>
 * 业务失败同样以 HTTP 200 返回，由 code 区分；成功为 "0000"。
 * </p>
 *
 * @param <T> 响应数据类型
 * @author agentpipeline
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 3185204761198236541L;

    private String code;

    private String info;

    private T data;
}
