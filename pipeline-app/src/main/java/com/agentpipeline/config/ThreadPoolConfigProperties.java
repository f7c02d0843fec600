package com.agentpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 流水线运行线程池配置，前缀 thread.pool.executor.config。
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 8;

    /** 最大线程数 */
    private Integer maxPoolSize = 32;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 阻塞队列容量 */
    private Integer blockQueueSize = 200;

    /** 拒绝策略：AbortPolicy / CallerRunsPolicy / DiscardPolicy / DiscardOldestPolicy */
    private String policy = "AbortPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "pipeline-run-";
}
