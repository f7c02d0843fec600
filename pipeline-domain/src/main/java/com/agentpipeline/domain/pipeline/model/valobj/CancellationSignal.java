package com.agentpipeline.domain.pipeline.model.valobj;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行取消信号，在下一个回合边界生效。
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    public void cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    public void cancel() {
        cancel("run canceled");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }
}
