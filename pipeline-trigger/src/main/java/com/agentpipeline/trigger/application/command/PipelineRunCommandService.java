package com.agentpipeline.trigger.application.command;

import com.agentpipeline.domain.agent.adapter.repository.IAgentSpecRepository;
import com.agentpipeline.domain.agent.model.valobj.AgentRoster;
import com.agentpipeline.domain.conversation.model.entity.Conversation;
import com.agentpipeline.domain.conversation.model.valobj.ChatExchange;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.conversation.service.ChatHistoryDomainService;
import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.CancellationSignal;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunOptions;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.domain.pipeline.service.PipelineEngine;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.enums.TerminalReasonEnum;
import com.agentpipeline.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 流水线运行用例：查找配置、组装任务文本，并在共享线程池上带超时执行。
 * <p>
 * 超时后发出取消信号，等待当前 Agent 调用返回，运行在下一个回合边界以 CANCELED 结束。
 * 宽限期内仍未结束时直接返回 CANCELED 结果，附带此刻已完成的发言。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Service
public class PipelineRunCommandService {

    private final PipelineEngine pipelineEngine;
    private final IPipelineSpecRepository pipelineSpecRepository;
    private final IAgentSpecRepository agentSpecRepository;
    private final ChatHistoryDomainService chatHistoryDomainService;
    private final Executor commonThreadPoolExecutor;
    private final long defaultTimeoutSeconds;
    private final long cancelGraceSeconds;

    public PipelineRunCommandService(PipelineEngine pipelineEngine,
                                     IPipelineSpecRepository pipelineSpecRepository,
                                     IAgentSpecRepository agentSpecRepository,
                                     ChatHistoryDomainService chatHistoryDomainService,
                                     @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor,
                                     @Value("${agent-pipeline.run.timeout-seconds:300}") long defaultTimeoutSeconds,
                                     @Value("${agent-pipeline.run.cancel-grace-seconds:30}") long cancelGraceSeconds) {
        this.pipelineEngine = pipelineEngine;
        this.pipelineSpecRepository = pipelineSpecRepository;
        this.agentSpecRepository = agentSpecRepository;
        this.chatHistoryDomainService = chatHistoryDomainService;
        this.commonThreadPoolExecutor = commonThreadPoolExecutor;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.cancelGraceSeconds = cancelGraceSeconds;
    }

    public RunResult runPipeline(String pipelineName, String task, List<ChatExchange> history, Long timeoutSeconds) {
        if (StringUtils.isBlank(task)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "task 不能为空");
        }
        PipelineSpec spec = pipelineSpecRepository.findByName(pipelineName);
        if (spec == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "流水线不存在: " + pipelineName);
        }
        String composedTask = chatHistoryDomainService.composeTask(history, task);
        AgentRoster roster = agentSpecRepository.loadRoster();
        return execute(spec, options -> pipelineEngine.run(spec, composedTask, roster, options), timeoutSeconds);
    }

    public RunResult runAgent(String agentName, String message, Long timeoutSeconds) {
        if (StringUtils.isBlank(message)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "message 不能为空");
        }
        AgentRoster roster = agentSpecRepository.loadRoster();
        if (!roster.contains(agentName)) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Agent 不存在: " + agentName);
        }
        PipelineSpec spec = PipelineSpec.singleAgent(agentName);
        return execute(spec, options -> pipelineEngine.runAgent(agentName, message, roster, options), timeoutSeconds);
    }

    private RunResult execute(PipelineSpec spec, Function<RunOptions, RunResult> run, Long timeoutSeconds) {
        CancellationSignal signal = new CancellationSignal();
        AtomicReference<Conversation> conversation = new AtomicReference<>();
        RunOptions options = RunOptions.builder()
                .cancellationSignal(signal)
                .conversationObserver(conversation::set)
                .build();
        long timeout = resolveTimeout(timeoutSeconds);

        CompletableFuture<RunResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> run.apply(options), commonThreadPoolExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("PIPELINE_RUN_REJECTED pipeline={}, error={}", spec.getName(), e.getMessage());
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "执行线程池繁忙，请稍后重试", e);
        }
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            signal.cancel("run exceeded timeout of " + timeout + "s");
            log.warn("PIPELINE_RUN_TIMEOUT pipeline={}, timeoutSeconds={}", spec.getName(), timeout);
            return awaitCanceled(spec, future, signal, conversation);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel("caller interrupted");
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "运行被中断", e);
        }
    }

    private RunResult awaitCanceled(PipelineSpec spec, CompletableFuture<RunResult> future, CancellationSignal signal,
                                    AtomicReference<Conversation> conversation) {
        try {
            return future.get(cancelGraceSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            Conversation live = conversation.get();
            List<Turn> transcript = live == null ? List.of() : live.getTurns();
            log.warn("PIPELINE_RUN_CANCEL_GRACE_EXCEEDED pipeline={}, graceSeconds={}, turns={}",
                    spec.getName(), cancelGraceSeconds, transcript.size());
            return RunResult.builder()
                    .pipelineName(spec.getName())
                    .strategy(spec.getStrategy())
                    .reason(TerminalReasonEnum.CANCELED)
                    .content(signal.getReason())
                    .transcript(transcript)
                    .build();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "运行被中断", e);
        }
    }

    private AppException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof AppException) {
            return (AppException) cause;
        }
        log.error("PIPELINE_RUN_ERROR error={}", cause == null ? e.getMessage() : cause.getMessage(), cause);
        return new AppException(ResponseCode.UN_ERROR.getCode(), "流水线运行异常", cause == null ? e : cause);
    }

    private long resolveTimeout(Long timeoutSeconds) {
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            return defaultTimeoutSeconds;
        }
        return timeoutSeconds;
    }
}
