package com.agentpipeline.trigger.cli;

import com.agentpipeline.domain.agent.adapter.repository.IAgentSpecRepository;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.conversation.model.valobj.Turn;
import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.domain.pipeline.model.valobj.RunResult;
import com.agentpipeline.trigger.application.command.PipelineRunCommandService;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * 命令行入口。
 * <ul>
 *   <li>--pipeline=&lt;name&gt; --task=&lt;text&gt;：运行流水线</li>
 *   <li>--agent=&lt;name&gt; --message=&lt;text&gt;：运行单个 Agent</li>
 *   <li>--list：列出已加载的 Agent 与流水线</li>
 *   <li>--timeout=&lt;seconds&gt;、--verbose：超时与打印完整会话</li>
 * </ul>
 * 退出码：0 成功，1 运行以失败原因结束，2 参数或配置错误。
 */
@Slf4j
@Component
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPT_PIPELINE = "pipeline";
    static final String OPT_TASK = "task";
    static final String OPT_AGENT = "agent";
    static final String OPT_MESSAGE = "message";
    static final String OPT_LIST = "list";
    static final String OPT_TIMEOUT = "timeout";
    static final String OPT_VERBOSE = "verbose";

    public static final int EXIT_OK = 0;
    public static final int EXIT_RUN_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private final PipelineRunCommandService pipelineRunCommandService;
    private final IAgentSpecRepository agentSpecRepository;
    private final IPipelineSpecRepository pipelineSpecRepository;
    private final PrintStream out;

    private volatile int exitCode = EXIT_OK;
    private volatile boolean commandExecuted;

    @Autowired
    public PipelineCommandLineRunner(PipelineRunCommandService pipelineRunCommandService,
                                     IAgentSpecRepository agentSpecRepository,
                                     IPipelineSpecRepository pipelineSpecRepository) {
        this(pipelineRunCommandService, agentSpecRepository, pipelineSpecRepository, System.out);
    }

    public PipelineCommandLineRunner(PipelineRunCommandService pipelineRunCommandService,
                                     IAgentSpecRepository agentSpecRepository,
                                     IPipelineSpecRepository pipelineSpecRepository,
                                     PrintStream out) {
        this.pipelineRunCommandService = pipelineRunCommandService;
        this.agentSpecRepository = agentSpecRepository;
        this.pipelineSpecRepository = pipelineSpecRepository;
        this.out = out;
    }

    /**
     * 判断启动参数是否为命令行调用，命令行调用不启动 Web 容器。
     */
    public static boolean isCommandInvocation(String... args) {
        if (args == null) {
            return false;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            if (arg.equals("--" + OPT_LIST) || arg.startsWith("--" + OPT_PIPELINE + "=")
                    || arg.startsWith("--" + OPT_AGENT + "=")) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(OPT_LIST)) {
            commandExecuted = true;
            printCatalog();
            return;
        }
        String pipeline = option(args, OPT_PIPELINE);
        String agent = option(args, OPT_AGENT);
        if (pipeline == null && agent == null) {
            return;
        }
        commandExecuted = true;
        try {
            Long timeout = parseTimeout(option(args, OPT_TIMEOUT));
            RunResult result;
            if (pipeline != null) {
                String task = option(args, OPT_TASK);
                if (StringUtils.isBlank(task)) {
                    usage("--task is required with --pipeline");
                    return;
                }
                result = pipelineRunCommandService.runPipeline(pipeline, task, Collections.emptyList(), timeout);
            } else {
                String message = option(args, OPT_MESSAGE);
                if (StringUtils.isBlank(message)) {
                    usage("--message is required with --agent");
                    return;
                }
                result = pipelineRunCommandService.runAgent(agent, message, timeout);
            }
            render(result, args.containsOption(OPT_VERBOSE));
            exitCode = result.isSuccessful() ? EXIT_OK : EXIT_RUN_FAILED;
        } catch (AppException e) {
            log.warn("CLI_COMMAND_FAILED code={}, info={}", e.getCode(), e.getInfo());
            out.println("Error [" + e.getCode() + "]: " + e.getInfo());
            exitCode = EXIT_USAGE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public boolean isCommandExecuted() {
        return commandExecuted;
    }

    private void render(RunResult result, boolean verbose) {
        if (verbose) {
            for (Turn turn : result.getTranscript()) {
                out.println("[" + turn.index() + "] " + turn.speaker() + ": " + turn.content());
            }
            out.println("---");
        }
        if (!result.isSuccessful()) {
            out.println("Run ended with " + result.getReason() + ": " + result.getContent());
            return;
        }
        if (verbose) {
            out.println("(" + result.getReason() + ", by " + result.getAgentName() + ")");
        }
        out.println(result.getContent());
    }

    private void printCatalog() {
        out.println("Agents:");
        for (AgentSpec agent : agentSpecRepository.findAll()) {
            out.println("  " + agent.getName() + " (" + agent.getBackend() + ", " + agent.getLlm().getModel() + ")");
        }
        out.println("Pipelines:");
        for (PipelineSpec pipeline : pipelineSpecRepository.findAll()) {
            out.println("  " + pipeline.getName() + " [" + pipeline.getStrategy().getCode() + "] "
                    + String.join(" -> ", pipeline.getAgents()));
        }
    }

    private void usage(String problem) {
        out.println("Error: " + problem);
        out.println("Usage: --pipeline=<name> --task=<text> | --agent=<name> --message=<text> | --list"
                + " [--timeout=<seconds>] [--verbose]");
        exitCode = EXIT_USAGE;
    }

    private Long parseTimeout(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        if (!StringUtils.isNumeric(value.trim())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "--timeout must be a positive number of seconds: " + value);
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "--timeout must be a positive number of seconds: " + value, e);
        }
    }

    private String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return StringUtils.trimToNull(values.get(values.size() - 1));
    }
}
