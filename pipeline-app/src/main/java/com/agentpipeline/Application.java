package com.agentpipeline;

import com.agentpipeline.trigger.cli.PipelineCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 多 Agent 流水线编排服务启动类。
 * <p>
 * 无命令参数时以 Web 服务运行；带 --pipeline / --agent / --list 时以命令行方式运行一次后退出。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(Application.class);
        boolean commandInvocation = PipelineCommandLineRunner.isCommandInvocation(args);
        if (commandInvocation) {
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setAdditionalProfiles("cli");
        }
        ConfigurableApplicationContext context = application.run(args);
        if (commandInvocation) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
