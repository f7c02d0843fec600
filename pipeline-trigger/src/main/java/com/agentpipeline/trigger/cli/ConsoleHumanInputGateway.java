package com.agentpipeline.trigger.cli;

import com.agentpipeline.domain.agent.adapter.gateway.IHumanInputGateway;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.types.enums.ResponseCode;
import com.agentpipeline.types.exception.AppException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 控制台人工审阅：打印草稿，读取一行输入；空行采纳草稿。
 */
@Component
@ConditionalOnProperty(prefix = "agent-pipeline.human-input", name = "console-enabled", havingValue = "true")
public class ConsoleHumanInputGateway implements IHumanInputGateway {

    private final BufferedReader in;
    private final PrintStream out;

    @Autowired
    public ConsoleHumanInputGateway() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleHumanInputGateway(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public synchronized String review(String agentName, ConversationView transcript, String draft) {
        out.println("[" + agentName + "] draft reply:");
        out.println(draft);
        out.print("Press Enter to accept, or type a replacement: ");
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim();
        } catch (IOException e) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to read human input for " + agentName, e);
        }
    }
}
