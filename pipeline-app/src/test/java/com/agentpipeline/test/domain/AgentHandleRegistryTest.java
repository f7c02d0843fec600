package com.agentpipeline.test.domain;

import com.agentpipeline.domain.agent.adapter.gateway.IHumanInputGateway;
import com.agentpipeline.domain.agent.adapter.runtime.IAgentHandle;
import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.agent.service.AgentHandleRegistry;
import com.agentpipeline.domain.conversation.model.valobj.ConversationView;
import com.agentpipeline.test.support.PipelineFixtures;
import com.agentpipeline.test.support.ScriptedAgentHandleFactory;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AgentHandleRegistryTest {

    private ScriptedAgentHandleFactory factory;

    @BeforeEach
    public void setUp() {
        factory = new ScriptedAgentHandleFactory().reply("writer", "draft answer");
    }

    @Test
    public void shouldRejectDuplicateBackendRegistration() {
        Assertions.assertThrows(IllegalStateException.class,
                () -> new AgentHandleRegistry(List.of(factory, new ScriptedAgentHandleFactory()), null));
    }

    @Test
    public void shouldRejectUnknownBackend() {
        AgentHandleRegistry registry = new AgentHandleRegistry(List.of(factory), null);
        AgentSpec spec = PipelineFixtures.agent("writer").toBuilder().backend("langgraph").build();

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> registry.create(spec));

        Assertions.assertTrue(ex.getMessage().contains("langgraph"));
        Assertions.assertTrue(registry.supports(ScriptedAgentHandleFactory.BACKEND));
        Assertions.assertFalse(registry.supports("langgraph"));
    }

    @Test
    public void shouldRequireGatewayForHumanInputAgents() {
        AgentHandleRegistry registry = new AgentHandleRegistry(List.of(factory), null);
        AgentSpec spec = PipelineFixtures.agent("writer").toBuilder().humanInput(true).build();

        Assertions.assertThrows(PipelineConfigurationException.class, () -> registry.create(spec));
    }

    @Test
    public void shouldReplaceDraftWithOperatorOverride() {
        IHumanInputGateway gateway = mock(IHumanInputGateway.class);
        when(gateway.review(eq("writer"), any(ConversationView.class), eq("draft answer"))).thenReturn("edited answer");
        AgentHandleRegistry registry = new AgentHandleRegistry(List.of(factory), gateway);

        IAgentHandle handle = registry.create(PipelineFixtures.agent("writer").toBuilder().humanInput(true).build());
        String reply = handle.invoke(ConversationView.ofMessage("task", "write"));

        Assertions.assertEquals("edited answer", reply);
        Assertions.assertEquals("writer", handle.getName());
        verify(gateway).review(eq("writer"), any(ConversationView.class), eq("draft answer"));
    }

    @Test
    public void shouldKeepDraftWhenOperatorSubmitsBlank() {
        IHumanInputGateway gateway = mock(IHumanInputGateway.class);
        when(gateway.review(any(), any(), any())).thenReturn("   ");
        AgentHandleRegistry registry = new AgentHandleRegistry(List.of(factory), gateway);

        IAgentHandle handle = registry.create(PipelineFixtures.agent("writer").toBuilder().humanInput(true).build());

        Assertions.assertEquals("draft answer", handle.invoke(ConversationView.ofMessage("task", "write")));
    }

    @Test
    public void shouldNotWrapAgentsWithoutHumanInput() {
        IHumanInputGateway gateway = mock(IHumanInputGateway.class);
        AgentHandleRegistry registry = new AgentHandleRegistry(List.of(factory), gateway);

        IAgentHandle handle = registry.create(PipelineFixtures.agent("writer"));

        Assertions.assertSame(factory.lastHandle("writer"), handle);
    }
}
