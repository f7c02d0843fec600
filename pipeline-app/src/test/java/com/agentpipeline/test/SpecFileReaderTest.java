package com.agentpipeline.test;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.infrastructure.config.SpecConverter;
import com.agentpipeline.infrastructure.config.SpecFileReader;
import com.agentpipeline.infrastructure.repository.agent.AgentSpecRepositoryImpl;
import com.agentpipeline.infrastructure.repository.pipeline.PipelineSpecRepositoryImpl;
import com.agentpipeline.types.enums.StrategyTypeEnum;
import com.agentpipeline.types.enums.SupervisorModeEnum;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public class SpecFileReaderTest {

    @TempDir
    Path tempDir;

    private SpecFileReader reader;

    @BeforeEach
    public void setUp() {
        reader = new SpecFileReader(new SpecConverter());
    }

    @Test
    public void shouldFillDefaultsForMinimalYamlAgent() throws IOException {
        Path file = write("researcher.yaml", "name: researcher\ninstructions: Find facts.\n");

        AgentSpec spec = reader.readAgent(file);

        Assertions.assertEquals("researcher", spec.getName());
        Assertions.assertEquals("spring_ai", spec.getBackend());
        Assertions.assertEquals("gpt-4o", spec.getLlm().getModel());
        Assertions.assertEquals(0.1D, spec.getLlm().getTemperature());
        Assertions.assertNull(spec.getLlm().getMaxTokens());
        Assertions.assertEquals(10, spec.getMaxTurns());
        Assertions.assertFalse(spec.isHumanInput());
        Assertions.assertTrue(spec.getTools().isEmpty());
    }

    @Test
    public void shouldReadFullYamlAgent() throws IOException {
        Path file = write("critic.yml", String.join("\n",
                "name: critic",
                "instructions: |",
                "  Review the draft.",
                "  Reply APPROVED when done.",
                "llm:",
                "  provider: openAiChatModel",
                "  model: gpt-4o-mini",
                "  temperature: 0.7",
                "  max_tokens: 512",
                "tools:",
                "  - name: styleGuide",
                "    description: Look up the house style",
                "max_turns: 3",
                "human_input: true",
                "extra:",
                "  log_requests: true",
                "  unknown_key: ignored",
                "future_field: ignored",
                ""));

        AgentSpec spec = reader.readAgent(file);

        Assertions.assertEquals("openAiChatModel", spec.getLlm().getProvider());
        Assertions.assertEquals("gpt-4o-mini", spec.getLlm().getModel());
        Assertions.assertEquals(0.7D, spec.getLlm().getTemperature());
        Assertions.assertEquals(512, spec.getLlm().getMaxTokens());
        Assertions.assertEquals("styleGuide", spec.getTools().get(0).resolveToolName());
        Assertions.assertEquals(3, spec.getMaxTurns());
        Assertions.assertTrue(spec.isHumanInput());
        Assertions.assertTrue(spec.isExtraEnabled("log_requests"));
        Assertions.assertTrue(spec.getInstructions().startsWith("Review the draft."));
    }

    @Test
    public void shouldReadJsonSupervisorPipeline() throws IOException {
        Path file = write("help-desk.json", "{\"name\":\"help-desk\",\"agents\":[\"router\",\"billing\",\"tech\"],"
                + "\"strategy\":\"supervisor\",\"supervisor_agent\":\"router\",\"supervisor_mode\":\"multi_round\","
                + "\"done_sentinel\":\"DONE\",\"max_rounds\":4}");

        PipelineSpec spec = reader.readPipeline(file);

        Assertions.assertEquals(StrategyTypeEnum.SUPERVISOR, spec.getStrategy());
        Assertions.assertEquals(List.of("router", "billing", "tech"), spec.getAgents());
        Assertions.assertEquals("router", spec.getSupervisorAgent());
        Assertions.assertEquals(SupervisorModeEnum.MULTI_ROUND, spec.getSupervisorMode());
        Assertions.assertEquals("DONE", spec.getDoneSentinel());
        Assertions.assertEquals(4, spec.getMaxRounds());
    }

    @Test
    public void shouldDefaultPipelineToSequential() throws IOException {
        Path file = write("chain.yaml", "name: chain\nagents: [a, b]\n");

        PipelineSpec spec = reader.readPipeline(file);

        Assertions.assertEquals(StrategyTypeEnum.SEQUENTIAL, spec.getStrategy());
        Assertions.assertEquals(10, spec.getMaxRounds());
        Assertions.assertEquals(SupervisorModeEnum.SINGLE_SHOT, spec.getSupervisorMode());
    }

    @Test
    public void shouldRejectUnknownStrategy() throws IOException {
        Path file = write("odd.yaml", "name: odd\nagents: [a]\nstrategy: round_robin\n");

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> reader.readPipeline(file));

        Assertions.assertTrue(ex.getMessage().contains("Unsupported strategy 'round_robin'"));
    }

    @Test
    public void shouldRejectSupervisorPipelineWithoutSupervisor() throws IOException {
        Path file = write("desk.yaml", "name: desk\nagents: [a, b]\nstrategy: supervisor\n");

        Assertions.assertThrows(PipelineConfigurationException.class, () -> reader.readPipeline(file));
    }

    @Test
    public void shouldRejectAgentWithoutInstructions() throws IOException {
        Path file = write("mute.yaml", "name: mute\n");

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> reader.readAgent(file));

        Assertions.assertTrue(ex.getMessage().contains("instructions"));
    }

    @Test
    public void shouldRejectMissingFile() {
        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> reader.readAgent(tempDir.resolve("absent.yaml")));

        Assertions.assertTrue(ex.getMessage().startsWith("Config file not found"));
    }

    @Test
    public void shouldRejectUnsupportedExtension() throws IOException {
        Path file = write("agent.toml", "name = \"x\"");

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> reader.readAgent(file));

        Assertions.assertEquals("Unsupported config format: .toml. Use .yaml, .yml, or .json", ex.getMessage());
    }

    @Test
    public void shouldRejectMalformedContent() throws IOException {
        Path file = write("broken.json", "{\"name\": ");

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                () -> reader.readAgent(file));

        Assertions.assertTrue(ex.getMessage().startsWith("Failed to parse config file"));
    }

    @Test
    public void shouldListOnlySupportedFilesInNameOrder() throws IOException {
        write("b.yml", "name: b");
        write("a.yaml", "name: a");
        write("c.json", "{}");
        write("notes.txt", "ignored");

        List<String> names = reader.listSpecFiles(tempDir).stream()
                .map(path -> path.getFileName().toString())
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of("a.yaml", "b.yml", "c.json"), names);
        Assertions.assertTrue(reader.listSpecFiles(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    public void shouldLoadRosterFromDirectory() throws IOException {
        Path agents = Files.createDirectory(tempDir.resolve("agents"));
        Files.writeString(agents.resolve("writer.yaml"), "name: writer\ninstructions: Write.\n", StandardCharsets.UTF_8);
        Files.writeString(agents.resolve("critic.json"), "{\"name\":\"critic\",\"instructions\":\"Review.\"}",
                StandardCharsets.UTF_8);

        AgentSpecRepositoryImpl repository = new AgentSpecRepositoryImpl(reader, agents.toString());
        repository.load();

        Assertions.assertEquals(List.of("critic", "writer"), repository.loadRoster().names());
        Assertions.assertEquals("Write.", repository.findByName("writer").getInstructions());
        Assertions.assertNull(repository.findByName("ghost"));
    }

    @Test
    public void shouldRejectDuplicateAgentNames() throws IOException {
        Path agents = Files.createDirectory(tempDir.resolve("agents"));
        Files.writeString(agents.resolve("one.yaml"), "name: writer\ninstructions: Write.\n", StandardCharsets.UTF_8);
        Files.writeString(agents.resolve("two.yaml"), "name: writer\ninstructions: Rewrite.\n", StandardCharsets.UTF_8);

        AgentSpecRepositoryImpl repository = new AgentSpecRepositoryImpl(reader, agents.toString());

        Assertions.assertThrows(PipelineConfigurationException.class, repository::load);
    }

    @Test
    public void shouldRejectDuplicatePipelineNames() throws IOException {
        Path pipelines = Files.createDirectory(tempDir.resolve("pipelines"));
        Files.writeString(pipelines.resolve("one.yaml"), "name: chain\nagents: [a]\n", StandardCharsets.UTF_8);
        Files.writeString(pipelines.resolve("two.yaml"), "name: chain\nagents: [b]\n", StandardCharsets.UTF_8);

        PipelineSpecRepositoryImpl repository = new PipelineSpecRepositoryImpl(reader, pipelines.toString());

        PipelineConfigurationException ex = Assertions.assertThrows(PipelineConfigurationException.class,
                repository::load);
        Assertions.assertTrue(ex.getMessage().startsWith("Duplicate pipeline name: chain"));
    }

    private Path write(String fileName, String content) throws IOException {
        return Files.writeString(tempDir.resolve(fileName), content, StandardCharsets.UTF_8);
    }
}
