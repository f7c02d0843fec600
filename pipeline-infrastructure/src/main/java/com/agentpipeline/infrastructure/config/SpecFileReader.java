package com.agentpipeline.infrastructure.config;

import com.agentpipeline.domain.agent.model.valobj.AgentSpec;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.infrastructure.config.po.AgentConfigPO;
import com.agentpipeline.infrastructure.config.po.PipelineConfigPO;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 读取 Agent / 流水线配置文件。
 * <p>
 * 按扩展名选择格式：.yaml / .yml 为 YAML，.json 为 JSON；
 * 文件缺失、格式不支持、解析失败或字段非法都抛出 {@link PipelineConfigurationException}。
 * </p>
 *
 * @author agentpipeline
 * @since 2026-03-02
 */
@Slf4j
@Component
public class SpecFileReader {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final SpecConverter converter;

    public SpecFileReader(SpecConverter converter) {
        this.converter = converter;
    }

    public AgentSpec readAgent(Path path) {
        AgentSpec spec = converter.toAgentSpec(read(path, AgentConfigPO.class), path.toString());
        spec.validate();
        return spec;
    }

    public PipelineSpec readPipeline(Path path) {
        PipelineSpec spec = converter.toPipelineSpec(read(path, PipelineConfigPO.class), path.toString());
        spec.validate();
        return spec;
    }

    /**
     * 列出目录下支持的配置文件，按文件名排序；目录不存在时返回空列表。
     */
    public List<Path> listSpecFiles(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("SPEC_DIRECTORY_MISSING dir={}", directory);
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> isSupported(path))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to list config directory: " + directory, e);
        }
    }

    private <T> T read(Path path, Class<T> type) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new PipelineConfigurationException("Config file not found: " + path);
        }
        ObjectMapper mapper = mapperFor(path);
        try {
            T value = mapper.readValue(path.toFile(), type);
            if (value == null) {
                throw new PipelineConfigurationException("Config file is empty: " + path);
            }
            return value;
        } catch (IOException e) {
            throw new PipelineConfigurationException("Failed to parse config file " + path + ": " + e.getMessage(), e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String extension = extension(path);
        if ("yaml".equals(extension) || "yml".equals(extension)) {
            return yamlMapper;
        }
        if ("json".equals(extension)) {
            return jsonMapper;
        }
        throw new PipelineConfigurationException(
                "Unsupported config format: ." + extension + ". Use .yaml, .yml, or .json");
    }

    private boolean isSupported(Path path) {
        String extension = extension(path);
        return "yaml".equals(extension) || "yml".equals(extension) || "json".equals(extension);
    }

    private String extension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
