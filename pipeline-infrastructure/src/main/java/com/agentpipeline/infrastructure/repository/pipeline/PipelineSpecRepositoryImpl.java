package com.agentpipeline.infrastructure.repository.pipeline;

import com.agentpipeline.domain.pipeline.adapter.repository.IPipelineSpecRepository;
import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;
import com.agentpipeline.infrastructure.config.SpecFileReader;
import com.agentpipeline.types.exception.PipelineConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于配置目录的流水线仓储。
 */
@Slf4j
@Repository
public class PipelineSpecRepositoryImpl implements IPipelineSpecRepository {

    private final SpecFileReader specFileReader;
    private final Path pipelinesDir;
    private volatile Map<String, PipelineSpec> pipelines = Collections.emptyMap();

    public PipelineSpecRepositoryImpl(SpecFileReader specFileReader,
                                      @Value("${agent-pipeline.config.pipelines-dir:config/pipelines}") String pipelinesDir) {
        this.specFileReader = specFileReader;
        this.pipelinesDir = Paths.get(pipelinesDir);
    }

    @PostConstruct
    public void load() {
        Map<String, PipelineSpec> loaded = new LinkedHashMap<>();
        for (Path file : specFileReader.listSpecFiles(pipelinesDir)) {
            PipelineSpec spec = specFileReader.readPipeline(file);
            if (loaded.putIfAbsent(spec.getName(), spec) != null) {
                throw new PipelineConfigurationException("Duplicate pipeline name: " + spec.getName() + " in " + file);
            }
        }
        this.pipelines = Collections.unmodifiableMap(loaded);
        log.info("PIPELINE_SPECS_LOADED dir={}, count={}, pipelines={}",
                pipelinesDir.toAbsolutePath(), loaded.size(), loaded.keySet());
    }

    @Override
    public PipelineSpec findByName(String name) {
        return name == null ? null : pipelines.get(name);
    }

    @Override
    public List<PipelineSpec> findAll() {
        return new ArrayList<>(pipelines.values());
    }
}
