package com.agentpipeline.domain.pipeline.adapter.repository;

import com.agentpipeline.domain.pipeline.model.valobj.PipelineSpec;

import java.util.List;

/**
 * 流水线配置仓储接口。
 */
public interface IPipelineSpecRepository {

    PipelineSpec findByName(String name);

    List<PipelineSpec> findAll();
}
