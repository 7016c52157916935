package com.strategylab.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.strategylab.domain.model.RunMetrics;
import com.strategylab.domain.model.RunResult;
import com.strategylab.entity.BatchJobRunEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between RunResult and BatchJobRunEntity. Variables and metrics are
 * JSON objects in the entity.
 */
@Mapper
public interface BatchJobRunMapper {

    TypeReference<Map<String, String>> VARIABLES_TYPE = new TypeReference<>() {};

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "batchJobId", ignore = true)
    @Mapping(source = "variables", target = "variables", qualifiedByName = "variablesToJson")
    @Mapping(source = "metrics", target = "metrics", qualifiedByName = "metricsToJson")
    BatchJobRunEntity toEntity(RunResult run);

    @Mapping(source = "variables", target = "variables", qualifiedByName = "jsonToVariables")
    @Mapping(source = "metrics", target = "metrics", qualifiedByName = "jsonToMetrics")
    RunResult toDomain(BatchJobRunEntity entity);

    List<RunResult> toDomainList(List<BatchJobRunEntity> entities);

    @Named("variablesToJson")
    default String variablesToJson(Map<String, String> variables) {
        return JsonHelper.toJson(variables);
    }

    @Named("jsonToVariables")
    default Map<String, String> jsonToVariables(String json) {
        return JsonHelper.fromJson(json, VARIABLES_TYPE);
    }

    @Named("metricsToJson")
    default String metricsToJson(RunMetrics metrics) {
        return metrics != null ? JsonHelper.toJson(metrics.toMap()) : null;
    }

    @Named("jsonToMetrics")
    default RunMetrics jsonToMetrics(String json) {
        Map<String, Double> values = JsonHelper.fromJson(json, new TypeReference<Map<String, Double>>() {});
        return values != null ? RunMetrics.of(values) : null;
    }
}
