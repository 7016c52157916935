package com.strategylab.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.strategylab.domain.model.BatchJob;
import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.StrategyDefinition;
import com.strategylab.domain.model.VariableDetail;
import com.strategylab.entity.BatchJobEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the BatchJob snapshot and BatchJobEntity.
 *
 * <p>Detail and summary are stored as JSON text. The base strategy and assignment list
 * are not part of the snapshot; they are written once at creation through the
 * {@code strategyToJson}/{@code assignmentsToJson} helpers and read back only when a job
 * is resumed.
 */
@Mapper
public interface BatchJobMapper {

    TypeReference<List<Map<String, String>>> ASSIGNMENTS_TYPE = new TypeReference<>() {};

    @Mapping(source = "detail", target = "detail", qualifiedByName = "detailToJson")
    @Mapping(source = "summary", target = "summary", qualifiedByName = "summaryToJson")
    @Mapping(target = "strategy", ignore = true)
    @Mapping(target = "assignments", ignore = true)
    BatchJobEntity toEntity(BatchJob job);

    @Mapping(source = "detail", target = "detail", qualifiedByName = "jsonToDetail")
    @Mapping(source = "summary", target = "summary", qualifiedByName = "jsonToSummary")
    BatchJob toDomain(BatchJobEntity entity);

    List<BatchJob> toDomainList(List<BatchJobEntity> entities);

    /** Copies the mutable progress fields of a snapshot onto an existing row. */
    @Mapping(source = "detail", target = "detail", qualifiedByName = "detailToJson")
    @Mapping(source = "summary", target = "summary", qualifiedByName = "summaryToJson")
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "strategy", ignore = true)
    @Mapping(target = "assignments", ignore = true)
    void updateEntity(BatchJob job, @MappingTarget BatchJobEntity entity);

    @Named("detailToJson")
    default String detailToJson(List<VariableDetail> detail) {
        return JsonHelper.toJson(detail);
    }

    @Named("jsonToDetail")
    default List<VariableDetail> jsonToDetail(String json) {
        return JsonHelper.fromJsonList(json, VariableDetail.class);
    }

    @Named("summaryToJson")
    default String summaryToJson(BatchJobSummary summary) {
        return JsonHelper.toJson(summary);
    }

    @Named("jsonToSummary")
    default BatchJobSummary jsonToSummary(String json) {
        return JsonHelper.fromJson(json, BatchJobSummary.class);
    }

    default String strategyToJson(StrategyDefinition strategy) {
        return JsonHelper.toJson(strategy);
    }

    default StrategyDefinition jsonToStrategy(String json) {
        return JsonHelper.fromJson(json, StrategyDefinition.class);
    }

    default String assignmentsToJson(List<Map<String, String>> assignments) {
        return JsonHelper.toJson(assignments, ASSIGNMENTS_TYPE);
    }

    default List<Map<String, String>> jsonToAssignments(String json) {
        List<Map<String, String>> assignments = JsonHelper.fromJson(json, ASSIGNMENTS_TYPE);
        return assignments != null ? assignments : List.of();
    }
}
