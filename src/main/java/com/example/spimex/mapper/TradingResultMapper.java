package com.example.spimex.mapper;

import com.example.spimex.domain.entity.TaskExecutionLog;
import com.example.spimex.domain.entity.TradingResult;
import com.example.spimex.dto.TaskExecutionLogResponse;
import com.example.spimex.dto.TradingResultResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TradingResultMapper {

    @Mapping(target = "date", source = "tradeDate")
    TradingResultResponse toResponse(TradingResult result);

    List<TradingResultResponse> toResponseList(List<TradingResult> results);

    TaskExecutionLogResponse toLogResponse(TaskExecutionLog log);

    List<TaskExecutionLogResponse> toLogResponses(List<TaskExecutionLog> logs);
}
