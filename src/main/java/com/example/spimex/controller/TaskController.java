package com.example.spimex.controller;

import com.example.spimex.broker.TaskDispatcher;
import com.example.spimex.dto.ApiResponse;
import com.example.spimex.dto.TaskAcceptedResponse;
import com.example.spimex.dto.TaskStatusResponse;
import com.example.spimex.service.TaskStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api_v1/tasks")
@Tag(name = "Tasks", description = "Status of background tasks")
public class TaskController {

    private final TaskStatusService taskStatusService;
    private final TaskDispatcher dispatcher;

    @GetMapping("/{taskId}")
    @Operation(summary = "Get task status", description = "Broker status and execution history of a task")
    public ResponseEntity<ApiResponse<TaskStatusResponse>> getTask(@Parameter(description = "Task UUID") @PathVariable UUID taskId) {
        return ResponseEntity.ok(ApiResponse.success(taskStatusService.getStatus(taskId)));
    }

    @PostMapping("/refresh_cache")
    @Operation(summary = "Refresh caches", description = "Enqueue a task that clears every cached trading result response")
    public ResponseEntity<ApiResponse<TaskAcceptedResponse>> refreshCache() {
        log.info("API: Cache refresh request");

        var message = dispatcher.dispatchCacheRefresh(TradingResultsController.ORIGIN);
        var accepted = TaskAcceptedResponse.builder()
                .taskId(message.getId())
                .taskType(message.getType())
                .enqueuedAt(message.getEnqueuedAt())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(accepted, "Cache refresh enqueued"));
    }
}
