package com.example.spimex.broker;

import com.example.spimex.config.TaskQueueProperties;
import com.example.spimex.domain.enums.TaskType;
import com.example.spimex.exception.BrokerUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Producer side of the broker, used by the API and the beat.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskDispatcher {

    public static final String TARGET_DATE = "targetDate";
    public static final String FORCE = "force";

    private final RedisTaskQueue taskQueue;
    private final TaskQueueProperties properties;

    public TaskMessage dispatchImport(LocalDate targetDate, boolean force, String origin) {
        var payload = new HashMap<String, Object>();
        payload.put(TARGET_DATE, targetDate.toString());
        payload.put(FORCE, force);
        return dispatch(TaskType.IMPORT_BULLETINS, payload, origin);
    }

    public TaskMessage dispatchCacheRefresh(String origin) {
        return dispatch(TaskType.REFRESH_CACHE, Map.of(), origin);
    }

    /**
     * Enqueue a new task.
     *
     * @throws BrokerUnavailableException if the broker cannot be reached
     */
    public TaskMessage dispatch(TaskType type, Map<String, Object> payload, String origin) {
        var message = TaskMessage.create(type, payload, properties.getDefaultMaxRetries(), origin);
        try {
            taskQueue.enqueue(message);
            return message;
        } catch (DataAccessException e) {
            log.error("Failed to enqueue {} task from {}: {}", type, origin, e.getMessage());
            throw new BrokerUnavailableException("Task broker unavailable, " + type.getDisplayName() + " not enqueued", e);
        }
    }
}
