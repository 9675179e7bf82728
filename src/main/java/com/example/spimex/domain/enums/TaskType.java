package com.example.spimex.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Defines the types of tasks carried by the broker.
 * Each task type maps to a specific handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    /**
     * Download and store SPIMEX bulletins from a target date up to today
     */
    IMPORT_BULLETINS("import-bulletins", "Bulletin Import"),

    /**
     * Drop every cached trading result response
     */
    REFRESH_CACHE("refresh-cache", "Cache Refresh");

    private final String code;
    private final String displayName;
}
