package com.example.spimex.bulletin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one import run, per requested date
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    private LocalDate targetDate;
    private boolean force;

    @Builder.Default
    private List<LocalDate> requested = new ArrayList<>();

    @Builder.Default
    private List<LocalDate> imported = new ArrayList<>();

    @Builder.Default
    private List<LocalDate> skipped = new ArrayList<>();

    /**
     * Dates for which the exchange published no bulletin
     */
    @Builder.Default
    private List<LocalDate> missing = new ArrayList<>();

    private int rowsWritten;

    public boolean hasWrites() {
        return !imported.isEmpty();
    }

    public Map<String, Object> toResultData() {
        var data = new HashMap<String, Object>();
        data.put("targetDate", String.valueOf(targetDate));
        data.put("force", force);
        data.put("requested", requested.size());
        data.put("imported", imported.stream().map(LocalDate::toString).toList());
        data.put("skipped", skipped.stream().map(LocalDate::toString).toList());
        data.put("missing", missing.stream().map(LocalDate::toString).toList());
        data.put("rowsWritten", rowsWritten);
        return data;
    }
}
