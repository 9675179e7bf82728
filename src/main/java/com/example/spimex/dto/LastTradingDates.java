package com.example.spimex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Trading days found among the requested number of most recent calendar days, newest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LastTradingDates {

    @Builder.Default
    private List<LocalDate> lastTradingDates = new ArrayList<>();
}
