package com.example.spimex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingResultsList {

    @Builder.Default
    private List<TradingResultResponse> tradingResults = new ArrayList<>();
}
