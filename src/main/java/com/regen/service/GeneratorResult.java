package com.regen.service;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of a batch generation run.
 */
@Value
@Builder
public class GeneratorResult {
    boolean success;
    String errorMessage;
    String failingPattern;

    @Singular
    List<String> outputs;

    int patternsParsed;
    int stringsGenerated;
    /** Strings cut short by an end-of-text or end-of-line marker. */
    int stoppedEarly;

    public static GeneratorResult failure(String failingPattern, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .failingPattern(failingPattern)
                .errorMessage(errorMessage)
                .build();
    }
}
