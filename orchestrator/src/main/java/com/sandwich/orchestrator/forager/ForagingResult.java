package com.sandwich.orchestrator.forager;

import com.sandwich.orchestrator.source.SourceResult;

import java.util.UUID;

/**
 * Content found by one successful forage.
 *
 * @param curiosityPrompt the directed query used, or null for a random fetch
 * @param logId           identifies this forage in logs and checkpoints
 */
public record ForagingResult(
        SourceResult sourceResult,
        String       sourceName,
        String       curiosityPrompt,
        UUID         logId
) {

    public ForagingResult(SourceResult sourceResult, String sourceName, String curiosityPrompt) {
        this(sourceResult, sourceName, curiosityPrompt, UUID.randomUUID());
    }
}
