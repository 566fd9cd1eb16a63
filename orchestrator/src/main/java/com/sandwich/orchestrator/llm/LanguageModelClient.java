package com.sandwich.orchestrator.llm;

import com.sandwich.orchestrator.model.AssembledSandwich;
import com.sandwich.orchestrator.model.CandidateStructure;
import com.sandwich.orchestrator.model.ValidationResult;

import java.util.List;

/**
 * Language-model capabilities the pipeline needs.
 *
 * Implementations throw {@link com.sandwich.orchestrator.error.PipelineException}
 * on failure: PARSE when a response cannot be decoded, RETRYABLE once their
 * own retry budget is spent, FATAL when the API rejects the credentials.
 */
public interface LanguageModelClient {

    /** One-sentence prompt steering the next foraging round away from {@code recentTopics}. */
    String generateCuriosity(List<String> recentTopics);

    /** Sandwich candidates found in {@code content}; possibly empty. */
    List<CandidateStructure> identifyCandidates(String content);

    AssembledSandwich assemble(CandidateStructure candidate, String content);

    ValidationResult validate(AssembledSandwich sandwich, String content);
}
