package com.sandwich.orchestrator.pipeline;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.SandwichStatus;
import com.sandwich.orchestrator.model.ValidationResult;
import org.springframework.stereotype.Component;

/**
 * Turns a validation score into the VALIDATING state's outcome.
 */
@Component
public class ValidationPolicy {

    public enum Verdict {
        ACCEPTED(PipelineEvent.ACCEPTED, SandwichStatus.ACCEPTED),
        REVIEW(PipelineEvent.REVIEW,     SandwichStatus.PENDING_REVIEW),
        REJECTED(PipelineEvent.REJECTED, null);

        private final PipelineEvent  event;
        private final SandwichStatus status;

        Verdict(PipelineEvent event, SandwichStatus status) {
            this.event  = event;
            this.status = status;
        }

        public PipelineEvent event() { return event; }

        /** Status the sandwich is stored with; null for REJECTED, which is not stored. */
        public SandwichStatus status() { return status; }
    }

    private final PipelineProperties config;

    public ValidationPolicy(PipelineProperties config) {
        this.config = config;
    }

    public Verdict decide(ValidationResult result) {
        double score = result.overallScore();
        if (score >= config.acceptThreshold()) return Verdict.ACCEPTED;
        if (score >= config.reviewThreshold()) return Verdict.REVIEW;
        return Verdict.REJECTED;
    }
}
