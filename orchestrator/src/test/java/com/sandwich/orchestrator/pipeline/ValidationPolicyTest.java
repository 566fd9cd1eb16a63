package com.sandwich.orchestrator.pipeline;

import com.sandwich.orchestrator.model.PipelineEvent;
import com.sandwich.orchestrator.model.SandwichStatus;
import com.sandwich.orchestrator.model.ValidationResult;
import com.sandwich.orchestrator.pipeline.ValidationPolicy.Verdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationPolicyTest {

    private final ValidationPolicy policy = new ValidationPolicy(PipelineProperties.defaults());

    @Test
    void decide_thresholdsAreInclusive() {
        assertThat(policy.decide(score(0.7))).isEqualTo(Verdict.ACCEPTED);
        assertThat(policy.decide(score(0.69))).isEqualTo(Verdict.REVIEW);
        assertThat(policy.decide(score(0.5))).isEqualTo(Verdict.REVIEW);
        assertThat(policy.decide(score(0.49))).isEqualTo(Verdict.REJECTED);
    }

    @Test
    void verdicts_mapToEventsAndStatuses() {
        assertThat(Verdict.ACCEPTED.event()).isEqualTo(PipelineEvent.ACCEPTED);
        assertThat(Verdict.ACCEPTED.status()).isEqualTo(SandwichStatus.ACCEPTED);
        assertThat(Verdict.REVIEW.event()).isEqualTo(PipelineEvent.REVIEW);
        assertThat(Verdict.REVIEW.status()).isEqualTo(SandwichStatus.PENDING_REVIEW);
        assertThat(Verdict.REJECTED.event()).isEqualTo(PipelineEvent.REJECTED);
        assertThat(Verdict.REJECTED.status()).isNull();
    }

    @Test
    void reviewAboveAccept_isRejectedAtBinding() {
        assertThatThrownBy(() -> new PipelineProperties(0, 0, 0.5, 0.8, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ValidationResult score(double overall) {
        return new ValidationResult(overall, overall, overall, overall, "");
    }
}
