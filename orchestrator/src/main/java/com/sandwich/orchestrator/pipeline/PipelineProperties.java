package com.sandwich.orchestrator.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session pipeline tuning, bound from {@code sandwich.pipeline.*}.
 *
 * @param minContentLength shortest normalised content worth identifying
 * @param maxContentLength content is truncated to this many characters
 * @param acceptThreshold  validation score at or above which a sandwich is accepted
 * @param reviewThreshold  validation score at or above which a sandwich is kept for review
 * @param resumeOnStartup  resume sessions left unfinished by a previous run
 */
@ConfigurationProperties(prefix = "sandwich.pipeline")
public record PipelineProperties(
        int     minContentLength,
        int     maxContentLength,
        Double  acceptThreshold,
        Double  reviewThreshold,
        boolean resumeOnStartup
) {

    public PipelineProperties {
        if (minContentLength <= 0) minContentLength = 200;
        if (maxContentLength <= 0) maxContentLength = 10_000;
        if (acceptThreshold == null) acceptThreshold = 0.7;
        if (reviewThreshold == null) reviewThreshold = 0.5;
        if (reviewThreshold > acceptThreshold) {
            throw new IllegalArgumentException("reviewThreshold " + reviewThreshold
                    + " exceeds acceptThreshold " + acceptThreshold);
        }
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(0, 0, null, null, false);
    }
}
