package com.sandwich.orchestrator.forager;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Forager tuning, bound from {@code sandwich.forager.*}.
 *
 * @param successesToPromote consecutive successes before moving up one tier
 * @param failuresToDemote   consecutive failures before moving down one tier
 * @param maxPatience        consecutive failed forages tolerated before a session gives up
 * @param useCuriosity       ask the language model for a directed query before each forage
 * @param recentTopicWindow  how many recent sandwich names are passed to curiosity generation
 */
@ConfigurationProperties(prefix = "sandwich.forager")
public record ForagerProperties(
        int     successesToPromote,
        int     failuresToDemote,
        int     maxPatience,
        Boolean useCuriosity,
        int     recentTopicWindow
) {

    public ForagerProperties {
        if (successesToPromote <= 0) successesToPromote = 5;
        if (failuresToDemote <= 0)   failuresToDemote = 3;
        if (maxPatience <= 0)        maxPatience = 5;
        if (useCuriosity == null)    useCuriosity = Boolean.TRUE;
        if (recentTopicWindow <= 0)  recentTopicWindow = 10;
    }

    public static ForagerProperties defaults() {
        return new ForagerProperties(0, 0, 0, null, 0);
    }
}
