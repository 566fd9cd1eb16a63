package com.sandwich.orchestrator.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All enabled {@link ContentSource} beans, grouped by tier.
 *
 * Spring collects every source bean and passes the list here; enabling a
 * new source only requires declaring it as a {@code @Component}.
 */
@Component
public class SourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);

    private final Map<Integer, List<ContentSource>> tiers;

    public SourceCatalog(List<ContentSource> allSources) {
        Map<Integer, List<ContentSource>> grouped = new TreeMap<>();
        for (ContentSource source : allSources) {
            grouped.computeIfAbsent(source.tier(), t -> new ArrayList<>()).add(source);
            log.info("Registered content source '{}' at tier {}", source.name(), source.tier());
        }
        grouped.replaceAll((tier, sources) -> List.copyOf(sources));
        this.tiers = Collections.unmodifiableMap(grouped);
    }

    /** Tier → sources, ordered by tier. Possibly empty. */
    public Map<Integer, List<ContentSource>> tiers() {
        return tiers;
    }
}
