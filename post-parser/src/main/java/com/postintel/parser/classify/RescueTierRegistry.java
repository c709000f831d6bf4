package com.postintel.parser.classify;

import com.postintel.parser.config.PostParserProperties;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.taxonomy.RescueTier;
import com.postintel.parser.taxonomy.TaxonomyLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered rescue tiers, held copy-on-write so readers never see a half-applied change.
 *
 * Starts with the taxonomy's tiers, then applies any advisory proposals
 * (post-parser.taxonomy.proposed-rescue-tiers) at their requested positions.
 * Proposals are optional; the engine runs the same without them.
 */
@Component
@Slf4j
public class RescueTierRegistry {

    private volatile List<RescueTier> tiers;

    @Autowired
    public RescueTierRegistry(KeywordTaxonomy taxonomy, TaxonomyLoader loader, PostParserProperties properties) {
        this.tiers = List.copyOf(taxonomy.rescueTiers());
        for (TaxonomyLoader.RescueProposal proposal : loader.loadProposals(properties.getTaxonomy().getProposedRescueTiers())) {
            insert(proposal.position(), proposal.tier());
        }
    }

    public RescueTierRegistry(List<RescueTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    /** Current snapshot, in evaluation order. */
    public List<RescueTier> tiers() {
        return tiers;
    }

    /**
     * Inserts a tier at a priority position (0 = evaluated first). Out-of-range positions
     * are clamped. A tier with an existing tag replaces that tier.
     */
    public synchronized void insert(int position, RescueTier tier) {
        List<RescueTier> next = new ArrayList<>(tiers);
        next.removeIf(t -> t.tag().equals(tier.tag()));
        int at = Math.max(0, Math.min(position, next.size()));
        next.add(at, tier);
        tiers = List.copyOf(next);
        log.info("Rescue tier '{}' installed at position {} ({} tiers)", tier.tag(), at, next.size());
    }
}
