package ch.so.arp.rag.hybrid.parameter;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * One retrieval perspective with its own traversal priors and the relation
 * types it may follow.
 *
 * @param relationPriors        prior traversal weight per relation type
 * @param defaultRelationWeight prior of allowed relations without an explicit prior
 * @param allowedRelations      relation types traversed by this strategy
 * @param alphaPrior            prior of the vector/graph mixing coefficient
 * @param gatingPrior           prior bias of this strategy in the gating network
 */
public record Strategy(
        String id,
        Map<String, Double> relationPriors,
        double defaultRelationWeight,
        Set<String> allowedRelations,
        double alphaPrior,
        double gatingPrior) {

    public Strategy {
        Objects.requireNonNull(id, "id");
        relationPriors = Map.copyOf(new TreeMap<>(relationPriors));
        Set<String> allowed = new LinkedHashSet<>(allowedRelations == null ? Set.of() : allowedRelations);
        if (allowed.isEmpty()) {
            allowed.addAll(new TreeMap<>(relationPriors).keySet());
        }
        allowedRelations = Set.copyOf(allowed);
        requireUnit("defaultRelationWeight", defaultRelationWeight);
        requireUnit("alphaPrior", alphaPrior);
        requireUnit("gatingPrior", gatingPrior);
        relationPriors.forEach((relation, prior) -> requireUnit("prior of " + relation, prior));
    }

    public boolean allows(String relationType) {
        return allowedRelations.contains(relationType);
    }

    public double priorFor(String relationType) {
        return relationPriors.getOrDefault(relationType, defaultRelationWeight);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw new IllegalArgumentException(name + " must be within [0,1] but was " + value);
        }
    }
}
