package kgrs.core.rules;

import kgrs.core.rdf.Namespaces;
import kgrs.core.rules.library.LibraryRuleTier;
import kgrs.core.rules.library.LibraryVocabulary;
import kgrs.core.rules.library.RecommendationStep;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Registry for rule tiers.
 * Holds at most one tier per {@link RuleMode.Kind}; NONE never has a tier.
 */
public class RuleTierRegistry {

    private static final Logger logger = Logger.getLogger(RuleTierRegistry.class.getName());

    private final Map<RuleMode.Kind, RuleTier> tiers = new EnumMap<>(RuleMode.Kind.class);

    /**
     * Register a tier.
     *
     * @param tier The tier to register
     * @throws IllegalArgumentException if a tier for the same kind already exists,
     *         or the tier claims the NONE kind
     */
    public void register(RuleTier tier) {
        if (tier.getKind() == RuleMode.Kind.NONE) {
            throw new IllegalArgumentException("NONE cannot have a tier: " + tier.getId());
        }
        if (tiers.containsKey(tier.getKind())) {
            throw new IllegalArgumentException(
                "Tier already registered for " + tier.getKind() + ": " + tiers.get(tier.getKind()).getId());
        }
        tiers.put(tier.getKind(), tier);
        logger.info("Registered rule tier " + tier.getId() + ": " + tier.getDescription());
    }

    public void registerAll(RuleTier... tiers) {
        for (RuleTier tier : tiers) {
            register(tier);
        }
    }

    /**
     * Get the tier serving a mode kind.
     */
    public Optional<RuleTier> getTier(RuleMode.Kind kind) {
        return Optional.ofNullable(tiers.get(kind));
    }

    /**
     * Get all registered tiers, in kind order.
     */
    public Collection<RuleTier> getAll() {
        return Collections.unmodifiableCollection(tiers.values());
    }

    public boolean isEmpty() {
        return tiers.isEmpty();
    }

    public int size() {
        return tiers.size();
    }

    /**
     * Create a registry with the built-in tiers for the given namespaces.
     * The library vocabulary lives in the default namespace.
     */
    public static RuleTierRegistry withDefaults(Namespaces namespaces, RecommendationStep.Variant variant) {
        LibraryVocabulary vocab = LibraryVocabulary.of(namespaces);
        RuleTierRegistry registry = new RuleTierRegistry();
        registry.registerAll(
            LibraryRuleTier.basic(vocab),
            LibraryRuleTier.advanced(vocab, variant),
            new HeuristicRuleTier(vocab),
            new DeclarativeRuleTier(new RuleParser(namespaces)));
        return registry;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (RuleTier tier : tiers.values()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(tier.getDescription());
        }
        return String.format("RuleTierRegistry{%d tiers: %s}", tiers.size(), sb);
    }
}
