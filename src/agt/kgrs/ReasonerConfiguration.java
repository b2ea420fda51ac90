package kgrs;

import kgrs.capabilities.ConfigResolver;
import kgrs.core.rdf.NamespaceLoader;
import kgrs.core.rules.library.RecommendationStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for the reasoning service.
 *
 * Supports configuration via:
 * - Direct builder pattern
 * - Environment variables, system properties or a .env file
 */
public class ReasonerConfiguration {

    public static final String DEFAULT_NAMESPACE = "http://users.jyu.fi/~tanibir/";
    public static final String DEFAULT_PREFIX = "ex";

    // Namespaces
    private final String defaultPrefix;
    private final String defaultNamespace;
    private final List<String> namespaceSources;

    // Rules
    private final RecommendationStep.Variant recommendationVariant;
    private final boolean traceEnabled;

    private ReasonerConfiguration(Builder builder) {
        this.defaultPrefix = builder.defaultPrefix;
        this.defaultNamespace = builder.defaultNamespace;
        this.namespaceSources = Collections.unmodifiableList(new ArrayList<>(builder.namespaceSources));
        this.recommendationVariant = builder.recommendationVariant;
        this.traceEnabled = builder.traceEnabled;
    }

    public String getDefaultPrefix() {
        return defaultPrefix;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public List<String> getNamespaceSources() {
        return namespaceSources;
    }

    public RecommendationStep.Variant getRecommendationVariant() {
        return recommendationVariant;
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public static ReasonerConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder initialized from the environment.
     *
     * Looks for:
     * - KGRS_DEFAULT_NAMESPACE, KGRS_DEFAULT_PREFIX
     * - KGRS_NAMESPACE_SOURCES (comma separated)
     * - KGRS_RECOMMENDATION (preference or borrowing)
     * - KGRS_TRACE (true or false)
     *
     * @throws IllegalArgumentException for an unknown recommendation variant
     */
    public static Builder fromEnvironment() {
        Builder builder = new Builder();

        String namespace = ConfigResolver.setting("default.namespace");
        if (namespace != null) builder.defaultNamespace(namespace);

        String prefix = ConfigResolver.setting("default.prefix");
        if (prefix != null) builder.defaultPrefix(prefix);

        List<String> sources = ConfigResolver.settingList("namespace.sources");
        if (!sources.isEmpty()) builder.namespaceSources(sources);

        String variant = ConfigResolver.setting("recommendation");
        if (variant != null) {
            builder.recommendationVariant(
                RecommendationStep.Variant.valueOf(variant.toUpperCase(Locale.ROOT)));
        }

        String trace = ConfigResolver.setting("trace");
        if (trace != null) builder.traceEnabled(Boolean.parseBoolean(trace));

        return builder;
    }

    @Override
    public String toString() {
        return "ReasonerConfiguration{" +
            "defaultPrefix='" + defaultPrefix + '\'' +
            ", defaultNamespace='" + defaultNamespace + '\'' +
            ", namespaceSources=" + namespaceSources +
            ", recommendationVariant=" + recommendationVariant +
            ", traceEnabled=" + traceEnabled +
            '}';
    }

    /**
     * Builder for ReasonerConfiguration.
     */
    public static class Builder {
        private String defaultPrefix = DEFAULT_PREFIX;
        private String defaultNamespace = DEFAULT_NAMESPACE;
        private List<String> namespaceSources = List.of(NamespaceLoader.DEFAULT_SOURCE);
        private RecommendationStep.Variant recommendationVariant = RecommendationStep.Variant.PREFERENCE;
        private boolean traceEnabled = true;

        public Builder defaultPrefix(String defaultPrefix) {
            this.defaultPrefix = defaultPrefix;
            return this;
        }

        public Builder defaultNamespace(String defaultNamespace) {
            this.defaultNamespace = defaultNamespace;
            return this;
        }

        public Builder namespaceSources(List<String> namespaceSources) {
            this.namespaceSources = namespaceSources;
            return this;
        }

        public Builder recommendationVariant(RecommendationStep.Variant variant) {
            this.recommendationVariant = variant;
            return this;
        }

        public Builder traceEnabled(boolean traceEnabled) {
            this.traceEnabled = traceEnabled;
            return this;
        }

        public ReasonerConfiguration build() {
            if (defaultNamespace == null || defaultNamespace.isBlank()) {
                throw new IllegalStateException("Default namespace must be set");
            }
            if (defaultPrefix == null || defaultPrefix.isBlank()) {
                throw new IllegalStateException("Default prefix must be set");
            }
            return new ReasonerConfiguration(this);
        }
    }
}
