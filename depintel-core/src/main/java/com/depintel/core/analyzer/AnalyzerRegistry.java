package com.depintel.core.analyzer;

import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.model.AnalysisType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Dispatch table from {@link AnalysisType} to the analyzer implementing it.
 */
public final class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<AnalysisType, Analyzer> analyzers;

    /**
     * Creates a registry from explicit analyzers.
     *
     * @param analyzers analyzers, at most one per type
     * @throws IllegalStateException when two analyzers claim the same type
     */
    public AnalyzerRegistry(Collection<? extends Analyzer> analyzers) {
        Map<AnalysisType, Analyzer> table = new EnumMap<>(AnalysisType.class);
        for (Analyzer analyzer : analyzers) {
            Analyzer previous = table.putIfAbsent(analyzer.getType(), analyzer);
            if (previous != null) {
                throw new IllegalStateException("Analyzers " + previous.getId() + " and " + analyzer.getId()
                    + " both implement " + analyzer.getType().id());
            }
        }
        this.analyzers = Collections.unmodifiableMap(table);
    }

    /**
     * Creates a registry from the analyzers registered via {@link ServiceLoader}.
     *
     * @return registry
     */
    public static AnalyzerRegistry loadInstalled() {
        List<Analyzer> discovered = ServiceLoader.load(Analyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        log.debug("Discovered {} analyzers via ServiceLoader", discovered.size());
        return new AnalyzerRegistry(discovered);
    }

    public Optional<Analyzer> find(AnalysisType type) {
        return Optional.ofNullable(analyzers.get(type));
    }

    /**
     * Returns the analyzer for a type.
     *
     * @param type analysis type
     * @return analyzer
     * @throws InvalidConfigurationException when no analyzer is installed for the type
     */
    public Analyzer require(AnalysisType type) {
        Analyzer analyzer = analyzers.get(type);
        if (analyzer == null) {
            throw new InvalidConfigurationException("No analyzer installed for analysis type " + type.id());
        }
        return analyzer;
    }

    /**
     * Resolves a wire identifier to its installed analyzer.
     *
     * @param typeId snake_case analysis type id
     * @return analyzer
     * @throws InvalidConfigurationException for unknown type ids
     */
    public Analyzer require(String typeId) {
        AnalysisType type = AnalysisType.fromId(typeId)
            .orElseThrow(() -> new InvalidConfigurationException("Unknown analysis type: " + typeId));
        return require(type);
    }

    /**
     * @return installed analyzers in {@link AnalysisType} order
     */
    public Collection<Analyzer> all() {
        return analyzers.values();
    }
}
