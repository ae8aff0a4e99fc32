package com.strategist.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Classified project analysis consumed by the planning pipeline.
 * <p>
 * Produced upstream by a {@link com.strategist.core.analysis.ProjectAnalyzer}
 * (or supplied directly by the caller) and optionally revised by an
 * {@link com.strategist.core.analysis.AnalysisRefiner} before any stage runs.
 *
 * @param domain               project domain (e.g. "web", "api", "data"); nullable
 * @param complexity           complexity label (e.g. "medium", "alta"); nullable
 * @param keywords             keywords extracted from the project description
 * @param technologyStack      technology hints
 * @param patterns             identified project patterns
 * @param implicitRequirements requirements inferred but not stated
 */
public record AnalysisResult(
    String domain,
    String complexity,
    List<String> keywords,
    List<String> technologyStack,
    List<String> patterns,
    List<String> implicitRequirements
) implements Serializable {

    public AnalysisResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        technologyStack = technologyStack == null ? List.of() : List.copyOf(technologyStack);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        implicitRequirements = implicitRequirements == null ? List.of() : List.copyOf(implicitRequirements);
    }

    public static AnalysisResult of(String domain, String complexity) {
        return new AnalysisResult(domain, complexity, List.of(), List.of(), List.of(), List.of());
    }

    public Optional<Complexity> complexityLevel() {
        return Complexity.fromLabel(complexity);
    }

    public AnalysisResult withDomain(String newDomain) {
        return new AnalysisResult(newDomain, complexity, keywords, technologyStack, patterns, implicitRequirements);
    }

    public AnalysisResult withComplexity(String newComplexity) {
        return new AnalysisResult(domain, newComplexity, keywords, technologyStack, patterns, implicitRequirements);
    }
}
