package com.strategist.core.analysis;

import com.strategist.core.model.AnalysisResult;

/**
 * Classifies a natural-language project description into an {@link AnalysisResult}.
 * Implementations live outside the planner; the pipeline only consumes their output.
 */
@FunctionalInterface
public interface ProjectAnalyzer {

    AnalysisResult analyze(String projectDescription);
}
