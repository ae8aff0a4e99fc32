package com.strategist.core.analysis;

import com.strategist.core.model.AnalysisResult;

/**
 * Optionally revises an analysis before planning starts, e.g. after review by
 * an external collaborator. When a bean of this type is registered the engine
 * applies it once per run, before any stage.
 */
@FunctionalInterface
public interface AnalysisRefiner {

    /**
     * @return the revised analysis; returning the input unchanged is allowed
     */
    AnalysisResult refine(AnalysisResult analysis);
}
