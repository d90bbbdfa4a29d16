package com.chainpulse.domain;

/**
 * Field-level updates on contract_analyses.
 */
public interface ContractAnalysisRepositoryCustom {

    /**
     * Applies the update to the analysis with the given id.
     *
     * @return false when no analysis with that id exists
     */
    boolean applyUpdate(String analysisId, AnalysisUpdate update);
}
