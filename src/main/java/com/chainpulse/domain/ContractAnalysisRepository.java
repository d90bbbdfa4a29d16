package com.chainpulse.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for contract_analyses. Partial updates go through {@link ContractAnalysisRepositoryCustom}.
 */
public interface ContractAnalysisRepository extends MongoRepository<ContractAnalysis, String>, ContractAnalysisRepositoryCustom {

    Optional<ContractAnalysis> findFirstByUserIdOrderByCreatedAtDesc(String userId);
}
