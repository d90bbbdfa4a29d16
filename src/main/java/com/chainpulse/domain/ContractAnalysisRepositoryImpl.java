package com.chainpulse.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed partial updates for contract_analyses: {@code $set} per field, {@code $push $each} for logs.
 */
@Repository
@RequiredArgsConstructor
public class ContractAnalysisRepositoryImpl implements ContractAnalysisRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean applyUpdate(String analysisId, AnalysisUpdate update) {
        Update mongoUpdate = new Update();
        if (update.getStatus() != null) {
            mongoUpdate.set("status", update.getStatus());
        }
        if (update.getProgress() != null) {
            mongoUpdate.set("progress", update.getProgress());
        }
        update.getMetadataFields().forEach((field, value) -> mongoUpdate.set("metadata." + field, value));
        if (!update.getLogs().isEmpty()) {
            mongoUpdate.push("logs").each(update.getLogs().toArray());
        }
        if (update.getResults() != null) {
            mongoUpdate.set("results", update.getResults());
        }
        if (update.getErrorMessage() != null) {
            mongoUpdate.set("errorMessage", update.getErrorMessage());
        }
        if (update.getCompletedAt() != null) {
            mongoUpdate.set("completedAt", update.getCompletedAt());
        }
        if (update.isReopen()) {
            mongoUpdate.unset("errorMessage");
            mongoUpdate.unset("completedAt");
            mongoUpdate.unset("metadata." + SyncMetadata.CONTINUOUS_STOPPED);
        }
        mongoUpdate.set("updatedAt", Instant.now());
        Query query = new Query(where("_id").is(analysisId));
        return mongoTemplate.updateFirst(query, mongoUpdate, ContractAnalysis.class).getMatchedCount() > 0;
    }
}
