package com.chainpulse.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@Repository
@RequiredArgsConstructor
public class UserAccountRepositoryImpl implements UserAccountRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean updateDefaultContract(String userId, DefaultContractUpdate update) {
        Update mongoUpdate = new Update();
        setIfPresent(mongoUpdate, "lastAnalysisId", update.getLastAnalysisId());
        setIfPresent(mongoUpdate, "indexed", update.getIndexed());
        setIfPresent(mongoUpdate, "indexingProgress", update.getIndexingProgress());
        setIfPresent(mongoUpdate, "continuousSync", update.getContinuousSync());
        setIfPresent(mongoUpdate, "continuousSyncStarted", update.getContinuousSyncStarted());
        setIfPresent(mongoUpdate, "continuousSyncStopped", update.getContinuousSyncStopped());
        setIfPresent(mongoUpdate, "lastUpdate", update.getLastUpdate());
        setIfPresent(mongoUpdate, "completionReason", update.getCompletionReason());
        if (update.isClearError()) {
            mongoUpdate.unset(DefaultContract.PATH + ".error");
        } else {
            setIfPresent(mongoUpdate, "error", update.getError());
        }
        if (mongoUpdate.getUpdateObject().isEmpty()) {
            return false;
        }
        Query query = new Query(where("_id").is(userId).and(DefaultContract.PATH).exists(true));
        return mongoTemplate.updateFirst(query, mongoUpdate, UserAccount.class).getMatchedCount() > 0;
    }

    private static void setIfPresent(Update update, String field, Object value) {
        if (value != null) {
            update.set(DefaultContract.PATH + "." + field, value);
        }
    }
}
