package com.chainpulse.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for users.
 */
public interface UserAccountRepository extends MongoRepository<UserAccount, String>, UserAccountRepositoryCustom {
}
