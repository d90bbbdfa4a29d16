package com.chainpulse.domain;

public interface UserAccountRepositoryCustom {

    /**
     * Applies the update to the user's default contract.
     *
     * @return false when the user does not exist or has no default contract
     */
    boolean updateDefaultContract(String userId, DefaultContractUpdate update);
}
