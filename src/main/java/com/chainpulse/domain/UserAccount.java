package com.chainpulse.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Owner of contract analyses. Only the onboarding projection of the user's default contract is
 * touched by continuous sync.
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true, sparse = true)
    private String email;
    private Onboarding onboarding = new Onboarding();
    private Instant createdAt;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Onboarding {
        private boolean completed;
        private DefaultContract defaultContract;
    }
}
