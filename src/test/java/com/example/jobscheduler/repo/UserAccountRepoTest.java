package com.example.jobscheduler.repo;

import com.example.jobscheduler.domain.UserAccount;
import com.example.jobscheduler.service.UserAccountIdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(UserAccountIdentityResolver.class)
class UserAccountRepoTest {

    @Autowired
    private UserAccountRepo repo;
    @Autowired
    private UserAccountIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        UserAccount u = new UserAccount();
        u.setId("0b6f7a1e-1111-4c2e-9d7a-000000000042");
        u.setExternalUserId("auth0|abc");
        u.setDisplayName("Ops");
        u.setRole("admin");
        repo.save(u);
    }

    @Test
    void resolvesExternalIdToInternalId() {
        assertThat(resolver.resolveInternalId("auth0|abc")).contains("0b6f7a1e-1111-4c2e-9d7a-000000000042");
        assertThat(resolver.resolveInternalId(" auth0|abc ")).isPresent();
    }

    @Test
    void unknownOrBlankIdsResolveToEmpty() {
        assertThat(resolver.resolveInternalId("auth0|nobody")).isEmpty();
        assertThat(resolver.resolveInternalId("")).isEmpty();
        assertThat(resolver.resolveInternalId(null)).isEmpty();
    }
}
