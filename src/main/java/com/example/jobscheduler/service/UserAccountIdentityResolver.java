package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.UserAccount;
import com.example.jobscheduler.repo.UserAccountRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class UserAccountIdentityResolver implements IdentityResolver {

    private final UserAccountRepo userRepo;

    @Override
    public Optional<String> resolveInternalId(String externalUserId) {
        if (!StringUtils.hasText(externalUserId)) return Optional.empty();
        return userRepo.findByExternalUserId(externalUserId.trim()).map(UserAccount::getId);
    }
}
