package com.example.jobscheduler.service;

import java.util.Optional;

/**
 * 外部认证身份 -> 内部用户 id。
 */
public interface IdentityResolver {
    Optional<String> resolveInternalId(String externalUserId);
}
