package com.example.jobscheduler.repo;

import com.example.jobscheduler.domain.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAccountRepo extends JpaRepository<UserAccount, String> {
    Optional<UserAccount> findByExternalUserId(String externalUserId);
}
