package com.swiftload.loadservice.repository;

import com.swiftload.loadservice.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    List<UserAccount> findTop20ByOrderByCreatedAtDesc();
}
