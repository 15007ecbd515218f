package com.swiftload.loadservice.service;

import com.swiftload.common.exception.ResourceNotFoundException;
import com.swiftload.loadservice.dto.UserProfileResponse;
import com.swiftload.loadservice.mapper.UserAccountMapper;
import com.swiftload.loadservice.model.UserAccount;
import com.swiftload.loadservice.repository.UserAccountRepository;
import com.swiftload.loadservice.security.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccountServiceImpl implements UserAccountService {

    private final UserAccountRepository userAccountRepository;
    private final UserAccountMapper userAccountMapper;

    @Override
    @Transactional
    public UserProfileResponse getOrCreateProfile(Jwt jwt, Actor actor) {
        UUID userId = actor.getUserId();

        UserAccount account = userAccountRepository.findById(userId)
                .orElseGet(() -> {
                    log.info("User {} not found in database. Creating new profile (first login).", userId);
                    UserAccount newAccount = new UserAccount();
                    newAccount.setId(userId);
                    return newAccount;
                });

        // the identity provider is the source of truth for these
        account.setRole(actor.getRole());
        account.setName(jwt.getClaimAsString("name"));
        account.setEmail(jwt.getClaimAsString("email"));
        account.setCompany(jwt.getClaimAsString("company"));
        account.setPhone(jwt.getClaimAsString("phone_number"));
        account.setMcNumber(jwt.getClaimAsString("mc_number"));

        UserAccount saved = userAccountRepository.save(account);
        log.info("User profile loaded/created: id={}, role={}", saved.getId(), saved.getRole());
        return userAccountMapper.toUserProfileResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(UUID userId) {
        UserAccount account = userAccountRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found: userId={}", userId);
                    return new ResourceNotFoundException("User not found with id: " + userId);
                });
        return userAccountMapper.toUserProfileResponse(account);
    }
}
