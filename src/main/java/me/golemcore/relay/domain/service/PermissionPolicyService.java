package me.golemcore.relay.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.config.ConfigException;
import me.golemcore.relay.port.outbound.ConversationRepositoryPort;
import me.golemcore.relay.port.outbound.PersistenceException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the live {@link PermissionPolicy} snapshot.
 *
 * <p>
 * The policy is loaded once at startup: a stored policy wins, otherwise the
 * one declared under {@code bot.permission} is used and saved. A malformed
 * policy aborts startup with a {@link ConfigException}. Workers read the
 * snapshot through {@link #current()}; {@link #replace(PermissionPolicy)}
 * swaps it as a whole.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PermissionPolicyService {

    private final BotProperties properties;
    private final ConversationRepositoryPort repository;

    private final AtomicReference<PermissionPolicy> policyRef = new AtomicReference<>();

    @PostConstruct
    public void load() {
        Optional<PermissionPolicy> stored;
        try {
            stored = repository.loadPolicy();
        } catch (PersistenceException e) {
            throw new ConfigException("Stored permission policy is unreadable: " + e.getMessage(), e);
        }

        if (stored.isPresent()) {
            PermissionPolicy policy = stored.get();
            validate(policy);
            policyRef.set(policy);
            log.info("[Policy] loaded stored policy: default={}, private={}, admins={}, overrides={}",
                    policy.getDefaultTier(), policy.getPrivateTier(), policy.getAdminIds().size(),
                    policy.getOverrides().size());
            return;
        }

        PermissionPolicy configured = fromProperties(properties.getPermission());
        validate(configured);
        policyRef.set(configured);
        log.info("[Policy] using configured policy: default={}, private={}, admins={}, overrides={}",
                configured.getDefaultTier(), configured.getPrivateTier(), configured.getAdminIds().size(),
                configured.getOverrides().size());
        saveQuietly(configured);
    }

    public PermissionPolicy current() {
        PermissionPolicy policy = policyRef.get();
        if (policy == null) {
            throw new IllegalStateException("Permission policy not loaded");
        }
        return policy;
    }

    /**
     * Validates and atomically installs a new policy, then persists it
     * best-effort.
     *
     * @throws ConfigException
     *             if the policy is malformed; the current snapshot is kept
     */
    public void replace(PermissionPolicy policy) {
        validate(policy);
        PermissionPolicy previous = policyRef.getAndSet(policy);
        log.info("[Policy] policy replaced (admins {} -> {}, overrides {} -> {})",
                previous != null ? previous.getAdminIds().size() : 0, policy.getAdminIds().size(),
                previous != null ? previous.getOverrides().size() : 0, policy.getOverrides().size());
        saveQuietly(policy);
    }

    static PermissionPolicy fromProperties(BotProperties.PermissionProperties permission) {
        PermissionPolicy.PermissionPolicyBuilder builder = PermissionPolicy.builder()
                .defaultTier(permission.getDefaultTier())
                .privateTier(permission.getPrivateTier());
        if (permission.getAdmins() != null) {
            for (String admin : permission.getAdmins()) {
                builder.adminId(admin != null ? admin.trim() : null);
            }
        }
        if (permission.getOverrides() != null) {
            for (Map.Entry<String, Tier> entry : permission.getOverrides().entrySet()) {
                Scope scope;
                try {
                    scope = Scope.parse(entry.getKey());
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Invalid permission override scope '" + entry.getKey()
                            + "': expected private:<id> or group:<id>", e);
                }
                builder.override(scope, entry.getValue());
            }
        }
        return builder.build();
    }

    static void validate(PermissionPolicy policy) {
        if (policy == null) {
            throw new ConfigException("Permission policy must not be null");
        }
        if (policy.getDefaultTier() == null) {
            throw new ConfigException("Permission policy default tier is missing");
        }
        if (policy.getPrivateTier() == null) {
            throw new ConfigException("Permission policy private tier is missing");
        }
        for (String admin : policy.getAdminIds()) {
            if (admin == null || admin.isBlank()) {
                throw new ConfigException("Permission policy contains a blank admin id");
            }
        }
        for (Map.Entry<Scope, Tier> entry : policy.getOverrides().entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigException("Permission override for " + entry.getKey() + " has no tier");
            }
        }
    }

    private void saveQuietly(PermissionPolicy policy) {
        try {
            repository.savePolicy(policy);
        } catch (PersistenceException e) {
            log.warn("[Policy] failed to persist policy: {}", e.getMessage());
        }
    }
}
