package me.golemcore.relay.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ConversationContext;
import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.domain.model.Turn;
import me.golemcore.relay.port.outbound.ConversationRepositoryPort;
import me.golemcore.relay.port.outbound.PersistenceException;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Conversation repository backed by JSON documents in the workspace.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code conversations/<kind>_<id>.json} - one window per scope</li>
 * <li>{@code policy/permission-policy.json} - the permission policy</li>
 * </ul>
 * Every write goes through {@link StoragePort#putTextAtomic}, so a crash never
 * leaves a half-written document behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonConversationRepository implements ConversationRepositoryPort {

    static final String CONVERSATIONS_DIR = "conversations";
    static final String POLICY_DIR = "policy";
    static final String POLICY_FILE = "permission-policy.json";
    private static final String JSON_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Optional<ConversationContext> loadContext(Scope scope) {
        String json = await(() -> storagePort.getText(CONVERSATIONS_DIR, fileName(scope)).join(),
                "read conversation " + scope);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            ConversationDocument document = objectMapper.readValue(json, ConversationDocument.class);
            List<Turn> turns = document.getTurns() != null ? document.getTurns() : List.of();
            return Optional.of(ConversationContext.of(scope, turns));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupted conversation document for " + scope, e);
        }
    }

    @Override
    public void saveContext(Scope scope, ConversationContext context) {
        ConversationDocument document = new ConversationDocument();
        document.setScope(scope.key());
        document.setUpdatedAt(Instant.now(clock));
        document.setTurns(new ArrayList<>(context.getTurns()));
        String json = serialize(document, "conversation " + scope);
        awaitWrite(() -> storagePort.putTextAtomic(CONVERSATIONS_DIR, fileName(scope), json, false).join(),
                "write conversation " + scope);
        log.debug("[Conversation] saved {} turns for {}", context.size(), scope);
    }

    @Override
    public Optional<PermissionPolicy> loadPolicy() {
        String json = await(() -> storagePort.getText(POLICY_DIR, POLICY_FILE).join(), "read permission policy");
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            PolicyDocument document = objectMapper.readValue(json, PolicyDocument.class);
            return Optional.of(toPolicy(document));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupted permission policy document", e);
        }
    }

    @Override
    public void savePolicy(PermissionPolicy policy) {
        PolicyDocument document = new PolicyDocument();
        document.setDefaultTier(policy.getDefaultTier());
        document.setPrivateTier(policy.getPrivateTier());
        document.setAdmins(new ArrayList<>(policy.getAdminIds()));
        Map<String, Tier> overrides = new LinkedHashMap<>();
        policy.getOverrides().forEach((scope, tier) -> overrides.put(scope.key(), tier));
        document.setOverrides(overrides);
        document.setUpdatedAt(Instant.now(clock));
        String json = serialize(document, "permission policy");
        awaitWrite(() -> storagePort.putTextAtomic(POLICY_DIR, POLICY_FILE, json, true).join(),
                "write permission policy");
        log.debug("[Policy] saved permission policy");
    }

    /**
     * Percent-encodes every byte of the id outside {@code [A-Za-z0-9.-]}, so
     * distinct ids always map to distinct file names.
     */
    static String fileName(Scope scope) {
        StringBuilder name = new StringBuilder(scope.kind().key()).append('_');
        for (byte b : scope.id().getBytes(StandardCharsets.UTF_8)) {
            char ch = (char) (b & 0xFF);
            boolean safe = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9')
                    || ch == '-' || ch == '.';
            if (safe) {
                name.append(ch);
            } else {
                name.append('%').append(String.format("%02X", b & 0xFF));
            }
        }
        return name.append(JSON_SUFFIX).toString();
    }

    private PermissionPolicy toPolicy(PolicyDocument document) {
        PermissionPolicy.PermissionPolicyBuilder builder = PermissionPolicy.builder()
                .defaultTier(document.getDefaultTier())
                .privateTier(document.getPrivateTier());
        if (document.getAdmins() != null) {
            builder.adminIds(document.getAdmins());
        }
        if (document.getOverrides() != null) {
            for (Map.Entry<String, Tier> entry : document.getOverrides().entrySet()) {
                try {
                    builder.override(Scope.parse(entry.getKey()), entry.getValue());
                } catch (IllegalArgumentException e) {
                    throw new PersistenceException("Invalid override scope in stored policy: " + entry.getKey(), e);
                }
            }
        }
        return builder.build();
    }

    private String serialize(Object document, String what) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + what, e);
        }
    }

    private <T> T await(Supplier<T> call, String what) {
        try {
            return call.get();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PersistenceException persistenceException) {
                throw persistenceException;
            }
            throw new PersistenceException("Failed to " + what, cause);
        }
    }

    private void awaitWrite(Runnable call, String what) {
        await(() -> {
            call.run();
            return null;
        }, what);
    }

    @Data
    @NoArgsConstructor
    static class ConversationDocument {
        private String scope;
        private Instant updatedAt;
        private List<Turn> turns = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    static class PolicyDocument {
        private Tier defaultTier;
        private Tier privateTier;
        private List<String> admins = new ArrayList<>();
        private Map<String, Tier> overrides = new LinkedHashMap<>();
        private Instant updatedAt;
    }
}
