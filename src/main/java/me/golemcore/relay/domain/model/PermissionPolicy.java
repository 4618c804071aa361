package me.golemcore.relay.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable permission policy snapshot.
 *
 * <p>
 * Loaded once at startup and replaced only as a whole. Evaluation reads
 * whichever snapshot is current when an event is evaluated.
 */
@Value
@Builder(toBuilder = true)
public class PermissionPolicy {

    Tier defaultTier;
    Tier privateTier;
    @Singular
    Set<String> adminIds;
    @Singular
    Map<Scope, Tier> overrides;

    public boolean isAdmin(String senderId) {
        return senderId != null && adminIds.contains(senderId);
    }

    public Optional<Tier> overrideFor(Scope scope) {
        return Optional.ofNullable(overrides.get(scope));
    }
}
