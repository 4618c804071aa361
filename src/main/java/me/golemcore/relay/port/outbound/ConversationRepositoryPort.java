package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.ConversationContext;
import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Scope;

import java.util.Optional;

/**
 * Durable storage for conversation windows and the permission policy.
 *
 * <p>
 * All methods are blocking. Write failures surface as
 * {@link PersistenceException}; callers treat them as best-effort.
 */
public interface ConversationRepositoryPort {

    Optional<ConversationContext> loadContext(Scope scope);

    void saveContext(Scope scope, ConversationContext context);

    Optional<PermissionPolicy> loadPolicy();

    void savePolicy(PermissionPolicy policy);
}
