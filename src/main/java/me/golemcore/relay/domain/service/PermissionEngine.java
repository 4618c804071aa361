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

import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Principal;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the trust tier of a sender within a scope.
 *
 * <p>
 * Precedence, highest first:
 * <ol>
 * <li>explicit override for the scope</li>
 * <li>admin membership ({@link Tier#ADMIN})</li>
 * <li>the private-chat tier when the scope is private</li>
 * <li>the policy default tier</li>
 * </ol>
 * Evaluation is a pure function of its arguments.
 */
@Component
public class PermissionEngine {

    public Tier evaluate(Principal principal, Scope scope, PermissionPolicy policy) {
        Optional<Tier> override = policy.overrideFor(scope);
        if (override.isPresent()) {
            return override.get();
        }
        if (policy.isAdmin(principal.senderId())) {
            return Tier.ADMIN;
        }
        if (scope.isPrivate()) {
            return policy.getPrivateTier();
        }
        return policy.getDefaultTier();
    }
}
