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

import java.util.Locale;

/**
 * Kind of conversation a {@link Scope} addresses.
 */
public enum ScopeKind {

    /**
     * One-to-one chat with a single user.
     */
    PRIVATE("private"),

    /**
     * Multi-user group chat.
     */
    GROUP("group");

    private final String key;

    ScopeKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static ScopeKind fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scope kind must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScopeKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown scope kind: " + value);
    }
}
