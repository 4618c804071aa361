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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Identity of a conversation context: a private chat with one user or a group.
 *
 * <p>
 * The canonical string form is {@code private:<id>} or {@code group:<id>}, and
 * {@link #parse(String)} is its inverse. Scopes are immutable and safe to use
 * as map keys.
 */
public record Scope(ScopeKind kind, String id) {

    private static final char SEPARATOR = ':';

    public Scope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Scope id must not be blank");
        }
    }

    public static Scope privateChat(String userId) {
        return new Scope(ScopeKind.PRIVATE, userId);
    }

    public static Scope group(String groupId) {
        return new Scope(ScopeKind.GROUP, groupId);
    }

    @JsonCreator
    public static Scope parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scope must not be null");
        }
        int separator = value.indexOf(SEPARATOR);
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Malformed scope: " + value);
        }
        ScopeKind kind = ScopeKind.fromKey(value.substring(0, separator));
        return new Scope(kind, value.substring(separator + 1).trim());
    }

    public boolean isPrivate() {
        return kind == ScopeKind.PRIVATE;
    }

    public boolean isGroup() {
        return kind == ScopeKind.GROUP;
    }

    @JsonValue
    public String key() {
        return kind.key() + SEPARATOR + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
