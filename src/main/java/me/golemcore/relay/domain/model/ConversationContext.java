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

import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of a scope's rolling window of turns, oldest first.
 *
 * <p>
 * The live window is owned by the conversation store; every instance handed
 * out is a copy, so callers may keep it while the window moves on.
 */
public final class ConversationContext {

    private final Scope scope;
    private final List<Turn> turns;

    private ConversationContext(Scope scope, List<Turn> turns) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.turns = List.copyOf(turns);
    }

    public static ConversationContext of(Scope scope, List<Turn> turns) {
        return new ConversationContext(scope, turns != null ? turns : List.of());
    }

    public static ConversationContext empty(Scope scope) {
        return new ConversationContext(scope, List.of());
    }

    public Scope getScope() {
        return scope;
    }

    public List<Turn> getTurns() {
        return turns;
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public Turn latest() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversationContext other)) {
            return false;
        }
        return scope.equals(other.scope) && turns.equals(other.turns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, turns);
    }

    @Override
    public String toString() {
        return "ConversationContext{scope=" + scope + ", turns=" + turns.size() + "}";
    }
}
