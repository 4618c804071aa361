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

/**
 * Resolved trust level of a sender within a scope. Declaration order is the
 * total order {@code BLOCKED < DEFAULT < TRUSTED < ADMIN}.
 */
public enum Tier {

    BLOCKED,

    DEFAULT,

    TRUSTED,

    ADMIN;

    public boolean isAtLeast(Tier other) {
        return compareTo(other) >= 0;
    }

    /**
     * Whether a sender at this tier may trigger completions and commands.
     */
    public boolean permitsReply() {
        return isAtLeast(DEFAULT);
    }
}
