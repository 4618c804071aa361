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
import lombok.Value;

import java.time.Instant;

/**
 * A single inbound chat message as delivered by the gateway. Produced once by
 * the gateway adapter and consumed once by the dispatcher.
 */
@Value
@Builder(toBuilder = true)
public class InboundEvent {

    Scope scope;
    String senderId;
    String senderName;
    String rawText;
    Instant receivedAt;
    long sequenceNo;
    String messageId;
    boolean mentionsSelf;

    public boolean hasText() {
        return rawText != null && !rawText.isBlank();
    }

    /**
     * Display label used in logs and group prompts; falls back to the sender id.
     */
    public String senderLabel() {
        return senderName != null && !senderName.isBlank() ? senderName : senderId;
    }
}
