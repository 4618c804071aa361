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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One stored message in a conversation window. User turns also carry the
 * sender so that group history can tell speakers apart. Immutable, so a
 * snapshot can share turns with the live window.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Turn {

    TurnRole role;
    String text;
    Instant timestamp;
    String senderId;
    String senderName;

    public static Turn user(InboundEvent event) {
        return Turn.builder()
                .role(TurnRole.USER)
                .text(event.getRawText())
                .timestamp(event.getReceivedAt())
                .senderId(event.getSenderId())
                .senderName(event.getSenderName())
                .build();
    }

    public static Turn assistant(String text, Instant timestamp) {
        return Turn.builder()
                .role(TurnRole.ASSISTANT)
                .text(text)
                .timestamp(timestamp)
                .build();
    }

    @JsonIgnore
    public boolean isUser() {
        return role == TurnRole.USER;
    }

    @JsonIgnore
    public boolean isAssistant() {
        return role == TurnRole.ASSISTANT;
    }
}
