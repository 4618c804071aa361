package me.golemcore.relay.adapter.inbound.onebot;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.relay.domain.model.Scope;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Decodes OneBot 11 event frames.
 *
 * <ul>
 * <li>{@code meta_event/lifecycle} and {@code meta_event/heartbeat} become
 * status frames carrying the bot's self id.</li>
 * <li>{@code message} events with {@code message_type} private or group become
 * message frames; text comes from the segment array, or from
 * {@code raw_message} when the bridge sends string messages.</li>
 * <li>Everything else (notices, requests, echoes of own messages) is
 * {@link OneBotFrame.Type#IGNORED}.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class OneBotEventParser {

    static final String MENTION_ALL = "all";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OneBotFrame parse(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("frame is not a JSON object");
        }

        String postType = root.path("post_type").asText("");
        String selfId = textOrNull(root.get("self_id"));
        if ("meta_event".equals(postType)) {
            return parseMetaEvent(root, selfId);
        }
        if ("message".equals(postType)) {
            return parseMessage(root, selfId);
        }
        return OneBotFrame.builder()
                .type(OneBotFrame.Type.IGNORED)
                .selfId(selfId)
                .build();
    }

    private OneBotFrame parseMetaEvent(JsonNode root, String selfId) {
        String metaType = root.path("meta_event_type").asText("");
        if ("lifecycle".equals(metaType)) {
            return OneBotFrame.builder()
                    .type(OneBotFrame.Type.LIFECYCLE)
                    .selfId(selfId)
                    .build();
        }
        if ("heartbeat".equals(metaType)) {
            JsonNode status = root.path("status");
            return OneBotFrame.builder()
                    .type(OneBotFrame.Type.HEARTBEAT)
                    .selfId(selfId)
                    .online(status.has("online") ? status.get("online").asBoolean() : null)
                    .good(status.has("good") ? status.get("good").asBoolean() : null)
                    .build();
        }
        return OneBotFrame.builder()
                .type(OneBotFrame.Type.IGNORED)
                .selfId(selfId)
                .build();
    }

    private OneBotFrame parseMessage(JsonNode root, String selfId) {
        String messageType = root.path("message_type").asText("");
        String userId = textOrNull(root.get("user_id"));
        Scope scope;
        if ("private".equals(messageType)) {
            scope = userId != null ? Scope.privateChat(userId) : null;
        } else if ("group".equals(messageType)) {
            String groupId = textOrNull(root.get("group_id"));
            scope = groupId != null ? Scope.group(groupId) : null;
        } else {
            scope = null;
        }
        if (scope == null || userId == null) {
            return OneBotFrame.builder()
                    .type(OneBotFrame.Type.IGNORED)
                    .selfId(selfId)
                    .build();
        }

        OneBotFrame.OneBotFrameBuilder builder = OneBotFrame.builder()
                .type(OneBotFrame.Type.MESSAGE)
                .selfId(selfId)
                .scope(scope)
                .senderId(userId)
                .senderName(resolveSenderName(root.path("sender"), scope))
                .time(resolveTime(root.get("time")))
                .messageId(textOrNull(root.get("message_id")));

        JsonNode seq = root.get("message_seq");
        if (seq != null && seq.canConvertToLong()) {
            builder.messageSeq(seq.asLong());
        }

        JsonNode message = root.get("message");
        if (message != null && message.isArray()) {
            builder.text(renderSegments(message, builder));
        } else {
            String raw = root.hasNonNull("raw_message")
                    ? root.get("raw_message").asText()
                    : message != null ? message.asText("") : "";
            builder.text(raw.trim());
        }
        return builder.build();
    }

    private String renderSegments(JsonNode segments, OneBotFrame.OneBotFrameBuilder builder) {
        StringBuilder text = new StringBuilder();
        for (JsonNode segment : segments) {
            String type = segment.path("type").asText("");
            JsonNode data = segment.path("data");
            switch (type) {
                case "text" -> text.append(data.path("text").asText(""));
                case "at" -> {
                    String target = data.path("qq").asText("");
                    if (!target.isEmpty()) {
                        builder.mention(target);
                    }
                    String name = data.path("name").asText("");
                    text.append('@').append(!name.isEmpty() ? name : target).append(' ');
                }
                case "face" -> text.append("[face]");
                case "image" -> text.append("[image]");
                case "reply" -> {
                    // quoted message id only, no text
                }
                default -> text.append('[').append(type).append(']');
            }
        }
        return text.toString().trim();
    }

    private String resolveSenderName(JsonNode sender, Scope scope) {
        if (scope.isGroup()) {
            String card = sender.path("card").asText("");
            if (!card.isBlank()) {
                return card;
            }
        }
        String nickname = sender.path("nickname").asText("");
        return nickname.isBlank() ? null : nickname;
    }

    private Instant resolveTime(JsonNode time) {
        if (time != null && time.canConvertToLong() && time.asLong() > 0) {
            return Instant.ofEpochSecond(time.asLong());
        }
        return Instant.now(clock);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
