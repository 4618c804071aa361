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

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a permitted message is addressed to the bot.
 *
 * <p>
 * Private chats always trigger. A group message triggers when its score
 * reaches {@code bot.trigger.threshold}: a mention of the bot, configured
 * keywords and a short conversation boost after the bot last spoke in that
 * group all add to the score.
 */
@Component
@RequiredArgsConstructor
public class ReplyTrigger {

    private final BotProperties properties;

    private final Map<Scope, Integer> remainingBoosts = new ConcurrentHashMap<>();

    /**
     * Scores the event and consumes one boosted message if a boost is active.
     */
    public boolean shouldReply(InboundEvent event) {
        if (event.getScope().isPrivate()) {
            return true;
        }
        boolean boosted = consumeBoost(event.getScope());
        return score(event, boosted) >= properties.getTrigger().getThreshold();
    }

    /**
     * Starts a conversation boost after the bot replied in a group.
     */
    public void onReplied(Scope scope) {
        int boostMessages = properties.getTrigger().getBoostMessages();
        if (scope.isGroup() && boostMessages > 0) {
            remainingBoosts.put(scope, boostMessages);
        }
    }

    public void reset(Scope scope) {
        remainingBoosts.remove(scope);
    }

    int score(InboundEvent event, boolean boosted) {
        BotProperties.TriggerProperties trigger = properties.getTrigger();
        int score = 0;
        if (event.isMentionsSelf()) {
            score += trigger.getMentionScore();
        }
        if (boosted) {
            score += trigger.getBoostScore();
        }
        String text = event.getRawText() != null ? event.getRawText().toLowerCase(Locale.ROOT) : "";
        for (Map.Entry<String, Integer> keyword : trigger.getKeywords().entrySet()) {
            String needle = keyword.getKey().toLowerCase(Locale.ROOT);
            if (!needle.isEmpty() && text.contains(needle) && keyword.getValue() != null) {
                score += keyword.getValue();
            }
        }
        return score;
    }

    private boolean consumeBoost(Scope scope) {
        boolean[] boosted = new boolean[1];
        remainingBoosts.computeIfPresent(scope, (key, remaining) -> {
            boosted[0] = true;
            return remaining > 1 ? remaining - 1 : null;
        });
        return boosted[0];
    }
}
