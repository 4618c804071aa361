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
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Final state of one inbound event's run with the path that led there.
 */
@Value
@Builder
public class DispatchOutcome {

    Scope scope;
    long sequenceNo;
    DispatchState finalState;
    Reason reason;
    Tier tier;
    int completionAttempts;
    int sendAttempts;
    String deliveryId;
    String error;
    Duration waited;
    @Singular
    List<DispatchState> transitions;

    public boolean isFailed() {
        return finalState == DispatchState.FAILED;
    }

    public boolean isDelivered() {
        return reason == Reason.DELIVERED || reason == Reason.COMMAND;
    }

    public enum Reason {
        /**
         * Completion was generated and sent.
         */
        DELIVERED,
        /**
         * Resolved tier below DEFAULT.
         */
        PERMISSION_DENIED,
        /**
         * Sequence number already processed for this scope.
         */
        DUPLICATE,
        /**
         * Nothing to answer (blank text).
         */
        EMPTY_MESSAGE,
        /**
         * Group message recorded as context but not addressed to the bot.
         */
        NOT_TRIGGERED,
        /**
         * Chat command handled without a completion.
         */
        COMMAND,
        COMPLETION_FAILED,
        DELIVERY_FAILED,
        /**
         * Event was still queued or running when the dispatcher shut down.
         */
        SHUTDOWN,
        /**
         * Unexpected exception inside the run.
         */
        ERROR
    }
}
