package me.golemcore.relay.domain.loop;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.CompletionFailureKind;
import me.golemcore.relay.domain.model.CompletionRequest;
import me.golemcore.relay.domain.model.CompletionResult;
import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.domain.model.DispatchOutcome;
import me.golemcore.relay.domain.model.DispatchState;
import me.golemcore.relay.domain.model.GatewayFailureKind;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Principal;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.domain.model.Turn;
import me.golemcore.relay.domain.service.ConversationStore;
import me.golemcore.relay.domain.service.PermissionEngine;
import me.golemcore.relay.domain.service.PermissionPolicyService;
import me.golemcore.relay.domain.service.PromptComposer;
import me.golemcore.relay.domain.service.ReplyTrigger;
import me.golemcore.relay.domain.service.RetryPolicy;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.config.LoggingFlagsConfigurer;
import me.golemcore.relay.port.inbound.CommandPort;
import me.golemcore.relay.port.inbound.GatewayPort;
import me.golemcore.relay.port.outbound.CompletionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs one inbound event through the dispatch state machine.
 *
 * <pre>
 * IDLE → EVALUATING → REQUESTING → REPLYING → IDLE
 *                      ↘ RETRYING ↗  ↘ RETRYING ↗
 *                           ↘ FAILED     ↘ FAILED
 * </pre>
 *
 * <p>
 * The dispatcher is a single-turn orchestrator: it assumes its caller runs at
 * most one event per scope at a time (see {@link ScopeRunCoordinator}).
 * Retries of the completion call reuse the same request, so one event yields
 * at most one request chain. Turns already appended are never rolled back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Dispatcher {

    private static final Logger CHAT_LOG = LoggerFactory.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER);

    private final BotProperties properties;
    private final PermissionEngine permissionEngine;
    private final PermissionPolicyService policyService;
    private final ConversationStore conversationStore;
    private final PromptComposer promptComposer;
    private final ReplyTrigger replyTrigger;
    private final CompletionPort completionPort;
    private final GatewayPort gatewayPort;
    private final CommandPort commandPort;
    private final RetryPolicy retryPolicy;
    private final RecentSequenceCache recentSequences;
    private final Sleeper sleeper;
    private final Clock clock;

    public DispatchOutcome process(InboundEvent event) {
        Run run = new Run(event);
        try {
            return evaluate(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Dispatcher] run for {} interrupted in state {}", run.scope, run.state);
            if (run.touchedContext) {
                conversationStore.flush(run.scope);
            }
            return run.fail(DispatchOutcome.Reason.SHUTDOWN, "interrupted");
        } catch (RuntimeException e) { // NOSONAR - a broken run must not kill the scope runner
            log.error("[Dispatcher] run for {} failed in state {}: {}", run.scope, run.state, e.getMessage(), e);
            if (run.touchedContext) {
                conversationStore.flush(run.scope);
            }
            return run.fail(DispatchOutcome.Reason.ERROR, e.getMessage());
        }
    }

    private DispatchOutcome evaluate(Run run) throws InterruptedException {
        InboundEvent event = run.event;
        run.enter(DispatchState.EVALUATING);

        if (!recentSequences.markSeen(event)) {
            log.debug("[Dispatcher] duplicate event in {} (seq={}), dropped", run.scope, event.getSequenceNo());
            return run.idle(DispatchOutcome.Reason.DUPLICATE);
        }

        Tier tier = permissionEngine.evaluate(Principal.of(event), run.scope, policyService.current());
        run.tier = tier;
        if (!tier.permitsReply()) {
            log.debug("[Dispatcher] {} in {} resolved to {}, dropped", event.getSenderId(), run.scope, tier);
            return run.idle(DispatchOutcome.Reason.PERMISSION_DENIED);
        }
        if (!event.hasText()) {
            return run.idle(DispatchOutcome.Reason.EMPTY_MESSAGE);
        }

        Optional<ChatCommand> command = parseCommand(event.getRawText());
        if (command.isPresent()) {
            return runCommand(run, command.get());
        }

        if (!replyTrigger.shouldReply(event)) {
            conversationStore.append(run.scope, Turn.user(event));
            conversationStore.flush(run.scope);
            return run.idle(DispatchOutcome.Reason.NOT_TRIGGERED);
        }

        run.enter(DispatchState.REQUESTING);
        conversationStore.append(run.scope, Turn.user(event));
        run.touchedContext = true;
        CompletionResult completion = requestCompletion(run);
        if (!completion.isSuccess()) {
            conversationStore.flush(run.scope);
            return run.fail(DispatchOutcome.Reason.COMPLETION_FAILED,
                    completion.getFailureKind() + ": " + completion.getError());
        }

        String reply = completion.getText().trim();
        run.enter(DispatchState.REPLYING);
        conversationStore.append(run.scope, Turn.assistant(reply, Instant.now(clock)));
        DeliveryResult delivery = deliver(run, reply);
        conversationStore.flush(run.scope);
        if (!delivery.isDelivered()) {
            return run.fail(DispatchOutcome.Reason.DELIVERY_FAILED,
                    delivery.getFailureKind() + ": " + delivery.getError());
        }

        replyTrigger.onReplied(run.scope);
        CHAT_LOG.info("[{}] bot: {}", run.scope, reply);
        run.deliveryId = delivery.getDeliveryId();
        return run.idle(DispatchOutcome.Reason.DELIVERED);
    }

    // ==================== Completion ====================

    private CompletionResult requestCompletion(Run run) throws InterruptedException {
        CompletionRequest request = promptComposer.compose(conversationStore.snapshot(run.scope));
        while (true) {
            run.completionAttempts++;
            CompletionResult result = awaitCompletion(request);
            if (result.isSuccess() && (result.getText() == null || result.getText().isBlank())) {
                result = CompletionResult.failure(CompletionFailureKind.TRANSIENT, "blank completion");
            }
            if (result.isSuccess()) {
                return result;
            }

            Optional<Duration> delay = retryPolicy.completionRetryDelay(run.completionAttempts, result);
            if (delay.isEmpty()) {
                if (result.getFailureKind() == CompletionFailureKind.FATAL) {
                    log.error("[Dispatcher] completion for {} failed fatally: {}", run.scope, result.getError());
                } else {
                    log.warn("[Dispatcher] completion for {} gave up after {} attempt(s): {} {}", run.scope,
                            run.completionAttempts, result.getFailureKind(), result.getError());
                }
                return result;
            }

            run.enter(DispatchState.RETRYING);
            waitBeforeRetry(run, "completion", result.getFailureKind().name(), delay.get());
            run.enter(DispatchState.REQUESTING);
        }
    }

    private CompletionResult awaitCompletion(CompletionRequest request) throws InterruptedException {
        try {
            CompletableFuture<CompletionResult> future = completionPort.complete(request);
            CompletionResult result = future != null ? future.get() : null;
            return result != null
                    ? result
                    : CompletionResult.failure(CompletionFailureKind.TRANSIENT, "no completion result");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return CompletionResult.failure(CompletionFailureKind.TRANSIENT, cause.getMessage());
        }
    }

    // ==================== Delivery ====================

    private DeliveryResult deliver(Run run, String text) throws InterruptedException {
        while (true) {
            run.sendAttempts++;
            DeliveryResult result = awaitDelivery(run.scope, text);
            if (result.isDelivered()) {
                return result;
            }

            Optional<Duration> delay = retryPolicy.deliveryRetryDelay(run.sendAttempts, result);
            if (delay.isEmpty()) {
                log.warn("[Dispatcher] delivery to {} failed after {} attempt(s): {} {}", run.scope,
                        run.sendAttempts, result.getFailureKind(), result.getError());
                return result;
            }

            run.enter(DispatchState.RETRYING);
            waitBeforeRetry(run, "delivery", result.getFailureKind().name(), delay.get());
            run.enter(DispatchState.REPLYING);
        }
    }

    private DeliveryResult awaitDelivery(Scope scope, String text) throws InterruptedException {
        try {
            CompletableFuture<DeliveryResult> future = gatewayPort.send(scope, text);
            DeliveryResult result = future != null ? future.get() : null;
            return result != null
                    ? result
                    : DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, "no delivery result");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, cause.getMessage());
        }
    }

    private void waitBeforeRetry(Run run, String stage, String kind, Duration delay) throws InterruptedException {
        Instant nextAttemptAt = Instant.now(clock).plus(delay);
        log.warn("[Dispatcher] {} for {} failed ({}), retrying in {} ms (next attempt at {})",
                stage, run.scope, kind, delay.toMillis(), nextAttemptAt);
        sleeper.sleep(delay);
        run.waited = run.waited.plus(delay);
    }

    // ==================== Commands ====================

    private Optional<ChatCommand> parseCommand(String text) {
        BotProperties.CommandsProperties commands = properties.getCommands();
        String prefix = commands.getPrefix();
        if (!commands.isEnabled() || prefix == null || prefix.isEmpty()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith(prefix) || trimmed.length() == prefix.length()) {
            return Optional.empty();
        }
        String[] tokens = trimmed.substring(prefix.length()).trim().split("\\s+");
        String name = tokens[0].toLowerCase(Locale.ROOT);
        if (name.isEmpty() || !commandPort.hasCommand(name)) {
            return Optional.empty();
        }
        List<String> args = new ArrayList<>(Arrays.asList(tokens).subList(1, tokens.length));
        return Optional.of(new ChatCommand(name, args));
    }

    private DispatchOutcome runCommand(Run run, ChatCommand command) throws InterruptedException {
        Map<String, Object> context = new HashMap<>();
        context.put(CommandPort.CONTEXT_SCOPE, run.scope);
        context.put(CommandPort.CONTEXT_SENDER_ID, run.event.getSenderId());
        context.put(CommandPort.CONTEXT_SENDER_NAME, run.event.senderLabel());
        context.put(CommandPort.CONTEXT_TIER, run.tier);

        CommandPort.CommandResult result;
        try {
            result = commandPort.execute(command.name(), command.args(), context).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Dispatcher] command {} failed in {}: {}", command.name(), run.scope, cause.getMessage(),
                    cause);
            result = CommandPort.CommandResult.failure("Command failed.");
        }
        log.info("[Dispatcher] command {} in {} by {} (success={})", command.name(), run.scope,
                run.event.getSenderId(), result.success());

        run.enter(DispatchState.REPLYING);
        DeliveryResult delivery = deliver(run, result.output());
        if (!delivery.isDelivered()) {
            return run.fail(DispatchOutcome.Reason.DELIVERY_FAILED,
                    delivery.getFailureKind() + ": " + delivery.getError());
        }
        run.deliveryId = delivery.getDeliveryId();
        return run.idle(DispatchOutcome.Reason.COMMAND);
    }

    private record ChatCommand(String name, List<String> args) {
    }

    /**
     * Mutable bookkeeping for one event's pass through the machine.
     */
    private static final class Run {

        private final InboundEvent event;
        private final Scope scope;
        private final List<DispatchState> transitions = new ArrayList<>();
        private DispatchState state = DispatchState.IDLE;
        private Tier tier;
        private int completionAttempts;
        private int sendAttempts;
        private String deliveryId;
        private boolean touchedContext;
        private Duration waited = Duration.ZERO;

        private Run(InboundEvent event) {
            this.event = event;
            this.scope = event.getScope();
        }

        private void enter(DispatchState next) {
            state = next;
            transitions.add(next);
        }

        private DispatchOutcome idle(DispatchOutcome.Reason reason) {
            enter(DispatchState.IDLE);
            return build(reason, null);
        }

        private DispatchOutcome fail(DispatchOutcome.Reason reason, String error) {
            enter(DispatchState.FAILED);
            return build(reason, error);
        }

        private DispatchOutcome build(DispatchOutcome.Reason reason, String error) {
            return DispatchOutcome.builder()
                    .scope(scope)
                    .sequenceNo(event.getSequenceNo())
                    .finalState(state)
                    .reason(reason)
                    .tier(tier)
                    .completionAttempts(completionAttempts)
                    .sendAttempts(sendAttempts)
                    .deliveryId(deliveryId)
                    .error(error)
                    .transitions(transitions)
                    .waited(waited)
                    .build();
        }
    }
}
