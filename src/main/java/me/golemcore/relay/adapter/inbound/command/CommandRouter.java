package me.golemcore.relay.adapter.inbound.command;

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
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.domain.service.ConversationStore;
import me.golemcore.relay.domain.service.ReplyTrigger;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Chat command handler.
 *
 * <p>
 * Commands:
 * <ul>
 * <li>{@code echo <text>} - repeat the text</li>
 * <li>{@code help} - list commands</li>
 * <li>{@code whoami} - show sender id, scope and resolved tier</li>
 * <li>{@code reset} - clear this scope's context (TRUSTED and above)</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_ECHO = "echo";
    private static final String CMD_HELP = "help";
    private static final String CMD_WHOAMI = "whoami";
    private static final String CMD_RESET = "reset";

    private final BotProperties properties;
    private final ConversationStore conversationStore;
    private final ReplyTrigger replyTrigger;

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        String name = normalize(command);
        Scope scope = (Scope) context.get(CONTEXT_SCOPE);
        Tier tier = (Tier) context.get(CONTEXT_TIER);
        log.debug("Executing command: {}{} (scope={})", prefix(), name, scope);
        if (!hasCommand(name)) {
            return CompletableFuture.completedFuture(CommandResult.failure("Unknown command: " + command));
        }

        CommandResult result = switch (name) {
        case CMD_ECHO -> handleEcho(args);
        case CMD_HELP -> handleHelp();
        case CMD_WHOAMI -> handleWhoami(context, scope, tier);
        case CMD_RESET -> handleReset(scope, tier);
        default -> CommandResult.failure("Unknown command: " + command);
        };
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public boolean hasCommand(String command) {
        String name = normalize(command);
        return listCommands().stream().anyMatch(definition -> definition.name().equals(name));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        String prefix = prefix();
        return List.of(
                new CommandDefinition(CMD_ECHO, "Repeat the given text", prefix + "echo <text>"),
                new CommandDefinition(CMD_HELP, "Show available commands", prefix + "help"),
                new CommandDefinition(CMD_WHOAMI, "Show your id, this chat and your tier", prefix + "whoami"),
                new CommandDefinition(CMD_RESET, "Forget this chat's history", prefix + "reset"));
    }

    private CommandResult handleEcho(List<String> args) {
        if (args == null || args.isEmpty()) {
            return CommandResult.failure("Usage: " + prefix() + "echo <text>");
        }
        return CommandResult.success(String.join(" ", args));
    }

    private CommandResult handleHelp() {
        StringBuilder help = new StringBuilder("Commands:");
        for (CommandDefinition definition : listCommands()) {
            help.append('\n').append(definition.usage()).append(" - ").append(definition.description());
        }
        return CommandResult.success(help.toString());
    }

    private CommandResult handleWhoami(Map<String, Object> context, Scope scope, Tier tier) {
        Object senderId = context.get(CONTEXT_SENDER_ID);
        return CommandResult.success("id: " + senderId + "\nchat: " + scope + "\ntier: " + tier);
    }

    private CommandResult handleReset(Scope scope, Tier tier) {
        if (tier == null || !tier.isAtLeast(Tier.TRUSTED)) {
            return CommandResult.failure("Only trusted users can reset this chat.");
        }
        conversationStore.clear(scope);
        replyTrigger.reset(scope);
        return CommandResult.success("Conversation history cleared.");
    }

    private String prefix() {
        return properties.getCommands().getPrefix();
    }

    private static String normalize(String command) {
        return command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
    }
}
