package me.golemcore.relay.port.inbound;

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
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for executing chat commands such as {@code #help} or {@code #reset}.
 * Commands bypass the completion service and are never recorded as turns.
 */
public interface CommandPort {

    String CONTEXT_SCOPE = "scope";
    String CONTEXT_SENDER_ID = "senderId";
    String CONTEXT_SENDER_NAME = "senderName";
    String CONTEXT_TIER = "tier";

    /**
     * Executes a command with the given arguments and context.
     *
     * @param command
     *            Command name (without prefix)
     * @param args
     *            List of command arguments
     * @param context
     *            Execution context keyed by the {@code CONTEXT_*} constants
     * @return Command execution result with success status and output
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    record CommandResult(
            boolean success,
            String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }

    record CommandDefinition(
            String name,
            String description,
            String usage) {
    }
}
