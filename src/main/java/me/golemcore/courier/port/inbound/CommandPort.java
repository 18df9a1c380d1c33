package me.golemcore.courier.port.inbound;

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

import me.golemcore.courier.domain.model.CommandContext;
import me.golemcore.courier.domain.model.ScheduleCommand;

/**
 * Port for executing parsed user commands against the schedule engine.
 */
public interface CommandPort {

    /**
     * Executes a command on behalf of the caller described by the context.
     *
     * @param command
     *            parsed command
     * @param context
     *            issuing user, chat and resolved mentions
     * @return execution result; {@link CommandResult#output()} is {@code null}
     *         when nothing should be sent back
     */
    CommandResult execute(ScheduleCommand command, CommandContext context);

    /**
     * Represents the result of a command execution including success status and
     * the reply for the caller.
     */
    record CommandResult(
            boolean success,
            String output) {

        /**
         * Creates a successful command result.
         */
        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        /**
         * Creates a failed command result with error message.
         */
        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }

        /**
         * Creates a successful result with no reply.
         */
        public static CommandResult silent() {
            return new CommandResult(true, null);
        }

        /**
         * Creates a failed result with no reply.
         */
        public static CommandResult silentFailure() {
            return new CommandResult(false, null);
        }

        public boolean hasOutput() {
            return output != null && !output.isBlank();
        }
    }
}
