package me.golemcore.courier.adapter.inbound.command;

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

import me.golemcore.courier.domain.model.ScheduleCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns chat text into a {@link ScheduleCommand}.
 *
 * <p>
 * Supported forms (aliases in brackets):
 * <ul>
 * <li>add [send, spam] &lt;mention&gt; &lt;intervalSeconds&gt; &lt;text...&gt;
 * <li>update &lt;timestamp&gt; &lt;intervalSeconds&gt;
 * <li>delete [remove] &lt;timestamp&gt;
 * <li>pause [deactivate] &lt;timestamp&gt;
 * <li>unpause [activate] &lt;timestamp&gt;
 * <li>list
 * <li>help
 * </ul>
 * A leading bot mention is dropped, as are a leading {@code /} and an
 * {@code @botname} suffix on the command word. Timestamps may span several
 * tokens. Anything else yields an empty result.
 */
@Component
@Slf4j
public class CommandParser {

    private static final String WHITESPACE = "\\s+";
    private static final int MIN_ADD_TOKENS = 3;
    private static final int MIN_UPDATE_TOKENS = 3;

    /**
     * @param text
     *            raw message text
     * @param botUsername
     *            the bot's username without {@code @}, or {@code null}
     */
    public Optional<ScheduleCommand> parse(String text, String botUsername) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<String> tokens = Arrays.asList(text.trim().split(WHITESPACE));
        if (isBotMention(tokens.get(0), botUsername)) {
            tokens = tokens.subList(1, tokens.size());
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        String word = normalizeCommandWord(tokens.get(0));
        List<String> args = tokens.subList(1, tokens.size());

        switch (word) {
        case "add":
        case "send":
        case "spam":
            return parseAdd(tokens);
        case "update":
            return parseUpdate(tokens);
        case "delete":
        case "remove":
            return timestamp(args).map(ScheduleCommand.Delete::new);
        case "pause":
        case "deactivate":
            return timestamp(args).map(ScheduleCommand.Pause::new);
        case "unpause":
        case "activate":
            return timestamp(args).map(ScheduleCommand.Unpause::new);
        case "list":
            return args.isEmpty() ? Optional.of(new ScheduleCommand.ListSchedules()) : Optional.empty();
        case "help":
            return args.isEmpty() ? Optional.of(new ScheduleCommand.Help()) : Optional.empty();
        default:
            return Optional.empty();
        }
    }

    private Optional<ScheduleCommand> parseAdd(List<String> tokens) {
        if (tokens.size() < MIN_ADD_TOKENS) {
            return Optional.empty();
        }
        Optional<Integer> interval = parseInterval(tokens.get(2));
        if (interval.isEmpty()) {
            return Optional.empty();
        }
        String body = String.join(" ", tokens.subList(MIN_ADD_TOKENS, tokens.size()));
        return Optional.of(new ScheduleCommand.Add(tokens.get(1), interval.get(), body));
    }

    private Optional<ScheduleCommand> parseUpdate(List<String> tokens) {
        if (tokens.size() < MIN_UPDATE_TOKENS) {
            return Optional.empty();
        }
        Optional<Integer> interval = parseInterval(tokens.get(tokens.size() - 1));
        if (interval.isEmpty()) {
            return Optional.empty();
        }
        String timestamp = String.join(" ", tokens.subList(1, tokens.size() - 1));
        return Optional.of(new ScheduleCommand.Update(timestamp, interval.get()));
    }

    private static Optional<String> timestamp(List<String> args) {
        return args.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", args));
    }

    static Optional<Integer> parseInterval(String token) {
        try {
            int value = Integer.parseInt(token);
            if (value < 1) {
                log.debug("[Command] Ignoring non-positive interval: {}", token);
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            log.debug("[Command] Ignoring non-numeric interval: {}", token);
            return Optional.empty();
        }
    }

    private static String normalizeCommandWord(String token) {
        String word = token.startsWith("/") ? token.substring(1) : token;
        int at = word.indexOf('@');
        if (at > 0) {
            word = word.substring(0, at);
        }
        return word.toLowerCase(Locale.ROOT);
    }

    private static boolean isBotMention(String token, String botUsername) {
        return botUsername != null && !botUsername.isBlank()
                && token.equalsIgnoreCase("@" + botUsername);
    }
}
