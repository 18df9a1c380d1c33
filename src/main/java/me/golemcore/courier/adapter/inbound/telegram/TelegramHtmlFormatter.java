package me.golemcore.courier.adapter.inbound.telegram;

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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders outgoing text as Telegram HTML.
 *
 * <p>
 * User-supplied message bodies are delivered literally: everything is
 * HTML-escaped, and only fenced code blocks (used by the list reply) become
 * {@code <pre>} blocks.
 */
public final class TelegramHtmlFormatter {

    private TelegramHtmlFormatter() {
    }

    // ```lang\ncode\n``` or ```code```
    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile(
            "```(?:\\w*\\n)?([\\s\\S]*?)```");

    private static final String CODE_BLOCK_PLACEHOLDER = "\uE000CB";

    public static String format(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        List<String> codeBlocks = new ArrayList<>();
        Matcher m = CODE_BLOCK_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            codeBlocks.add(m.group(1));
            m.appendReplacement(sb, CODE_BLOCK_PLACEHOLDER + (codeBlocks.size() - 1) + CODE_BLOCK_PLACEHOLDER);
        }
        m.appendTail(sb);
        text = escapeHtml(sb.toString());

        for (int i = 0; i < codeBlocks.size(); i++) {
            text = text.replace(
                    CODE_BLOCK_PLACEHOLDER + i + CODE_BLOCK_PLACEHOLDER,
                    "<pre>" + escapeHtml(stripTrailingNewline(codeBlocks.get(i))) + "</pre>");
        }
        return text;
    }

    /**
     * Inline mention of a user that works whether or not they have a username.
     */
    public static String userMention(String userId, String displayName) {
        return "<a href=\"tg://user?id=" + userId + "\">" + escapeHtml(displayName) + "</a>";
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private static String stripTrailingNewline(String code) {
        return code.endsWith("\n") ? code.substring(0, code.length() - 1) : code;
    }
}
