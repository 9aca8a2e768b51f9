package me.golemcore.agent.tools;

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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips HTML markup from fetched pages for model consumption. Drops script,
 * style and head sections, converts block-level elements to newlines and
 * decodes common HTML entities.
 */
public final class HtmlSanitizer {

    private static final Pattern INVISIBLE_SECTIONS = Pattern.compile(
            "<(script|style|head|noscript)[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENTS = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern BLOCK_TAGS = Pattern.compile("<(br|p|div|tr|li|h[1-6])[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\n");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\n{3,}");
    private static final Pattern MULTI_SPACES = Pattern.compile("[ \\t]{2,}");

    private HtmlSanitizer() {
    }

    /**
     * Strips HTML tags and returns plain text.
     *
     * @param html
     *            the HTML content
     * @return plain text with tags removed and entities decoded
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }

        String result = INVISIBLE_SECTIONS.matcher(html).replaceAll("");
        result = COMMENTS.matcher(result).replaceAll("");
        result = BLOCK_TAGS.matcher(result).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll("");
        result = decodeEntities(result);

        result = MULTI_SPACES.matcher(result).replaceAll(" ");
        result = TRAILING_SPACES.matcher(result).replaceAll("\n");
        result = MULTI_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }

    private static String decodeEntities(String text) {
        Matcher matcher = NUMERIC_ENTITY.matcher(text);
        StringBuilder decoded = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            try {
                int codePoint = Integer.parseInt(matcher.group(2), matcher.group(1).isEmpty() ? 10 : 16);
                replacement = new String(Character.toChars(codePoint));
            } catch (IllegalArgumentException e) {
                replacement = matcher.group();
            }
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(decoded);

        return decoded.toString()
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
