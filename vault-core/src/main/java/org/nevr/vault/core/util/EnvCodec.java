package org.nevr.vault.core.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and writes the {@code KEY=value} plaintext format used by .env files.
 * Maps returned here are insertion ordered; comments and blank lines are dropped on parse.
 */
public final class EnvCodec {

    private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\s#=\"']");

    private EnvCodec() {
    }

    /**
     * Parse .env content. A later duplicate key overwrites the value but keeps the position of
     * the first occurrence.
     */
    public static Map<String, String> parse(String content) {
        Map<String, String> result = new LinkedHashMap<>();
        if (content == null || content.isEmpty()) {
            return result;
        }

        for (String line : content.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            int eqIndex = trimmed.indexOf('=');
            if (eqIndex == -1) {
                continue;
            }

            String key = trimmed.substring(0, eqIndex).trim();
            if (key.isEmpty()) {
                continue;
            }
            result.put(key, unquote(trimmed.substring(eqIndex + 1).trim()));
        }
        return result;
    }

    /**
     * Write {@code KEY=value} lines in map order. Values containing whitespace, {@code #},
     * {@code =} or quotes are double-quoted with {@code \} and {@code "} escaped.
     */
    public static String stringify(Map<String, String> env) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : env.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            sb.append(entry.getKey()).append('=');
            if (NEEDS_QUOTES.matcher(value).find()) {
                sb.append('"')
                        .append(value.replace("\\", "\\\\").replace("\"", "\\\""))
                        .append('"');
            } else {
                sb.append(value);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Overlay entries win. Keys only present in {@code base} keep their position.
     */
    public static Map<String, String> merge(Map<String, String> base, Map<String, String> overlay) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        merged.putAll(overlay);
        return merged;
    }

    /**
     * Copy of {@code env} without {@code key}
     */
    public static Map<String, String> without(Map<String, String> env, String key) {
        Map<String, String> copy = new LinkedHashMap<>(env);
        copy.remove(key);
        return copy;
    }

    /**
     * Replace the first {@code key=} line of raw content or append one, leaving every other
     * line (comments included) as it was.
     */
    public static String upsertLine(String content, String key, String value) {
        String line = key + "=" + value;
        if (content == null || content.isEmpty()) {
            return line + "\n";
        }

        Matcher matcher = Pattern.compile("^" + Pattern.quote(key) + "\\s*=.*$", Pattern.MULTILINE)
                .matcher(content);
        if (matcher.find()) {
            return content.substring(0, matcher.start()) + line + content.substring(matcher.end());
        }
        String separator = content.endsWith("\n") ? "" : "\n";
        return content + separator + line + "\n";
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if (first == '\'' && last == '\'') {
                return value.substring(1, value.length() - 1);
            }
            if (first == '"' && last == '"') {
                return unescape(value.substring(1, value.length() - 1));
            }
        }
        return value;
    }

    private static String unescape(String quoted) {
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length()) {
                char next = quoted.charAt(i + 1);
                if (next == '\\' || next == '"') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
