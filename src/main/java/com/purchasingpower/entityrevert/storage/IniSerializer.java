package com.purchasingpower.entityrevert.storage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the INI dialect used by the file store.
 *
 * <pre>
 * [post:ab12cd34]
 * post_title = "Hello \"world\""
 * vp_post_author = "f00dcafe"
 * vp_term_taxonomy[] = "11aa22bb"
 * vp_term_taxonomy[] = "33cc44dd"
 * </pre>
 *
 * Sections are written in sorted order and keys in insertion order so that the
 * same content always produces the same bytes; Git diffs and three-way merges
 * depend on that. Lines starting with {@code ;} or {@code #} are comments.
 */
public class IniSerializer {

    private static final Pattern SECTION = Pattern.compile("^\\[([^\\]]+)]$");
    private static final Pattern ENTRY = Pattern.compile("^([A-Za-z0-9_.\\-]+)(\\[])?\\s*=\\s*(.*)$");

    public String serialize(Map<String, Map<String, Object>> sections) {
        StringBuilder out = new StringBuilder();
        new TreeMap<>(sections).forEach((section, fields) -> {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append('[').append(section).append("]\n");
            fields.forEach((key, value) -> {
                if (value instanceof List<?> list) {
                    for (Object item : list) {
                        out.append(key).append("[] = ").append(quote(String.valueOf(item))).append('\n');
                    }
                } else if (value != null) {
                    out.append(key).append(" = ").append(quote(String.valueOf(value))).append('\n');
                }
            });
        });
        return out.toString();
    }

    /**
     * @throws IllegalArgumentException on a line that is neither a section, an entry nor a comment
     */
    public Map<String, Map<String, Object>> deserialize(String content) {
        Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
        Map<String, Object> current = null;
        int lineNumber = 0;

        for (String rawLine : content.split("\\r?\\n")) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }

            Matcher section = SECTION.matcher(line);
            if (section.matches()) {
                current = sections.computeIfAbsent(section.group(1).trim(), k -> new LinkedHashMap<>());
                continue;
            }

            Matcher entry = ENTRY.matcher(line);
            if (!entry.matches() || current == null) {
                throw new IllegalArgumentException("Malformed INI line " + lineNumber + ": " + rawLine);
            }

            String key = entry.group(1);
            String value = unquote(entry.group(3).trim());
            if (entry.group(2) != null) {
                addToList(current, key, value);
            } else {
                current.put(key, value);
            }
        }
        return sections;
    }

    @SuppressWarnings("unchecked")
    private static void addToList(Map<String, Object> fields, String key, String value) {
        Object existing = fields.get(key);
        List<String> list;
        if (existing instanceof List<?>) {
            list = (List<String>) existing;
        } else {
            list = new ArrayList<>();
            fields.put(key, list);
        }
        list.add(value);
    }

    private static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> quoted.append("\\\\");
                case '"' -> quoted.append("\\\"");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private static String unquote(String raw) {
        if (raw.length() < 2 || raw.charAt(0) != '"' || raw.charAt(raw.length() - 1) != '"') {
            return raw;
        }
        String body = raw.substring(1, raw.length() - 1);
        StringBuilder value = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    default -> value.append(next);
                }
            } else {
                value.append(c);
            }
        }
        return value.toString();
    }
}
