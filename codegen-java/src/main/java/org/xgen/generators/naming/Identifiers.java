package org.xgen.generators.naming;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts schema names into identifiers that are legal in the target languages.
 */
public final class Identifiers {

    // end of an acronym: "XMLHttp" -> "XML_Http"
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z])([A-Z][a-z])");
    // camel-case word boundary: "userId" -> "user_Id"
    private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

    private Identifiers() {}

    /**
     * Convert to snake_case. Idempotent.
     *
     * <ul>
     *   <li>{@code "XMLHttpRequest"} → {@code "xml_http_request"}</li>
     *   <li>{@code "UserID"} → {@code "user_id"}</li>
     *   <li>{@code "kebab-case"} → {@code "kebab_case"}</li>
     * </ul>
     */
    public static String toSnakeCase(String input) {
        if (input == null || input.isEmpty()) return input;
        String output = ACRONYM_BOUNDARY.matcher(input).replaceAll("$1_$2");
        output = WORD_BOUNDARY.matcher(output).replaceAll("$1_$2");
        output = output.replace("-", "_");
        return output.toLowerCase(Locale.ROOT);
    }

    /**
     * Uppercase the first character, leaving the rest untouched.
     */
    public static String makeFirstUpperCase(String s) {
        return toTitle(s);
    }

    /**
     * Uppercase the first code point. Supplementary characters are handled as
     * one character, never split into surrogates.
     */
    public static String toTitle(String s) {
        if (s == null || s.isEmpty()) return s;
        int first = s.codePointAt(0);
        int upper = Character.toUpperCase(first);
        if (upper == first) return s;
        return new StringBuilder(s.length())
            .appendCodePoint(upper)
            .append(s, Character.charCount(first), s.length())
            .toString();
    }

    /**
     * Lowercase the first code point, leaving the rest untouched.
     */
    public static String makeFirstLowerCase(String s) {
        if (s == null || s.isEmpty()) return s;
        int first = s.codePointAt(0);
        int lower = Character.toLowerCase(first);
        if (lower == first) return s;
        return new StringBuilder(s.length())
            .appendCodePoint(lower)
            .append(s, Character.charCount(first), s.length())
            .toString();
    }

    /**
     * Replace every character that is not a letter, digit or underscore with
     * {@code _}, and prefix {@code _} when the result would be empty or start
     * with a digit.
     */
    public static String toIdentifier(String name) {
        if (name == null || name.isEmpty()) return "_";
        StringBuilder sb = new StringBuilder(name.length() + 1);
        name.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == '_') {
                sb.appendCodePoint(cp);
            } else {
                sb.append('_');
            }
        });
        if (Character.isDigit(sb.codePointAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * Convert a hyphenated or underscored name to camelCase, e.g.
     * {@code "Street-Name"} → {@code "streetName"}.
     */
    public static String toCamelCase(String name) {
        if (name == null || name.isEmpty()) return name;
        String[] parts = name.split("[-_.]");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.isEmpty()) {
                sb.append(makeFirstLowerCase(part));
            } else {
                sb.append(makeFirstUpperCase(part));
            }
        }
        return sb.isEmpty() ? name : sb.toString();
    }

    /**
     * Convert to UPPER_SNAKE_CASE for constant names.
     */
    public static String toConstantCase(String name) {
        if (name == null || name.isEmpty()) return name;
        return toSnakeCase(name).toUpperCase(Locale.ROOT);
    }
}
