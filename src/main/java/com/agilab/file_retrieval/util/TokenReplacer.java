package com.agilab.file_retrieval.util;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the date tokens {yyyy}, {yy}, {mm} and {dd} in path and filename patterns.
 * Tokens are case-insensitive; anything else in braces is left as is.
 */
public final class TokenReplacer {

    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]*)}");
    private static final Set<String> SUPPORTED = Set.of("yyyy", "yy", "mm", "dd");

    private TokenReplacer() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String replace(String pattern, Instant at, ZoneId zone) {
        if (pattern == null || pattern.indexOf('{') < 0) {
            return pattern;
        }
        var date = at.atZone(zone).toLocalDate();
        var matcher = TOKEN.matcher(pattern);
        var result = new StringBuilder();
        while (matcher.find()) {
            var value = switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
                case "yyyy" -> String.format("%04d", date.getYear());
                case "yy" -> String.format("%02d", date.getYear() % 100);
                case "mm" -> String.format("%02d", date.getMonthValue());
                case "dd" -> String.format("%02d", date.getDayOfMonth());
                default -> matcher.group();
            };
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static Set<String> invalidTokens(String pattern) {
        var invalid = new LinkedHashSet<String>();
        if (pattern == null) {
            return invalid;
        }
        var matcher = TOKEN.matcher(pattern);
        while (matcher.find()) {
            if (!SUPPORTED.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                invalid.add(matcher.group());
            }
        }
        return invalid;
    }
}
