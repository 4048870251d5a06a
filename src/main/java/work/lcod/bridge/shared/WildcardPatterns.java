package work.lcod.bridge.shared;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.lcod.bridge.error.ValidationException;

/**
 * Compiles user-facing search patterns: {@code *}/{@code ?} wildcards or raw regular expressions.
 * Both forms are case-insensitive. Wildcards are anchored to the whole candidate; a raw regular
 * expression is a substring search unless it carries its own anchors.
 */
public final class WildcardPatterns {
    private WildcardPatterns() {}

    public static Pattern compile(String pattern, boolean useRegex) {
        if (pattern == null || pattern.isBlank()) {
            throw new ValidationException("pattern parameter is required");
        }
        if (useRegex) {
            try {
                return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException ex) {
                throw new ValidationException("Invalid regex pattern: " + pattern + ". Error: " + ex.getDescription(), ex);
            }
        }
        return Pattern.compile(toRegex(pattern), Pattern.CASE_INSENSITIVE);
    }

    public static boolean hasWildcard(String pattern) {
        return pattern != null && (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0);
    }

    static String toRegex(String wildcard) {
        var regex = new StringBuilder(wildcard.length() + 8).append('^');
        var literal = new StringBuilder();
        for (int i = 0; i < wildcard.length(); i++) {
            char ch = wildcard.charAt(i);
            if (ch == '*' || ch == '?') {
                flush(regex, literal);
                regex.append(ch == '*' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        flush(regex, literal);
        return regex.append('$').toString();
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
