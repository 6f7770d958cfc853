package com.schemacraft.generator.intake;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The fixed, bounded set of textual repairs applied to a candidate JSON span.
 *
 * Each step runs once, in declaration order. There is no iteration to a fixpoint.
 * The comma and key steps only touch text outside quoted literals.
 * {@link Step#SINGLE_QUOTES} is known to damage prose containing apostrophes; such damage
 * surfaces later as a parse or validation failure and is not compensated for here.
 */
public final class JsonRepair {

    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");

    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_$][A-Za-z0-9_$]*)(\\s*:)");

    private static final Pattern SINGLE_QUOTED = Pattern.compile("'((?:[^'\\\\]|\\\\.)*)'");

    private JsonRepair() {
        // Utility class
    }

    /**
     * Repair steps, in the order they are applied.
     */
    public enum Step {
        TRAILING_COMMAS(JsonRepair::stripTrailingCommas),
        BARE_KEYS(JsonRepair::quoteBareKeys),
        SINGLE_QUOTES(JsonRepair::normalizeSingleQuotes);

        private final UnaryOperator<String> transform;

        Step(UnaryOperator<String> transform) {
            this.transform = transform;
        }

        public String apply(String text) {
            return transform.apply(text);
        }
    }

    /**
     * Drops a comma that directly precedes a closing brace or bracket.
     */
    public static String stripTrailingCommas(String text) {
        return outsideLiterals(text, plain -> TRAILING_COMMA.matcher(plain).replaceAll("$1"));
    }

    /**
     * Wraps identifier-like object keys in double quotes.
     */
    public static String quoteBareKeys(String text) {
        return outsideLiterals(text, plain -> BARE_KEY.matcher(plain).replaceAll("$1\"$2\"$3"));
    }

    /**
     * Rewrites 'single quoted' literals as "double quoted" ones.
     */
    public static String normalizeSingleQuotes(String text) {
        return SINGLE_QUOTED.matcher(text).replaceAll(m -> {
            String body = m.group(1)
                    .replace("\\'", "'")
                    .replace("\"", "\\\"");
            return Matcher.quoteReplacement("\"" + body + "\"");
        });
    }

    /**
     * Applies {@code transform} to each run of text between quoted literals, copying the
     * literals themselves through unchanged. Both quote characters open a literal; a
     * backslash escapes the next character.
     */
    private static String outsideLiterals(String text, UnaryOperator<String> transform) {
        StringBuilder out = new StringBuilder(text.length());
        int runStart = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                out.append(transform.apply(text.substring(runStart, i)));
                int end = endOfLiteral(text, i);
                out.append(text, i, end);
                i = end;
                runStart = end;
            } else {
                i++;
            }
        }
        out.append(transform.apply(text.substring(runStart)));
        return out.toString();
    }

    private static int endOfLiteral(String text, int open) {
        char quote = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }
}
