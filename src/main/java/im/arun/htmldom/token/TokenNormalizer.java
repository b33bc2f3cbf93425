package im.arun.htmldom.token;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the indentation noise of pretty-printed markup from text tokens.
 *
 * <p>A text run starting with a newline loses all leading whitespace; one starting with a space
 * or tab loses it only if nothing but whitespace follows. A run containing a newline (after the
 * leading trim) loses its trailing whitespace. Runs that end up empty are dropped. Non-text
 * tokens pass through untouched and in order.
 */
public final class TokenNormalizer {

    private TokenNormalizer() {}

    public static List<Token> normalize(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.getKind() != TokenKind.TEXT) {
                result.add(token);
                continue;
            }

            String text = trimEnd(trimStart(token.getContent()));
            if (!text.isEmpty()) {
                result.add(token.withContent(text));
            }
        }
        return result;
    }

    static String trimStart(String s) {
        if (s.isEmpty()) {
            return s;
        }

        char first = s.charAt(0);
        if (first == '\n') {
            return s.stripLeading();
        }
        if (first == ' ' || first == '\t') {
            for (int i = 1; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c != ' ' && c != '\t' && c != '\n') {
                    return s;
                }
            }
            return s.stripLeading();
        }
        return s;
    }

    static String trimEnd(String s) {
        return s.indexOf('\n') >= 0 ? s.stripTrailing() : s;
    }
}
