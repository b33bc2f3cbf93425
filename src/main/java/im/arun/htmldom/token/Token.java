package im.arun.htmldom.token;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single markup event.
 *
 * <p>For {@link TokenKind#START} and {@link TokenKind#EMPTY} the {@code content} holds the raw
 * tag body after the name (attributes, unparsed). For {@link TokenKind#TEXT} it holds the literal
 * text, entities left escaped. End tags carry only a name.
 */
@Data
@AllArgsConstructor
public class Token {

    private final TokenKind kind;

    private final String name;

    private final String content;

    private final int position;

    public static Token start(String name, String rawAttributes, int position) {
        return new Token(TokenKind.START, name, rawAttributes, position);
    }

    public static Token end(String name, int position) {
        return new Token(TokenKind.END, name, null, position);
    }

    public static Token empty(String name, String rawAttributes, int position) {
        return new Token(TokenKind.EMPTY, name, rawAttributes, position);
    }

    public static Token text(String text, int position) {
        return new Token(TokenKind.TEXT, null, text, position);
    }

    /**
     * Same token with its text replaced. Used by the normalizer.
     */
    public Token withContent(String newContent) {
        return new Token(kind, name, newContent, position);
    }
}
