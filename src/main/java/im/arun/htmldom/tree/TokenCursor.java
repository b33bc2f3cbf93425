package im.arun.htmldom.tree;

import im.arun.htmldom.token.Token;

import java.util.List;

/**
 * Position in a token buffer. Lookahead is done on a {@link #fork()} so the real cursor only
 * moves once the expected pattern has been confirmed.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int index;

    TokenCursor(List<Token> tokens) {
        this(tokens, 0);
    }

    private TokenCursor(List<Token> tokens, int index) {
        this.tokens = tokens;
        this.index = index;
    }

    /**
     * Token at the current position, or {@code null} at the end.
     */
    Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * Return the current token and move past it; {@code null} at the end.
     */
    Token next() {
        Token token = peek();
        if (token != null) {
            index++;
        }
        return token;
    }

    /**
     * Independent cursor at the same position.
     */
    TokenCursor fork() {
        return new TokenCursor(tokens, index);
    }

    /**
     * Adopt the position of a fork of this cursor.
     */
    void commit(TokenCursor fork) {
        this.index = fork.index;
    }

    int position() {
        return index;
    }
}
