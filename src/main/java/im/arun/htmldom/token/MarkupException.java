package im.arun.htmldom.token;

import lombok.Getter;

/**
 * Raised by {@link MarkupTokenizer} when the low-level token stream is malformed.
 * This is the only error that aborts tree construction.
 */
@Getter
public class MarkupException extends Exception {

    public enum Kind {
        /** A tag, comment, CDATA section or declaration is still open at end of input. */
        UNEXPECTED_EOF,
        /** A tag with no name, e.g. {@code <>} or {@code </ >}. */
        EMPTY_TAG_NAME,
        /** Input bytes that are not valid UTF-8; the position is a byte offset. */
        INVALID_ENCODING
    }

    private final Kind kind;

    private final int position;

    public MarkupException(Kind kind, int position, String message) {
        super(message + " at position " + position);
        this.kind = kind;
        this.position = position;
    }
}
