package im.arun.htmldom.token;

/**
 * Kinds of events produced by {@link MarkupTokenizer}.
 */
public enum TokenKind {
    /** Opening tag, e.g. {@code <p class="a">}. */
    START,
    /** Closing tag, e.g. {@code </p>}. */
    END,
    /** Self-closing tag, e.g. {@code <br/>}. */
    EMPTY,
    /** Raw text between tags. */
    TEXT,
    COMMENT,
    CDATA,
    DOCTYPE,
    PROCESSING_INSTRUCTION;

    /**
     * Whether the tree builder consumes this kind. All other kinds are dropped
     * before normalization.
     */
    public boolean isStructural() {
        return this == START || this == END || this == EMPTY || this == TEXT;
    }
}
