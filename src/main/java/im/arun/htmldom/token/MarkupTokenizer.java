package im.arun.htmldom.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Lenient, position-based markup tokenizer.
 *
 * <p>Splits the input into tag and text events without validating nesting: closing tags are
 * never checked against open elements, unknown constructs are passed through as-is and entities
 * are left escaped. Only constructs that cannot be delimited (a tag or comment still open at end
 * of input, or a tag without a name) fail with {@link MarkupException}.
 */
public class MarkupTokenizer {
    private static final Logger logger = LoggerFactory.getLogger(MarkupTokenizer.class);

    private final String markup;
    private int pos = 0;

    public MarkupTokenizer(String markup) {
        if (markup == null) {
            throw new NullPointerException("markup");
        }
        this.markup = markup;
    }

    /**
     * Decode raw input as strict UTF-8.
     *
     * @throws MarkupException of kind {@link MarkupException.Kind#INVALID_ENCODING} at the offset
     * of the first malformed or unmappable byte sequence
     */
    public static String decodeUtf8(byte[] bytes) throws MarkupException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        try {
            return decoder.decode(in).toString();
        } catch (CharacterCodingException e) {
            throw new MarkupException(MarkupException.Kind.INVALID_ENCODING, in.position(),
                "Invalid UTF-8 (" + e.getMessage() + ")");
        }
    }

    /**
     * Read every remaining token.
     *
     * @return tokens in document order, including comments and declarations
     * @throws MarkupException on the first malformed construct
     */
    public List<Token> readAll() throws MarkupException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = next()) != null) {
            tokens.add(token);
        }
        logger.debug("Read {} tokens from {} chars", tokens.size(), markup.length());
        return tokens;
    }

    /**
     * Read the next token.
     *
     * @return the token, or {@code null} at end of input
     * @throws MarkupException if the construct at the current position is malformed
     */
    public Token next() throws MarkupException {
        if (pos >= markup.length()) {
            return null;
        }

        if (markup.charAt(pos) != '<') {
            return readText();
        }

        if (markup.startsWith("<!--", pos)) {
            return readDelimited(TokenKind.COMMENT, 4, "-->", "comment");
        }
        if (markup.startsWith("<![CDATA[", pos)) {
            return readDelimited(TokenKind.CDATA, 9, "]]>", "CDATA section");
        }
        if (markup.startsWith("<!", pos)) {
            return readDelimited(TokenKind.DOCTYPE, 2, ">", "declaration");
        }
        if (markup.startsWith("<?", pos)) {
            return readDelimited(TokenKind.PROCESSING_INSTRUCTION, 2, "?>", "processing instruction");
        }
        if (markup.startsWith("</", pos)) {
            return readEndTag();
        }
        return readStartTag();
    }

    private Token readText() {
        int start = pos;
        int lt = markup.indexOf('<', pos);
        pos = lt < 0 ? markup.length() : lt;
        return Token.text(markup.substring(start, pos), start);
    }

    private Token readDelimited(TokenKind kind, int openLength, String terminator, String what)
            throws MarkupException {
        int start = pos;
        int end = markup.indexOf(terminator, pos + openLength);
        if (end < 0) {
            throw new MarkupException(MarkupException.Kind.UNEXPECTED_EOF, start, "Unterminated " + what);
        }
        pos = end + terminator.length();
        return new Token(kind, null, markup.substring(start + openLength, end), start);
    }

    private Token readEndTag() throws MarkupException {
        int start = pos;
        int gt = markup.indexOf('>', pos + 2);
        if (gt < 0) {
            throw new MarkupException(MarkupException.Kind.UNEXPECTED_EOF, start, "Unterminated closing tag");
        }
        String name = markup.substring(start + 2, gt).strip();
        if (name.isEmpty()) {
            throw new MarkupException(MarkupException.Kind.EMPTY_TAG_NAME, start, "Closing tag without a name");
        }
        pos = gt + 1;
        return Token.end(name, start);
    }

    private Token readStartTag() throws MarkupException {
        int start = pos;
        int gt = findTagEnd(start + 1);
        if (gt < 0) {
            throw new MarkupException(MarkupException.Kind.UNEXPECTED_EOF, start, "Unterminated tag");
        }
        pos = gt + 1;

        String body = markup.substring(start + 1, gt);
        boolean selfClosing = body.endsWith("/");
        if (selfClosing) {
            body = body.substring(0, body.length() - 1);
        }

        int nameEnd = 0;
        while (nameEnd < body.length() && !isWhitespace(body.charAt(nameEnd))) {
            nameEnd++;
        }
        String name = body.substring(0, nameEnd);
        if (name.isEmpty()) {
            throw new MarkupException(MarkupException.Kind.EMPTY_TAG_NAME, start, "Tag without a name");
        }
        String rawAttributes = body.substring(nameEnd);

        return selfClosing
            ? Token.empty(name, rawAttributes, start)
            : Token.start(name, rawAttributes, start);
    }

    /**
     * Index of the {@code >} closing a tag that starts before {@code from}, skipping quoted
     * attribute values; -1 if there is none.
     */
    private int findTagEnd(int from) {
        char quote = 0;
        for (int i = from; i < markup.length(); i++) {
            char c = markup.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i;
            }
        }
        return -1;
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
