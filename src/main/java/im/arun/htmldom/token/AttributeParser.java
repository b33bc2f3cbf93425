package im.arun.htmldom.token;

import im.arun.htmldom.model.Attribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the raw attribute section of an opening tag, e.g. {@code  class="a b" id='x'}.
 *
 * <p>Only quoted values are accepted. An entry without {@code =}, with an unquoted or
 * unterminated value, or repeating a name already seen on the tag is skipped and parsing
 * resumes with the next entry. Values are kept raw (no entity decoding).
 */
public class AttributeParser {
    private static final Logger logger = LoggerFactory.getLogger(AttributeParser.class);

    private final String raw;
    private int pos = 0;

    private AttributeParser(String raw) {
        this.raw = raw;
    }

    public static List<Attribute> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        return new AttributeParser(raw).parseAll();
    }

    private List<Attribute> parseAll() {
        List<Attribute> attributes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        while (true) {
            skipWhitespace();
            if (pos >= raw.length()) {
                break;
            }

            int entryStart = pos;
            String name = readName();
            if (name.isEmpty()) {
                skipMalformed(entryStart, "missing name");
                continue;
            }
            int nameEnd = pos;
            skipWhitespace();
            if (pos >= raw.length() || raw.charAt(pos) != '=') {
                pos = nameEnd;
                logger.debug("Skipping attribute '{}': no value", name);
                continue;
            }
            pos++; // '='
            skipWhitespace();

            if (pos >= raw.length() || (raw.charAt(pos) != '"' && raw.charAt(pos) != '\'')) {
                skipMalformed(entryStart, "unquoted value");
                continue;
            }
            char quote = raw.charAt(pos);
            int close = raw.indexOf(quote, pos + 1);
            if (close < 0) {
                pos = raw.length();
                logger.debug("Skipping attribute '{}': unterminated value", name);
                continue;
            }
            String value = raw.substring(pos + 1, close);
            pos = close + 1;

            if (!seen.add(name)) {
                logger.debug("Skipping duplicated attribute '{}'", name);
                continue;
            }
            attributes.add(Attribute.of(name, value));
        }

        return attributes;
    }

    private String readName() {
        int start = pos;
        while (pos < raw.length()) {
            char c = raw.charAt(pos);
            if (c == '=' || MarkupTokenizer.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return raw.substring(start, pos);
    }

    private void skipMalformed(int entryStart, String reason) {
        // A lone '=' must still be consumed.
        if (pos == entryStart) {
            pos++;
        }
        while (pos < raw.length() && !MarkupTokenizer.isWhitespace(raw.charAt(pos))) {
            pos++;
        }
        logger.debug("Skipping malformed attribute at offset {}: {}", entryStart, reason);
    }

    private void skipWhitespace() {
        while (pos < raw.length() && MarkupTokenizer.isWhitespace(raw.charAt(pos))) {
            pos++;
        }
    }
}
