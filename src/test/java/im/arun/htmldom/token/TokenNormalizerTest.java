package im.arun.htmldom.token;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public final class TokenNormalizerTest {

    @Test
    public void testNewlineStripsAllLeadingWhitespace() {
        assertEquals("Some  ", TokenNormalizer.trimEnd(TokenNormalizer.trimStart("\n  Some  ")));
    }

    @Test
    public void testLeadingSpaceBeforeContentIsKept() {
        assertEquals(" more text", TokenNormalizer.trimStart(" more text"));
        assertEquals("\tx", TokenNormalizer.trimStart("\tx"));
    }

    @Test
    public void testPureIndentationIsStripped() {
        assertEquals("", TokenNormalizer.trimStart("  \t \n  "));
    }

    @Test
    public void testTrailingTrimOnlyWithNewline() {
        assertEquals("Text ", TokenNormalizer.trimEnd("Text "));
        assertEquals("Some text", TokenNormalizer.trimEnd("Some text\n    "));
    }

    @Test
    public void testEmptyRunsAreDroppedAndOrderKept() {
        Token start = Token.start("p", "", 0);
        Token end = Token.end("p", 20);
        List<Token> normalized = TokenNormalizer.normalize(List.of(
            Token.text("\n    ", 0), start, Token.text("Some text\n   ", 3), end, Token.text("   ", 24)));

        assertEquals(3, normalized.size());
        assertSame(start, normalized.get(0));
        assertEquals("Some text", normalized.get(1).getContent());
        assertEquals(3, normalized.get(1).getPosition());
        assertSame(end, normalized.get(2));
    }
}
