package im.arun.htmldom.tree;

import im.arun.htmldom.config.LoadSettings;
import im.arun.htmldom.model.Attribute;
import im.arun.htmldom.model.Node;
import im.arun.htmldom.model.NodeAccess;
import im.arun.htmldom.model.NodeView;
import im.arun.htmldom.model.OpeningTag;
import im.arun.htmldom.token.MarkupException;
import im.arun.htmldom.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TreeBuilderTest {

    private static NodeView load(String markup) throws MarkupException {
        return load(markup, LoadSettings.defaults());
    }

    private static NodeView load(String markup, LoadSettings settings) throws MarkupException {
        return TreeBuilder.fromMarkup(markup, settings).orElseThrow();
    }

    private static NodeView child(NodeView node, int index) {
        return node.getChildren().get(index);
    }

    @Test
    public void testMixedDocument() throws MarkupException {
        NodeView root = load("<p>Some text\n<img src=\"a\">\n</p><a>Link</a><br />");

        assertTrue(root.getStart().isEmpty());
        assertTrue(root.getText().isEmpty());
        assertTrue(root.getEnd().isEmpty());
        assertEquals(3, root.getChildren().size());

        NodeView p = child(root, 0);
        assertEquals(Optional.of("p"), p.getTagName());
        assertEquals(Optional.of("p"), p.getEnd());
        assertEquals(2, p.getChildren().size());
        assertEquals(Optional.of("Some text"), child(p, 0).getText());

        NodeView img = child(p, 1);
        assertEquals(Optional.of("img"), img.getTagName());
        assertTrue(img.getEnd().isEmpty());
        assertTrue(img.getChildren().isEmpty());
        assertEquals(Optional.of(Attribute.of("src", "a")), img.getAttributeByName("src"));

        NodeView a = child(root, 1);
        assertEquals(Optional.of("a"), a.getTagName());
        assertEquals(1, a.getChildren().size());
        assertEquals(Optional.of("Link"), child(a, 0).getText());
        assertTrue(a.getText().isEmpty());

        NodeView br = child(root, 2);
        assertEquals(Optional.of("br"), br.getTagName());
        assertTrue(br.getStart().orElseThrow().isSelfClosing());
        assertTrue(br.getEnd().isEmpty());
    }

    @Test
    public void testPrettyPrintedDocument() throws MarkupException {
        String markup = "\n        <p>Some text\n            <img src=\"a\">\n        </p>\n"
            + "        <a>Link</a>\n        <br />\n        ";

        assertEquals(load("<p>Some text\n<img src=\"a\">\n</p><a>Link</a><br />"), load(markup));
    }

    @Test
    @DisplayName("Text mixed with children is hoisted even when not storing all text separately")
    public void testMixedTextIsAlwaysHoisted() throws MarkupException {
        NodeView root = load("<p>Text <sup>child</sup> more text</p>",
            LoadSettings.defaults().allTextSeparately(false));

        NodeView p = child(root, 0);
        assertTrue(p.getText().isEmpty());
        assertEquals(3, p.getChildren().size());
        assertEquals(Optional.of("Text "), child(p, 0).getText());
        assertEquals(Optional.of(" more text"), child(p, 2).getText());

        NodeView sup = child(p, 1);
        assertEquals(Optional.of("sup"), sup.getTagName());
        assertEquals(Optional.of("child"), sup.getText());
        assertTrue(sup.getChildren().isEmpty());
    }

    @Test
    public void testLoneTextPlacement() throws MarkupException {
        NodeView separate = child(load("<p>Text</p>"), 0);
        assertTrue(separate.getText().isEmpty());
        assertEquals(Optional.of("Text"), child(separate, 0).getText());

        NodeView inline = child(load("<p>Text</p>", LoadSettings.defaults().allTextSeparately(false)), 0);
        assertEquals(Optional.of("Text"), inline.getText());
        assertTrue(inline.getChildren().isEmpty());
    }

    @Test
    public void testSpacesKeptInsideText() throws MarkupException {
        NodeView p = child(load("   <p>\n  Some  </p>"), 0);

        assertEquals(Optional.of("p"), p.getTagName());
        assertEquals(Optional.of("Some  "), child(p, 0).getText());
    }

    @Test
    public void testEmptyAndWhitespaceOnlyInputHasNoTree() throws MarkupException {
        assertEquals(Optional.empty(), TreeBuilder.fromMarkup("", LoadSettings.defaults()));
        assertEquals(Optional.empty(), TreeBuilder.fromMarkup("   ", LoadSettings.defaults()));
        assertEquals(Optional.empty(), TreeBuilder.fromMarkup("\n\t  \n", LoadSettings.defaults()));
        assertEquals(Optional.empty(), TreeBuilder.fromMarkup("  <!-- only a comment -->\n", LoadSettings.defaults()));
    }

    @Test
    public void testMismatchedClosingTagIsLeftForAncestor() throws MarkupException {
        NodeView root = load("<div><p>one</div>");

        NodeView div = child(root, 0);
        assertEquals(Optional.of("div"), div.getEnd());
        NodeView p = child(div, 0);
        assertEquals(Optional.of("p"), p.getTagName());
        assertTrue(p.getEnd().isEmpty());
        assertEquals(Optional.of("one"), child(p, 0).getText());
    }

    @Test
    public void testSeveralUnclosedLevels() throws MarkupException {
        NodeView root = load("<a><b><c>x</a><d></d>");

        assertEquals(2, root.getChildren().size());
        NodeView a = child(root, 0);
        assertEquals(Optional.of("a"), a.getEnd());
        NodeView b = child(a, 0);
        NodeView c = child(b, 0);
        assertTrue(b.getEnd().isEmpty());
        assertTrue(c.getEnd().isEmpty());
        assertEquals(Optional.of("d"), child(root, 1).getEnd());
    }

    @Test
    public void testMissingClosingTagAtEnd() throws MarkupException {
        NodeView root = load("<ul><li>1<li>2");

        NodeView ul = child(root, 0);
        assertTrue(ul.getEnd().isEmpty());
        NodeView first = child(ul, 0);
        assertEquals(Optional.of("li"), first.getTagName());
        NodeView nested = child(first, 1);
        assertEquals(Optional.of("li"), nested.getTagName());
        assertEquals(Optional.of("2"), child(nested, 0).getText());
    }

    @Test
    public void testStrayClosingTagStopsTopLevel() throws MarkupException {
        NodeView root = load("<p>a</p></x><i>b</i>");

        assertEquals(1, root.getChildren().size());
        assertEquals(Optional.of("p"), child(root, 0).getTagName());
        assertEquals(Optional.empty(), TreeBuilder.fromMarkup("</x><p>a</p>", LoadSettings.defaults()));
    }

    @Test
    public void testSelfClosingTagAttributesAreNotParsed() throws MarkupException {
        NodeView img = child(load("<img src=\"a\"/>"), 0);

        assertEquals(new OpeningTag("img", true, List.of()), img.getStart().orElseThrow());
    }

    @Test
    public void testCommentsDoNotBreakContent() throws MarkupException {
        NodeView p = child(load("<p>a<!-- note -->b</p>"), 0);

        assertEquals(2, p.getChildren().size());
        assertEquals(Optional.of("a"), child(p, 0).getText());
        assertEquals(Optional.of("b"), child(p, 1).getText());
    }

    @Test
    public void testTextAtTopLevel() throws MarkupException {
        NodeView root = load("lead <b>bold</b> tail");

        assertEquals(3, root.getChildren().size());
        assertEquals(Optional.of("lead "), child(root, 0).getText());
        assertEquals(Optional.of(" tail"), child(root, 2).getText());
    }

    @Test
    public void testChildrenStorageIsApplied() throws MarkupException {
        Node root = TreeBuilder.fromMarkup("<p><i>x</i></p>", LoadSettings.defaults().sharableChildren())
            .orElseThrow();

        NodeAccess p = root.getChildrenMut().get(0);
        assertTrue(p.isShared());
        NodeAccess i = p.tryMut().orElseThrow().getChildrenMut().get(0);
        assertTrue(i.isShared());
        assertTrue(i.tryMut().orElseThrow().getChildrenMut().get(0).isShared());

        Node owned = TreeBuilder.fromMarkup("<p><i>x</i></p>", LoadSettings.defaults()).orElseThrow();
        assertFalse(owned.getChildrenMut().get(0).isShared());
    }

    @Test
    public void testTokenizerFailureIsPropagated() {
        assertThrows(MarkupException.class, () -> TreeBuilder.fromMarkup("<p>ok</p><br", LoadSettings.defaults()));
    }

    @Test
    public void testNextNodeLeavesUnknownTokenInPlace() {
        TreeBuilder builder = new TreeBuilder(LoadSettings.defaults());
        TokenCursor cursor = new TokenCursor(List.of(Token.end("p", 0), Token.text("x", 4)));

        assertNull(builder.nextNode(cursor));
        assertEquals(0, cursor.position());
    }

    @Test
    public void testBuildFromTokens() {
        TreeBuilder builder = new TreeBuilder(LoadSettings.defaults().allTextSeparately(false));
        NodeView root = builder.build(List.of(
            Token.start("p", " id=\"x\"", 0), Token.text("hi", 10), Token.end("p", 12))).orElseThrow();

        NodeView p = child(root, 0);
        assertEquals(Optional.of("hi"), p.getText());
        assertEquals(Optional.of(Attribute.of("id", "x")), p.getAttributeByName("id"));
        assertTrue(builder.build(List.of()).isEmpty());
    }
}
