package im.arun.htmldom.model;

import im.arun.htmldom.config.LoadSettings;
import im.arun.htmldom.token.MarkupException;
import im.arun.htmldom.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NodeTest {

    private static Node load(String markup) throws MarkupException {
        return TreeBuilder.fromMarkup(markup, LoadSettings.defaults()).orElseThrow();
    }

    private static Node first(Node root) {
        return root.getChildrenMut().get(0).tryMut().orElseThrow();
    }

    @Test
    public void testPutAttributeRejectsExistingName() throws MarkupException {
        Node root = load("<a href='a'>x</a>");
        Node a = first(root);

        Attribute rejected = Attribute.of("href", "b");
        assertEquals(Optional.of(rejected), a.putAttribute(rejected));
        assertEquals(List.of("a"), a.getAttributeByName("href").orElseThrow().getValues());

        assertEquals(Optional.empty(), a.putAttribute(Attribute.of("id", "top")));
        assertEquals("<a href=\"a\" id=\"top\">x</a>", root.toMarkup());
    }

    @Test
    public void testOverwriteAttributeKeepsPosition() throws MarkupException {
        Node root = load("<a href='a'>");
        Node a = first(root);

        Attribute attr = a.getAttributeByName("href").orElseThrow().withValues(List.of("b"));
        a.overwriteAttribute(attr);

        assertEquals("<a href=\"b\">", root.toMarkup());
    }

    @Test
    public void testOverwriteAttributeAppendsAndIgnoresTextNodes() throws MarkupException {
        Node root = load("<p class='x'>text</p>");
        Node p = first(root);
        p.overwriteAttribute(Attribute.of("id", "i"));
        assertEquals(List.of(Attribute.of("class", "x"), Attribute.of("id", "i")), p.getAttributes().orElseThrow());

        Node text = p.getChildrenMut().get(0).tryMut().orElseThrow();
        text.overwriteAttribute(Attribute.of("id", "i"));
        assertEquals(Optional.empty(), text.getAttributes());
        assertEquals(Optional.empty(), text.putAttribute(Attribute.of("id", "i")));
        assertEquals(Optional.empty(), text.getAttributeByName("id"));
    }

    @Test
    public void testRename() throws MarkupException {
        Node root = load("<b>x</b><i>");
        first(root).changeName("strong");
        Node i = root.getChildrenMut().get(1).tryMut().orElseThrow();
        i.changeName("em");

        assertEquals("<strong>x</strong><em>", root.toMarkup());
    }

    @Test
    public void testClosingRenameIsNotValidated() throws MarkupException {
        Node root = load("<b>x</b>");
        Node b = first(root);
        b.changeClosingName("i");

        assertEquals(Optional.of("b"), b.getTagName());
        assertEquals(Optional.of("i"), b.getEnd());
        assertEquals("<b>x</i>", root.toMarkup());

        b.changeOpeningName("u");
        assertEquals("<u>x</i>", root.toMarkup());
    }

    @Test
    public void testChildrenEdits() throws MarkupException {
        Node root = load("<ul><li>1</li></ul>");
        Node ul = first(root);

        Node li = Node.element("li");
        li.getChildrenMut().add(NodeAccess.exclusive(Node.text("2")));
        ul.getChildrenMut().add(NodeAccess.exclusive(li));
        ul.getChildrenMut().add(0, NodeAccess.exclusive(Node.selfClosing("hr")));
        assertEquals("<ul><hr/><li>1</li><li>2</li></ul>", root.toMarkup());

        ul.getChildrenMut().remove(1);
        assertEquals("<ul><hr/><li>2</li></ul>", root.toMarkup());
    }

    @Test
    public void testReadOnlyChildren() throws MarkupException {
        Node root = load("<p>x</p>");
        assertThrows(UnsupportedOperationException.class,
            () -> root.getChildren().add(new Node()));
        assertThrows(UnsupportedOperationException.class,
            () -> root.getChildren().get(0).getStart().orElseThrow().getAttributes()
                .add(Attribute.of("a", "b")));
    }

    @Test
    public void testStructuralEquality() throws MarkupException {
        assertEquals(load("<p class='a'>x</p>"), load("<p class=\"a\">x</p>"));
        assertNotEquals(load("<p class='a'>x</p>"), load("<p class='b'>x</p>"));
        assertNotEquals(load("<p>x</p>"), load("<p>x"));
    }

    @Test
    public void testCopyIsIndependentForExclusiveChildren() throws MarkupException {
        Node root = load("<p>x</p>");
        Node copy = root.copy();
        assertEquals(root, copy);

        first(copy).changeName("div");
        assertNotEquals(root, copy);
        assertEquals("<p>x</p>", root.toMarkup());
    }

    @Test
    public void testNewNodeIsEmpty() {
        Node node = new Node();
        assertTrue(node.getStart().isEmpty());
        assertTrue(node.getText().isEmpty());
        assertTrue(node.getEnd().isEmpty());
        assertTrue(node.getChildren().isEmpty());
        assertEquals("", node.toMarkup());
    }
}
