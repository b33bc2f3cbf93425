package im.arun.htmldom.model;

import im.arun.htmldom.search.ChildrenFetch;
import im.arun.htmldom.search.ChildrenFetchMut;
import im.arun.htmldom.serialize.MarkupWriter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One entry of the document tree: an element, a text run or the synthetic root.
 *
 * <p>Holds the opening tag and, if one was matched, the closing tag name. Text that appears
 * together with child elements is always stored in its own child node so that the order of
 * text and elements is kept; only a lone text run may live in {@link #getText()}.
 *
 * <p>Equality is structural, field by field. Children compare through {@link NodeAccess}, so
 * shared children compare by identity.
 */
@EqualsAndHashCode
@ToString
public class Node implements NodeView {

    private OpeningTag start;

    private String text;

    private String end;

    private final Children children;

    /**
     * Empty node with no tags, text nor children.
     */
    public Node() {
        this(null, null, null, new Children());
    }

    public Node(OpeningTag start, String text, String end, Children children) {
        this.start = start;
        this.text = text;
        this.end = end;
        this.children = children != null ? children : new Children();
    }

    public static Node text(String text) {
        return new Node(null, text, null, new Children());
    }

    /**
     * Element with an opening and a matching closing tag and no content.
     */
    public static Node element(String name, Attribute... attrs) {
        return new Node(new OpeningTag(name, false, List.of(attrs)), null, name, new Children());
    }

    public static Node selfClosing(String name) {
        return new Node(new OpeningTag(name, true, List.of()), null, null, new Children());
    }

    @Override
    public Optional<OpeningTag> getStart() {
        return Optional.ofNullable(start);
    }

    @Override
    public Optional<String> getEnd() {
        return Optional.ofNullable(end);
    }

    @Override
    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    @Override
    public List<NodeView> getChildren() {
        List<NodeView> views = new ArrayList<>(children.size());
        for (NodeAccess child : children) {
            views.add(child.view());
        }
        return Collections.unmodifiableList(views);
    }

    @Override
    public Optional<String> getTagName() {
        return start == null ? Optional.empty() : Optional.of(start.getName());
    }

    @Override
    public Optional<List<Attribute>> getAttributes() {
        return start == null ? Optional.empty() : Optional.of(start.getAttributes());
    }

    @Override
    public Optional<Attribute> getAttributeByName(String key) {
        if (start != null) {
            for (Attribute attr : start.getAttributes()) {
                if (attr.getName().equals(key)) {
                    return Optional.of(attr);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Store {@code attr} unless an attribute with the same name exists.
     *
     * @return the rejected attribute if one with that name is already present, empty if stored
     */
    public Optional<Attribute> putAttribute(Attribute attr) {
        if (getAttributeByName(attr.getName()).isPresent()) {
            return Optional.of(attr);
        }
        overwriteAttribute(attr);
        return Optional.empty();
    }

    /**
     * Replace the values of the attribute with the same name, keeping its position, or append
     * {@code attr} if there is none. Does nothing on a node without an opening tag.
     */
    public void overwriteAttribute(Attribute attr) {
        if (start == null) {
            return;
        }

        List<Attribute> attrs = start.mutableAttributes();
        for (int i = 0; i < attrs.size(); i++) {
            Attribute existing = attrs.get(i);
            if (existing.getName().equals(attr.getName())) {
                attrs.set(i, existing.withValues(attr.getValues()));
                return;
            }
        }
        attrs.add(attr);
    }

    /**
     * Rename both the opening and the closing tag, where present.
     */
    public void changeName(String name) {
        changeOpeningName(name);
        changeClosingName(name);
    }

    public void changeOpeningName(String name) {
        if (start != null) {
            start.setName(name);
        }
    }

    /**
     * Rename the closing tag if there is one. The new name is not checked against the opening
     * tag; keeping the two consistent is up to the caller.
     */
    public void changeClosingName(String name) {
        if (end != null) {
            end = name;
        }
    }

    /**
     * Mutable list of direct children. The only way to reach their {@link NodeAccess} handles.
     */
    public Children getChildrenMut() {
        return children;
    }

    @Override
    public ChildrenFetch childrenFetch() {
        return ChildrenFetch.forNode(this);
    }

    public ChildrenFetchMut childrenFetchMut() {
        return ChildrenFetchMut.forNode(this);
    }

    @Override
    public String toMarkup() {
        return MarkupWriter.write(this);
    }

    /**
     * Structural copy. Exclusive children are copied recursively, shared children get a new
     * handle on the same allocation.
     */
    public Node copy() {
        Children copied = new Children();
        for (NodeAccess child : children) {
            copied.add(child.duplicate());
        }
        return new Node(start != null ? start.copy() : null, text, end, copied);
    }

    /**
     * Recursive copy in which every descendant uses {@code storage}.
     */
    Node convert(ChildrenStorage storage) {
        Children converted = new Children();
        for (NodeAccess child : children) {
            converted.add(storage.wrap(child.node().convert(storage)));
        }
        return new Node(start != null ? start.copy() : null, text, end, converted);
    }
}
