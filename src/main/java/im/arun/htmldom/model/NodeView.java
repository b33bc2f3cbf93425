package im.arun.htmldom.model;

import im.arun.htmldom.search.ChildrenFetch;

import java.util.List;
import java.util.Optional;

/**
 * Read-only side of a {@link Node}. This is all a {@link NodeAccess} hands out without
 * {@link NodeAccess#tryMut()}, and all a serializer needs to rebuild the markup.
 *
 * <p>Children are reachable only as views. Their {@link NodeAccess} handles come from
 * {@link Node#getChildrenMut()} on a node already held mutably, so a shared subtree cannot be
 * changed through an alias of one of its ancestors.
 */
public interface NodeView {

    /** Opening tag; absent for text nodes and the root. */
    Optional<OpeningTag> getStart();

    /** Closing tag name; present only when a matching closing tag was read. */
    Optional<String> getEnd();

    /** Inline text not split into a child node. */
    Optional<String> getText();

    /** Views of the direct children in document order, unmodifiable. */
    List<NodeView> getChildren();

    Optional<String> getTagName();

    /** Attributes of the opening tag; absent if there is no opening tag. */
    Optional<List<Attribute>> getAttributes();

    /** First attribute named {@code key}. */
    Optional<Attribute> getAttributeByName(String key);

    /** Search for descendants whose attributes match some criteria. */
    ChildrenFetch childrenFetch();

    String toMarkup();
}
