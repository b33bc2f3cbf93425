package im.arun.htmldom.search;

import im.arun.htmldom.model.Node;
import im.arun.htmldom.model.NodeAccess;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ChildrenFetch} that hands out the matched nodes for mutation. Only obtainable from a
 * {@link Node}, i.e. from something the caller may already mutate.
 *
 * <p>Descendants are reached through {@link Node#getChildrenMut()} and {@link NodeAccess#tryMut()}
 * level by level, so a match counts as mutable only if every node on its path is.
 *
 * <p>Results may be nested in one another; changing the children of one result can detach
 * later results from the tree.
 */
public class ChildrenFetchMut extends ChildrenFetch {

    private final Node node;

    private ChildrenFetchMut(Node node) {
        super(node);
        this.node = node;
    }

    public static ChildrenFetchMut forNode(Node node) {
        return new ChildrenFetchMut(node);
    }

    /**
     * Same criteria, searching below another mutable node.
     */
    public ChildrenFetchMut sameForNode(Node other) {
        return copyCriteriaTo(new ChildrenFetchMut(other));
    }

    @Override
    public ChildrenFetchMut key(String key) {
        super.key(key);
        return this;
    }

    @Override
    public ChildrenFetchMut value(String value) {
        super.value(value);
        return this;
    }

    @Override
    public ChildrenFetchMut valuePart(String valuePart) {
        super.valuePart(valuePart);
        return this;
    }

    /**
     * All matching descendants, mutable, in document pre-order.
     *
     * @throws IllegalStateException if a matched node, or one of its ancestors below the
     * starting node, is shared through more than one handle
     */
    public List<Node> fetchMut() {
        List<Node> result = new ArrayList<>();
        collectMut(node, result);
        return result;
    }

    private void collectMut(Node parent, List<Node> result) {
        for (NodeAccess child : parent.getChildrenMut()) {
            Optional<Node> mutable = child.tryMut();
            if (mutable.isPresent()) {
                if (matches(mutable.get())) {
                    result.add(mutable.get());
                }
                collectMut(mutable.get(), result);
            } else if (matches(child.view()) || !sameForNode(child.view()).fetch().isEmpty()) {
                throw new IllegalStateException("Node <" + child.view().getTagName().orElse("")
                    + "> holds a match but is shared and cannot be mutated");
            }
        }
    }
}
