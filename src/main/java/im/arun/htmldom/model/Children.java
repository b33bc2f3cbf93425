package im.arun.htmldom.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;

/**
 * Ordered children of a node. A plain list of {@link NodeAccess}: no deduplication, no
 * reordering.
 */
public class Children extends AbstractList<NodeAccess> implements RandomAccess {

    private final List<NodeAccess> nodes;

    public Children() {
        this.nodes = new ArrayList<>();
    }

    public Children(Collection<NodeAccess> nodes) {
        this.nodes = new ArrayList<>(nodes);
    }

    /**
     * Wrap freshly built nodes using the given storage.
     */
    public static Children of(List<Node> nodes, ChildrenStorage storage) {
        Children children = new Children();
        for (Node node : nodes) {
            children.add(storage.wrap(node));
        }
        return children;
    }

    @Override
    public NodeAccess get(int index) {
        return nodes.get(index);
    }

    @Override
    public int size() {
        return nodes.size();
    }

    @Override
    public NodeAccess set(int index, NodeAccess element) {
        return nodes.set(index, requireNonNull(element));
    }

    @Override
    public void add(int index, NodeAccess element) {
        nodes.add(index, requireNonNull(element));
    }

    @Override
    public NodeAccess remove(int index) {
        return nodes.remove(index);
    }

    /**
     * Deep copy in which every node is shared.
     */
    public Children toSharable() {
        Children result = new Children();
        for (NodeAccess child : nodes) {
            result.add(child.toSharable());
        }
        return result;
    }

    /**
     * Deep copy in which every node is exclusively owned.
     */
    public Children toOwned() {
        Children result = new Children();
        for (NodeAccess child : nodes) {
            result.add(child.toOwned());
        }
        return result;
    }

    private static NodeAccess requireNonNull(NodeAccess element) {
        if (element == null) {
            throw new NullPointerException("Children cannot hold null");
        }
        return element;
    }
}
