package im.arun.htmldom.model;

/**
 * How a loaded tree stores its children.
 */
public enum ChildrenStorage {
    /** Every node is owned by its parent and always mutable. */
    EXCLUSIVE,
    /** Every node sits behind a reference-counted handle that can be shared. */
    SHARED;

    public NodeAccess wrap(Node node) {
        return this == SHARED ? NodeAccess.shared(node) : NodeAccess.exclusive(node);
    }
}
