package im.arun.htmldom.model;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * How a node is stored by its parent: either {@link Exclusive}ly owned or {@link Shared} behind
 * a reference-counted handle.
 *
 * <p>Reading goes through {@link #view()}. Writing goes through {@link #tryMut()}, which always
 * succeeds for an exclusive node and succeeds for a shared node only while its handle is the
 * only one. There is no implicit copy on write; use {@link #toOwned()} to get a private copy.
 *
 * <p>Equality differs per variant: two exclusive nodes are equal if their trees are
 * structurally equal, two shared nodes are equal only if they point at the same allocation.
 * Values of different variants are never equal.
 *
 * <p>The library takes no locks. Shared handles may be read from several threads, but
 * mutation must be confined to a single owner by the caller.
 */
public abstract class NodeAccess {

    private NodeAccess() {}

    public static Exclusive exclusive(Node node) {
        return new Exclusive(node);
    }

    public static Shared shared(Node node) {
        return new Shared(new Cell(node));
    }

    /**
     * Read-only view of the node.
     */
    public abstract NodeView view();

    /**
     * Mutable access to the node, if this handle is allowed to mutate it.
     */
    public abstract Optional<Node> tryMut();

    /**
     * Deep copy of this subtree in which every node is shared.
     */
    public Shared toSharable() {
        return shared(node().convert(ChildrenStorage.SHARED));
    }

    /**
     * Deep copy of this subtree in which every node is exclusively owned.
     */
    public Exclusive toOwned() {
        return exclusive(node().convert(ChildrenStorage.EXCLUSIVE));
    }

    public abstract boolean isShared();

    abstract Node node();

    /**
     * Copy used by {@link Node#copy()}: exclusive nodes are copied, shared ones re-shared.
     */
    abstract NodeAccess duplicate();

    /**
     * Sole owner of its node.
     */
    public static final class Exclusive extends NodeAccess {

        private final Node node;

        private Exclusive(Node node) {
            if (node == null) {
                throw new NullPointerException("node");
            }
            this.node = node;
        }

        @Override
        public NodeView view() {
            return node;
        }

        @Override
        public Optional<Node> tryMut() {
            return Optional.of(node);
        }

        @Override
        public boolean isShared() {
            return false;
        }

        @Override
        Node node() {
            return node;
        }

        @Override
        NodeAccess duplicate() {
            return new Exclusive(node.copy());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Exclusive)) {
                return false;
            }
            return node.equals(((Exclusive) o).node);
        }

        @Override
        public int hashCode() {
            return node.hashCode();
        }

        @Override
        public String toString() {
            return "Exclusive(" + node + ")";
        }
    }

    /**
     * Handle on a reference-counted node. Every handle counts once until it is
     * {@link #release() released}.
     */
    public static final class Shared extends NodeAccess {

        private final Cell cell;

        private boolean released;

        private Shared(Cell cell) {
            this.cell = cell;
        }

        /**
         * New handle on the same node. The reference count grows by one.
         */
        public Shared share() {
            checkLive();
            cell.refs.incrementAndGet();
            return new Shared(cell);
        }

        /**
         * Drop this handle. The reference count shrinks by one; releasing twice has no
         * further effect. A released handle cannot be used anymore.
         */
        public void release() {
            if (!released) {
                released = true;
                cell.refs.decrementAndGet();
            }
        }

        public int refCount() {
            return cell.refs.get();
        }

        public boolean isReleased() {
            return released;
        }

        @Override
        public NodeView view() {
            checkLive();
            return cell.node;
        }

        @Override
        public Optional<Node> tryMut() {
            checkLive();
            return cell.refs.get() == 1 ? Optional.of(cell.node) : Optional.empty();
        }

        @Override
        public boolean isShared() {
            return true;
        }

        @Override
        Node node() {
            checkLive();
            return cell.node;
        }

        @Override
        NodeAccess duplicate() {
            return share();
        }

        private void checkLive() {
            if (released) {
                throw new IllegalStateException("Shared node handle has been released");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Shared)) {
                return false;
            }
            return cell == ((Shared) o).cell;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(cell);
        }

        @Override
        public String toString() {
            return "Shared@" + Integer.toHexString(hashCode()) + "(refs=" + cell.refs.get() + ")";
        }
    }

    private static final class Cell {
        private final Node node;
        private final AtomicInteger refs = new AtomicInteger(1);

        private Cell(Node node) {
            if (node == null) {
                throw new NullPointerException("node");
            }
            this.node = node;
        }
    }
}
