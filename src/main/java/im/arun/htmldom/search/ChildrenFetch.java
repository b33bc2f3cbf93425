package im.arun.htmldom.search;

import im.arun.htmldom.model.Attribute;
import im.arun.htmldom.model.NodeView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the descendants of a node whose attributes match some criteria.
 *
 * <p>Criteria:
 * <ul>
 *   <li>{@code key} restricts matching to the attribute of that name; without it every
 *   attribute of a node is tried.</li>
 *   <li>{@code value} requires the space-joined attribute value to be equal.</li>
 *   <li>{@code valuePart} requires one of the value tokens to be equal. Ignored when
 *   {@code value} is set.</li>
 * </ul>
 * With neither value criterion, having the attribute (or, without a key, any attribute) is
 * enough.
 *
 * <p>The node the search starts from is never part of the result. Results are in document
 * pre-order; a matching node is listed once and its descendants are searched as well.
 *
 * <pre>{@code
 * List<NodeView> found = root.childrenFetch()
 *         .key("class")
 *         .valuePart("someclass")
 *         .fetch();
 * }</pre>
 */
public class ChildrenFetch {

    private final NodeView node;

    private String key;

    private String value;

    private String valuePart;

    protected ChildrenFetch(NodeView node) {
        if (node == null) {
            throw new NullPointerException("node");
        }
        this.node = node;
    }

    public static ChildrenFetch forNode(NodeView node) {
        return new ChildrenFetch(node);
    }

    /**
     * Same criteria, searching below another node.
     */
    public ChildrenFetch sameForNode(NodeView other) {
        return copyCriteriaTo(new ChildrenFetch(other));
    }

    protected <T extends ChildrenFetch> T copyCriteriaTo(T fetch) {
        fetch.key(key).value(value).valuePart(valuePart);
        return fetch;
    }

    public ChildrenFetch key(String key) {
        this.key = key;
        return this;
    }

    public ChildrenFetch value(String value) {
        this.value = value;
        return this;
    }

    public ChildrenFetch valuePart(String valuePart) {
        this.valuePart = valuePart;
        return this;
    }

    public Optional<String> getKey() {
        return Optional.ofNullable(key);
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<String> getValuePart() {
        return Optional.ofNullable(valuePart);
    }

    /**
     * All matching descendants in document pre-order.
     */
    public List<NodeView> fetch() {
        List<NodeView> result = new ArrayList<>();
        collect(node, result);
        return result;
    }

    private void collect(NodeView parent, List<NodeView> result) {
        for (NodeView child : parent.getChildren()) {
            if (matches(child)) {
                result.add(child);
            }
            collect(child, result);
        }
    }

    /**
     * Whether a single node satisfies the criteria.
     */
    public boolean matches(NodeView candidate) {
        if (key != null) {
            return candidate.getAttributeByName(key)
                .map(this::matchesValue)
                .orElse(false);
        }

        Optional<List<Attribute>> attrs = candidate.getAttributes();
        if (attrs.isEmpty()) {
            return false;
        }
        for (Attribute attr : attrs.get()) {
            if (matchesValue(attr)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesValue(Attribute attr) {
        if (value != null) {
            return attr.valuesToString().equals(value);
        }
        if (valuePart != null) {
            return attr.hasValue(valuePart);
        }
        return true;
    }
}
