package im.arun.htmldom.serialize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.htmldom.model.Attribute;
import im.arun.htmldom.model.NodeView;
import im.arun.htmldom.model.OpeningTag;

import java.util.List;

/**
 * Converts node trees to JSON. Absent fields are omitted.
 *
 * <pre>{@code
 * {"tag": "a", "attributes": {"class": ["x", "y"]}, "end": "a",
 *  "children": [{"text": "Link"}]}
 * }</pre>
 */
public class NodeJsonMapper {
    private final ObjectMapper objectMapper;

    public NodeJsonMapper() {
        this.objectMapper = new ObjectMapper();
    }

    public ObjectNode toJson(NodeView node) {
        ObjectNode json = objectMapper.createObjectNode();

        if (node.getStart().isPresent()) {
            OpeningTag start = node.getStart().get();
            json.put("tag", start.getName());
            if (start.isSelfClosing()) {
                json.put("self_closing", true);
            }
            if (!start.getAttributes().isEmpty()) {
                ObjectNode attributes = json.putObject("attributes");
                for (Attribute attr : start.getAttributes()) {
                    ArrayNode values = attributes.putArray(attr.getName());
                    attr.getValues().forEach(values::add);
                }
            }
        }

        node.getText().ifPresent(text -> json.put("text", text));
        node.getEnd().ifPresent(end -> json.put("end", end));

        if (!node.getChildren().isEmpty()) {
            json.set("children", toJson(node.getChildren()));
        }
        return json;
    }

    public ArrayNode toJson(List<NodeView> nodes) {
        ArrayNode array = objectMapper.createArrayNode();
        for (NodeView node : nodes) {
            array.add(toJson(node));
        }
        return array;
    }

    public String writeString(NodeView node) {
        return toJson(node).toPrettyString();
    }

    public String writeString(List<NodeView> nodes) {
        return toJson(nodes).toPrettyString();
    }
}
