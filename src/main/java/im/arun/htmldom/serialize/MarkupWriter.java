package im.arun.htmldom.serialize;

import im.arun.htmldom.model.Attribute;
import im.arun.htmldom.model.NodeView;
import im.arun.htmldom.model.OpeningTag;

/**
 * Writes a node tree back to markup text.
 *
 * <p>Attribute values are always double-quoted and their tokens joined with single spaces.
 * Closing tags are written only where one was matched while loading.
 */
public final class MarkupWriter {

    private MarkupWriter() {}

    public static String write(NodeView node) {
        StringBuilder sb = new StringBuilder();
        write(node, sb);
        return sb.toString();
    }

    public static void write(NodeView node, StringBuilder sb) {
        if (node.getStart().isPresent()) {
            OpeningTag start = node.getStart().get();
            sb.append('<').append(start.getName());
            for (Attribute attr : start.getAttributes()) {
                sb.append(' ')
                    .append(attr.getName())
                    .append("=\"")
                    .append(attr.valuesToString())
                    .append('"');
            }
            if (start.isSelfClosing()) {
                sb.append('/');
            }
            sb.append('>');
        }

        node.getText().ifPresent(sb::append);

        for (NodeView child : node.getChildren()) {
            write(child, sb);
        }

        node.getEnd().ifPresent(end -> sb.append("</").append(end).append('>'));
    }
}
