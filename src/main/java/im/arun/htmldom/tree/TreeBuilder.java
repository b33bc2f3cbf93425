package im.arun.htmldom.tree;

import im.arun.htmldom.config.LoadSettings;
import im.arun.htmldom.model.Children;
import im.arun.htmldom.model.Node;
import im.arun.htmldom.model.OpeningTag;
import im.arun.htmldom.token.AttributeParser;
import im.arun.htmldom.token.MarkupException;
import im.arun.htmldom.token.MarkupTokenizer;
import im.arun.htmldom.token.Token;
import im.arun.htmldom.token.TokenKind;
import im.arun.htmldom.token.TokenNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a node tree from a flat token sequence by recursive descent.
 *
 * <p>Each call of {@link #nextNode(TokenCursor)} reads one node with all its children. Tags do
 * not have to be balanced: an element whose closing tag is missing, or is followed by a closing
 * tag of another name, is emitted without {@code end}, and the closing tag is left in place for
 * an enclosing element to match. Such elements are a normal outcome, never an error.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final LoadSettings settings;

    public TreeBuilder(LoadSettings settings) {
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        this.settings = settings;
    }

    /**
     * Load a node tree from markup.
     *
     * <p>The returned root has no opening tag, closing tag or text, only children.
     *
     * @return the root, or empty if the markup is empty or only whitespace
     * @throws MarkupException if the tokenizer rejects the markup; no partial tree is returned
     */
    public static Optional<Node> fromMarkup(String markup, LoadSettings settings) throws MarkupException {
        List<Token> tokens = new ArrayList<>();
        for (Token token : new MarkupTokenizer(markup).readAll()) {
            if (token.getKind().isStructural()) {
                tokens.add(token);
            }
        }
        return new TreeBuilder(settings).build(TokenNormalizer.normalize(tokens));
    }

    /**
     * Build the tree from normalized tokens.
     *
     * @return the synthetic root, or empty if no node could be read
     */
    public Optional<Node> build(List<Token> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);
        List<Node> nodes = new ArrayList<>();
        Node node;
        while ((node = nextNode(cursor)) != null) {
            nodes.add(node);
        }

        if (cursor.position() < tokens.size()) {
            logger.debug("Stopped at token {} of {}: unmatched {}",
                cursor.position(), tokens.size(), cursor.peek().getKind());
        }

        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Node(null, null, null, Children.of(nodes, settings.getChildrenStorage())));
    }

    /**
     * Read the node at the cursor.
     *
     * @return the node, or {@code null} at the end of the tokens or if the next token cannot
     * start a node; the cursor does not move in that case
     */
    Node nextNode(TokenCursor cursor) {
        Token token = cursor.fork().next();
        if (token == null) {
            return null;
        }

        switch (token.getKind()) {
            case START:
                cursor.next();
                return readElement(token, cursor);
            case TEXT:
                cursor.next();
                return Node.text(token.getContent());
            case EMPTY:
                cursor.next();
                return new Node(new OpeningTag(token.getName(), true, List.of()), null, null, new Children());
            default:
                return null;
        }
    }

    private Node readElement(Token startToken, TokenCursor cursor) {
        OpeningTag start = new OpeningTag(startToken.getName(), false,
            AttributeParser.parse(startToken.getContent()));

        String text = null;
        TokenCursor lookahead = cursor.fork();
        Token peek = lookahead.next();
        if (peek != null && peek.getKind() == TokenKind.TEXT) {
            cursor.commit(lookahead);
            text = peek.getContent();
        }

        List<Node> children = new ArrayList<>();
        Node child;
        while ((child = nextNode(cursor)) != null) {
            children.add(child);
        }

        // The text read above precedes every child. Mixed with children it must become the
        // first child to keep document order.
        if (text != null && (!children.isEmpty() || settings.isAllTextSeparately())) {
            children.add(0, Node.text(text));
            text = null;
        }

        String end = null;
        lookahead = cursor.fork();
        peek = lookahead.next();
        if (peek != null && peek.getKind() == TokenKind.END && peek.getName().equals(start.getName())) {
            cursor.commit(lookahead);
            end = peek.getName();
        } else {
            logger.debug("Element <{}> at {} has no matching closing tag", start.getName(),
                startToken.getPosition());
        }

        return new Node(start, text, end, Children.of(children, settings.getChildrenStorage()));
    }
}
