package im.arun.htmldom.service;

import im.arun.htmldom.config.LoadSettings;
import im.arun.htmldom.model.Node;
import im.arun.htmldom.model.NodeView;
import im.arun.htmldom.search.ChildrenFetch;
import im.arun.htmldom.token.MarkupException;
import im.arun.htmldom.token.MarkupTokenizer;
import im.arun.htmldom.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for loading markup documents and querying them.
 */
public class HtmlDomService {
    private static final Logger logger = LoggerFactory.getLogger(HtmlDomService.class);

    /**
     * Load a node tree from markup text.
     *
     * @return the root node, or empty for markup that is empty or only whitespace
     * @throws MarkupException if the markup cannot be tokenized
     */
    public Optional<Node> load(String markup, LoadSettings settings) throws MarkupException {
        try {
            Optional<Node> root = TreeBuilder.fromMarkup(markup, settings);
            logger.debug("Loaded {} top-level nodes from {} chars",
                root.map(r -> r.getChildren().size()).orElse(0), markup.length());
            return root;
        } catch (MarkupException e) {
            logger.warn("Rejected markup: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Load a node tree from a UTF-8 file.
     *
     * @throws IOException if the file cannot be read
     * @throws MarkupException if the bytes are not valid UTF-8 or the markup cannot be tokenized
     */
    public Optional<Node> load(Path path, LoadSettings settings) throws IOException, MarkupException {
        logger.debug("Reading {}", path);
        byte[] bytes = Files.readAllBytes(path);
        String markup;
        try {
            markup = MarkupTokenizer.decodeUtf8(bytes);
        } catch (MarkupException e) {
            logger.warn("Rejected {}: {}", path, e.getMessage());
            throw e;
        }
        return load(markup, settings);
    }

    /**
     * Descendants of {@code root} matching the given criteria; any of them may be {@code null}.
     */
    public List<NodeView> find(Node root, String key, String value, String valuePart) {
        ChildrenFetch fetch = root.childrenFetch();
        if (key != null) {
            fetch.key(key);
        }
        if (value != null) {
            fetch.value(value);
        }
        if (valuePart != null) {
            fetch.valuePart(valuePart);
        }
        List<NodeView> found = fetch.fetch();
        logger.debug("Criteria key={} value={} valuePart={} matched {} nodes", key, value, valuePart, found.size());
        return found;
    }
}
