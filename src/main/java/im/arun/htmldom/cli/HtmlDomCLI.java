package im.arun.htmldom.cli;

import im.arun.htmldom.config.LoadSettings;
import im.arun.htmldom.config.SettingsLoader;
import im.arun.htmldom.model.Node;
import im.arun.htmldom.model.NodeView;
import im.arun.htmldom.serialize.MarkupWriter;
import im.arun.htmldom.serialize.NodeJsonMapper;
import im.arun.htmldom.service.HtmlDomService;
import im.arun.htmldom.token.MarkupException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface: loads a markup file and prints its node tree, or the nodes matching
 * attribute criteria.
 */
@Command(
    name = "htmldom",
    description = "Load markup into a node tree and print it or search it by attributes",
    mixinStandardHelpOptions = true,
    version = "htmldom 1.0"
)
public class HtmlDomCLI implements Callable<Integer> {

    enum Format { JSON, MARKUP }

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "Path to markup file", required = true)
    private String inputPath;

    @Option(names = {"--config"}, description = "Settings YAML file")
    private String configPath;

    @Option(names = {"--all-text-separately"}, description = "Store every text run as its own node (yes/no)")
    private String allTextSeparately;

    @Option(names = {"--children-storage"}, description = "exclusive or shared")
    private String childrenStorage;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "JSON",
        converter = FormatConverter.class)
    private Format format;

    @Option(names = {"--key"}, description = "Search: attribute name")
    private String key;

    @Option(names = {"--value"}, description = "Search: exact attribute value")
    private String value;

    @Option(names = {"--value-part"}, description = "Search: one whitespace-separated value token")
    private String valuePart;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }

        Map<String, Object> options = new HashMap<>();
        if (allTextSeparately != null) {
            options.put("all_text_separately", allTextSeparately);
        }
        if (childrenStorage != null) {
            options.put("children_storage", childrenStorage);
        }
        LoadSettings settings = new SettingsLoader(configPath).load(options);

        HtmlDomService service = new HtmlDomService();
        Optional<Node> root;
        try {
            root = service.load(input, settings);
        } catch (MarkupException e) {
            err.println("Error: malformed markup: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error reading " + inputPath + ": " + e.getMessage());
            return 1;
        }

        if (root.isEmpty()) {
            out.println("(empty document)");
            return 0;
        }

        String rendered;
        if (key != null || value != null || valuePart != null) {
            rendered = render(service.find(root.get(), key, value, valuePart));
        } else {
            rendered = render(root.get());
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), rendered);
            out.println("Output written to: " + outputPath);
        } else {
            out.println(rendered);
        }
        return 0;
    }

    private String render(Node root) {
        return format == Format.MARKUP ? MarkupWriter.write(root) : new NodeJsonMapper().writeString(root);
    }

    private String render(List<NodeView> found) {
        if (format == Format.JSON) {
            return new NodeJsonMapper().writeString(found);
        }
        StringBuilder sb = new StringBuilder();
        for (NodeView node : found) {
            MarkupWriter.write(node, sb);
            sb.append(System.lineSeparator());
        }
        return sb.toString().stripTrailing();
    }

    public static class FormatConverter implements CommandLine.ITypeConverter<Format> {
        @Override
        public Format convert(String value) {
            return Format.valueOf(value.trim().toUpperCase());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HtmlDomCLI()).execute(args);
        System.exit(exitCode);
    }
}
