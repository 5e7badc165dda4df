package org.dxworks.syntaxview;

import org.dxworks.syntaxview.inspect.PropertyEntry;
import org.dxworks.syntaxview.parser.ParseResult;
import org.dxworks.syntaxview.parser.TreeSitterSyntaxParser;
import org.dxworks.syntaxview.render.DisplayTreeJsonWriter;
import org.dxworks.syntaxview.render.PresentationTheme;
import org.dxworks.syntaxview.render.PropertyTableRenderer;
import org.dxworks.syntaxview.render.TreeTextRenderer;
import org.dxworks.syntaxview.tree.DisplayNode;
import org.dxworks.syntaxview.tree.MaterializedTree;
import org.dxworks.syntaxview.tree.TraversalAnomaly;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public class App {

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) {
        Options options = Options.parse(args);
        if (options == null) {
            printUsage();
            return 2;
        }

        Path input = Paths.get(options.file);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            return 1;
        }

        Optional<Language> language = LanguageDetector.detectLanguage(input);
        if (language.isEmpty()) {
            System.err.println("Error: Unsupported file type: " + input.getFileName());
            printUsage();
            return 2;
        }

        SyntaxViewConfig config = SyntaxViewConfig.load();
        if (!withinMaxLines(input, config.getMaxFileLines())) {
            System.err.println("Error: " + input.getFileName() + " has more than " + config.getMaxFileLines() + " lines");
            return 1;
        }

        try {
            String sourceCode = readSource(input);
            SyntaxTreeSession session = new SyntaxTreeSession(
                    new TreeSitterSyntaxParser(language.get()), new SyntaxTreeViewer(config));
            ParseResult result = session.load(sourceCode);
            if (!result.isSuccess()) {
                System.err.println("Error: " + result.getFailure());
                return 1;
            }

            MaterializedTree tree = session.current().orElseThrow().getDisplayTree();
            if (options.json) {
                System.out.println(new DisplayTreeJsonWriter().toJson(tree.getRoot()));
            } else {
                TreeTextRenderer renderer = new TreeTextRenderer(options.color ? PresentationTheme.DARK : PresentationTheme.PLAIN);
                System.out.print(renderer.render(tree.getRoot()));
            }

            for (TraversalAnomaly anomaly : tree.getAnomalies()) {
                System.err.println("Warning: " + anomaly);
            }

            if (options.selectPath != null) {
                Optional<DisplayNode> selected = select(tree.getRoot(), options.selectPath);
                if (selected.isEmpty()) {
                    System.err.println("Error: No display node at path " + options.selectPath);
                    return 1;
                }
                List<PropertyEntry> properties = session.select(selected.get());
                System.out.println();
                System.out.println(selected.get().getLabel());
                System.out.print(new PropertyTableRenderer().render(properties));
            }
            return 0;
        } catch (IOException e) {
            System.err.println("Error: Failed to read or write " + input + ": " + e.getMessage());
            return 1;
        }
    }

    static String readSource(Path path) throws IOException {
        String sourceCode = Files.readString(path, StandardCharsets.UTF_8);
        // Remove BOM if present (common in C# files)
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }
        return sourceCode;
    }

    /**
     * Follows a dot-separated list of child indexes from the root, e.g. {@code 0.2.1}.
     * An empty path selects the root.
     */
    static Optional<DisplayNode> select(DisplayNode root, String path) {
        DisplayNode current = root;
        if (path.isBlank()) {
            return Optional.of(current);
        }
        for (String part : path.trim().split("\\.")) {
            int index;
            try {
                index = Integer.parseInt(part.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (index < 0 || index >= current.getChildren().size()) {
                return Optional.empty();
            }
            current = current.getChildren().get(index);
        }
        return Optional.of(current);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files fail later with a proper message
            return true;
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar syntaxview.jar <source-file> [--json] [--color] [--select <path>]");
        System.err.println("  <source-file>:   Source file to parse");
        System.err.println("  --json:          Print the syntax tree as JSON");
        System.err.println("  --color:         Color node and token labels");
        System.err.println("  --select <path>: Print the properties of the node at a dot-separated child index path");
        List<String> languages = new ArrayList<>();
        for (Language language : Language.values()) {
            languages.add(language.getName() + " " + language.getExtensions());
        }
        System.err.println("Supported languages: " + String.join(", ", languages));
    }

    static final class Options {
        String file;
        boolean json;
        boolean color;
        String selectPath;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--json" -> options.json = true;
                    case "--color" -> options.color = true;
                    case "--select" -> {
                        if (i + 1 >= args.length) return null;
                        options.selectPath = args[++i];
                    }
                    default -> {
                        if (arg.startsWith("--") || options.file != null) return null;
                        options.file = arg;
                    }
                }
            }
            return options.file == null ? null : options;
        }
    }
}
