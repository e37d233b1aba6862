package com.challenges.jhtml;

import com.challenges.jhtml.fetch.FetchSettings;
import com.challenges.jhtml.fetch.HtmlFetcher;
import com.challenges.jhtml.output.NodeFormatter;
import com.challenges.jhtml.path.NodePath;
import com.challenges.jhtml.path.PathMatcher;
import com.challenges.jhtml.tree.Node;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(name = "jhtml", mixinStandardHelpOptions = true, version = "1.0",
         description = "Find elements in an HTML document by tag path, class and id")
public class JHtml implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "HTML file or http(s) URL (default: stdin)")
    private String source;

    @Option(names = {"-p", "--path"}, description = "Element path, e.g. body/div/.h1 (default: any element)")
    private String path = "";

    @Option(names = {"-c", "--class"}, description = "Required value of the class attribute")
    private String cssClass = "";

    @Option(names = {"-i", "--id"}, description = "Required value of the id attribute")
    private String id = "";

    @Option(names = {"-a", "--all"}, description = "Print every match instead of the first")
    private boolean all = false;

    @Option(names = {"-s", "--structure"}, description = "Print the element structure of each match")
    private boolean structure = false;

    @Option(names = {"-j", "--json"}, description = "Print each match as JSON")
    private boolean json = false;

    @Option(names = "--compact-output", description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort attribute keys in JSON output")
    private boolean sortKeys = false;

    @Option(names = "--indent", description = "Indent string for --structure (default: two spaces)")
    private String indent = "  ";

    @Option(names = "--connect-timeout", description = "Connect timeout in seconds for URLs (default: 10)")
    private long connectTimeoutSeconds = 10;

    @Option(names = "--read-timeout", description = "Read timeout in seconds for URLs (default: 30)")
    private long readTimeoutSeconds = 30;

    @Option(names = "--user-agent", description = "User-Agent header for URLs")
    private String userAgent = FetchSettings.DEFAULT_USER_AGENT;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JHtml()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Node root = load();
            if (root == null) {
                return 0;
            }

            PathMatcher matcher = new PathMatcher();
            NodePath query = new NodePath(path, cssClass, id);
            MutableList<Node> matches;
            if (all) {
                matches = matcher.findPathAll(root, query);
            } else {
                matches = Lists.mutable.empty();
                matcher.findPath(root, query).ifPresent(matches::add);
            }

            NodeFormatter formatter = new NodeFormatter(!compactOutput, sortKeys);
            for (Node match : matches) {
                if (json) {
                    out.println(formatter.toJson(match));
                } else if (structure) {
                    formatter.printStructure(match, out, 0, indent);
                } else {
                    out.println(match.path());
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private Node load() throws Exception {
        if (source == null || source.equals("-")) {
            return HtmlDocuments.parse(System.in, StandardCharsets.UTF_8);
        }
        if (source.startsWith("http://") || source.startsWith("https://")) {
            FetchSettings settings = FetchSettings.defaults()
                    .withConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                    .withReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                    .withUserAgent(userAgent);
            return new HtmlFetcher(settings).fetch(source);
        }
        return HtmlDocuments.parse(Path.of(source));
    }
}
