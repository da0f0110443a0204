package structview;

import picocli.CommandLine;

import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "structview",
        description = "Browse XML, YAML, JSON, CSV and Excel documents as a tree linked to their source text.",
        version = "1.0.0",
        mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-f", "--file"}, description = "File to open; '-' reads stdin")
    private String file;

    @CommandLine.ArgGroup(exclusive = true)
    private FormatFlags formatFlags;

    @CommandLine.Option(names = {"-p", "--print"}, description = "Print the tree to stdout instead of opening a window")
    private boolean print;

    @CommandLine.Option(names = "--debug", description = "Write debug log lines to stdout")
    private boolean debug;

    private int maxDepth = ViewerSettings.DEFAULT_MAX_DEPTH;
    private boolean windowOpened;

    static class FormatFlags {
        @CommandLine.Option(names = {"-x", "--xml"}, description = "Read as XML") boolean xml;
        @CommandLine.Option(names = {"-y", "--yaml"}, description = "Read as YAML") boolean yaml;
        @CommandLine.Option(names = {"-j", "--json"}, description = "Read as JSON") boolean json;
        @CommandLine.Option(names = {"-c", "--csv"}, description = "Read as CSV") boolean csv;
        @CommandLine.Option(names = {"-e", "--excel"}, description = "Read as an Excel workbook") boolean excel;

        DocumentFormat format() {
            if (xml) return DocumentFormat.XML;
            if (yaml) return DocumentFormat.YAML;
            if (json) return DocumentFormat.JSON;
            if (csv) return DocumentFormat.CSV;
            if (excel) return DocumentFormat.EXCEL;
            return DocumentFormat.AUTO;
        }
    }

    @CommandLine.Option(names = "--max-depth", paramLabel = "N",
            description = "Deepest tree level to expand (default: ${DEFAULT-VALUE})", defaultValue = "10")
    void setMaxDepth(int value) {
        if (value < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid value for option '--max-depth': " + value + " (must be zero or more)");
        }
        maxDepth = value;
    }

    public static void main(String[] args) {
        Main main = new Main();
        int exitCode = new CommandLine(main).execute(args);
        // the window keeps the JVM alive; exit only when no window was opened
        if (exitCode != 0 || !main.windowOpened) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() {
        DebugLog.setEnabled(debug);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        DocumentFormat forced = formatFlags == null ? DocumentFormat.AUTO : formatFlags.format();

        ParsedDocument doc = null;
        Path path = null;
        try {
            if (file != null && !"-".equals(file)) {
                path = Paths.get(file);
                if (!Files.exists(path)) {
                    err.println("Error: file not found: " + file);
                    return 1;
                }
                doc = DocumentLoader.load(path, forced);
            } else if ("-".equals(file) || stdinHasData()) {
                doc = DocumentLoader.load(System.in, forced);
            }
        } catch (IOException ex) {
            DebugLog.log("Load failed", ex);
            err.println(ex.getMessage());
            return 1;
        }

        if (print) {
            if (doc == null) {
                err.println("Error: --print needs a file (-f) or data on stdin");
                return 1;
            }
            printTree(doc, maxDepth, out);
            out.flush();
            return 0;
        }

        if (GraphicsEnvironment.isHeadless()) {
            err.println("Error: no display available; use --print to write the tree to stdout");
            return 1;
        }
        ViewerSettings settings = new ViewerSettings();
        settings.setMaxDepth(maxDepth);
        StructViewApp.launch(settings, doc, path);
        windowOpened = true;
        return 0;
    }

    int maxDepth() {
        return maxDepth;
    }

    /** Writes the tree depth-first, two spaces per level. */
    static void printTree(ParsedDocument doc, int maxDepth, PrintWriter out) {
        DocumentSession session = new DocumentSession();
        session.setMaxDepth(maxDepth);
        session.load(doc);
        if (session.root() != null) {
            printNode(session.root(), 0, out);
        }
    }

    private static void printNode(TreeNode node, int indent, PrintWriter out) {
        out.println("  ".repeat(indent) + node);
        for (TreeNode child : node.children()) {
            printNode(child, indent + 1, out);
        }
    }

    private static boolean stdinHasData() {
        if (System.console() != null) return false;
        try {
            InputStream in = System.in;
            return in.available() > 0;
        } catch (IOException ex) {
            DebugLog.log("stdin not readable", ex);
            return false;
        }
    }
}
