// file: src/main/java/io/treeyaml/editor/Console.java
package io.treeyaml.editor;

import io.treeyaml.core.NodeId;
import io.treeyaml.core.TraversalOrder;
import io.treeyaml.notation.ParseError;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.LogManager;

/**
 * Line-oriented command console driving a {@link TreeEditor}.
 *
 * Usage:
 *   treeyaml [--config file.json] [--range-min N] [--range-max N] [--ids sequential|random] [--echo]
 *
 * Example session:
 *   &gt; insert 10
 *   Inserted node 10
 *   &gt; traverse inorder
 *   inorder: [10]
 *
 * Errors in a single command are reported as {@code error: ...} and the loop
 * carries on; only {@code quit}/{@code exit} or end of input stop it.
 */
public final class Console {

    static final String HELP = """
            Commands:
              insert <int> | add <int>      insert a value
              delete <int> | del <int>      delete a value
              delete                        delete the selected node
              select <id>                   select a node by id
              deselect                      clear the selection
              edit <id> <int>               relabel a node
              edit <int>                    relabel the selected node
              clear                         remove every node
              show                          print the notation draft
              json                          print the tree as JSON
              parse                         read notation up to a lone "." and sync it
              repair                        repair the draft's indentation
              sync                          parse the draft into the tree
              traverse <order>              inorder | preorder | postorder
              range <min> <max>             values within [min, max]
              traversals                    all orders plus the configured range
              status                        size, height, selection, last error
              help                          this text
              quit | exit                   leave""";

    private final TreeEditor editor;
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean echo;

    public Console(TreeEditor editor, InputStream in, PrintStream out) {
        this.editor = editor;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.echo = editor.config().echoCommands();
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            System.out.println(EditorConfig.usage());
            System.out.println(HELP);
            System.exit(0);
        }
        configureLogging();

        EditorConfig cfg = null;
        try {
            cfg = EditorConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
        }

        try {
            new Console(new TreeEditor(cfg), System.in, System.out).run();
        } catch (IOException e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Run until quit/exit or end of input. */
    public void run() throws IOException {
        out.println(editor.lastMessage());
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) {
                return;
            }
        }
    }

    /**
     * Execute one command line.
     *
     * @return false when the console should stop
     */
    boolean execute(String line) throws IOException {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return true;
        if (echo) out.println("> " + trimmed);

        String[] words = trimmed.split("\\s+");
        try {
            return dispatch(words);
        } catch (ConsoleException | IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
        } catch (RuntimeException e) {
            CommandLogger.logFailure(trimmed, e);
            out.println("error: " + e);
        }
        return true;
    }

    private boolean dispatch(String[] words) throws IOException {
        String cmd = words[0];
        switch (cmd) {
            case "insert", "add" -> {
                expectArgs(words, 1, "insert requires <int>");
                print(editor.insert(intArg(words[1])));
            }
            case "delete", "del" -> {
                if (words.length == 1) {
                    print(editor.deleteSelected());
                } else {
                    expectArgs(words, 1, "delete requires <int>");
                    print(editor.delete(intArg(words[1])));
                }
            }
            case "select" -> {
                expectArgs(words, 1, "select requires <id>");
                NodeId id = new NodeId(words[1]);
                out.println(editor.select(id) ? "Selected " + id : "error: no node with id " + id);
            }
            case "deselect" -> {
                editor.clearSelection();
                out.println("Selection cleared");
            }
            case "edit" -> {
                if (words.length == 2) {
                    print(editor.editSelected(intArg(words[1])));
                } else {
                    expectArgs(words, 2, "edit requires [<id>] <int>");
                    print(editor.editValue(new NodeId(words[1]), intArg(words[2])));
                }
            }
            case "clear" -> print(editor.clear());
            case "show" -> out.print(editor.draft().isEmpty() ? "(empty)\n" : withNewline(editor.draft()));
            case "json" -> out.println(editor.viewJson());
            case "parse" -> print(editor.parseNotation(readBlock()));
            case "repair" -> {
                print(editor.repairDraft());
                out.print(withNewline(editor.draft()));
            }
            case "sync" -> print(editor.syncDraft());
            case "traverse" -> {
                expectArgs(words, 1, "traverse requires <order>");
                TraversalOrder order = TraversalOrder.fromToken(words[1]);
                out.println(order.token() + ": " + editor.traverse(order));
            }
            case "range" -> {
                expectArgs(words, 2, "range requires <min> <max>");
                int min = intArg(words[1]);
                int max = intArg(words[2]);
                out.println("range [" + min + ", " + max + "]: " + editor.rangeQuery(min, max));
            }
            case "traversals" -> {
                TraversalSnapshot t = editor.traversals();
                out.println("inorder: " + t.inOrder());
                out.println("preorder: " + t.preOrder());
                out.println("postorder: " + t.postOrder());
                out.println("range [" + t.rangeMin() + ", " + t.rangeMax() + "]: " + t.range());
            }
            case "status" -> printStatus();
            case "help" -> out.println(HELP);
            case "quit", "exit" -> {
                return false;
            }
            default -> throw new ConsoleException("unknown command: " + cmd);
        }
        return true;
    }

    private void printStatus() {
        var view = editor.view();
        out.printf("size=%d height=%d validBst=%s%n", view.size, view.height, view.validBst);
        out.println(editor.selection()
                .map(s -> "selected: " + s.id() + " (" + s.value() + ")")
                .orElse("selected: none"));
        editor.lastError().map(ParseError::describe).ifPresent(e -> out.println("last error: " + e));
        out.println("last message: " + editor.lastMessage());
    }

    /** Lines after "parse" up to a lone "." (or end of input). */
    private String readBlock() throws IOException {
        StringBuilder sb = new StringBuilder();
        String line;
        while ((line = in.readLine()) != null && !line.strip().equals(".")) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private void print(CommandResult result) {
        out.println(result.message());
    }

    private static void expectArgs(String[] words, int count, String usage) {
        if (words.length != count + 1) {
            throw new ConsoleException(usage);
        }
    }

    private static int intArg(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConsoleException("<int> expected, got '" + raw + "'");
        }
    }

    private static String withNewline(String s) {
        return s.endsWith("\n") ? s : s + "\n";
    }

    /** Bundled logging.properties, unless one was given with -Djava.util.logging.config.file. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream props = Console.class.getResourceAsStream("/logging.properties")) {
            if (props != null) {
                LogManager.getLogManager().readConfiguration(props);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging.properties: " + e.getMessage());
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println(EditorConfig.usage());
        System.exit(1);
    }

    static final class ConsoleException extends RuntimeException {
        ConsoleException(String msg) {
            super(msg);
        }
    }
}
