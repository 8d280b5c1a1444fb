package plc.lisp;

import plc.lisp.analyzer.AnalyzeException;
import plc.lisp.evaluator.EvaluateException;
import plc.lisp.parser.Ast;
import plc.lisp.parser.ParseException;
import plc.lisp.parser.Parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * With no arguments, reads expressions line by line from stdin and prints
 * {@code value: type} for each; with a file argument, runs the file.
 */
public final class Main {

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private Main() {}

    public static void main(String[] args) throws IOException {
        configureLogging();
        if (args.length > 1) {
            System.err.println("Usage: lisp [script]");
            System.exit(2);
        }
        if (args.length == 1) {
            System.exit(runScript(Path.of(args[0]), new Session(), System.out, System.err));
        }
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        repl(in, new Session(), System.out, System.err);
    }

    static void repl(BufferedReader in, Session session, PrintStream out, PrintStream err) throws IOException {
        logger.fine("Starting REPL");
        out.println("Lisp REPL");
        out.println("Type 'exit' or press Ctrl+C to quit");
        out.println();
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.equals("exit") || line.equals("quit")) {
                out.println("Goodbye!");
                break;
            }
            if (line.isEmpty()) {
                continue;
            }
            try {
                out.println(session.execute(line));
            } catch (ParseException | AnalyzeException | EvaluateException e) {
                err.println("Error: " + e.getMessage());
            }
        }
    }

    /**
     * Runs every expression in the file, printing each result.
     *
     * @return the process exit status, 1 at the first failing expression
     */
    static int runScript(Path path, Session session, PrintStream out, PrintStream err) throws IOException {
        logger.info(() -> "Running " + path);
        Ast.Source source;
        try {
            source = Parser.parseSource(Files.readString(path, StandardCharsets.UTF_8));
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        for (Ast.Expr expr : source.expressions()) {
            try {
                out.println(session.run(expr));
            } catch (AnalyzeException | EvaluateException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream stream = Main.class.getResourceAsStream("/logging.properties")) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        }
    }

}
