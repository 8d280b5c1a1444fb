package plc.lisp;

import plc.lisp.analyzer.AnalyzeException;
import plc.lisp.analyzer.Analyzer;
import plc.lisp.analyzer.Type;
import plc.lisp.evaluator.EvaluateException;
import plc.lisp.evaluator.Evaluator;
import plc.lisp.evaluator.RuntimeValue;
import plc.lisp.evaluator.Scope;
import plc.lisp.parser.Ast;
import plc.lisp.parser.ParseException;
import plc.lisp.parser.Parser;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs source through parse, check and evaluate against one pair of root
 * scopes that persists across calls, so top-level definitions stay visible
 * to later input.
 *
 * <p>Nothing is evaluated unless it type-checks. The type bindings an
 * expression makes only reach the root once it has also evaluated, and the
 * root values are put back if evaluation fails, so a failed input never
 * leaves a name typed one way and bound another.
 */
public final class Session {

    private static final Logger logger = Logger.getLogger(Session.class.getName());

    private final plc.lisp.analyzer.Scope types;
    private final Scope values;

    public Session() {
        this(System.out);
    }

    /**
     * @param out where {@code print} and {@code println} write
     */
    public Session(PrintStream out) {
        this.types = plc.lisp.analyzer.Environment.scope();
        this.values = plc.lisp.evaluator.Environment.scope(out);
    }

    public Ast.Expr parse(String input) throws ParseException {
        Ast.Expr expr = Parser.parse(input);
        logger.fine(() -> "Parsed " + expr);
        return expr;
    }

    public Result run(Ast.Expr expr) throws AnalyzeException, EvaluateException {
        var pending = new plc.lisp.analyzer.Scope(types);
        Type type;
        try {
            type = new Analyzer(pending).visit(expr);
        } catch (AnalyzeException e) {
            logger.fine(() -> "Rejected " + expr + ": " + e.getMessage());
            throw e;
        }
        logger.fine(() -> "Checked " + expr + " : " + type);
        var checkpoint = values.bindings();
        RuntimeValue value;
        try {
            value = new Evaluator(values).visit(expr);
        } catch (EvaluateException e) {
            values.restore(checkpoint);
            logger.fine(() -> "Failed " + expr + ": " + e.getMessage());
            throw e;
        }
        pending.commit();
        logger.fine(() -> "Evaluated " + expr + " = " + value);
        return new Result(value, type);
    }

    public Result execute(String input) throws ParseException, AnalyzeException, EvaluateException {
        return run(parse(input));
    }

    /**
     * Runs each top-level expression in turn, stopping at the first failure.
     */
    public List<Result> execute(Ast.Source source) throws AnalyzeException, EvaluateException {
        List<Result> results = new ArrayList<>();
        for (Ast.Expr expr : source.expressions()) {
            results.add(run(expr));
        }
        return results;
    }

    public record Result(RuntimeValue value, Type type) {

        @Override
        public String toString() {
            return value + ": " + type;
        }

    }

}
