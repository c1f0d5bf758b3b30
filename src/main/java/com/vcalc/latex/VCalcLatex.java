package com.vcalc.latex;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.vcalc.debug.Debug;
import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Evaluator;
import com.vcalc.latex.parser.Interpreter;
import com.vcalc.latex.parser.Parser;
import com.vcalc.latex.parser.Statement.Stmt;
import com.vcalc.latex.parser.Value;
import com.vcalc.latex.plugins.VCalcBuiltinsPlugin;
import com.vcalc.latex.plugins.VCalcMathPlugin;
import com.vcalc.latex.render.LineAssembler;

/**
 * Core vcalc engine: Python calculation code in, LaTeX {@code aligned} block out.
 *
 * - Only single-name assignments are rendered; imports, prints, definitions
 *   and control flow are skipped
 * - Literal assignments render as {@code x &= 5}, derived ones as
 *   {@code z &= x + y = 5 + 10 = 15}
 * - Statements that fail to evaluate are dropped, later ones still run
 * - Functions come from a registry filled by the math and builtins plugins;
 *   hosts can add their own with {@link #registerFunction}
 *
 * An engine is not thread-safe while it is being configured; each conversion
 * gets its own environment and evaluator state.
 */
public class VCalcLatex {

    private static final String TAG = "vcalc.engine";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new HashMap<>();
    private RenderOptions renderOptions = RenderOptions.defaults();
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;
    private Evaluator evaluator = null;

    public VCalcLatex() {
        VCalcMathPlugin.register(this);
        VCalcBuiltinsPlugin.register(this);
    }

    public void setRenderOptions(RenderOptions options) {
        this.renderOptions = (options == null) ? RenderOptions.defaults() : options;
    }

    public RenderOptions getRenderOptions() { return renderOptions; }

    /** Bound on expression nesting in the parser, the evaluator and the renderers. */
    public void setMaxDepth(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() { return maxDepth; }

    /** Replaces the built-in interpreter; null restores it. */
    public void setEvaluator(Evaluator evaluator) { this.evaluator = evaluator; }

    public void registerFunction(String name, BuiltinFunction fn) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("function name must not be empty");
        if (fn == null) throw new IllegalArgumentException("function must not be null");
        functions.put(name, fn);
    }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    public Map<String, BuiltinFunction> functions() { return Collections.unmodifiableMap(functions); }

    // ===================== CONVERSION =====================

    public ConversionResult convert(String source) {
        return convert(parse(source), Environment.withDefaults());
    }

    /** Converts with {@code existing} variables visible to every statement (variable injection). */
    public ConversionResult convert(String source, Map<String, Value> existing) {
        List<Stmt> program = parse(source);
        Environment env = Environment.withDefaults();
        env.putAll(existing);
        return convert(program, env);
    }

    /** Core entry point over an already parsed program; {@code env} receives the new bindings. */
    public ConversionResult convert(List<Stmt> program, Environment env) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        if (env == null) throw new IllegalArgumentException("environment must not be null");

        List<AssignmentRecord> records = new StatementSequencer(evaluatorForRun()).run(program, env);
        String latex = new LineAssembler(renderOptions, maxDepth).assemble(records);
        Debug.get().i(TAG, "converted " + program.size() + " statement(s) into " + records.size() + " line(s)");
        return new ConversionResult(latex, records, env);
    }

    /** Lexes and parses; a {@link CalcParseException} here means nothing was evaluated. */
    public List<Stmt> parse(String source) {
        return Parser.parse(source, maxDepth);
    }

    /** Interpreter over this engine's function registry. */
    public Interpreter newInterpreter() {
        Interpreter interpreter = new Interpreter(functions());
        interpreter.setMaxDepth(maxDepth);
        return interpreter;
    }

    private Evaluator evaluatorForRun() {
        return (evaluator != null) ? evaluator : newInterpreter();
    }
}
