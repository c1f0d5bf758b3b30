package com.vcalc.latex;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

import com.vcalc.debug.Debug;
import com.vcalc.debug.DebugLevel;
import com.vcalc.latex.parser.Value;
import com.vcalc.protocol.ConversionJson;

/**
 * Command line front end.
 *
 * Usage:
 *   VCalcCli [options] [code]
 *
 * Code comes from the argument (';' separates statements), from --file, or
 * from stdin. Prints the aligned block, or the JSON result with --json.
 *
 * Exit codes: 0 ok, 1 parse error, 2 usage error, 3 I/O error.
 */
public final class VCalcCli {

    private static final String TAG = "vcalc.cli";

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARSE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: VCalcCli [--no-symbolic] [--no-substitution] [--no-result] [--settings <file>]\n"
          + "                [--vars <file>] [--file <file>] [--json] [--verbose] [code]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Runs one invocation and returns its exit code. */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        RenderOptions options = RenderOptions.defaults();
        Path settingsFile = null;
        Path varsFile = null;
        Path codeFile = null;
        String code = null;
        boolean json = false;
        boolean verbose = false;
        boolean noSymbolic = false;
        boolean noSubstitution = false;
        boolean noResult = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--no-symbolic": noSymbolic = true; break;
                case "--no-substitution": noSubstitution = true; break;
                case "--no-result": noResult = true; break;
                case "--json": json = true; break;
                case "-v":
                case "--verbose": verbose = true; break;
                case "--settings":
                case "--vars":
                case "--file": {
                    if (i + 1 >= args.length) return usage(err, a + " needs a file argument");
                    Path p = Path.of(args[++i]);
                    if (a.equals("--settings")) settingsFile = p;
                    else if (a.equals("--vars")) varsFile = p;
                    else codeFile = p;
                    break;
                }
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    if (a.startsWith("--")) return usage(err, "unknown option " + a);
                    if (code != null) return usage(err, "more than one code argument");
                    code = a;
            }
        }
        if (code != null && codeFile != null) return usage(err, "give code either inline or with --file");

        Debug.get().setSink(Debug.printing(err, verbose ? DebugLevel.DEBUG : DebugLevel.WARN));

        Map<String, Value> vars = Collections.emptyMap();
        try {
            if (settingsFile != null) options = ConversionJson.readSettings(readFile(settingsFile));
            if (varsFile != null) vars = ConversionJson.readVariables(readFile(varsFile));
            if (codeFile != null) code = readFile(codeFile);
            if (code == null) code = readAll(in);
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        } catch (VCalcException e) {
            return usage(err, e.getMessage());
        }

        if (noSymbolic) options = options.withSymbolic(false);
        if (noSubstitution) options = options.withSubstitution(false);
        if (noResult) options = options.withResult(false);

        VCalcLatex engine = new VCalcLatex();
        engine.setRenderOptions(options);

        ConversionResult result;
        try {
            result = engine.convert(code, vars);
        } catch (CalcParseException e) {
            err.println("Syntax Error: " + e.getMessage());
            return EXIT_PARSE;
        } catch (ExpressionDepthException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_PARSE;
        }

        out.println(json ? ConversionJson.toJson(result) : result.latex());
        Debug.get().d(TAG, "printed " + result.records().size() + " line(s)");
        return EXIT_OK;
    }

    private static int usage(PrintStream err, String message) {
        err.println("Error: " + message);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static String readFile(Path p) throws IOException {
        return Files.readString(p, StandardCharsets.UTF_8);
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        in.transferTo(buf);
        return buf.toString(StandardCharsets.UTF_8);
    }

    private VCalcCli() {}
}
