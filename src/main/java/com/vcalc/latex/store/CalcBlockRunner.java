package com.vcalc.latex.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import com.vcalc.debug.Debug;
import com.vcalc.debug.DebugLevel;
import com.vcalc.latex.CalcParseException;
import com.vcalc.latex.ConversionResult;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Value;

/**
 * Runs one calculation block against a {@link VariableStore}.
 *
 *  1) read the options line (vset defaults to {@code main}, a missing id is generated)
 *  2) drop the variables this block defined on its previous run
 *  3) convert with the vset's remaining variables injected
 *  4) record every assigned variable under the block id
 *
 * Usage:
 *   java com.vcalc.latex.store.CalcBlockRunner <block-file> <store-json-file> [note-path] [block-title]
 */
public final class CalcBlockRunner {

    private static final String TAG = "vcalc.store";

    public static final String DEFAULT_VSET = "main";
    public static final String DEFAULT_TITLE = "Calculation";

    /** Outcome of one block run. */
    public static final class BlockRun {
        private final BlockOptions options;
        private final String vset;
        private final ConversionResult result;

        BlockRun(BlockOptions options, String vset, ConversionResult result) {
            this.options = options;
            this.vset = vset;
            this.result = result;
        }

        /** Options with the effective block id filled in. */
        public BlockOptions options() { return options; }
        public String vset() { return vset; }
        public ConversionResult result() { return result; }
        public String latex() { return result.latex(); }
    }

    private CalcBlockRunner() {}

    public static BlockRun run(VCalcLatex engine, VariableStore store, String notePath, String blockTitle, String block) {
        if (engine == null) throw new IllegalArgumentException("engine is required");
        if (store == null) throw new IllegalArgumentException("store is required");
        if (notePath == null) throw new IllegalArgumentException("note path is required");

        BlockOptions options = BlockOptions.parse(block);
        if (options.id() == null) {
            options = options.withId(newBlockId());
        }
        String vset = (options.vset() == null) ? DEFAULT_VSET : options.vset();
        String title = (blockTitle == null || blockTitle.isEmpty()) ? DEFAULT_TITLE : blockTitle;

        store.removeBlockVariables(notePath, vset, options.id());
        Map<String, Value> injected = store.values(notePath, vset);

        ConversionResult result = engine.convert(options.code(), injected);

        for (Map.Entry<String, Value> e : result.variables().entrySet()) {
            store.updateVariable(notePath, vset, e.getKey(), e.getValue(), title, options.id());
        }
        Debug.get().d(TAG, notePath + "#" + options.id() + ": " + result.variables().size()
                + " variable(s) stored in vset '" + vset + "' (" + injected.size() + " injected)");
        return new BlockRun(options, vset, result);
    }

    /** Eight lowercase hex characters. */
    static String newBlockId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 4) {
            System.err.println("Usage: CalcBlockRunner <block-file> <store-json-file> [note-path] [block-title]");
            System.exit(2);
            return;
        }
        Debug.useSysErr(DebugLevel.WARN);

        Path blockPath = Path.of(args[0]);
        Path storePath = Path.of(args[1]);
        String notePath = (args.length > 2) ? args[2] : blockPath.getFileName().toString();
        String title = (args.length > 3) ? args[3] : DEFAULT_TITLE;

        String block;
        try {
            block = Files.readString(blockPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read block: " + blockPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        VariableStore store = new VariableStore();
        if (Files.exists(storePath)) {
            try {
                store = VariableStore.fromJson(Files.readString(storePath, StandardCharsets.UTF_8));
            } catch (Exception e) {
                Debug.get().w(TAG, "failed to load store, starting fresh: " + storePath, e);
                store = new VariableStore();
            }
        }

        BlockRun run;
        try {
            run = run(new VCalcLatex(), store, notePath, title, block);
        } catch (CalcParseException e) {
            System.err.println("Parse error: " + e.getMessage());
            System.exit(1);
            return;
        }

        try {
            Files.writeString(storePath, store.toJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to write store: " + storePath);
            e.printStackTrace(System.err);
            System.exit(4);
            return;
        }

        System.out.println(run.options().buildOptionsLine());
        System.out.println(run.latex());
    }
}
