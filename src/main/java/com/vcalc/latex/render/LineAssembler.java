package com.vcalc.latex.render;

import java.util.ArrayList;
import java.util.List;

import com.vcalc.latex.AssignmentRecord;
import com.vcalc.latex.RenderOptions;
import com.vcalc.latex.parser.Parser;

/**
 * Builds the {@code aligned} block from assignment records.
 *
 * Rows are separated by {@code \\}; the first derived row after a run of
 * given values gets {@code \\[10pt]} instead.
 */
public class LineAssembler {

    public static final String ROW_BREAK = "\\\\";
    public static final String WIDE_ROW_BREAK = "\\\\[10pt]";

    private final RenderOptions options;
    private final int maxDepth;

    public LineAssembler(RenderOptions options) {
        this(options, Parser.DEFAULT_MAX_DEPTH);
    }

    public LineAssembler(RenderOptions options, int maxDepth) {
        this.options = (options == null) ? RenderOptions.defaults() : options;
        this.maxDepth = maxDepth;
    }

    /** Empty string when there is nothing to show. */
    public String assemble(List<AssignmentRecord> records) {
        if (records.isEmpty()) return "";

        List<String> rows = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            AssignmentRecord record = records.get(i);
            if (i > 0) {
                boolean widen = records.get(i - 1).trivial() && !record.trivial();
                rows.add(widen ? WIDE_ROW_BREAK : ROW_BREAK);
            }
            rows.add(line(record));
        }
        return "\\begin{aligned}\n" + String.join("\n", rows) + "\n\\end{aligned}";
    }

    public String line(AssignmentRecord record) {
        String head = IdentifierRenderer.render(record.target()) + " &= ";
        String result = ValueFormatter.format(record.value());
        if (record.trivial()) return head + result;

        String symbolic = new SymbolicRenderer(maxDepth).render(record.expression());
        List<String> parts = new ArrayList<>();
        if (options.includeSymbolic()) {
            parts.add(symbolic);
        }
        if (options.includeSubstitution()) {
            String substituted = new SubstitutionRenderer(record.scope(), maxDepth).render(record.expression());
            if (!options.includeSymbolic() || !substituted.equals(symbolic)) {
                parts.add(substituted);
            }
        }
        if (options.includeResult()) {
            parts.add(result);
        }
        return head + String.join(" = ", parts);
    }
}
