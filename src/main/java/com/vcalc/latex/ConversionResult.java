package com.vcalc.latex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.vcalc.latex.parser.Environment;
import com.vcalc.latex.parser.Value;

/** Output of one conversion: the LaTeX block plus the values behind it. */
public final class ConversionResult {
    private final String latex;
    private final List<AssignmentRecord> records;
    private final Environment environment;

    public ConversionResult(String latex, List<AssignmentRecord> records, Environment environment) {
        this.latex = latex;
        this.records = Collections.unmodifiableList(records);
        this.environment = environment;
    }

    /** The {@code aligned} block, or {@code ""} when no assignment was accepted. */
    public String latex() {
        return latex;
    }

    public List<AssignmentRecord> records() {
        return records;
    }

    /** Every binding after the run, including seeded constants and injected variables. */
    public Map<String, Value> environment() {
        return environment.asMap();
    }

    /** Names assigned by this run, in order of first assignment, with their final values. */
    public Map<String, Value> variables() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (AssignmentRecord r : records) {
            out.putIfAbsent(r.target(), environment.lookup(r.target()));
        }
        return Collections.unmodifiableMap(out);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
