package com.vcalc.latex.store;

import java.util.Objects;

import com.vcalc.latex.parser.Value;

/** A stored variable with the block that defined it. */
public final class VariableInfo {
    private final Value value;
    private final String type;
    private final String blockTitle;
    private final String sourceBlockId;
    private final long timestamp;

    /**
     * @param type          Python type name ({@code int}, {@code float}, {@code complex}, ...)
     * @param sourceBlockId defining block, or null for variables not owned by a block
     * @param timestamp     epoch millis of the assignment
     */
    public VariableInfo(Value value, String type, String blockTitle, String sourceBlockId, long timestamp) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.value = value;
        this.type = (type == null) ? value.pyTypeName() : type;
        this.blockTitle = blockTitle;
        this.sourceBlockId = sourceBlockId;
        this.timestamp = timestamp;
    }

    public Value value() { return value; }
    public String type() { return type; }
    public String blockTitle() { return blockTitle; }
    public String sourceBlockId() { return sourceBlockId; }
    public long timestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableInfo)) return false;
        VariableInfo other = (VariableInfo) o;
        return timestamp == other.timestamp
                && value.equals(other.value)
                && type.equals(other.type)
                && Objects.equals(blockTitle, other.blockTitle)
                && Objects.equals(sourceBlockId, other.sourceBlockId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type, blockTitle, sourceBlockId, timestamp);
    }

    @Override
    public String toString() {
        return type + " " + value.repr() + " from " + (sourceBlockId == null ? "?" : sourceBlockId);
    }
}
