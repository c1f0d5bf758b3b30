package com.vcalc.latex;

/**
 * Which parts a derived line shows: {@code x &= symbolic = substituted = result}.
 * All parts are on by default.
 */
public final class RenderOptions {

    private static final RenderOptions DEFAULTS = new RenderOptions(true, true, true);

    private final boolean includeSymbolic;
    private final boolean includeSubstitution;
    private final boolean includeResult;

    public RenderOptions(boolean includeSymbolic, boolean includeSubstitution, boolean includeResult) {
        this.includeSymbolic = includeSymbolic;
        this.includeSubstitution = includeSubstitution;
        this.includeResult = includeResult;
    }

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean includeSymbolic() { return includeSymbolic; }
    public boolean includeSubstitution() { return includeSubstitution; }
    public boolean includeResult() { return includeResult; }

    public RenderOptions withSymbolic(boolean on) {
        return new RenderOptions(on, includeSubstitution, includeResult);
    }

    public RenderOptions withSubstitution(boolean on) {
        return new RenderOptions(includeSymbolic, on, includeResult);
    }

    public RenderOptions withResult(boolean on) {
        return new RenderOptions(includeSymbolic, includeSubstitution, on);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderOptions)) return false;
        RenderOptions other = (RenderOptions) o;
        return includeSymbolic == other.includeSymbolic
                && includeSubstitution == other.includeSubstitution
                && includeResult == other.includeResult;
    }

    @Override
    public int hashCode() {
        return (includeSymbolic ? 4 : 0) | (includeSubstitution ? 2 : 0) | (includeResult ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RenderOptions{symbolic=" + includeSymbolic + ", substitution=" + includeSubstitution
                + ", result=" + includeResult + "}";
    }

    public static final class Builder {
        private boolean symbolic = true;
        private boolean substitution = true;
        private boolean result = true;

        private Builder() {}

        public Builder symbolic(boolean on) { this.symbolic = on; return this; }
        public Builder substitution(boolean on) { this.substitution = on; return this; }
        public Builder result(boolean on) { this.result = on; return this; }

        public RenderOptions build() {
            return new RenderOptions(symbolic, substitution, result);
        }
    }
}
