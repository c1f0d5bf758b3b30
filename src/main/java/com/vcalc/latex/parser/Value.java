package com.vcalc.latex.parser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.vcalc.latex.parser.utils.NumberText;

/**
 * Runtime value of a calculation. Immutable: containers are wrapped unmodifiable.
 *
 * equals/hashCode follow Python: {@code 1 == 1.0 == True == (1+0j)}.
 */
public class Value {
    public enum Type { INT, REAL, COMPLEX, BOOL, STRING, LIST, TUPLE, DICT, FUNC, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(BigInteger i) { return new Value(Type.INT, i); }
    public static Value integer(long i) { return new Value(Type.INT, BigInteger.valueOf(i)); }
    public static Value real(double d) { return new Value(Type.REAL, d); }
    public static Value complex(Complex c) { return new Value(Type.COMPLEX, c); }
    public static Value complex(double re, double im) { return new Value(Type.COMPLEX, new Complex(re, im)); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value list(List<Value> items) { return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items))); }
    public static Value tuple(List<Value> items) { return new Value(Type.TUPLE, Collections.unmodifiableList(new ArrayList<>(items))); }
    public static Value dict(Map<Value, Value> entries) { return new Value(Type.DICT, Collections.unmodifiableMap(new LinkedHashMap<>(entries))); }
    public static Value func(String name) { return new Value(Type.FUNC, name); }
    public static Value none() { return NONE; }

    /** Value of a parsed literal: BigInteger, Double, Complex, Boolean, String or null. */
    public static Value ofLiteral(Object literal) {
        if (literal == null) return NONE;
        if (literal instanceof BigInteger) return integer((BigInteger) literal);
        if (literal instanceof Double) return real((Double) literal);
        if (literal instanceof Complex) return complex((Complex) literal);
        if (literal instanceof Boolean) return bool((Boolean) literal);
        if (literal instanceof String) return string((String) literal);
        if (literal instanceof Integer || literal instanceof Long) return integer(((Number) literal).longValue());
        throw new IllegalArgumentException("Unsupported literal value: " + literal.getClass().getName());
    }

    public Type getType() { return type; }

    public boolean isNumber() {
        return type == Type.INT || type == Type.REAL || type == Type.COMPLEX || type == Type.BOOL;
    }

    /** int or bool (bool is an int subtype in Python). */
    public boolean isIntegral() {
        return type == Type.INT || type == Type.BOOL;
    }

    public BigInteger asInt() {
        if (type == Type.BOOL) return ((Boolean) value) ? BigInteger.ONE : BigInteger.ZERO;
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + type);
        return (BigInteger) value;
    }

    public double asReal() {
        if (type != Type.REAL) throw new IllegalStateException("Expected float, got " + type);
        return (Double) value;
    }

    public Complex asComplex() {
        if (type != Type.COMPLEX) throw new IllegalStateException("Expected complex, got " + type);
        return (Complex) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected str, got " + type);
        return (String) value;
    }

    public String asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST && type != Type.TUPLE) throw new IllegalStateException("Expected sequence, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<Value, Value> asDict() {
        if (type != Type.DICT) throw new IllegalStateException("Expected dict, got " + type);
        return (Map<Value, Value>) value;
    }

    /** Python {@code type(v).__name__}. */
    public String pyTypeName() {
        switch (type) {
            case INT: return "int";
            case REAL: return "float";
            case COMPLEX: return "complex";
            case BOOL: return "bool";
            case STRING: return "str";
            case LIST: return "list";
            case TUPLE: return "tuple";
            case DICT: return "dict";
            case FUNC: return "builtin_function_or_method";
            default: return "NoneType";
        }
    }

    /** Python {@code str(v)}. */
    @Override
    public String toString() {
        if (type == Type.STRING) return asString();
        return repr();
    }

    /** Python {@code repr(v)}. */
    public String repr() {
        switch (type) {
            case INT:
                return asInt().toString();
            case REAL:
                return NumberText.repr(asReal());
            case COMPLEX:
                return asComplex().toString();
            case BOOL:
                return asBool() ? "True" : "False";
            case STRING:
                return quote(asString());
            case LIST:
                return join("[", asList(), "]");
            case TUPLE: {
                List<Value> items = asList();
                if (items.size() == 1) return "(" + items.get(0).repr() + ",)";
                return join("(", items, ")");
            }
            case DICT: {
                StringBuilder sb = new StringBuilder("{");
                boolean first = true;
                for (Map.Entry<Value, Value> e : asDict().entrySet()) {
                    if (!first) sb.append(", ");
                    sb.append(e.getKey().repr()).append(": ").append(e.getValue().repr());
                    first = false;
                }
                return sb.append('}').toString();
            }
            case FUNC:
                return "<built-in function " + asFunc() + ">";
            default:
                return "None";
        }
    }

    private static String join(String open, List<Value> items, String close) {
        StringBuilder sb = new StringBuilder(open);
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i).repr());
        }
        return sb.append(close).toString();
    }

    private static String quote(String s) {
        char q = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(q);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == q || c == '\\') sb.append('\\').append(c);
            else if (c == '\n') sb.append("\\n");
            else if (c == '\t') sb.append("\\t");
            else if (c == '\r') sb.append("\\r");
            else sb.append(c);
        }
        return sb.append(q).toString();
    }

    // -------------------------
    // Python equality / hashing
    // -------------------------

    /**
     * Python {@code ==}. Numbers compare by value first, so a NaN is unequal
     * even to itself; containers compare their items with {@link #sameOrEqual}.
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumber() && other.isNumber()) return numericEquals(this, other);
        if (this == o) return true;
        if (type != other.type) return false;
        switch (type) {
            case LIST:
            case TUPLE:
                return sequenceEquals(asList(), other.asList());
            case DICT:
                return dictEquals(asDict(), other.asDict());
            default:
                return (value == null) ? other.value == null : value.equals(other.value);
        }
    }

    /** Identity first, then {@code ==}: how Python compares container items and tests {@code in}. */
    public static boolean sameOrEqual(Value a, Value b) {
        return a == b || (a != null && a.equals(b));
    }

    private static boolean sequenceEquals(List<Value> a, List<Value> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!sameOrEqual(a.get(i), b.get(i))) return false;
        }
        return true;
    }

    private static boolean dictEquals(Map<Value, Value> a, Map<Value, Value> b) {
        if (a.size() != b.size()) return false;
        for (Map.Entry<Value, Value> e : a.entrySet()) {
            if (!b.containsKey(e.getKey())) return false;
            if (!sameOrEqual(e.getValue(), b.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        if (isNumber()) {
            Complex c = toComplexForHash();
            if (c.im != 0.0) return c.hashCode();
            double re = c.re;
            if (isIntegral()) return asInt().hashCode();
            if (!Double.isInfinite(re) && !Double.isNaN(re) && re == Math.rint(re)) {
                return new BigDecimal(re).toBigInteger().hashCode();
            }
            return Double.hashCode(re);
        }
        return 31 * type.hashCode() + (value == null ? 0 : value.hashCode());
    }

    private Complex toComplexForHash() {
        switch (type) {
            case COMPLEX: return asComplex();
            case REAL: return new Complex(asReal(), 0.0);
            default: return new Complex(0.0, 0.0);
        }
    }

    private static boolean numericEquals(Value a, Value b) {
        if (a.isIntegral() && b.isIntegral()) return a.asInt().equals(b.asInt());
        if (a.type == Type.COMPLEX || b.type == Type.COMPLEX) {
            Complex ca = a.toComplex();
            Complex cb = b.toComplex();
            return ca.im == cb.im && realEquals(a, ca.re, b, cb.re);
        }
        return realEquals(a, a.isIntegral() ? 0.0 : a.asReal(), b, b.isIntegral() ? 0.0 : b.asReal());
    }

    /** Exact int/float comparison (no rounding of large ints). */
    private static boolean realEquals(Value a, double ra, Value b, double rb) {
        if (a.isIntegral() && b.isIntegral()) return a.asInt().equals(b.asInt());
        if (a.isIntegral()) return exactEquals(a.asInt(), rb);
        if (b.isIntegral()) return exactEquals(b.asInt(), ra);
        return ra == rb;
    }

    private static boolean exactEquals(BigInteger i, double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return false;
        return new BigDecimal(i).compareTo(new BigDecimal(d)) == 0;
    }

    /** Widen any number to complex. */
    public Complex toComplex() {
        switch (type) {
            case COMPLEX: return asComplex();
            case REAL: return new Complex(asReal(), 0.0);
            case INT:
            case BOOL: return new Complex(asInt().doubleValue(), 0.0);
            default: throw new IllegalStateException("Expected number, got " + type);
        }
    }
}
