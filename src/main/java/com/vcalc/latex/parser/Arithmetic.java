package com.vcalc.latex.parser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.vcalc.latex.EvaluationException;

/**
 * Python operator semantics over {@link Value}: int/bool/float/complex promotion,
 * floor division and modulo with the sign of the divisor, {@code **} producing
 * complex results for negative bases, sequence concatenation and repetition.
 */
public final class Arithmetic {

    /** Largest int result {@code **} and {@code <<} will build, in bits. */
    private static final long MAX_INT_BITS = 1_000_000L;
    private static final MathContext DIVISION = new MathContext(40);

    private Arithmetic() {}

    // -------------------------
    // Binary operators
    // -------------------------

    public static Value binary(TokenType op, Value left, Value right) {
        switch (op) {
            case PLUS: return add(left, right);
            case MINUS: return subtract(left, right);
            case STAR: return multiply(left, right);
            case SLASH: return trueDivide(left, right);
            case DOUBLE_SLASH: return floorDivide(left, right);
            case PERCENT: return modulo(left, right);
            case DOUBLE_STAR: return power(left, right);
            case AMP:
            case PIPE:
            case CARET:
            case LSHIFT:
            case RSHIFT:
                return bitwise(op, left, right);
            default:
                throw new EvaluationException("unsupported binary operator: " + op);
        }
    }

    public static Value add(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            switch (rank(a, b)) {
                case 0: return Value.integer(a.asInt().add(b.asInt()));
                case 1: return Value.real(toDouble(a) + toDouble(b));
                default: return Value.complex(a.toComplex().plus(b.toComplex()));
            }
        }
        if (a.type == Value.Type.STRING && b.type == Value.Type.STRING) {
            return Value.string(a.asString() + b.asString());
        }
        if (a.type == b.type && (a.type == Value.Type.LIST || a.type == Value.Type.TUPLE)) {
            List<Value> items = new ArrayList<>(a.asList());
            items.addAll(b.asList());
            return a.type == Value.Type.LIST ? Value.list(items) : Value.tuple(items);
        }
        throw unsupported("+", a, b);
    }

    public static Value subtract(Value a, Value b) {
        requireNumbers("-", a, b);
        switch (rank(a, b)) {
            case 0: return Value.integer(a.asInt().subtract(b.asInt()));
            case 1: return Value.real(toDouble(a) - toDouble(b));
            default: return Value.complex(a.toComplex().minus(b.toComplex()));
        }
    }

    public static Value multiply(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            switch (rank(a, b)) {
                case 0: return Value.integer(a.asInt().multiply(b.asInt()));
                case 1: return Value.real(toDouble(a) * toDouble(b));
                default: return Value.complex(a.toComplex().times(b.toComplex()));
            }
        }
        if (isRepeatable(a) && b.isIntegral()) return repeat(a, b.asInt());
        if (isRepeatable(b) && a.isIntegral()) return repeat(b, a.asInt());
        throw unsupported("*", a, b);
    }

    public static Value trueDivide(Value a, Value b) {
        requireNumbers("/", a, b);
        switch (rank(a, b)) {
            case 0: {
                BigInteger d = b.asInt();
                if (d.signum() == 0) throw new EvaluationException("division by zero");
                double q = new BigDecimal(a.asInt()).divide(new BigDecimal(d), DIVISION).doubleValue();
                if (Double.isInfinite(q)) throw new EvaluationException("integer division result too large for a float");
                return Value.real(q);
            }
            case 1: {
                double d = toDouble(b);
                if (d == 0.0) throw new EvaluationException("float division by zero");
                return Value.real(toDouble(a) / d);
            }
            default: {
                Complex d = b.toComplex();
                if (d.isZero()) throw new EvaluationException("complex division by zero");
                return Value.complex(a.toComplex().dividedBy(d));
            }
        }
    }

    public static Value floorDivide(Value a, Value b) {
        requireNumbers("//", a, b);
        switch (rank(a, b)) {
            case 0: {
                BigInteger d = b.asInt();
                if (d.signum() == 0) throw new EvaluationException("integer division or modulo by zero");
                return Value.integer(floorDiv(a.asInt(), d));
            }
            case 1: {
                double d = toDouble(b);
                if (d == 0.0) throw new EvaluationException("float floor division by zero");
                return Value.real(floatDivmod(toDouble(a), d)[0]);
            }
            default:
                throw unsupported("//", a, b);
        }
    }

    public static Value modulo(Value a, Value b) {
        requireNumbers("%", a, b);
        switch (rank(a, b)) {
            case 0: {
                BigInteger d = b.asInt();
                if (d.signum() == 0) throw new EvaluationException("integer division or modulo by zero");
                BigInteger r = a.asInt().remainder(d);
                if (r.signum() != 0 && r.signum() != d.signum()) r = r.add(d);
                return Value.integer(r);
            }
            case 1: {
                double d = toDouble(b);
                if (d == 0.0) throw new EvaluationException("float modulo");
                return Value.real(floatDivmod(toDouble(a), d)[1]);
            }
            default:
                throw unsupported("%", a, b);
        }
    }

    public static Value power(Value a, Value b) {
        requireNumbers("** or pow()", a, b);
        switch (rank(a, b)) {
            case 0: return intPower(a.asInt(), b.asInt());
            case 1: return floatPower(toDouble(a), toDouble(b));
            default: return Value.complex(complexPower(a.toComplex(), b.toComplex()));
        }
    }

    private static Value bitwise(TokenType op, Value a, Value b) {
        if (!a.isIntegral() || !b.isIntegral()) throw unsupported(symbol(op), a, b);
        BigInteger x = a.asInt();
        BigInteger y = b.asInt();
        boolean bools = a.type == Value.Type.BOOL && b.type == Value.Type.BOOL;
        switch (op) {
            case AMP: return bools ? Value.bool(a.asBool() & b.asBool()) : Value.integer(x.and(y));
            case PIPE: return bools ? Value.bool(a.asBool() | b.asBool()) : Value.integer(x.or(y));
            case CARET: return bools ? Value.bool(a.asBool() ^ b.asBool()) : Value.integer(x.xor(y));
            case LSHIFT:
                if (y.signum() < 0) throw new EvaluationException("negative shift count");
                if (x.signum() != 0 && (y.bitLength() > 31 || x.bitLength() + y.longValue() > MAX_INT_BITS)) {
                    throw new EvaluationException("integer result too large");
                }
                return Value.integer(x.signum() == 0 ? x : x.shiftLeft(y.intValue()));
            default:
                if (y.signum() < 0) throw new EvaluationException("negative shift count");
                if (y.bitLength() > 31) return Value.integer(x.signum() < 0 ? BigInteger.ONE.negate() : BigInteger.ZERO);
                return Value.integer(x.shiftRight(y.intValue()));
        }
    }

    // -------------------------
    // Power
    // -------------------------

    private static Value intPower(BigInteger base, BigInteger exp) {
        if (exp.signum() < 0) {
            if (base.signum() == 0) throw new EvaluationException("0.0 cannot be raised to a negative power");
            return floatPower(toDouble(base), toDouble(exp));
        }
        if (base.equals(BigInteger.ONE) || exp.signum() == 0) return Value.integer(BigInteger.ONE);
        if (base.signum() == 0) return Value.integer(BigInteger.ZERO);
        if (base.equals(BigInteger.ONE.negate())) {
            return Value.integer(exp.testBit(0) ? base : BigInteger.ONE);
        }
        if (exp.bitLength() > 31 || (long) base.bitLength() * exp.longValue() > MAX_INT_BITS) {
            throw new EvaluationException("integer result too large");
        }
        return Value.integer(base.pow(exp.intValue()));
    }

    private static Value floatPower(double x, double y) {
        if (y == 0.0) return Value.real(1.0);
        if (Double.isNaN(x)) return Value.real(Double.NaN);
        if (Double.isNaN(y)) return Value.real(x == 1.0 ? 1.0 : Double.NaN);
        if (Double.isInfinite(y)) {
            double ax = Math.abs(x);
            if (ax == 1.0) return Value.real(1.0);
            if ((y > 0) == (ax > 1.0)) return Value.real(Double.POSITIVE_INFINITY);
            return Value.real(0.0);
        }
        if (x == 0.0 && y < 0) throw new EvaluationException("0.0 cannot be raised to a negative power");
        if (x < 0 && !Double.isInfinite(x) && y != Math.floor(y)) {
            // negative base, fractional exponent: Python switches to complex
            return Value.complex(complexPower(new Complex(x, 0.0), new Complex(y, 0.0)));
        }
        double r = Math.pow(x, y);
        if (Double.isInfinite(r) && !Double.isInfinite(x)) {
            throw new EvaluationException("(34, 'Numerical result out of range')");
        }
        return Value.real(r);
    }

    public static Complex complexPower(Complex a, Complex b) {
        Complex r;
        if (b.im == 0.0 && b.re == Math.floor(b.re) && Math.abs(b.re) <= 100.0) {
            long n = (long) b.re;
            if (n >= 0) {
                r = powu(a, n);
            } else {
                Complex p = powu(a, -n);
                if (p.isZero()) throw new EvaluationException("0.0 to a negative or complex power");
                r = Complex.ONE.dividedBy(p);
            }
        } else if (b.isZero()) {
            r = Complex.ONE;
        } else if (a.isZero()) {
            if (b.im != 0.0 || b.re < 0) throw new EvaluationException("0.0 to a negative or complex power");
            r = Complex.ZERO;
        } else {
            double vabs = Math.hypot(a.re, a.im);
            double len = Math.pow(vabs, b.re);
            double at = Math.atan2(a.im, a.re);
            double phase = at * b.re;
            if (b.im != 0.0) {
                len /= Math.exp(at * b.im);
                phase += b.im * Math.log(vabs);
            }
            r = new Complex(len * Math.cos(phase), len * Math.sin(phase));
        }
        if (Double.isInfinite(r.re) || Double.isInfinite(r.im)) {
            throw new EvaluationException("complex exponentiation");
        }
        return r;
    }

    private static Complex powu(Complex x, long n) {
        Complex r = Complex.ONE;
        Complex p = x;
        long mask = 1;
        while (mask > 0 && n >= mask) {
            if ((n & mask) != 0) r = r.times(p);
            mask <<= 1;
            p = p.times(p);
        }
        return r;
    }

    // -------------------------
    // Unary operators
    // -------------------------

    public static Value unary(TokenType op, Value v) {
        switch (op) {
            case NOT:
                return Value.bool(!truthy(v));
            case MINUS:
                if (v.isIntegral()) return Value.integer(v.asInt().negate());
                if (v.type == Value.Type.REAL) return Value.real(-v.asReal());
                if (v.type == Value.Type.COMPLEX) return Value.complex(v.asComplex().negate());
                throw new EvaluationException("bad operand type for unary -: '" + v.pyTypeName() + "'");
            case PLUS:
                if (v.isIntegral()) return Value.integer(v.asInt());
                if (v.type == Value.Type.REAL || v.type == Value.Type.COMPLEX) return v;
                throw new EvaluationException("bad operand type for unary +: '" + v.pyTypeName() + "'");
            case TILDE:
                if (v.isIntegral()) return Value.integer(v.asInt().not());
                throw new EvaluationException("bad operand type for unary ~: '" + v.pyTypeName() + "'");
            default:
                throw new EvaluationException("unsupported unary operator: " + op);
        }
    }

    public static boolean truthy(Value v) {
        switch (v.type) {
            case NONE: return false;
            case BOOL: return v.asBool();
            case INT: return v.asInt().signum() != 0;
            case REAL: return v.asReal() != 0.0;
            case COMPLEX: return !v.asComplex().isZero();
            case STRING: return !v.asString().isEmpty();
            case LIST:
            case TUPLE: return !v.asList().isEmpty();
            case DICT: return !v.asDict().isEmpty();
            default: return true;
        }
    }

    // -------------------------
    // Comparisons
    // -------------------------

    public static boolean compare(TokenType op, Value a, Value b) {
        switch (op) {
            case EQUAL_EQUAL: return a.equals(b);
            case BANG_EQUAL: return !a.equals(b);
            case LESS: return order("<", a, b) < 0;
            case LESS_EQUAL: return order("<=", a, b) <= 0;
            case GREATER: return order(">", a, b) > 0;
            case GREATER_EQUAL: return order(">=", a, b) >= 0;
            case IN: return contains(b, a);
            case NOT_IN: return !contains(b, a);
            case IS: return identical(a, b);
            case IS_NOT: return !identical(a, b);
            default:
                throw new EvaluationException("unsupported comparison: " + op);
        }
    }

    /** Values are immutable, so identity is the same instance or same type and equal value. */
    private static boolean identical(Value a, Value b) {
        return a == b || (a.type == b.type && a.equals(b));
    }

    private static boolean contains(Value container, Value item) {
        switch (container.type) {
            case STRING:
                if (item.type != Value.Type.STRING) {
                    throw new EvaluationException("'in <string>' requires string as left operand, not " + item.pyTypeName());
                }
                return container.asString().contains(item.asString());
            case LIST:
            case TUPLE:
                for (Value v : container.asList()) {
                    if (Value.sameOrEqual(item, v)) return true;
                }
                return false;
            case DICT:
                return container.asDict().containsKey(item);
            default:
                throw new EvaluationException("argument of type '" + container.pyTypeName() + "' is not iterable");
        }
    }

    /**
     * Ordering for {@code < <= > >=}. NaN compares false every way, which the
     * callers get by mapping it to a value no test accepts.
     */
    private static int order(String symbol, Value a, Value b) {
        if (a.isNumber() && b.isNumber() && a.type != Value.Type.COMPLEX && b.type != Value.Type.COMPLEX) {
            if (a.isIntegral() && b.isIntegral()) return a.asInt().compareTo(b.asInt());
            double x = a.isIntegral() ? 0.0 : a.asReal();
            double y = b.isIntegral() ? 0.0 : b.asReal();
            if (Double.isNaN(x) || Double.isNaN(y)) return nanOrder(symbol);
            if (a.isIntegral()) return compareIntToDouble(a.asInt(), y);
            if (b.isIntegral()) return -compareIntToDouble(b.asInt(), x);
            return Double.compare(x, y) == 0 ? 0 : (x < y ? -1 : 1);
        }
        if (a.type == Value.Type.STRING && b.type == Value.Type.STRING) {
            return Integer.signum(a.asString().compareTo(b.asString()));
        }
        if (a.type == b.type && (a.type == Value.Type.LIST || a.type == Value.Type.TUPLE)) {
            List<Value> x = a.asList();
            List<Value> y = b.asList();
            for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
                if (!Value.sameOrEqual(x.get(i), y.get(i))) return order(symbol, x.get(i), y.get(i));
            }
            return Integer.compare(x.size(), y.size());
        }
        throw new EvaluationException("'" + symbol + "' not supported between instances of '"
                + a.pyTypeName() + "' and '" + b.pyTypeName() + "'");
    }

    private static int nanOrder(String symbol) {
        // a result that fails the operator's test
        return (symbol.startsWith("<")) ? 1 : -1;
    }

    private static int compareIntToDouble(BigInteger i, double d) {
        if (Double.isInfinite(d)) return d > 0 ? -1 : 1;
        return new BigDecimal(i).compareTo(new BigDecimal(d));
    }

    // -------------------------
    // Indexing
    // -------------------------

    public static Value index(Value target, Value key) {
        switch (target.type) {
            case LIST:
            case TUPLE: {
                List<Value> items = target.asList();
                return items.get(position(target, key, items.size()));
            }
            case STRING: {
                String s = target.asString();
                int i = position(target, key, s.length());
                return Value.string(s.substring(i, i + 1));
            }
            case DICT: {
                Map<Value, Value> map = target.asDict();
                Value v = map.get(key);
                if (v == null) throw new EvaluationException("KeyError: " + key.repr());
                return v;
            }
            default:
                throw new EvaluationException("'" + target.pyTypeName() + "' object is not subscriptable");
        }
    }

    private static int position(Value target, Value key, int size) {
        if (!key.isIntegral()) {
            throw new EvaluationException(target.pyTypeName() + " indices must be integers, not " + key.pyTypeName());
        }
        BigInteger i = key.asInt();
        if (i.signum() < 0) i = i.add(BigInteger.valueOf(size));
        if (i.signum() < 0 || i.compareTo(BigInteger.valueOf(size)) >= 0) {
            throw new EvaluationException(target.pyTypeName() + " index out of range");
        }
        return i.intValue();
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** 0 int/bool, 1 float, 2 complex. */
    private static int rank(Value a, Value b) {
        return Math.max(rank(a), rank(b));
    }

    private static int rank(Value v) {
        switch (v.type) {
            case REAL: return 1;
            case COMPLEX: return 2;
            default: return 0;
        }
    }

    public static double toDouble(Value v) {
        if (v.type == Value.Type.REAL) return v.asReal();
        if (v.isIntegral()) return toDouble(v.asInt());
        throw new EvaluationException("must be real number, not " + v.pyTypeName());
    }

    public static double toDouble(BigInteger i) {
        double d = i.doubleValue();
        if (Double.isInfinite(d)) throw new EvaluationException("int too large to convert to float");
        return d;
    }

    public static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) return qr[0].subtract(BigInteger.ONE);
        return qr[0];
    }

    /** CPython float divmod: {floor quotient, remainder with the divisor's sign}. */
    private static double[] floatDivmod(double vx, double wx) {
        double mod = vx % wx;
        double div = (vx - mod) / wx;
        if (mod != 0.0) {
            if ((wx < 0) != (mod < 0)) {
                mod += wx;
                div -= 1.0;
            }
        } else {
            mod = Math.copySign(0.0, wx);
        }
        double floordiv;
        if (div != 0.0) {
            floordiv = Math.floor(div);
            if (div - floordiv > 0.5) floordiv += 1.0;
        } else {
            floordiv = Math.copySign(0.0, vx / wx);
        }
        return new double[] { floordiv, mod };
    }

    private static boolean isRepeatable(Value v) {
        return v.type == Value.Type.STRING || v.type == Value.Type.LIST || v.type == Value.Type.TUPLE;
    }

    private static Value repeat(Value seq, BigInteger times) {
        int n = times.signum() <= 0 ? 0 : (times.bitLength() > 31 ? Integer.MAX_VALUE : times.intValue());
        long size = (seq.type == Value.Type.STRING) ? seq.asString().length() : seq.asList().size();
        if (size * (long) n > MAX_INT_BITS) throw new EvaluationException("repeated sequence too large");
        if (seq.type == Value.Type.STRING) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < n; i++) sb.append(seq.asString());
            return Value.string(sb.toString());
        }
        List<Value> items = new ArrayList<>();
        for (int i = 0; i < n; i++) items.addAll(seq.asList());
        return seq.type == Value.Type.LIST ? Value.list(items) : Value.tuple(items);
    }

    private static void requireNumbers(String symbol, Value a, Value b) {
        if (!a.isNumber() || !b.isNumber()) throw unsupported(symbol, a, b);
    }

    private static EvaluationException unsupported(String symbol, Value a, Value b) {
        return new EvaluationException("unsupported operand type(s) for " + symbol + ": '"
                + a.pyTypeName() + "' and '" + b.pyTypeName() + "'");
    }

    private static String symbol(TokenType op) {
        switch (op) {
            case AMP: return "&";
            case PIPE: return "|";
            case CARET: return "^";
            case LSHIFT: return "<<";
            default: return ">>";
        }
    }
}
