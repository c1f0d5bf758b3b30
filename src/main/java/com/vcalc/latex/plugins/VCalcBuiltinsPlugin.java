package com.vcalc.latex.plugins;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Arithmetic;
import com.vcalc.latex.parser.Complex;
import com.vcalc.latex.parser.TokenType;
import com.vcalc.latex.parser.Value;

/**
 * VCalcBuiltinsPlugin
 *
 * The Python builtins a calculation block typically reaches for:
 * abs, max, min, round, pow, sum, len, int, float, complex, bool.
 *
 *   round(2.5)        -> 2      (half to even)
 *   round(3.14159, 2) -> 3.14
 *   max([1, 7, 3])    -> 7
 *   pow(3, 4, 5)      -> 1
 */
public final class VCalcBuiltinsPlugin {

    private VCalcBuiltinsPlugin() {}

    public static void register(VCalcLatex engine) {

        engine.registerFunction("abs", args -> {
            VCalcMathPlugin.requireArgs("abs", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case INT:
                case BOOL: return Value.integer(v.asInt().abs());
                case REAL: return Value.real(Math.abs(v.asReal()));
                case COMPLEX: {
                    double r = v.asComplex().abs();
                    if (Double.isInfinite(r) && !Double.isInfinite(v.asComplex().re) && !Double.isInfinite(v.asComplex().im)) {
                        throw new EvaluationException("absolute value too large");
                    }
                    return Value.real(r);
                }
                default:
                    throw new EvaluationException("bad operand type for abs(): '" + v.pyTypeName() + "'");
            }
        });

        engine.registerFunction("max", args -> extreme("max", args, TokenType.GREATER));
        engine.registerFunction("min", args -> extreme("min", args, TokenType.LESS));

        engine.registerFunction("round", args -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new EvaluationException("round() takes 1 or 2 arguments (" + args.size() + " given)");
            }
            Value v = args.get(0);
            Value digits = (args.size() == 2) ? args.get(1) : Value.none();
            if (digits.type != Value.Type.NONE && !digits.isIntegral()) {
                throw new EvaluationException("'" + digits.pyTypeName() + "' object cannot be interpreted as an integer");
            }
            if (v.isIntegral()) {
                if (digits.type == Value.Type.NONE || digits.asInt().signum() >= 0) return Value.integer(v.asInt());
                int scale = digits.asInt().intValue();
                BigInteger rounded = new BigDecimal(v.asInt()).setScale(scale, RoundingMode.HALF_EVEN)
                        .setScale(0, RoundingMode.UNNECESSARY).toBigIntegerExact();
                return Value.integer(rounded);
            }
            if (v.type != Value.Type.REAL) {
                throw new EvaluationException("type " + v.pyTypeName() + " doesn't define __round__ method");
            }
            double x = v.asReal();
            if (digits.type == Value.Type.NONE) {
                return Value.integer(VCalcMathPlugin.toInteger(x, RoundingMode.HALF_EVEN));
            }
            if (Double.isNaN(x) || Double.isInfinite(x) || x == 0.0) return v;
            int scale = digits.asInt().max(BigInteger.valueOf(-400)).min(BigInteger.valueOf(400)).intValue();
            double r = new BigDecimal(x).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
            return Value.real(Math.copySign(r, x));
        });

        engine.registerFunction("pow", args -> {
            if (args.size() == 2) return Arithmetic.power(args.get(0), args.get(1));
            if (args.size() != 3) {
                throw new EvaluationException("pow expected 2 or 3 arguments, got " + args.size());
            }
            Value base = args.get(0);
            Value exp = args.get(1);
            Value mod = args.get(2);
            if (!base.isIntegral() || !exp.isIntegral() || !mod.isIntegral()) {
                throw new EvaluationException("pow() 3rd argument not allowed unless all arguments are integers");
            }
            BigInteger m = mod.asInt();
            if (m.signum() == 0) throw new EvaluationException("pow() 3rd argument cannot be 0");
            try {
                BigInteger r = base.asInt().modPow(exp.asInt(), m.abs());
                if (m.signum() < 0 && r.signum() != 0) r = r.add(m);
                return Value.integer(r);
            } catch (ArithmeticException e) {
                throw new EvaluationException("base is not invertible for the given modulus", e);
            }
        });

        engine.registerFunction("sum", args -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new EvaluationException("sum() takes 1 or 2 arguments (" + args.size() + " given)");
            }
            Value acc = (args.size() == 2) ? args.get(1) : Value.integer(0);
            if (acc.type == Value.Type.STRING) {
                throw new EvaluationException("sum() can't sum strings [use ''.join(seq) instead]");
            }
            for (Value item : items("sum", args.get(0))) {
                acc = Arithmetic.add(acc, item);
            }
            return acc;
        });

        engine.registerFunction("len", args -> {
            VCalcMathPlugin.requireArgs("len", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case STRING: return Value.integer(v.asString().codePointCount(0, v.asString().length()));
                case LIST:
                case TUPLE: return Value.integer(v.asList().size());
                case DICT: return Value.integer(v.asDict().size());
                default:
                    throw new EvaluationException("object of type '" + v.pyTypeName() + "' has no len()");
            }
        });

        engine.registerFunction("int", args -> {
            if (args.isEmpty()) return Value.integer(0);
            if (args.size() > 2) throw new EvaluationException("int() takes at most 2 arguments (" + args.size() + " given)");
            Value v = args.get(0);
            if (args.size() == 2) {
                if (v.type != Value.Type.STRING) throw new EvaluationException("int() can't convert non-string with explicit base");
                return Value.integer(parseInt(v.asString(), args.get(1)));
            }
            switch (v.type) {
                case INT:
                case BOOL: return Value.integer(v.asInt());
                case REAL: return Value.integer(VCalcMathPlugin.toInteger(v.asReal(), RoundingMode.DOWN));
                case STRING: return Value.integer(parseInt(v.asString(), Value.integer(10)));
                default:
                    throw new EvaluationException("int() argument must be a string or a real number, not '" + v.pyTypeName() + "'");
            }
        });

        engine.registerFunction("float", args -> {
            if (args.isEmpty()) return Value.real(0.0);
            VCalcMathPlugin.requireArgs("float", args, 1);
            Value v = args.get(0);
            if (v.type == Value.Type.STRING) return Value.real(parseFloat(v.asString()));
            if (v.type == Value.Type.REAL) return v;
            if (v.isIntegral()) return Value.real(Arithmetic.toDouble(v));
            throw new EvaluationException("float() argument must be a string or a real number, not '" + v.pyTypeName() + "'");
        });

        engine.registerFunction("complex", args -> {
            if (args.size() > 2) throw new EvaluationException("complex() takes at most 2 arguments (" + args.size() + " given)");
            Complex re = args.isEmpty() ? Complex.ZERO : complexPart(args.get(0));
            Complex im = (args.size() < 2) ? Complex.ZERO : complexPart(args.get(1));
            // complex(a, b) == a + b*1j, also for complex a and b
            return Value.complex(new Complex(re.re - im.im, re.im + im.re));
        });

        engine.registerFunction("bool", args -> {
            if (args.isEmpty()) return Value.bool(false);
            VCalcMathPlugin.requireArgs("bool", args, 1);
            return Value.bool(Arithmetic.truthy(args.get(0)));
        });
    }

    // ===================== HELPERS =====================

    /** First maximal (or minimal) item, from the arguments or from a single iterable argument. */
    private static Value extreme(String fn, List<Value> args, TokenType better) {
        List<Value> candidates = (args.size() == 1) ? items(fn, args.get(0)) : args;
        if (candidates.isEmpty()) {
            throw new EvaluationException(args.isEmpty()
                    ? fn + " expected at least 1 argument, got 0"
                    : fn + "() arg is an empty sequence");
        }
        Value best = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            Value v = candidates.get(i);
            if (Arithmetic.compare(better, v, best)) best = v;
        }
        return best;
    }

    private static List<Value> items(String fn, Value iterable) {
        switch (iterable.type) {
            case LIST:
            case TUPLE:
                return iterable.asList();
            case DICT:
                return new ArrayList<>(iterable.asDict().keySet());
            case STRING: {
                List<Value> chars = new ArrayList<>();
                iterable.asString().codePoints().forEach(cp -> chars.add(Value.string(new String(Character.toChars(cp)))));
                return chars;
            }
            default:
                throw new EvaluationException("'" + iterable.pyTypeName() + "' object is not iterable");
        }
    }

    private static Complex complexPart(Value v) {
        if (v.type == Value.Type.STRING) {
            throw new EvaluationException("complex() string arguments are not supported");
        }
        if (!v.isNumber()) {
            throw new EvaluationException("complex() argument must be a string or a number, not '" + v.pyTypeName() + "'");
        }
        if (v.type == Value.Type.COMPLEX) return v.asComplex();
        return new Complex(Arithmetic.toDouble(v), 0.0);
    }

    private static BigInteger parseInt(String text, Value baseValue) {
        if (!baseValue.isIntegral()) {
            throw new EvaluationException("'" + baseValue.pyTypeName() + "' object cannot be interpreted as an integer");
        }
        int base = baseValue.asInt().intValue();
        String s = text.trim().replace("_", "");
        String invalid = "invalid literal for int() with base " + base + ": '" + text + "'";
        if (base != 0 && (base < 2 || base > 36)) throw new EvaluationException("int() base must be >= 2 and <= 36, or 0");

        boolean negative = s.startsWith("-");
        if (negative || s.startsWith("+")) s = s.substring(1);
        String lower = s.toLowerCase(Locale.ROOT);
        if (base == 0 || base == 16 || base == 8 || base == 2) {
            int prefixed = lower.startsWith("0x") ? 16 : lower.startsWith("0o") ? 8 : lower.startsWith("0b") ? 2 : 0;
            if (prefixed != 0 && (base == 0 || base == prefixed)) {
                base = prefixed;
                s = s.substring(2);
            } else if (base == 0) {
                base = 10;
            }
        }
        if (s.isEmpty()) throw new EvaluationException(invalid);
        try {
            BigInteger v = new BigInteger(s, base);
            return negative ? v.negate() : v;
        } catch (NumberFormatException e) {
            throw new EvaluationException(invalid, e);
        }
    }

    private static double parseFloat(String text) {
        String s = text.trim().replace("_", "");
        String lower = s.toLowerCase(Locale.ROOT);
        String unsigned = (lower.startsWith("-") || lower.startsWith("+")) ? lower.substring(1) : lower;
        double sign = lower.startsWith("-") ? -1.0 : 1.0;
        if (unsigned.equals("inf") || unsigned.equals("infinity")) return sign * Double.POSITIVE_INFINITY;
        if (unsigned.equals("nan")) return Double.NaN;
        // Java accepts hex floats and a trailing d/f, Python does not
        if (!unsigned.matches("(\\d+\\.?\\d*|\\.\\d+)(e[+-]?\\d+)?")) {
            throw new EvaluationException("could not convert string to float: '" + text + "'");
        }
        return Double.parseDouble(s);
    }
}
