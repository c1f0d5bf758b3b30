package com.vcalc.latex.plugins;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import com.vcalc.latex.EvaluationException;
import com.vcalc.latex.VCalcLatex;
import com.vcalc.latex.parser.Arithmetic;
import com.vcalc.latex.parser.Value;

/**
 * VCalcMathPlugin
 *
 * Python {@code math} module functions. Arguments are real numbers (int, bool
 * or float); results follow CPython, including its domain and range errors:
 *
 *   sqrt(-1)     -> math domain error
 *   exp(1000)    -> math range error
 *   floor(2.5)   -> 2 (an int)
 *   log(8, 2)    -> 3.0
 *
 * Registered by {@link VCalcLatex} on construction; calls through a module
 * prefix ({@code math.sqrt(x)}) resolve to the same functions.
 */
public final class VCalcMathPlugin {

    private VCalcMathPlugin() {}

    public static void register(VCalcLatex engine) {

        unary(engine, "sqrt", Math::sqrt, false);
        unary(engine, "sin", Math::sin, false);
        unary(engine, "cos", Math::cos, false);
        unary(engine, "tan", Math::tan, false);
        unary(engine, "asin", Math::asin, false);
        unary(engine, "acos", Math::acos, false);
        unary(engine, "atan", Math::atan, false);
        unary(engine, "sinh", Math::sinh, true);
        unary(engine, "cosh", Math::cosh, true);
        unary(engine, "tanh", Math::tanh, false);
        unary(engine, "exp", Math::exp, true);

        engine.registerFunction("degrees", args -> {
            requireArgs("degrees", args, 1);
            return Value.real(Math.toDegrees(real(args, 0)));
        });

        engine.registerFunction("radians", args -> {
            requireArgs("radians", args, 1);
            return Value.real(Math.toRadians(real(args, 0)));
        });

        engine.registerFunction("atan2", args -> {
            requireArgs("atan2", args, 2);
            return Value.real(checked(Math::atan2, real(args, 0), real(args, 1)));
        });

        engine.registerFunction("log", args -> {
            if (args.size() < 1 || args.size() > 2) {
                throw new EvaluationException("log expected 1 or 2 arguments, got " + args.size());
            }
            double num = ln(args.get(0));
            if (args.size() == 1) return Value.real(num);
            double den = ln(args.get(1));
            if (den == 0.0) throw new EvaluationException("float division by zero");
            return Value.real(num / den);
        });

        engine.registerFunction("log10", args -> {
            requireArgs("log10", args, 1);
            Value v = args.get(0);
            if (fitsDouble(v)) return Value.real(Math.log10(positive(v)));
            return Value.real(ln(v) / Math.log(10.0));
        });

        engine.registerFunction("log2", args -> {
            requireArgs("log2", args, 1);
            Value v = args.get(0);
            if (!fitsDouble(v)) return Value.real(ln(v) / Math.log(2.0));
            double x = positive(v);
            if (Double.isInfinite(x) || Double.isNaN(x)) return Value.real(x);
            if (x == Math.scalb(1.0, Math.getExponent(x))) return Value.real(Math.getExponent(x));
            return Value.real(Math.log(x) / Math.log(2.0));
        });

        engine.registerFunction("floor", args -> {
            requireArgs("floor", args, 1);
            Value v = number(args, 0);
            if (v.isIntegral()) return Value.integer(v.asInt());
            return Value.integer(toInteger(v.asReal(), RoundingMode.FLOOR));
        });

        engine.registerFunction("ceil", args -> {
            requireArgs("ceil", args, 1);
            Value v = number(args, 0);
            if (v.isIntegral()) return Value.integer(v.asInt());
            return Value.integer(toInteger(v.asReal(), RoundingMode.CEILING));
        });

        engine.registerFunction("hypot", args -> {
            double acc = 0.0;
            for (int i = 0; i < args.size(); i++) {
                acc = Math.hypot(acc, real(args, i));
            }
            return Value.real(acc);
        });
    }

    // ===================== HELPERS =====================

    private static void unary(VCalcLatex engine, String name, DoubleUnaryOperator fn, boolean canOverflow) {
        engine.registerFunction(name, args -> {
            requireArgs(name, args, 1);
            double x = real(args, 0);
            double r = fn.applyAsDouble(x);
            if (Double.isNaN(r) && !Double.isNaN(x)) throw new EvaluationException("math domain error");
            if (Double.isInfinite(r) && !Double.isInfinite(x)) {
                throw new EvaluationException(canOverflow ? "math range error" : "math domain error");
            }
            return Value.real(r);
        });
    }

    private static double checked(DoubleBinaryOperator fn, double x, double y) {
        double r = fn.applyAsDouble(x, y);
        if (Double.isNaN(r) && !Double.isNaN(x) && !Double.isNaN(y)) throw new EvaluationException("math domain error");
        return r;
    }

    /** Natural log; ints beyond the double range are scaled down first, as CPython does. */
    private static double ln(Value v) {
        if (v.isIntegral()) {
            BigInteger i = v.asInt();
            if (i.signum() <= 0) throw new EvaluationException("math domain error");
            int shift = Math.max(0, i.bitLength() - 1000);
            return Math.log(i.shiftRight(shift).doubleValue()) + shift * Math.log(2.0);
        }
        double x = real(v);
        if (Double.isNaN(x)) return x;
        if (x <= 0.0) throw new EvaluationException("math domain error");
        return Math.log(x);
    }

    private static boolean fitsDouble(Value v) {
        return !v.isIntegral() || v.asInt().bitLength() < 1000;
    }

    /** Argument of a logarithm: real and greater than zero (NaN passes through). */
    private static double positive(Value v) {
        double x = real(v);
        if (x <= 0.0) throw new EvaluationException("math domain error");
        return x;
    }

    static BigInteger toInteger(double x, RoundingMode mode) {
        if (Double.isNaN(x)) throw new EvaluationException("cannot convert float NaN to integer");
        if (Double.isInfinite(x)) throw new EvaluationException("cannot convert float infinity to integer");
        return new BigDecimal(x).setScale(0, mode).toBigIntegerExact();
    }

    static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new EvaluationException(fn + "() takes exactly " + n + " argument" + (n == 1 ? "" : "s")
                    + " (" + args.size() + " given)");
        }
    }

    private static Value number(List<Value> args, int idx) {
        Value v = args.get(idx);
        if (!v.isNumber() || v.type == Value.Type.COMPLEX) {
            throw new EvaluationException("must be real number, not " + v.pyTypeName());
        }
        return v;
    }

    private static double real(List<Value> args, int idx) {
        return real(args.get(idx));
    }

    private static double real(Value v) {
        if (!v.isNumber() || v.type == Value.Type.COMPLEX) {
            throw new EvaluationException("must be real number, not " + v.pyTypeName());
        }
        return Arithmetic.toDouble(v);
    }
}
