package com.vcalc.latex.render;

import java.math.BigDecimal;

import com.vcalc.latex.parser.Complex;
import com.vcalc.latex.parser.Value;
import com.vcalc.latex.parser.utils.NumberText;

/**
 * Display text for a computed value.
 *
 * Reals within {@value #SNAP_TOLERANCE} of an integer print as that integer,
 * other reals with six significant digits. Complex values print as
 * {@code 3 + j}, {@code -2j}, {@code -1 -j}.
 */
public final class ValueFormatter {

    public static final double SNAP_TOLERANCE = 1e-10;

    private ValueFormatter() {}

    public static String format(Value value) {
        switch (value.type) {
            case COMPLEX:
                return formatComplex(value.asComplex());
            case REAL:
                return formatReal(value.asReal());
            case BOOL:
                return value.asBool() ? "\\text{True}" : "\\text{False}";
            default:
                return value.toString();
        }
    }

    public static String formatReal(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return NumberText.general(v);
        double nearest = Math.rint(v);
        if (Math.abs(v - nearest) < SNAP_TOLERANCE) {
            return new BigDecimal(nearest).toBigInteger().toString();
        }
        return NumberText.general(v, 6);
    }

    public static String formatComplex(Complex c) {
        String real = (c.re != 0.0) ? NumberText.general(c.re) : "";
        String imag;
        if (c.im == 1.0) imag = "j";
        else if (c.im == -1.0) imag = "-j";
        else imag = NumberText.general(c.im) + "j";

        if (!real.isEmpty() && c.im >= 0) return real + " + " + imag;
        if (!real.isEmpty()) return real + " " + imag;
        return imag;
    }
}
