package com.vcalc.latex.parser.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Python-compatible text for floats: the {@code g} presentation type and {@code repr}.
 *
 * Both work from the exact binary value of the double, so rounding matches CPython
 * (round-half-even on the exact decimal expansion).
 */
public final class NumberText {

    private NumberText() {}

    /** {@code format(v, "g")}. */
    public static String general(double v) {
        return general(v, 6);
    }

    /** {@code format(v, ".<precision>g")}: trailing zeros and a bare point are removed. */
    public static String general(double v, int precision) {
        if (Double.isNaN(v)) return "nan";
        if (Double.isInfinite(v)) return v > 0 ? "inf" : "-inf";
        int p = Math.max(1, precision);
        String sign = (v < 0 || (v == 0.0 && 1.0 / v < 0)) ? "-" : "";
        if (v == 0.0) return sign + "0";

        BigDecimal rounded = new BigDecimal(Math.abs(v)).round(new MathContext(p, RoundingMode.HALF_EVEN));
        int exp = decimalExponent(rounded);
        if (exp >= -4 && exp < p) {
            BigDecimal fixed = rounded.setScale(Math.max(0, p - 1 - exp), RoundingMode.HALF_EVEN);
            return sign + stripZeros(fixed.toPlainString());
        }
        return sign + scientific(rounded, exp);
    }

    /** Python {@code repr(float)}: shortest round-tripping digits, {@code 10.0}, {@code 1e+16}. */
    public static String repr(double v) {
        if (Double.isNaN(v)) return "nan";
        if (Double.isInfinite(v)) return v > 0 ? "inf" : "-inf";
        if (v == 0.0) return (1.0 / v < 0) ? "-0.0" : "0.0";

        String sign = v < 0 ? "-" : "";
        BigDecimal shortest = shortestDigits(Math.abs(v));
        int exp = decimalExponent(shortest);
        if (exp >= -4 && exp < 16) {
            String plain = shortest.toPlainString();
            if (plain.indexOf('.') < 0) plain = plain + ".0";
            return sign + plain;
        }
        return sign + scientific(shortest, exp);
    }

    /**
     * Fewest significant digits that read back as {@code v}, nearest to the exact value.
     * {@code Double.toString} is not always shortest before JDK 19.
     */
    static BigDecimal shortestDigits(double v) {
        BigDecimal exact = new BigDecimal(v);
        for (int p = 1; p < 17; p++) {
            BigDecimal candidate = exact.round(new MathContext(p, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == v) return candidate.stripTrailingZeros();
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /** {@link #repr(double)} without the trailing {@code .0}, as used inside complex reprs. */
    public static String reprNoDotZero(double v) {
        String r = repr(v);
        return r.endsWith(".0") ? r.substring(0, r.length() - 2) : r;
    }

    /** Exponent of the leading significant digit: 1234.5 -> 3, 0.00012 -> -4. */
    private static int decimalExponent(BigDecimal nonZero) {
        return nonZero.precision() - nonZero.scale() - 1;
    }

    private static String scientific(BigDecimal value, int exp) {
        String digits = value.unscaledValue().abs().toString();
        digits = stripTrailingDigitZeros(digits);
        StringBuilder sb = new StringBuilder();
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exp < 0 ? '-' : '+');
        int absExp = Math.abs(exp);
        if (absExp < 10) sb.append('0');
        sb.append(absExp);
        return sb.toString();
    }

    private static String stripTrailingDigitZeros(String digits) {
        int end = digits.length();
        while (end > 1 && digits.charAt(end - 1) == '0') end--;
        return digits.substring(0, end);
    }

    private static String stripZeros(String plain) {
        if (plain.indexOf('.') < 0) return plain;
        int end = plain.length();
        while (plain.charAt(end - 1) == '0') end--;
        if (plain.charAt(end - 1) == '.') end--;
        return plain.substring(0, end);
    }
}
