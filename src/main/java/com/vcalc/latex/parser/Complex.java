package com.vcalc.latex.parser;

import com.vcalc.latex.parser.utils.NumberText;

/** Immutable complex number with double parts. */
public final class Complex {
    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public final double re;
    public final double im;

    public Complex(double re, double im) {
        this.re = re;
        this.im = im;
    }

    public boolean isZero() { return re == 0.0 && im == 0.0; }

    public Complex plus(Complex o) { return new Complex(re + o.re, im + o.im); }
    public Complex minus(Complex o) { return new Complex(re - o.re, im - o.im); }
    public Complex negate() { return new Complex(-re, -im); }

    public Complex times(Complex o) {
        return new Complex(re * o.re - im * o.im, re * o.im + im * o.re);
    }

    /** Caller checks for a zero divisor. */
    public Complex dividedBy(Complex o) {
        double absRe = Math.abs(o.re);
        double absIm = Math.abs(o.im);
        if (absRe >= absIm) {
            double ratio = o.im / o.re;
            double denom = o.re + o.im * ratio;
            return new Complex((re + im * ratio) / denom, (im - re * ratio) / denom);
        }
        double ratio = o.re / o.im;
        double denom = o.re * ratio + o.im;
        return new Complex((re * ratio + im) / denom, (im * ratio - re) / denom);
    }

    public double abs() { return Math.hypot(re, im); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Complex)) return false;
        Complex c = (Complex) o;
        return re == c.re && im == c.im;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(re == 0.0 ? 0.0 : re) + Double.hashCode(im == 0.0 ? 0.0 : im);
    }

    /** Python {@code repr}: {@code 2j}, {@code (1+2j)}, {@code (1.5-0.5j)}. */
    @Override
    public String toString() {
        String imag = NumberText.reprNoDotZero(im);
        if (re == 0.0 && Math.copySign(1.0, re) > 0) {
            return imag + "j";
        }
        if (!imag.startsWith("-")) imag = "+" + imag;
        return "(" + NumberText.reprNoDotZero(re) + imag + "j)";
    }
}
