package org.structdiff.inspect;

/**
 * Immutable complex number, inspected as {@link ValueKind#COMPLEX}.
 */
public final class Complex {
    private final double real;
    private final double imaginary;

    private Complex(double real, double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    public static Complex of(double real, double imaginary) {
        return new Complex(real, imaginary);
    }

    public double real() {
        return real;
    }

    public double imaginary() {
        return imaginary;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Complex that)) {
            return false;
        }
        return Double.compare(real, that.real) == 0 && Double.compare(imaginary, that.imaginary) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imaginary);
    }

    @Override
    public String toString() {
        String sign = imaginary < 0 || (imaginary == 0 && 1 / imaginary < 0) ? "" : "+";
        return "(" + real + sign + imaginary + "i)";
    }
}
