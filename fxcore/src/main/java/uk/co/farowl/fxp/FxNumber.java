// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static java.math.BigInteger.ONE;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A binary fixed-point number: a signed integer {@code scaledValue}
 * and a {@link FxFormat} from which it takes its meaning, the
 * represented value being <i>scaledValue / 2<sup>f</sup></i> where
 * <i>f</i> is the format's number of fraction bits.
 * <p>
 * Instances are immutable. Arithmetic between numbers of different
 * formats takes place in the format given by
 * {@link FxFormat#resolve(FxFormat, FxFormat)}, unless the caller names
 * a format for the result. Whenever a result has more fraction bits
 * than its format provides, it is rounded to nearest, with halves
 * rounded away from zero. A result that does not fit a bounded format
 * raises {@link OverflowError}.
 */
public final class FxNumber extends Number implements Comparable<FxNumber> {
    private static final long serialVersionUID = 1L;

    /**
     * Extra fraction bits carried by the elementary functions beyond
     * those of the argument or result.
     */
    static final int GUARD_BITS = 20;

    /** The format of this number. */
    private final FxFormat format;

    /** Value multiplied by the scale of the format. */
    private final BigInteger scaledValue;

    /**
     * Construct from a scaled value already known to be in range.
     *
     * @param format of the number
     * @param scaledValue value multiplied by the scale
     */
    FxNumber(FxFormat format, BigInteger scaledValue) {
        this.format = format;
        this.scaledValue = scaledValue;
    }

    /**
     * Check a deserialized number against the range of its format.
     *
     * @return equivalent number
     * @throws ObjectStreamException if a field is missing or the value
     *     is out of range
     */
    private Object readResolve() throws ObjectStreamException {
        if (format == null || scaledValue == null) {
            throw new InvalidObjectException("FxNumber field missing");
        }
        try {
            return format.fromScaled(scaledValue);
        } catch (OverflowError e) {
            throw new InvalidObjectException(e.getMessage());
        }
    }

    /**
     * The sine and cosine of one angle.
     *
     * @param sin the sine
     * @param cos the cosine
     */
    public record SinCos(FxNumber sin, FxNumber cos) {}

    // Factories ------------------------------------------------------

    /**
     * Equivalent to {@code format.fromInt(v)}.
     *
     * @param format of the result
     * @param v integer value
     * @return the number
     */
    public static FxNumber fromInt(FxFormat format, long v) {
        return format.fromInt(v);
    }

    /**
     * Equivalent to {@code format.fromRational(num, den)}.
     *
     * @param format of the result
     * @param num numerator
     * @param den denominator
     * @return the number
     */
    public static FxNumber fromRational(FxFormat format, long num, long den) {
        return format.fromRational(num, den);
    }

    /**
     * Equivalent to {@code format.fromString(text)}.
     *
     * @param format of the result
     * @param text decimal text
     * @return the number
     */
    public static FxNumber fromString(FxFormat format, String text) {
        return format.fromString(text);
    }

    /**
     * Reconstruct a number from the text produced by {@link #toRepr()}.
     *
     * @param text canonical representation
     * @return an equal number in an equal format
     * @throws ValueError if the text is malformed
     * @throws OverflowError if the value does not fit the format
     */
    public static FxNumber fromRepr(String text)
            throws ValueError, OverflowError {
        return FxText.fromRepr(text);
    }

    // Attributes and conversion --------------------------------------

    /** @return the format of this number */
    public FxFormat getFormat() { return format; }

    /** @return the value multiplied by the scale of the format */
    public BigInteger getScaledValue() { return scaledValue; }

    /**
     * The same value re-expressed in another format, rounded if that
     * has fewer fraction bits.
     *
     * @param to destination format
     * @return the converted number
     * @throws OverflowError if the value is out of range for {@code to}
     */
    public FxNumber convert(FxFormat to) throws OverflowError {
        if (to == format) {
            return this;
        }
        return to.valueOf(scaledValue, format.getFractionBits());
    }

    /**
     * The scaled value re-expressed with more fraction bits, exactly.
     */
    private BigInteger at(int bits) {
        return scaledValue.shiftLeft(bits - format.getFractionBits());
    }

    /**
     * @return the integer part, truncated toward zero
     */
    public BigInteger toBigInteger() {
        int f = format.getFractionBits();
        if (scaledValue.signum() < 0) {
            return scaledValue.negate().shiftRight(f).negate();
        }
        return scaledValue.shiftRight(f);
    }

    /**
     * @return the integer part, truncated toward zero
     * @throws OverflowError if it is beyond the range of {@code long}
     */
    public long longValueExact() throws OverflowError {
        BigInteger i = toBigInteger();
        if (i.bitLength() > 63) {
            throw new OverflowError("%s too large to convert to long", this);
        }
        return i.longValue();
    }

    @Override
    public int intValue() { return toBigInteger().intValue(); }

    @Override
    public long longValue() { return toBigInteger().longValue(); }

    @Override
    public float floatValue() { return toBigDecimal().floatValue(); }

    @Override
    public double doubleValue() { return toBigDecimal().doubleValue(); }

    /**
     * @return the exact value as a {@code BigDecimal}
     */
    public BigDecimal toBigDecimal() {
        // x / 2^f = x * 5^f / 10^f
        int f = format.getFractionBits();
        return new BigDecimal(scaledValue.multiply(FIVE.pow(f)), f);
    }

    private static final BigInteger FIVE = BigInteger.valueOf(5);

    /**
     * @return whether the value is a whole number
     */
    public boolean isInteger() {
        return scaledValue.signum() == 0
                || scaledValue.getLowestSetBit() >= format.getFractionBits();
    }

    // Arithmetic -----------------------------------------------------

    /** The format in which to combine this with {@code other}. */
    private FxFormat resolve(FxNumber other) {
        return FxFormat.resolve(format, other.format);
    }

    /** The greater of the fraction bits of this and {@code other}. */
    private int commonBits(FxNumber other) {
        return Math.max(format.getFractionBits(),
                other.format.getFractionBits());
    }

    /**
     * @param other addend
     * @return {@code this + other}
     */
    public FxNumber add(FxNumber other) { return add(other, resolve(other)); }

    /**
     * @param other addend
     * @param result format of the result
     * @return {@code this + other}
     */
    public FxNumber add(FxNumber other, FxFormat result) {
        int fc = commonBits(other);
        return result.valueOf(at(fc).add(other.at(fc)), fc);
    }

    /**
     * @param n addend
     * @return {@code this + n} in the format of this number
     */
    public FxNumber add(long n) {
        return format.fromScaled(scaledValue
                .add(BigInteger.valueOf(n).shiftLeft(format.getFractionBits())));
    }

    /**
     * @param other subtrahend
     * @return {@code this - other}
     */
    public FxNumber subtract(FxNumber other) {
        return subtract(other, resolve(other));
    }

    /**
     * @param other subtrahend
     * @param result format of the result
     * @return {@code this - other}
     */
    public FxNumber subtract(FxNumber other, FxFormat result) {
        int fc = commonBits(other);
        return result.valueOf(at(fc).subtract(other.at(fc)), fc);
    }

    /**
     * @param n subtrahend
     * @return {@code this - n} in the format of this number
     */
    public FxNumber subtract(long n) {
        return format.fromScaled(scaledValue.subtract(
                BigInteger.valueOf(n).shiftLeft(format.getFractionBits())));
    }

    /**
     * @param other multiplier
     * @return {@code this * other}
     */
    public FxNumber multiply(FxNumber other) {
        return multiply(other, resolve(other));
    }

    /**
     * @param other multiplier
     * @param result format of the result
     * @return {@code this * other}
     */
    public FxNumber multiply(FxNumber other, FxFormat result) {
        // The exact product has the sum of the fraction bits.
        int fp = format.getFractionBits() + other.format.getFractionBits();
        return result.valueOf(scaledValue.multiply(other.scaledValue), fp);
    }

    /**
     * @param n multiplier
     * @return {@code this * n} in the format of this number
     */
    public FxNumber multiply(long n) {
        return format
                .fromScaled(scaledValue.multiply(BigInteger.valueOf(n)));
    }

    /**
     * @param other divisor
     * @return {@code this / other}
     * @throws ZeroDivisionError if {@code other} is zero
     */
    public FxNumber divide(FxNumber other) throws ZeroDivisionError {
        return divide(other, resolve(other));
    }

    /**
     * @param other divisor
     * @param result format of the result
     * @return {@code this / other}
     * @throws ZeroDivisionError if {@code other} is zero
     */
    public FxNumber divide(FxNumber other, FxFormat result)
            throws ZeroDivisionError {
        if (other.scaledValue.signum() == 0) {
            throw new ZeroDivisionError("fixed-point division by zero");
        }
        // q = a/b * 2^fr = sa * 2^(fb + fr - fa) / sb
        int e = other.format.getFractionBits() + result.getFractionBits()
                - format.getFractionBits();
        BigInteger q;
        if (e >= 0) {
            q = FxMath.divideRound(scaledValue.shiftLeft(e), other.scaledValue);
        } else {
            q = FxMath.divideRound(scaledValue,
                    other.scaledValue.shiftLeft(-e));
        }
        return result.fromScaled(q);
    }

    /**
     * @param n divisor
     * @return {@code this / n} in the format of this number
     * @throws ZeroDivisionError if {@code n == 0}
     */
    public FxNumber divide(long n) throws ZeroDivisionError {
        if (n == 0) {
            throw new ZeroDivisionError("fixed-point division by zero");
        }
        return format.fromScaled(
                FxMath.divideRound(scaledValue, BigInteger.valueOf(n)));
    }

    /**
     * Floored modulus: the result is zero or has the sign of
     * {@code other}, and {@code this - result} is an integer multiple
     * of {@code other}.
     *
     * @param other divisor
     * @return {@code this mod other}
     * @throws ZeroDivisionError if {@code other} is zero
     */
    public FxNumber mod(FxNumber other) throws ZeroDivisionError {
        return mod(other, resolve(other));
    }

    /**
     * Floored modulus into a given format.
     *
     * @param other divisor
     * @param result format of the result
     * @return {@code this mod other}
     * @throws ZeroDivisionError if {@code other} is zero
     */
    public FxNumber mod(FxNumber other, FxFormat result)
            throws ZeroDivisionError {
        if (other.scaledValue.signum() == 0) {
            throw new ZeroDivisionError("fixed-point modulo by zero");
        }
        int fc = commonBits(other);
        return result.valueOf(FxMath.floorMod(at(fc), other.at(fc)), fc);
    }

    /**
     * @return {@code -this}
     * @throws OverflowError if this is the least value of a bounded
     *     format
     */
    public FxNumber negate() throws OverflowError {
        return format.fromScaled(scaledValue.negate());
    }

    /** @return {@code this} */
    public FxNumber plus() { return this; }

    /**
     * @return {@code |this|}
     * @throws OverflowError if this is the least value of a bounded
     *     format
     */
    public FxNumber abs() throws OverflowError {
        return scaledValue.signum() < 0 ? negate() : this;
    }

    /**
     * Multiply by <i>2<sup>n</sup></i>, or divide (with rounding) if
     * {@code n} is negative.
     *
     * @param n power of two
     * @return {@code this * 2^n}
     */
    public FxNumber shiftLeft(int n) {
        return format.valueOf(scaledValue, format.getFractionBits() - n);
    }

    /**
     * Divide by <i>2<sup>n</sup></i> (with rounding), or multiply if
     * {@code n} is negative.
     *
     * @param n power of two
     * @return {@code this / 2^n}
     */
    public FxNumber shiftRight(int n) {
        return format.valueOf(scaledValue, format.getFractionBits() + n);
    }

    // Comparison -----------------------------------------------------

    @Override
    public int compareTo(FxNumber other) {
        int fc = commonBits(other);
        return at(fc).compareTo(other.at(fc));
    }

    /**
     * Equality of represented value, whatever the formats.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FxNumber other) {
            return compareTo(other) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        // Hash the value in its shortest form: m * 2^-e
        int f = format.getFractionBits();
        if (scaledValue.signum() == 0) {
            return 0;
        }
        int t = Math.min(scaledValue.getLowestSetBit(), f);
        return 31 * scaledValue.shiftRight(t).hashCode() + (f - t);
    }

    /** @return -1, 0 or 1 as this is negative, zero or positive */
    public int signum() { return scaledValue.signum(); }

    /** @return whether this is zero */
    public boolean isZero() { return scaledValue.signum() == 0; }

    /**
     * @param other to compare
     * @return the lesser of {@code this} and {@code other}
     */
    public FxNumber min(FxNumber other) {
        return compareTo(other) <= 0 ? this : other;
    }

    /**
     * @param other to compare
     * @return the greater of {@code this} and {@code other}
     */
    public FxNumber max(FxNumber other) {
        return compareTo(other) >= 0 ? this : other;
    }

    // Elementary functions -------------------------------------------

    /**
     * Precision at which to compute a function of this number for a
     * result in the given format.
     */
    private int workingBits(FxFormat result) {
        return Math.max(format.getFractionBits(), result.getFractionBits())
                + GUARD_BITS;
    }

    /** @return <i>&radic;this</i> */
    public FxNumber sqrt() { return sqrt(format); }

    /**
     * @param result format of the result
     * @return <i>&radic;this</i>
     * @throws DomainError if this is negative
     */
    public FxNumber sqrt(FxFormat result) throws DomainError {
        if (scaledValue.signum() < 0) {
            throw new DomainError("sqrt of negative number %s", this);
        }
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.sqrt(at(q)), q);
    }

    /** @return <i>ln this</i> */
    public FxNumber ln() { return ln(format); }

    /**
     * @param result format of the result
     * @return <i>ln this</i>
     * @throws DomainError if this is not positive
     */
    public FxNumber ln(FxFormat result) throws DomainError {
        if (scaledValue.signum() <= 0) {
            throw new DomainError("ln of non-positive number %s", this);
        }
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.ln(at(q)), q);
    }

    /** @return <i>log<sub>2</sub> this</i> */
    public FxNumber log2() { return log2(format); }

    /**
     * @param result format of the result
     * @return <i>log<sub>2</sub> this</i>
     * @throws DomainError if this is not positive
     */
    public FxNumber log2(FxFormat result) throws DomainError {
        if (scaledValue.signum() <= 0) {
            throw new DomainError("log2 of non-positive number %s", this);
        }
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.log2(at(q)), q);
    }

    /** @return <i>e<sup>this</sup></i> */
    public FxNumber exp() { return exp(format); }

    /**
     * @param result format of the result
     * @return <i>e<sup>this</sup></i>
     * @throws OverflowError if the result is too large for its format
     */
    public FxNumber exp(FxFormat result) throws OverflowError {
        if (result.isBounded() && toBigInteger()
                .compareTo(BigInteger.valueOf(result.getIntegerBits())) >= 0) {
            // e^x > 2^x >= 2^integerBits
            throw new OverflowError("exp(%s) too large for %s", this, result);
        }
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.exp(at(q)), q);
    }

    /** @return <i>sin this</i> */
    public FxNumber sin() { return sin(format); }

    /**
     * @param result format of the result
     * @return <i>sin this</i>
     */
    public FxNumber sin(FxFormat result) {
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.sin(at(q)), q);
    }

    /** @return <i>cos this</i> */
    public FxNumber cos() { return cos(format); }

    /**
     * @param result format of the result
     * @return <i>cos this</i>
     */
    public FxNumber cos(FxFormat result) {
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.cos(at(q)), q);
    }

    /** @return <i>sin this</i> and <i>cos this</i> together */
    public SinCos sinCos() { return sinCos(format); }

    /**
     * Sine and cosine of this angle, sharing the work of reducing it.
     *
     * @param result format of the results
     * @return <i>sin this</i> and <i>cos this</i>
     */
    public SinCos sinCos(FxFormat result) {
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        BigInteger[] sc = w.sinCos(at(q));
        return new SinCos(result.valueOf(sc[0], q), result.valueOf(sc[1], q));
    }

    /** @return <i>tan this</i> */
    public FxNumber tan() { return tan(format); }

    /**
     * Tangent of this angle. Where the cosine rounds to zero in the
     * result format, the tangent is not defined at that resolution.
     *
     * @param result format of the result
     * @return <i>tan this</i>
     * @throws ZeroDivisionError if the cosine is zero in {@code result}
     * @throws OverflowError if the tangent does not fit {@code result}
     */
    public FxNumber tan(FxFormat result)
            throws ZeroDivisionError, OverflowError {
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        BigInteger[] sc = w.sinCos(at(q));
        if (FxMath.rescale(sc[1], q, result.getFractionBits()).signum() == 0) {
            throw new ZeroDivisionError("tan(%s): cosine is zero", this);
        }
        return result.valueOf(w.div(sc[0], sc[1]), q);
    }

    /** Raise DomainError unless {@code |this| <= 1}. */
    private void checkUnitInterval(String function) throws DomainError {
        BigInteger one = ONE.shiftLeft(format.getFractionBits());
        if (scaledValue.abs().compareTo(one) > 0) {
            throw new DomainError("%s argument %s not in [-1, 1]", function,
                    this);
        }
    }

    /** @return <i>asin this</i> */
    public FxNumber asin() { return asin(format); }

    /**
     * @param result format of the result
     * @return <i>asin this</i> in <i>[-&pi;/2, &pi;/2]</i>
     * @throws DomainError if <i>|this| &gt; 1</i>
     */
    public FxNumber asin(FxFormat result) throws DomainError {
        checkUnitInterval("asin");
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.asin(at(q)), q);
    }

    /** @return <i>acos this</i> */
    public FxNumber acos() { return acos(format); }

    /**
     * @param result format of the result
     * @return <i>acos this</i> in <i>[0, &pi;]</i>
     * @throws DomainError if <i>|this| &gt; 1</i>
     */
    public FxNumber acos(FxFormat result) throws DomainError {
        checkUnitInterval("acos");
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.acos(at(q)), q);
    }

    /** @return <i>atan this</i> */
    public FxNumber atan() { return atan(format); }

    /**
     * @param result format of the result
     * @return <i>atan this</i> in <i>[-&pi;/2, &pi;/2]</i>
     */
    public FxNumber atan(FxFormat result) {
        int q = workingBits(result);
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.atan(at(q)), q);
    }

    // Powers ---------------------------------------------------------

    /**
     * An estimate of <i>log<sub>2</sub>|this|</i> (this not zero) from
     * the leading 63 bits of the scaled value. The error is of the
     * order of the precision of a {@code double}.
     */
    private double log2Magnitude() {
        BigInteger m = scaledValue.abs();
        int shift = Math.max(0, m.bitLength() - 63);
        double top = m.shiftRight(shift).doubleValue();
        return Math.log(top) / LN_2 + shift - format.getFractionBits();
    }

    private static final double LN_2 = Math.log(2.0);

    /**
     * An upper bound on the binary exponent of a power whose logarithm
     * to base 2 is estimated as {@code size}, allowing for the error in
     * each of {@code factors} estimates of the base.
     */
    private static double powerBound(double size, double factors) {
        return size + Math.abs(factors) * 1e-12 + 2;
    }

    /** @return whether {@code |this| == 1} */
    private boolean isUnitMagnitude() {
        return scaledValue.abs().equals(ONE.shiftLeft(format.getFractionBits()));
    }

    /**
     * @param n integer exponent
     * @return <i>this<sup>n</sup></i>
     */
    public FxNumber pow(long n) { return pow(n, format); }

    /**
     * Integer power by repeated squaring, at a precision extended by
     * the possible growth of the result and of the accumulated error.
     *
     * @param n integer exponent
     * @param result format of the result
     * @return <i>this<sup>n</sup></i>
     * @throws DomainError if this is zero and {@code n <= 0}
     * @throws OverflowError if the result is too large
     */
    public FxNumber pow(long n, FxFormat result)
            throws DomainError, OverflowError {
        if (scaledValue.signum() == 0) {
            if (n <= 0) {
                throw new DomainError("zero to the power %d", n);
            }
            return result.zero();
        } else if (n == 0) {
            return result.one();
        } else if (isUnitMagnitude()) {
            return (scaledValue.signum() < 0 && (n & 1) != 0)
                    ? result.one().negate() : result.one();
        }

        // The result magnitude is below 2^upper
        double upper = powerBound((double)n * log2Magnitude(), n);
        if (upper > FxMath.MAX_MAGNITUDE_BITS) {
            throw new OverflowError("%s ** %d too large", this, n);
        }

        int q = workingBits(result) + (int)Math.ceil(Math.max(upper, 0))
                + (64 - Long.numberOfLeadingZeros(n < 0 ? -n : n));
        FxMath w = new FxMath(result, q);
        return result.valueOf(w.pow(at(q), n), q);
    }

    /**
     * @param y exponent
     * @return <i>this<sup>y</sup></i>
     */
    public FxNumber pow(FxNumber y) { return pow(y, format); }

    /**
     * Power with a fixed-point exponent. An integer exponent is
     * treated as by {@link #pow(long, FxFormat)}, otherwise the result
     * is computed as <i>exp(y ln this)</i>, at a precision extended by
     * the possible size of the result.
     *
     * @param y exponent
     * @param result format of the result
     * @return <i>this<sup>y</sup></i>
     * @throws DomainError if this is zero and {@code y <= 0}, or this
     *     is negative and {@code y} is not an integer
     * @throws OverflowError if the result is too large
     */
    public FxNumber pow(FxNumber y, FxFormat result)
            throws DomainError, OverflowError {
        BigInteger yInt = y.toBigInteger();
        boolean integral = y.isInteger();

        if (integral && yInt.bitLength() <= 63) {
            return pow(yInt.longValue(), result);
        } else if (scaledValue.signum() == 0) {
            if (y.signum() <= 0) {
                throw new DomainError("zero to the power %s", y);
            }
            return result.zero();
        } else if (scaledValue.signum() < 0 && !integral) {
            throw new DomainError("negative number %s to non-integer power %s",
                    this, y);
        }

        // |this|^y, negated if this < 0 and y is odd.
        boolean negative = scaledValue.signum() < 0 && yInt.testBit(0);
        if (isUnitMagnitude()) {
            return negative ? result.one().negate() : result.one();
        }

        int q = Math.max(workingBits(result),
                y.format.getFractionBits() + GUARD_BITS);

        // y ln|b| > 0 when the bound is positive.
        double yd = y.doubleValue();
        double upper = powerBound(yd * log2Magnitude(), yd);
        if (upper > FxMath.MAX_MAGNITUDE_BITS) {
            throw new OverflowError("%s ** %s too large", this, y);
        } else if (upper > 0) {
            q += (int)Math.ceil(upper) + yInt.abs().add(ONE).bitLength();
        }

        FxMath w = new FxMath(result, q);
        BigInteger b = scaledValue.abs().shiftLeft(q - format.getFractionBits());
        BigInteger r = w.exp(w.mul(y.at(q), w.ln(b)));
        return result.valueOf(negative ? r.negate() : r, q);
    }

    // Text -----------------------------------------------------------

    /**
     * Decimal text with enough places to distinguish all values of the
     * format, less any trailing zeros.
     *
     * @return decimal text
     */
    public String toDecimalString() {
        return FxText.toDecimal(scaledValue, format.getFractionBits());
    }

    /**
     * Decimal text with exactly the given number of places, rounded
     * half away from zero.
     *
     * @param places after the point
     * @return decimal text
     * @throws IllegalArgumentException if {@code places < 0}
     */
    public String toDecimalString(int places) throws IllegalArgumentException {
        if (places < 0) {
            throw new IllegalArgumentException(String.format(
                    "decimal places must be non-negative (not %d)", places));
        }
        return FxText.toDecimal(scaledValue, format.getFractionBits(), places);
    }

    /** @return signed binary text */
    public String toBinaryString() { return toBinaryString(false); }

    /**
     * @param twosComplement whether to render in two's complement
     * @return binary text with the point among the digits
     */
    public String toBinaryString(boolean twosComplement) {
        return FxText.toRadix(format, scaledValue, 1, twosComplement);
    }

    /** @return signed octal text */
    public String toOctalString() { return toOctalString(false); }

    /**
     * @param twosComplement whether to render in two's complement
     * @return octal text with the point among the digits
     */
    public String toOctalString(boolean twosComplement) {
        return FxText.toRadix(format, scaledValue, 3, twosComplement);
    }

    /** @return signed hexadecimal text */
    public String toHexString() { return toHexString(false); }

    /**
     * @param twosComplement whether to render in two's complement
     * @return hexadecimal text with the point among the digits
     */
    public String toHexString(boolean twosComplement) {
        return FxText.toRadix(format, scaledValue, 4, twosComplement);
    }

    /**
     * The canonical representation, for example
     * {@code FxNumber(FxFormat(8, 8), 341)}, from which
     * {@link #fromRepr(String)} reconstructs the number.
     *
     * @return canonical text
     */
    public String toRepr() { return FxText.toRepr(format, scaledValue); }

    @Override
    public String toString() { return toDecimalString(); }
}
