// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static java.math.BigInteger.ONE;

import java.io.InvalidObjectException;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A binary fixed-point format: the number of bits to the right of the
 * binary point and, optionally, a limit on the bits to the left of it.
 * Every {@link FxNumber} belongs to exactly one format, and many numbers
 * will generally share one.
 * <p>
 * In a bounded format the integer bits include the sign, so that the
 * scaled values representable are those of a two's complement integer
 * of {@link #getTotalBits()} bits. A format with an unbounded integer
 * part fixes only the resolution.
 * <p>
 * A format is immutable, apart from a cache of the mathematical
 * constants (see {@link FxConstant}) that the elementary functions
 * need. That cache is filled on demand, to whatever precision has been
 * asked of it so far, and is safe for use from concurrent threads.
 * <p>
 * A format is serializable, but its cache is not: a deserialized
 * format starts with an empty one.
 */
public final class FxFormat implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Logger for formats and their constant cache. */
    static final Logger logger = LoggerFactory.getLogger(FxFormat.class);

    /**
     * Value returned by {@link #getIntegerBits()} and
     * {@link #getTotalBits()} when the integer part is unbounded.
     */
    public static final int UNBOUNDED = -1;

    /** A format of 64 fraction bits and an unbounded integer part. */
    public static final FxFormat DEFAULT = new FxFormat(UNBOUNDED, 64);

    /**
     * Bits beyond those requested with which a constant is computed
     * before rounding and storing it.
     */
    private static final int CONSTANT_GUARD_BITS = 16;

    /** Bits to the left of the point (including sign) or UNBOUNDED. */
    private final int integerBits;

    /** Bits to the right of the point. */
    private final int fractionBits;

    /** Least scaled value representable (null if unbounded). */
    private final BigInteger minScaled;

    /** Greatest scaled value representable (null if unbounded). */
    private final BigInteger maxScaled;

    /**
     * A constant computed to some precision. {@code value} is scaled
     * by <i>2<sup>precision + CONSTANT_GUARD_BITS</sup></i> and is
     * correct when rounded to {@code precision} bits.
     */
    private record Cached(int precision, BigInteger value) {}

    /** Constants computed so far (guarded by {@code this}). */
    private final transient Map<FxConstant, Cached> constants =
            new EnumMap<>(FxConstant.class);

    private FxFormat(int integerBits, int fractionBits) {
        this.integerBits = integerBits;
        this.fractionBits = fractionBits;
        if (integerBits == UNBOUNDED) {
            this.minScaled = this.maxScaled = null;
        } else {
            BigInteger limit = ONE.shiftLeft(integerBits + fractionBits - 1);
            this.minScaled = limit.negate();
            this.maxScaled = limit.subtract(ONE);
        }
    }

    /**
     * Replace a deserialized format with one made by the factory, so
     * that it has a cache and its bit counts are checked.
     *
     * @return equivalent format
     * @throws ObjectStreamException if the bit counts are invalid
     */
    private Object readResolve() throws ObjectStreamException {
        try {
            return integerBits == UNBOUNDED ? of(fractionBits)
                    : of(integerBits, fractionBits);
        } catch (IllegalArgumentException e) {
            throw new InvalidObjectException(e.getMessage());
        }
    }

    // Factories ------------------------------------------------------

    /**
     * Return a format with the given resolution and an unbounded
     * integer part.
     *
     * @param fractionBits bits to the right of the binary point
     * @return the format
     * @throws IllegalArgumentException if {@code fractionBits < 0}
     */
    public static FxFormat of(int fractionBits)
            throws IllegalArgumentException {
        if (fractionBits < 0) {
            throw new IllegalArgumentException(String.format(
                    "fraction bits must be non-negative (not %d)",
                    fractionBits));
        }
        return new FxFormat(UNBOUNDED, fractionBits);
    }

    /**
     * Return a format with the given numbers of integer (including
     * sign) and fraction bits.
     *
     * @param integerBits bits to the left of the binary point
     * @param fractionBits bits to the right of the binary point
     * @return the format
     * @throws IllegalArgumentException if either count is negative or
     *     both are zero
     */
    public static FxFormat of(int integerBits, int fractionBits)
            throws IllegalArgumentException {
        if (integerBits < 0 || fractionBits < 0
                || integerBits + fractionBits == 0) {
            throw new IllegalArgumentException(String.format(
                    "invalid fixed-point format (%d, %d)", integerBits,
                    fractionBits));
        }
        return new FxFormat(integerBits, fractionBits);
    }

    /**
     * Synonym for {@link #of(int, int)}.
     *
     * @param integerBits bits to the left of the binary point
     * @param fractionBits bits to the right of the binary point
     * @return the format
     */
    public static FxFormat makeFormat(int integerBits, int fractionBits) {
        return of(integerBits, fractionBits);
    }

    /**
     * The format in which to combine values from the two given
     * formats: the greater number of fraction bits, and the greater
     * number of integer bits (unbounded if either is). If one of the
     * arguments is already that format, it is returned, so that its
     * constant cache continues in use.
     *
     * @param a one format
     * @param b another format
     * @return the format able to represent all values of both
     */
    public static FxFormat resolve(FxFormat a, FxFormat b) {
        if (a == b || a.covers(b)) {
            return a;
        } else if (b.covers(a)) {
            return b;
        } else {
            int ib = a.isBounded() && b.isBounded()
                    ? Math.max(a.integerBits, b.integerBits) : UNBOUNDED;
            return new FxFormat(ib, Math.max(a.fractionBits, b.fractionBits));
        }
    }

    /** True if every value in {@code other} is a value of this. */
    private boolean covers(FxFormat other) {
        if (fractionBits < other.fractionBits) {
            return false;
        } else if (!isBounded()) {
            return true;
        } else {
            return other.isBounded() && integerBits >= other.integerBits;
        }
    }

    // Attributes -----------------------------------------------------

    /** @return whether the integer part is limited */
    public boolean isBounded() { return integerBits != UNBOUNDED; }

    /**
     * @return bits to the left of the point, including the sign, or
     *     {@link #UNBOUNDED}
     */
    public int getIntegerBits() { return integerBits; }

    /** @return bits to the right of the point */
    public int getFractionBits() { return fractionBits; }

    /** @return total bits or {@link #UNBOUNDED} */
    public int getTotalBits() {
        return isBounded() ? integerBits + fractionBits : UNBOUNDED;
    }

    /** @return <i>2<sup>fractionBits</sup></i> */
    public BigInteger getScale() { return ONE.shiftLeft(fractionBits); }

    /** @return least representable scaled value, or null if unbounded */
    public BigInteger minScaled() { return minScaled; }

    /**
     * @return greatest representable scaled value, or null if unbounded
     */
    public BigInteger maxScaled() { return maxScaled; }

    /**
     * Test whether a scaled value is in the range of this format.
     *
     * @param scaled value to test
     * @return true if representable
     */
    public boolean contains(BigInteger scaled) {
        return !isBounded() || (scaled.compareTo(minScaled) >= 0
                && scaled.compareTo(maxScaled) <= 0);
    }

    /**
     * Check a scaled value is in the range of this format.
     *
     * @param scaled value to test
     * @return {@code scaled}
     * @throws OverflowError if it is not
     */
    public BigInteger checkRange(BigInteger scaled) throws OverflowError {
        if (!contains(scaled)) {
            throw new OverflowError("value out of range for %s", this);
        }
        return scaled;
    }

    // Numbers in this format -----------------------------------------

    /**
     * A number in this format from a value scaled by
     * <i>2<sup>bits</sup></i>, rounded to this format's resolution and
     * range-checked.
     *
     * @param v scaled value
     * @param bits fraction bits in {@code v}
     * @return the number
     * @throws OverflowError if out of range
     */
    FxNumber valueOf(BigInteger v, int bits) throws OverflowError {
        return new FxNumber(this,
                checkRange(FxMath.rescale(v, bits, fractionBits)));
    }

    /**
     * A number in this format from its raw scaled value.
     *
     * @param scaled value multiplied by the scale
     * @return the number
     * @throws OverflowError if out of range
     */
    public FxNumber fromScaled(BigInteger scaled) throws OverflowError {
        return new FxNumber(this, checkRange(scaled));
    }

    /**
     * A number in this format with the given integer value.
     *
     * @param v the value
     * @return the number
     * @throws OverflowError if out of range
     */
    public FxNumber fromInt(long v) throws OverflowError {
        return fromInt(BigInteger.valueOf(v));
    }

    /**
     * A number in this format with the given integer value.
     *
     * @param v the value
     * @return the number
     * @throws OverflowError if out of range
     */
    public FxNumber fromInt(BigInteger v) throws OverflowError {
        return valueOf(v, 0);
    }

    /**
     * A number in this format nearest to the ratio of two integers
     * (rounding half away from zero).
     *
     * @param num numerator
     * @param den denominator
     * @return the number
     * @throws OverflowError if out of range
     * @throws ZeroDivisionError if {@code den == 0}
     */
    public FxNumber fromRational(long num, long den)
            throws OverflowError, ZeroDivisionError {
        return fromRational(BigInteger.valueOf(num), BigInteger.valueOf(den));
    }

    /**
     * A number in this format nearest to the ratio of two integers
     * (rounding half away from zero).
     *
     * @param num numerator
     * @param den denominator
     * @return the number
     * @throws OverflowError if out of range
     * @throws ZeroDivisionError if {@code den == 0}
     */
    public FxNumber fromRational(BigInteger num, BigInteger den)
            throws OverflowError, ZeroDivisionError {
        if (den.signum() == 0) {
            throw new ZeroDivisionError("rational with zero denominator");
        }
        return fromScaled(
                FxMath.divideRound(num.shiftLeft(fractionBits), den));
    }

    /**
     * A number in this format parsed from decimal text (an optional
     * sign, digits with an optional fraction part, and an optional
     * exponent).
     *
     * @param text to parse
     * @return the number nearest the text
     * @throws ValueError if the text is malformed
     * @throws OverflowError if out of range
     */
    public FxNumber fromString(String text)
            throws ValueError, OverflowError {
        BigInteger[] ratio = FxText.parseDecimal(text);
        return fromRational(ratio[0], ratio[1]);
    }

    /**
     * A number in this format nearest to the exact value of a
     * {@code double}.
     *
     * @param d the value
     * @return the number
     * @throws ValueError if {@code d} is a NaN
     * @throws OverflowError if {@code d} is infinite or out of range
     */
    public FxNumber fromDouble(double d) throws ValueError, OverflowError {
        long raw = Double.doubleToRawLongBits(d);
        int exponent = (int)((raw & EXPONENT) >>> SIGNIFICAND_BITS);
        long significand = raw & SIGNIFICAND;

        if (exponent == 0x7ff) {
            if (significand == 0) {
                throw new OverflowError("cannot convert infinity to %s",
                        this);
            }
            throw new ValueError("cannot convert NaN to %s", this);
        } else if (exponent == 0) {
            exponent = 1; // sub-normal
        } else {
            significand |= 1L << SIGNIFICAND_BITS;
        }

        // d = significand * 2^(exponent - EXPONENT_BIAS - SIGNIFICAND_BITS)
        BigInteger m = BigInteger.valueOf(d < 0 ? -significand : significand);
        return valueOf(m, EXPONENT_BIAS + SIGNIFICAND_BITS - exponent);
    }

    private static final int SIGNIFICAND_BITS = 52;
    private static final int EXPONENT_BIAS = 1023;
    private static final long EXPONENT = 0x7ff0_0000_0000_0000L;
    private static final long SIGNIFICAND = 0x000f_ffff_ffff_ffffL;

    /** @return zero in this format */
    public FxNumber zero() { return new FxNumber(this, BigInteger.ZERO); }

    /**
     * @return one in this format
     * @throws OverflowError if 1 is not representable
     */
    public FxNumber one() throws OverflowError { return fromInt(1); }

    // Constant cache -------------------------------------------------

    /**
     * Return the value of a constant scaled by
     * <i>2<sup>bits</sup></i>. If it has previously been computed to at
     * least this precision, the cached value is rounded and returned.
     * Otherwise it is computed (with guard bits), replaces the less
     * precise value in the cache, and is returned.
     *
     * @param c the constant required
     * @param bits fraction bits required
     * @return scaled value of the constant
     */
    public synchronized BigInteger constant(FxConstant c, int bits) {
        Cached cached = constants.get(c);
        if (cached == null || cached.precision() < bits) {
            int p = bits + CONSTANT_GUARD_BITS;
            long start = System.nanoTime();
            cached = new Cached(bits, c.compute(p));
            constants.put(c, cached);
            logger.debug("{} computed to {} bits for {} in {}us", c, bits,
                    this, (System.nanoTime() - start) / 1000);
        }
        return FxMath.roundShiftRight(cached.value(),
                cached.precision() + CONSTANT_GUARD_BITS - bits);
    }

    /**
     * The number of fraction bits to which a constant is currently
     * held, or -1 if it has not been computed.
     *
     * @param c the constant
     * @return precision available without recomputation
     */
    synchronized int cachedPrecision(FxConstant c) {
        Cached cached = constants.get(c);
        return cached == null ? -1 : cached.precision();
    }

    /**
     * @return <i>&pi;</i> in this format
     * @throws OverflowError if not representable
     */
    public FxNumber getPi() throws OverflowError {
        return fromScaled(constant(FxConstant.PI, fractionBits));
    }

    /**
     * @return <i>ln 2</i> in this format
     * @throws OverflowError if not representable
     */
    public FxNumber getLn2() throws OverflowError {
        return fromScaled(constant(FxConstant.LN2, fractionBits));
    }

    /**
     * @return <i>e</i> in this format
     * @throws OverflowError if not representable
     */
    public FxNumber getExp1() throws OverflowError {
        return fromScaled(constant(FxConstant.E, fractionBits));
    }

    // Object methods -------------------------------------------------

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FxFormat other) {
            return integerBits == other.integerBits
                    && fractionBits == other.fractionBits;
        }
        return false;
    }

    @Override
    public int hashCode() { return 31 * integerBits + fractionBits; }

    @Override
    public String toString() {
        return String.format("FxFormat(%s, %d)",
                isBounded() ? Integer.toString(integerBits) : "*",
                fractionBits);
    }

    private static final Pattern FORMAT_PATTERN = Pattern
            .compile("\\s*FxFormat\\(\\s*(\\*|\\d+)\\s*,\\s*(\\d+)\\s*\\)\\s*");

    /**
     * Parse the form produced by {@link #toString()}.
     *
     * @param text to parse
     * @return the format described
     * @throws ValueError if the text is not of the expected form
     */
    public static FxFormat parse(String text) throws ValueError {
        Matcher m = FORMAT_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new ValueError("invalid format description: '%s'", text);
        }
        try {
            int fb = Integer.parseInt(m.group(2));
            return "*".equals(m.group(1)) ? of(fb)
                    : of(Integer.parseInt(m.group(1)), fb);
        } catch (IllegalArgumentException e) {
            // Includes NumberFormatException
            throw new ValueError(e, "invalid format description: '%s'",
                    text);
        }
    }
}
