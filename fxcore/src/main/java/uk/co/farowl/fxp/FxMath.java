// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static java.math.BigInteger.ONE;
import static java.math.BigInteger.ZERO;

import java.math.BigInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arithmetic and elementary functions on raw scaled integers at a
 * fixed working precision. An instance represents the precision: every
 * {@code BigInteger} argument and result of an instance method is a
 * value scaled by <i>2<sup>bits</sup></i>. The static methods are the
 * integer primitives (shifts and divisions that round half away from
 * zero) from which everything else is built.
 * <p>
 * The functions here assume their arguments have already been checked
 * against the function's domain by {@link FxNumber}. They obtain π and
 * ln 2 from the constant cache of a {@link FxFormat}, asking for
 * whatever precision the calculation needs.
 */
final class FxMath {

    /** Logger for the iterative algorithms. */
    static final Logger logger = LoggerFactory.getLogger(FxMath.class);

    /**
     * The largest magnitude (as a power of two) we will compute for an
     * exponential or power before declaring it an overflow, even in a
     * format with an unbounded integer part.
     */
    static final int MAX_MAGNITUDE_BITS = 1 << 20;

    /** Where {@code π} and {@code ln 2} come from (may be null). */
    private final FxFormat constants;

    /** Fraction bits of all values handled by this instance. */
    final int bits;

    /** The value 1 at this precision. */
    final BigInteger one;

    /**
     * Create a calculator for the given working precision.
     *
     * @param constants format whose cache supplies constants (null if
     *     the calculation needs none)
     * @param bits number of fraction bits in the working precision
     */
    FxMath(FxFormat constants, int bits) {
        this.constants = constants;
        this.bits = bits;
        this.one = ONE.shiftLeft(bits);
    }

    // Integer primitives ---------------------------------------------

    /**
     * Divide by <i>2<sup>n</sup></i>, rounding half away from zero.
     *
     * @param v to shift
     * @param n places to shift ({@code n >= 0})
     * @return rounded quotient
     */
    static BigInteger roundShiftRight(BigInteger v, int n) {
        if (n == 0) {
            return v;
        }
        BigInteger half = ONE.shiftLeft(n - 1);
        if (v.signum() >= 0) {
            return v.add(half).shiftRight(n);
        } else {
            return v.negate().add(half).shiftRight(n).negate();
        }
    }

    /**
     * Re-express a value scaled by <i>2<sup>from</sup></i> as one
     * scaled by <i>2<sup>to</sup></i>, exactly if {@code to >= from},
     * otherwise rounding half away from zero.
     *
     * @param v scaled value
     * @param from fraction bits of {@code v}
     * @param to fraction bits required
     * @return rescaled value
     */
    static BigInteger rescale(BigInteger v, int from, int to) {
        if (to >= from) {
            return v.shiftLeft(to - from);
        } else {
            return roundShiftRight(v, from - to);
        }
    }

    /**
     * Integer division rounding half away from zero.
     *
     * @param n dividend
     * @param d divisor (not zero)
     * @return {@code n/d} rounded to nearest
     */
    static BigInteger divideRound(BigInteger n, BigInteger d) {
        BigInteger[] qr = n.divideAndRemainder(d);
        BigInteger q = qr[0], r = qr[1];
        if (r.signum() != 0 && r.abs().shiftLeft(1).compareTo(d.abs()) >= 0) {
            // Remainder is at least half the divisor: move away from 0
            q = n.signum() == d.signum() ? q.add(ONE) : q.subtract(ONE);
        }
        return q;
    }

    /**
     * Floored remainder: the result has the sign of the divisor.
     *
     * @param n dividend
     * @param d divisor (not zero)
     * @return {@code n - d*floor(n/d)}
     */
    static BigInteger floorMod(BigInteger n, BigInteger d) {
        BigInteger r = n.remainder(d);
        if (r.signum() != 0 && r.signum() != d.signum()) {
            r = r.add(d);
        }
        return r;
    }

    /**
     * Integer square root rounded to nearest, by Newton-Raphson
     * iteration from an over-estimate derived from the bit length.
     * Iteration stops when the iterate no longer decreases, at which
     * point it is <i>floor(&radic;n)</i>.
     *
     * @param n non-negative integer
     * @return <i>&radic;n</i> rounded to nearest
     */
    static BigInteger isqrt(BigInteger n) {
        if (n.signum() == 0) {
            return ZERO;
        }
        BigInteger r = ONE.shiftLeft((n.bitLength() + 1) / 2);
        int steps = 0;
        while (true) {
            BigInteger next = r.add(n.divide(r)).shiftRight(1);
            steps += 1;
            if (next.compareTo(r) >= 0) {
                break;
            }
            r = next;
        }
        // r*r <= n < (r+1)*(r+1). Round up if n >= r*r + r + 1.
        if (n.subtract(r.multiply(r)).compareTo(r) > 0) {
            r = r.add(ONE);
        }
        logger.trace("isqrt of {}-bit value took {} steps",
                n.bitLength(), steps);
        return r;
    }

    // Arithmetic at working precision --------------------------------

    /**
     * @param a multiplicand
     * @param b multiplier
     * @return {@code a * b} rounded to working precision
     */
    BigInteger mul(BigInteger a, BigInteger b) {
        return roundShiftRight(a.multiply(b), bits);
    }

    /**
     * @param a dividend
     * @param b divisor (not zero)
     * @return {@code a / b} rounded to working precision
     */
    BigInteger div(BigInteger a, BigInteger b) {
        return divideRound(a.shiftLeft(bits), b);
    }

    /** @return <i>&pi;/2</i> at working precision */
    private BigInteger halfPi() {
        return roundShiftRight(constants.constant(FxConstant.PI, bits + 1),
                2);
    }

    /** @return <i>&pi;</i> at working precision */
    private BigInteger pi() {
        return constants.constant(FxConstant.PI, bits);
    }

    /**
     * {@code k} times <i>ln 2</i> at working precision, where the
     * constant is fetched with enough extra bits to absorb the
     * multiplication.
     */
    private BigInteger multipleOfLn2(long k) {
        if (k == 0) {
            return ZERO;
        }
        int extra = 64 - Long.numberOfLeadingZeros(Math.abs(k));
        BigInteger ln2 = constants.constant(FxConstant.LN2, bits + extra);
        return roundShiftRight(ln2.multiply(BigInteger.valueOf(k)), extra);
    }

    // Square root ----------------------------------------------------

    /**
     * @param x non-negative
     * @return <i>&radic;x</i>
     */
    BigInteger sqrt(BigInteger x) {
        // sqrt(x/2^b) * 2^b = sqrt(x * 2^b)
        return isqrt(x.shiftLeft(bits));
    }

    // Logarithms -----------------------------------------------------

    /**
     * Split positive {@code x} as <i>m 2<sup>k</sup></i> with
     * <i>&radic;&frac12; &le; m &le; &radic;2</i>, returning {@code k}
     * and writing the scaled {@code m} into {@code mantissa[0]}.
     */
    private int reduceToUnity(BigInteger x, BigInteger[] mantissa) {
        // First 1 <= m < 2
        int k = x.bitLength() - 1 - bits;
        // m > sqrt(2) iff x^2 > 2^(2(bits+k)+1)
        if (x.multiply(x).compareTo(ONE.shiftLeft(2 * (bits + k) + 1)) > 0) {
            k += 1;
        }
        mantissa[0] = k >= 0 ? roundShiftRight(x, k) : x.shiftLeft(-k);
        return k;
    }

    /**
     * Inverse hyperbolic tangent by its series, for small {@code z}.
     *
     * @param z argument (|z| well below 1)
     * @return <i>atanh(z) = z + z<sup>3</sup>/3 + z<sup>5</sup>/5 +
     *     &hellip;</i>
     */
    BigInteger atanh(BigInteger z) {
        BigInteger z2 = mul(z, z);
        BigInteger sum = ZERO, power = z;
        int terms = 0;
        for (long n = 1;; n += 2) {
            BigInteger term = power.divide(BigInteger.valueOf(n));
            if (term.signum() == 0) {
                break;
            }
            sum = sum.add(term);
            power = mul(power, z2);
            terms += 1;
        }
        logger.trace("atanh series: {} terms at {} bits", terms, bits);
        return sum;
    }

    /**
     * Natural logarithm of {@code m} close to one, as <i>2
     * atanh((m-1)/(m+1))</i>.
     */
    private BigInteger lnNearOne(BigInteger m) {
        BigInteger z = div(m.subtract(one), m.add(one));
        return atanh(z).shiftLeft(1);
    }

    /**
     * @param x positive
     * @return <i>ln x</i>
     */
    BigInteger ln(BigInteger x) {
        BigInteger[] m = new BigInteger[1];
        int k = reduceToUnity(x, m);
        return lnNearOne(m[0]).add(multipleOfLn2(k));
    }

    /**
     * Binary logarithm, exact when {@code x} is a power of two.
     *
     * @param x positive
     * @return <i>log<sub>2</sub> x</i>
     */
    BigInteger log2(BigInteger x) {
        BigInteger[] m = new BigInteger[1];
        int k = reduceToUnity(x, m);
        BigInteger frac = ZERO;
        if (!m[0].equals(one)) {
            BigInteger ln2 = constants.constant(FxConstant.LN2, bits);
            frac = div(lnNearOne(m[0]), ln2);
        }
        return BigInteger.valueOf(k).shiftLeft(bits).add(frac);
    }

    // Exponential ----------------------------------------------------

    /**
     * Taylor series of the exponential, for small {@code r}.
     *
     * @param r argument (|r| &lt; 1)
     * @return <i>e<sup>r</sup></i>
     */
    BigInteger expSeries(BigInteger r) {
        BigInteger sum = one, term = one;
        int terms = 0;
        for (long n = 1;; n++) {
            term = mul(term, r).divide(BigInteger.valueOf(n));
            if (term.signum() == 0) {
                break;
            }
            sum = sum.add(term);
            terms += 1;
        }
        logger.trace("exp series: {} terms at {} bits", terms, bits);
        return sum;
    }

    /**
     * Exponential by reduction modulo <i>ln 2</i>. The series is summed
     * with enough extra bits that the shift by the removed power of two
     * leaves the result accurate at working precision.
     *
     * @param x argument
     * @return <i>e<sup>x</sup></i>
     * @throws OverflowError if the result would exceed
     *     <i>2<sup>{@link #MAX_MAGNITUDE_BITS}</sup></i>
     */
    BigInteger exp(BigInteger x) throws OverflowError {
        BigInteger ln2 = constants.constant(FxConstant.LN2, bits);
        BigInteger bk = divideRound(x, ln2);

        if (bk.bitLength() > 31) {
            if (bk.signum() < 0) {
                return ZERO;
            }
            throw new OverflowError("exp() result too large");
        }

        int k = bk.intValue();
        if (k < -(bits + 2)) {
            // Result less than half the least significant bit.
            return ZERO;
        } else if (k > MAX_MAGNITUDE_BITS) {
            throw new OverflowError("exp() result too large");
        }

        int guard = 8 + (32 - Integer.numberOfLeadingZeros(Math.abs(k)));
        int q = bits + Math.max(k, 0) + guard;

        FxMath w = new FxMath(constants, q);
        BigInteger r = x.shiftLeft(q - bits).subtract(w.multipleOfLn2(k));
        BigInteger er = w.expSeries(r);

        // e^x = e^r * 2^k, and q - bits - k >= guard > 0
        return roundShiftRight(er, q - bits - k);
    }

    // Trigonometric functions ----------------------------------------

    /**
     * An angle reduced to <i>r + idx&pi;/2</i> with <i>|r| &le;
     * &pi;/4</i>, and the (extended precision) calculator in which
     * {@code r} is expressed.
     */
    private record Reduced(FxMath w, BigInteger r, int quadrant) {}

    /**
     * Reduce an angle first modulo <i>2&pi;</i> into <i>[-&pi;,
     * &pi;]</i>, then to the nearest multiple of <i>&pi;/2</i>. The
     * precision is increased by the bit length of the integer part of
     * the angle, so that the error in the multiple of &pi; removed does
     * not reach the working precision.
     */
    private Reduced reduceAngle(BigInteger x) {
        int intBits = Math.max(0, x.abs().bitLength() - bits);
        int q = bits + intBits + 8;
        FxMath w = new FxMath(constants, q);

        BigInteger a = x.shiftLeft(q - bits);
        BigInteger pi = w.pi();
        BigInteger twoPi = pi.shiftLeft(1);
        a = a.subtract(twoPi.multiply(divideRound(a, twoPi)));

        BigInteger halfPi = w.halfPi();
        int idx = divideRound(a, halfPi).intValue();
        BigInteger r = a.subtract(halfPi.multiply(BigInteger.valueOf(idx)));
        return new Reduced(w, r, Math.floorMod(idx, 4));
    }

    /** Sine series <i>r - r<sup>3</sup>/3! + &hellip;</i> */
    BigInteger sinSeries(BigInteger r) {
        return trigSeries(r, r, 1);
    }

    /** Cosine series <i>1 - r<sup>2</sup>/2! + &hellip;</i> */
    BigInteger cosSeries(BigInteger r) {
        return trigSeries(r, one, 0);
    }

    /**
     * The sine or cosine series, starting from the given first term of
     * index {@code n} (1 for sine, 0 for cosine).
     */
    private BigInteger trigSeries(BigInteger r, BigInteger term, long n) {
        BigInteger x2 = mul(r, r);
        BigInteger sum = ZERO;
        int terms = 0;
        while (term.signum() != 0) {
            sum = sum.add(term);
            term = mul(term, x2).divide(BigInteger.valueOf((n + 1) * (n + 2)))
                    .negate();
            n += 2;
            terms += 1;
        }
        logger.trace("trig series: {} terms at {} bits", terms, bits);
        return sum;
    }

    /**
     * @param x angle in radians
     * @return <i>sin x</i>
     */
    BigInteger sin(BigInteger x) {
        Reduced a = reduceAngle(x);
        FxMath w = a.w();
        BigInteger s = switch (a.quadrant()) {
            case 0 -> w.sinSeries(a.r());
            case 1 -> w.cosSeries(a.r());
            case 2 -> w.sinSeries(a.r()).negate();
            default -> w.cosSeries(a.r()).negate();
        };
        return rescale(s, w.bits, bits);
    }

    /**
     * @param x angle in radians
     * @return <i>cos x</i>
     */
    BigInteger cos(BigInteger x) {
        Reduced a = reduceAngle(x);
        FxMath w = a.w();
        BigInteger c = switch (a.quadrant()) {
            case 0 -> w.cosSeries(a.r());
            case 1 -> w.sinSeries(a.r()).negate();
            case 2 -> w.cosSeries(a.r()).negate();
            default -> w.sinSeries(a.r());
        };
        return rescale(c, w.bits, bits);
    }

    /**
     * Sine and cosine from one reduction of the angle.
     *
     * @param x angle in radians
     * @return <i>{sin x, cos x}</i>
     */
    BigInteger[] sinCos(BigInteger x) {
        Reduced a = reduceAngle(x);
        FxMath w = a.w();
        BigInteger s = w.sinSeries(a.r()), c = w.cosSeries(a.r());
        BigInteger[] sc = switch (a.quadrant()) {
            case 0 -> new BigInteger[] {s, c};
            case 1 -> new BigInteger[] {c, s.negate()};
            case 2 -> new BigInteger[] {s.negate(), c.negate()};
            default -> new BigInteger[] {c.negate(), s};
        };
        sc[0] = rescale(sc[0], w.bits, bits);
        sc[1] = rescale(sc[1], w.bits, bits);
        return sc;
    }

    // Inverse trigonometric functions --------------------------------

    /**
     * Arctangent series <i>x - x<sup>3</sup>/3 + x<sup>5</sup>/5 -
     * &hellip;</i> for small {@code x}.
     */
    BigInteger atanSeries(BigInteger x) {
        BigInteger x2 = mul(x, x);
        BigInteger sum = ZERO, power = x;
        int terms = 0;
        for (long n = 1;; n += 2) {
            BigInteger term = power.divide(BigInteger.valueOf(n));
            if (term.signum() == 0) {
                break;
            }
            sum = (n & 2) == 0 ? sum.add(term) : sum.subtract(term);
            power = mul(power, x2);
            terms += 1;
        }
        logger.trace("atan series: {} terms at {} bits", terms, bits);
        return sum;
    }

    /**
     * Arctangent of <i>1/k</i> by the series with exact reciprocals, as
     * used in Machin's formula.
     */
    BigInteger atanReciprocal(int k) {
        BigInteger bk = BigInteger.valueOf(k);
        BigInteger k2 = bk.multiply(bk);
        BigInteger sum = ZERO, power = one.divide(bk);
        for (long n = 1; power.signum() != 0; n += 2) {
            BigInteger term = power.divide(BigInteger.valueOf(n));
            sum = (n & 2) == 0 ? sum.add(term) : sum.subtract(term);
            power = power.divide(k2);
        }
        return sum;
    }

    /**
     * Arctangent, using the reciprocal identity for {@code |x| > 1} and
     * then the half-angle identity <i>atan x = 2 atan(x / (1 +
     * &radic;(1 + x<sup>2</sup>)))</i> until the series argument is at
     * most &#x215b;.
     *
     * @param x argument
     * @return <i>atan x</i> in <i>[-&pi;/2, &pi;/2]</i>
     */
    BigInteger atan(BigInteger x) {
        boolean negative = x.signum() < 0;
        BigInteger t = x.abs();

        boolean reciprocal = t.compareTo(one) > 0;
        if (reciprocal) {
            t = div(one, t);
        }

        BigInteger eighth = one.shiftRight(3);
        int doublings = 0;
        while (t.compareTo(eighth) > 0) {
            t = div(t, one.add(sqrt(one.add(mul(t, t)))));
            doublings += 1;
        }

        BigInteger a = atanSeries(t).shiftLeft(doublings);
        if (reciprocal) {
            a = halfPi().subtract(a);
        }
        return negative ? a.negate() : a;
    }

    /**
     * Arcsine series <i>x + (1/2)x<sup>3</sup>/3 + (1&middot;3/2&middot;4)
     * x<sup>5</sup>/5 + &hellip;</i> for <i>|x| &le; &frac12;</i>.
     */
    BigInteger asinSeries(BigInteger x) {
        BigInteger x2 = mul(x, x);
        BigInteger sum = ZERO, t = x;
        int terms = 0;
        for (long n = 0;; n++) {
            BigInteger term = t.divide(BigInteger.valueOf(2 * n + 1));
            if (term.signum() == 0) {
                break;
            }
            sum = sum.add(term);
            t = mul(t, x2).multiply(BigInteger.valueOf(2 * n + 1))
                    .divide(BigInteger.valueOf(2 * n + 2));
            terms += 1;
        }
        logger.trace("asin series: {} terms at {} bits", terms, bits);
        return sum;
    }

    /**
     * <i>&radic;((1 - t)/2)</i>, the sine of half the angle whose cosine
     * is {@code t}.
     */
    private BigInteger halfAngleSine(BigInteger t) {
        return sqrt(roundShiftRight(one.subtract(t), 1));
    }

    /**
     * Arcsine. Near the ends of the domain the series converges
     * slowly, so for <i>|x| &gt; &frac12;</i> we use <i>asin x = &pi;/2 -
     * 2 asin &radic;((1 - x)/2)</i>, derived from <i>cos 2&theta; = 1 - 2
     * sin<sup>2</sup>&theta;</i>.
     *
     * @param x argument in <i>[-1, 1]</i>
     * @return <i>asin x</i> in <i>[-&pi;/2, &pi;/2]</i>
     */
    BigInteger asin(BigInteger x) {
        boolean negative = x.signum() < 0;
        BigInteger t = x.abs();
        BigInteger a;
        if (t.compareTo(one.shiftRight(1)) <= 0) {
            a = asinSeries(t);
        } else {
            a = halfPi().subtract(asinSeries(halfAngleSine(t)).shiftLeft(1));
        }
        return negative ? a.negate() : a;
    }

    /**
     * Arccosine, by the same transformation as {@link #asin(BigInteger)}
     * near the ends of the domain.
     *
     * @param x argument in <i>[-1, 1]</i>
     * @return <i>acos x</i> in <i>[0, &pi;]</i>
     */
    BigInteger acos(BigInteger x) {
        BigInteger half = one.shiftRight(1);
        if (x.compareTo(half) > 0) {
            // acos x = 2 asin sqrt((1-x)/2)
            return asinSeries(halfAngleSine(x)).shiftLeft(1);
        } else if (x.compareTo(half.negate()) < 0) {
            // acos x = pi - acos(-x)
            BigInteger a = asinSeries(halfAngleSine(x.negate())).shiftLeft(1);
            return pi().subtract(a);
        } else {
            return halfPi().subtract(asinSeries(x));
        }
    }

    // Powers ---------------------------------------------------------

    /**
     * Integer power by repeated squaring. A negative exponent is
     * applied to the reciprocal of the base.
     *
     * @param b base (not zero if {@code n < 0})
     * @param n exponent
     * @return <i>b<sup>n</sup></i>
     */
    BigInteger pow(BigInteger b, long n) {
        BigInteger term = n < 0 ? div(one, b) : b;
        BigInteger result = one;
        // Unsigned, so that Long.MIN_VALUE means 2^63
        for (long e = Math.abs(n); e != 0;) {
            if ((e & 1) != 0) {
                result = mul(result, term);
            }
            e >>>= 1;
            if (e != 0) {
                term = mul(term, term);
            }
        }
        return result;
    }

    // Constants ------------------------------------------------------

    /**
     * Compute <i>&pi;</i> by Machin's formula <i>&pi; = 16 atan(1/5) -
     * 4 atan(1/239)</i>.
     *
     * @param bits of precision required
     * @return scaled <i>&pi;</i>
     */
    static BigInteger pi(int bits) {
        FxMath w = new FxMath(null, bits + 8);
        BigInteger a = w.atanReciprocal(5).shiftLeft(4)
                .subtract(w.atanReciprocal(239).shiftLeft(2));
        return roundShiftRight(a, 8);
    }

    /**
     * Compute <i>ln 2 = 2 atanh(1/3)</i>.
     *
     * @param bits of precision required
     * @return scaled <i>ln 2</i>
     */
    static BigInteger ln2(int bits) {
        FxMath w = new FxMath(null, bits + 8);
        BigInteger third = divideRound(w.one, BigInteger.valueOf(3));
        return roundShiftRight(w.atanh(third).shiftLeft(1), 8);
    }

    /**
     * Compute <i>e = &Sigma; 1/n!</i>.
     *
     * @param bits of precision required
     * @return scaled <i>e</i>
     */
    static BigInteger e(int bits) {
        FxMath w = new FxMath(null, bits + 8);
        return roundShiftRight(w.expSeries(w.one), 8);
    }
}
