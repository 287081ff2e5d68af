// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static java.math.BigInteger.ONE;
import static java.math.BigInteger.TEN;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion of fixed-point values to and from text. Parsing produces
 * an exact rational, which the caller rounds into a format, and
 * rendering works on the scaled integer of a number.
 */
class FxText {

    private FxText() {} // no instances

    /** Exponents beyond this in decimal input are rejected. */
    static final int MAX_EXPONENT = 100_000;

    /** <i>log<sub>10</sub>2</i> to more precision than a double has. */
    private static final double LOG10_2 = 0.30102999566398120;

    /** Sign, integer digits, fraction digits, exponent. */
    private static final Pattern DECIMAL = Pattern
            .compile("\\s*([+-])?(\\d*)(?:\\.(\\d*))?(?:[eE]([+-]?\\d+))?\\s*");

    /** The format description and the scaled value. */
    private static final Pattern REPR = Pattern.compile(
            "\\s*FxNumber\\(\\s*(FxFormat\\([^)]*\\))\\s*,\\s*([+-]?\\d+)\\s*\\)\\s*");

    /**
     * Parse decimal text to an exact ratio.
     *
     * @param text to parse
     * @return numerator and (positive) denominator
     * @throws ValueError if the text is malformed
     */
    static BigInteger[] parseDecimal(String text) throws ValueError {
        Matcher m = DECIMAL.matcher(text);
        if (!m.matches()) {
            throw new ValueError("invalid literal for fixed point: '%s'",
                    text);
        }

        String intPart = m.group(2);
        String fracPart = m.group(3) == null ? "" : m.group(3);
        if (intPart.isEmpty() && fracPart.isEmpty()) {
            throw new ValueError("invalid literal for fixed point: '%s'",
                    text);
        }

        int exponent = 0;
        if (m.group(4) != null) {
            try {
                exponent = Integer.parseInt(m.group(4));
            } catch (NumberFormatException e) {
                throw new ValueError(e, "exponent out of range in '%s'",
                        text);
            }
            if (Math.abs(exponent) > MAX_EXPONENT) {
                throw new ValueError("exponent out of range in '%s'", text);
            }
        }

        BigInteger num = new BigInteger(intPart + fracPart);
        if ("-".equals(m.group(1))) {
            num = num.negate();
        }

        // Value is num * 10^(exponent - fracPart.length())
        int e = exponent - fracPart.length();
        if (e >= 0) {
            return new BigInteger[] {num.multiply(TEN.pow(e)), ONE};
        } else {
            return new BigInteger[] {num, TEN.pow(-e)};
        }
    }

    /**
     * The number of decimal places that distinguishes all values of the
     * given resolution.
     *
     * @param fractionBits of the format
     * @return <i>&#x2308;fractionBits log<sub>10</sub>2&#x2309;</i>
     */
    static int defaultPlaces(int fractionBits) {
        return (int)Math.ceil(fractionBits * LOG10_2);
    }

    /**
     * Render a scaled value in decimal to a given number of places,
     * rounding half away from zero.
     *
     * @param scaled value
     * @param fractionBits of the scaled value
     * @param places after the decimal point
     * @return the decimal text
     */
    static String toDecimal(BigInteger scaled, int fractionBits,
            int places) {
        BigInteger q = FxMath.divideRound(scaled.abs().multiply(TEN.pow(places)),
                ONE.shiftLeft(fractionBits));
        String digits = padLeft(q.toString(), places + 1);
        StringBuilder sb = new StringBuilder(digits.length() + 2);
        if (scaled.signum() < 0 && q.signum() != 0) {
            sb.append('-');
        }
        int point = digits.length() - places;
        sb.append(digits, 0, point);
        if (places > 0) {
            sb.append('.').append(digits, point, digits.length());
        }
        return sb.toString();
    }

    /**
     * Render a scaled value in decimal to the default number of places,
     * then remove trailing zeros (and the point if nothing remains
     * after it).
     *
     * @param scaled value
     * @param fractionBits of the scaled value
     * @return the shortest sufficient decimal text
     */
    static String toDecimal(BigInteger scaled, int fractionBits) {
        String s = toDecimal(scaled, fractionBits, defaultPlaces(fractionBits));
        if (s.indexOf('.') < 0) {
            return s;
        }
        int end = s.length();
        while (s.charAt(end - 1) == '0') {
            end--;
        }
        if (s.charAt(end - 1) == '.') {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Render a number in a power-of-two radix with the point placed
     * among the digits. The fraction is padded with zeros to whole
     * digits. In two's complement, the integer part is as wide as a
     * bounded format allows (or just wide enough to hold the sign of an
     * unbounded one), rounded up to whole digits.
     *
     * @param format of the number
     * @param scaled value of the number
     * @param bitsPerDigit 1, 3 or 4
     * @param twosComplement whether to render in two's complement
     * @return the text
     */
    static String toRadix(FxFormat format, BigInteger scaled,
            int bitsPerDigit, boolean twosComplement) {
        int f = format.getFractionBits();
        int k = bitsPerDigit;
        int fracDigits = (f + k - 1) / k;
        int pad = fracDigits * k - f;
        StringBuilder sb = new StringBuilder();
        String digits;

        if (twosComplement) {
            int width = format.isBounded() ? format.getTotalBits()
                    : Math.max(scaled.bitLength() + 1, f + 1);
            int intDigits = Math.max(1, (width - f + k - 1) / k);
            int totalDigits = intDigits + fracDigits;
            BigInteger v = scaled.shiftLeft(pad)
                    .mod(ONE.shiftLeft(totalDigits * k));
            digits = padLeft(v.toString(1 << k), totalDigits);
        } else {
            if (scaled.signum() < 0) {
                sb.append('-');
            }
            BigInteger v = scaled.abs().shiftLeft(pad);
            digits = padLeft(v.toString(1 << k), fracDigits + 1);
        }

        int point = digits.length() - fracDigits;
        sb.append(digits, 0, point);
        if (fracDigits > 0) {
            sb.append('.').append(digits, point, digits.length());
        }
        return sb.toString();
    }

    /**
     * The canonical representation of a number.
     *
     * @param format of the number
     * @param scaled value of the number
     * @return text from which {@link #fromRepr(String)} recovers it
     */
    static String toRepr(FxFormat format, BigInteger scaled) {
        return String.format("FxNumber(%s, %s)", format, scaled);
    }

    /**
     * Reconstruct a number from its canonical representation.
     *
     * @param text produced by {@link #toRepr(FxFormat, BigInteger)}
     * @return equivalent number in an equivalent (new) format
     * @throws ValueError if the text is malformed
     * @throws OverflowError if the value is out of range for the format
     */
    static FxNumber fromRepr(String text) throws ValueError, OverflowError {
        Matcher m = REPR.matcher(text);
        if (!m.matches()) {
            throw new ValueError("invalid fixed-point representation: '%s'",
                    text);
        }
        FxFormat format = FxFormat.parse(m.group(1));
        return format.fromScaled(new BigInteger(m.group(2)));
    }

    /** Pad with zeros on the left to at least the given width. */
    private static String padLeft(String digits, int width) {
        int n = width - digits.length();
        return n > 0 ? "0".repeat(n) + digits : digits;
    }
}
