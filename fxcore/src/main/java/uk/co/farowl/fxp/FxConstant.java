// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import java.math.BigInteger;

/**
 * The mathematical constants held in the cache of each
 * {@link FxFormat}. Each knows how to compute itself, as a scaled
 * integer, to a given number of fraction bits. None of these
 * computations consults a cache.
 */
public enum FxConstant {

    /** The ratio of circumference to diameter, &pi;. */
    PI {
        @Override
        BigInteger compute(int bits) { return FxMath.pi(bits); }
    },

    /** The natural logarithm of two. */
    LN2 {
        @Override
        BigInteger compute(int bits) { return FxMath.ln2(bits); }
    },

    /** The base of natural logarithms, e. */
    E {
        @Override
        BigInteger compute(int bits) { return FxMath.e(bits); }
    };

    /**
     * Compute the constant afresh.
     *
     * @param bits number of fraction bits
     * @return value scaled by <i>2<sup>bits</sup></i>
     */
    abstract BigInteger compute(int bits);
}
