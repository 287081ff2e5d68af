/**
 * The {@code fxp} package provides binary fixed-point arithmetic of
 * arbitrary precision, computed entirely with integers.
 * <p>
 * A client creates an {@link uk.co.farowl.fxp.FxFormat}, which fixes
 * the resolution (and optionally the range) of the numbers made from
 * it, then obtains {@link uk.co.farowl.fxp.FxNumber}s from the format
 * by conversion from integers, ratios, decimal text or {@code double}.
 * Numbers support the arithmetic operators, comparison, the elementary
 * functions and conversion to text in several radixes.
 * <p>
 * Errors are reported by the unchecked exceptions derived from
 * {@link uk.co.farowl.fxp.FxException}.
 */
package uk.co.farowl.fxp;
