// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This test requests constants from the cache of one format
 * concurrently from many threads, at a spread of precisions, so that
 * reads of the cache race with its upgrade.
 * <p>
 * As in other concurrency tests, the intense processing takes place
 * during the static initialisation method (annotated
 * &#64;{@link BeforeAll}), during which we collect the results and any
 * exceptions. The individual JUnit tests are predicates on what was
 * collected.
 */
@DisplayName("During concurrent use of a constant cache ...")
class ConstantCacheConcurrencyTest {

    /** Logger for the tests. */
    static final Logger logger =
            LoggerFactory.getLogger(ConstantCacheConcurrencyTest.class);

    /** Threads racing for the cache. */
    static final int THREADS = 16;

    /** Precision requested by thread {@code i}. */
    static int bitsFor(int i) { return 40 + 17 * i; }

    /** The format whose cache is shared. */
    static final FxFormat FORMAT = FxFormat.of(32);

    /** Result of one thread. */
    record Result(int bits, BigInteger pi, BigInteger ln2) {}

    static final List<Result> results =
            Collections.synchronizedList(new ArrayList<>());

    static final List<Throwable> errors =
            Collections.synchronizedList(new ArrayList<>());

    @BeforeAll
    static void race() throws InterruptedException {
        CyclicBarrier barrier = new CyclicBarrier(THREADS);
        List<Thread> threads = new ArrayList<>();

        for (int i = 0; i < THREADS; i++) {
            int bits = bitsFor(i);
            Thread t = new Thread(() -> {
                try {
                    barrier.await();
                    BigInteger pi = FORMAT.constant(FxConstant.PI, bits);
                    BigInteger ln2 = FORMAT.constant(FxConstant.LN2, bits);
                    results.add(new Result(bits, pi, ln2));
                } catch (Throwable e) {
                    errors.add(e);
                }
            });
            threads.add(t);
            t.start();
        }

        for (Thread t : threads) { t.join(); }
        logger.info("{} results and {} errors from {} threads",
                results.size(), errors.size(), THREADS);
    }

    @Test
    @DisplayName("no thread raises an exception")
    void noErrors() {
        assertTrue(errors.isEmpty(), () -> errors.toString());
        assertEquals(THREADS, results.size());
    }

    @Test
    @DisplayName("every value is correct at its precision")
    void valuesCorrect() {
        for (Result r : results) {
            assertWithinOne(FxMath.pi(r.bits() + 8), r.bits(), r.pi());
            assertWithinOne(FxMath.ln2(r.bits() + 8), r.bits(), r.ln2());
        }
    }

    @Test
    @DisplayName("the cache holds the greatest precision requested")
    void cacheUpgraded() {
        int max = bitsFor(THREADS - 1);
        assertEquals(max, FORMAT.cachedPrecision(FxConstant.PI));
        assertEquals(max, FORMAT.cachedPrecision(FxConstant.LN2));
    }

    /**
     * Assert a value differs by at most one unit from a reference
     * computed to 8 more bits.
     */
    private static void assertWithinOne(BigInteger reference, int bits,
            BigInteger actual) {
        BigInteger expected = FxMath.roundShiftRight(reference, 8);
        BigInteger diff = actual.subtract(expected).abs();
        assertTrue(diff.compareTo(BigInteger.ONE) <= 0,
                () -> String.format("at %d bits, %s differs from %s", bits,
                        actual, expected));
    }
}
