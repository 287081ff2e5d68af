package uk.co.farowl.fxpbm;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import uk.co.farowl.fxp.FxFormat;
import uk.co.farowl.fxp.FxNumber;

/**
 * This is a JMH benchmark for the elementary functions of
 * {@link FxNumber}, at a range of resolutions, so that we may see how
 * the cost grows with the number of fraction bits.
 *
 * Each trial uses a fresh format, and so the first call in it pays for
 * the constants it needs. Over the many calls of a trial, that cost
 * disappears into the average.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class FxNumberFunctions {

    @Param({"32", "64", "128", "256"})
    int fractionBits;

    FxNumber x, y, half;

    @Setup
    public void setup() {
        FxFormat f = FxFormat.of(fractionBits);
        x = f.fromString("1.7");
        y = f.fromString("2.3");
        half = f.fromString("0.5");
    }

    @Benchmark
    public void sqrt(Blackhole bh) { bh.consume(x.sqrt()); }

    @Benchmark
    public void ln(Blackhole bh) { bh.consume(x.ln()); }

    @Benchmark
    public void exp(Blackhole bh) { bh.consume(x.exp()); }

    @Benchmark
    public void sin(Blackhole bh) { bh.consume(x.sin()); }

    @Benchmark
    public void sinCos(Blackhole bh) { bh.consume(x.sinCos()); }

    @Benchmark
    public void atan(Blackhole bh) { bh.consume(x.atan()); }

    @Benchmark
    public void asin(Blackhole bh) { bh.consume(half.asin()); }

    @Benchmark
    public void pow_int(Blackhole bh) { bh.consume(x.pow(7)); }

    @Benchmark
    public void pow(Blackhole bh) { bh.consume(x.pow(y)); }

    @Benchmark
    public void text(Blackhole bh) { bh.consume(x.toDecimalString()); }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) {
        FxFormat f = FxFormat.of(128);
        FxNumber x = f.fromString("1.7");
        System.out.println(x.pow(f.fromString("2.3")));
        System.out.println(x.sinCos());
    }
}
