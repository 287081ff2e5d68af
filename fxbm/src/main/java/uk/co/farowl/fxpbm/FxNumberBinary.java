package uk.co.farowl.fxpbm;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import uk.co.farowl.fxp.FxFormat;
import uk.co.farowl.fxp.FxNumber;

/**
 * This is a JMH benchmark for the binary arithmetic operations on
 * {@link FxNumber}, in a single format and in mixed formats.
 *
 * Comparison is with the time for the same operation in-line on
 * {@code double}, which is the cost we are trying to approach.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class FxNumberBinary {

    static final FxFormat F = FxFormat.of(64);
    static final FxFormat G = FxFormat.of(16, 16);

    double v = 42.24, w = 1.1;
    FxNumber vx = F.fromDouble(v), wx = F.fromDouble(w);
    FxNumber wg = G.fromDouble(w);

    @Benchmark
    public void add_double(Blackhole bh) { bh.consume(v + w); }

    @Benchmark
    public void add(Blackhole bh) { bh.consume(vx.add(wx)); }

    @Benchmark
    public void add_mixed(Blackhole bh) { bh.consume(vx.add(wg)); }

    @Benchmark
    public void add_long(Blackhole bh) { bh.consume(vx.add(3)); }

    @Benchmark
    public void mul_double(Blackhole bh) { bh.consume(v * w); }

    @Benchmark
    public void mul(Blackhole bh) { bh.consume(vx.multiply(wx)); }

    @Benchmark
    public void mul_mixed(Blackhole bh) { bh.consume(vx.multiply(wg)); }

    @Benchmark
    public void div_double(Blackhole bh) { bh.consume(v / w); }

    @Benchmark
    public void div(Blackhole bh) { bh.consume(vx.divide(wx)); }

    @Benchmark
    public void mod(Blackhole bh) { bh.consume(vx.mod(wx)); }

    @Benchmark
    public void compare(Blackhole bh) { bh.consume(vx.compareTo(wg)); }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) {
        FxNumber v = F.fromDouble(42.24);
        FxNumber w = G.fromDouble(1.1);
        System.out.println(v.multiply(w));
    }
}
