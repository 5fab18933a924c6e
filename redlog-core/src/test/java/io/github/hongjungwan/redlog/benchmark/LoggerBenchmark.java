package io.github.hongjungwan.redlog.benchmark;

import io.github.hongjungwan.redlog.api.Logger;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.theme.Themes;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;
import io.github.hongjungwan.redlog.spi.ColorSupport;
import io.github.hongjungwan.redlog.spi.Sink;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmark for the logger hot path
 *
 * Filtered calls should cost a volatile read and a comparison.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class LoggerBenchmark {

    private LogRegistry registry;
    private Logger logger;
    private BlackholeSink sink;

    @Setup(Level.Trial)
    public void setup(Blackhole blackhole) {
        registry = new LogRegistry(ColorSupport.NEVER);
        sink = new BlackholeSink(blackhole);
        registry.setSink(sink);
        registry.setTheme(Themes.PLAIN);
        registry.setLevel(io.github.hongjungwan.redlog.api.Level.INFO);

        logger = registry.getLogger("bench").withName("db").withField("host", "db1").withField("pool", 16);
    }

    @Benchmark
    public void filteredLog() {
        logger.debug("not written", Field.of("retry", 3));
    }

    @Benchmark
    public void filteredPrintf() {
        logger.debugf("not written %d", 3);
    }

    @Benchmark
    public void enabledLog() {
        logger.info("conn failed", Field.of("retry", 3));
    }

    @Benchmark
    public void enabledPrintf() {
        logger.infof("pool %s size %d", "main", 16);
    }

    @Benchmark
    public Logger deriveField() {
        return logger.withField("request", "r-1");
    }

    static class BlackholeSink implements Sink {
        private final Blackhole blackhole;

        BlackholeSink(Blackhole blackhole) {
            this.blackhole = blackhole;
        }

        @Override
        public void write(String line) {
            blackhole.consume(line);
        }

        @Override
        public void flush() {
            // No-op
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(LoggerBenchmark.class.getSimpleName())
                .warmupIterations(3)
                .measurementIterations(5)
                .forks(1)
                .build();

        new Runner(opt).run();
    }
}
