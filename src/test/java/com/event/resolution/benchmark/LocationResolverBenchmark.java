package com.event.resolution.benchmark;

import com.event.resolution.cache.CacheConfig;
import com.event.resolution.core.model.LocationEntry;
import com.event.resolution.core.model.LocationQuery;
import com.event.resolution.location.LocationIndex;
import com.event.resolution.location.LocationResolver;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for venue resolution: exact key hits, the scored candidate scan, and
 * repeated lookups served from the cache, at different registry sizes.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class LocationResolverBenchmark {

    @Param({"500", "2000", "8000"})
    private int locationCount;

    private LocationResolver uncached;
    private LocationResolver cached;
    private int queryCounter;

    @Setup(Level.Trial)
    public void setUp() {
        List<LocationEntry> entries = new ArrayList<>(locationCount);
        for (int i = 0; i < locationCount; i++) {
            entries.add(LocationEntry.of("Gallery " + i + " Annex", 40.7 + i * 1e-5, -74.0 + i * 1e-5,
                    "The Gallery " + i + " Annex NYC"));
        }
        LocationIndex index = LocationIndex.build(entries);

        uncached = LocationResolver.builder(index).build();
        cached = LocationResolver.builder(index).cache(CacheConfig.defaults().createCache()).build();
        queryCounter = 0;
    }

    /**
     * Exact key hit on the location text.
     */
    @Benchmark
    public void exactLocation(Blackhole bh) {
        int idx = queryCounter++ % locationCount;
        bh.consume(uncached.resolve(LocationQuery.of("Gallery " + idx + " Annex", "")));
    }

    /**
     * Misspelled venue that falls through to the scored scan over every key.
     */
    @Benchmark
    public void scoredScan(Blackhole bh) {
        int idx = queryCounter++ % locationCount;
        bh.consume(uncached.resolve(new LocationQuery("At Galery " + idx + " Annex", "Upstairs", "", "Opening")));
    }

    /**
     * The same misspelled venues, repeated so most lookups hit the cache.
     */
    @Benchmark
    public void scoredScanCached(Blackhole bh) {
        int idx = queryCounter++ % 50;
        bh.consume(cached.resolve(new LocationQuery("At Galery " + idx + " Annex", "Upstairs", "", "Opening")));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(LocationResolverBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
