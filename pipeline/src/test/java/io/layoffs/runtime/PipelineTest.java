package io.layoffs.runtime;

import com.codahale.metrics.MetricRegistry;
import io.layoffs.core.Record;
import io.layoffs.core.Transform;
import io.layoffs.error.CollectingDeadLetterSink;
import io.layoffs.retry.ExponentialBackoffRetryPolicy;
import io.layoffs.sink.CollectingSink;
import io.layoffs.source.ListSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineTest {
    private Pipeline<?, ?> pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.close();
    }

    private static List<Integer> range(int n) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(i);
        return out;
    }

    @Test
    void preserves_order_with_parallel_transform() throws Exception {
        // later records finish first
        Transform<Integer, Integer> slowFirst = r -> {
            Thread.sleep(Math.max(0, 20 - r.payload()));
            return List.of(new Record<>(r.seq(), 0, r.payload() * 2));
        };
        CollectingSink<Integer> sink = new CollectingSink<>();
        Pipeline<Integer, Integer> p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(30)))
                .transform(slowFirst)
                .sink(sink)
                .workers(8)
                .backpressure(4, 16)
                .sinkBatching(5, 100)
                .metrics(new MetricRegistry())
                .build();
        pipeline = p;
        p.start();
        assertTrue(p.awaitCompletion(10, TimeUnit.SECONDS), "pipeline completed");

        List<Record<Integer>> out = sink.records();
        assertEquals(30, out.size());
        assertEquals(30, p.delivered());
        for (int i = 0; i < out.size(); i++) {
            assertEquals(i, out.get(i).seq());
            assertEquals(i * 2, out.get(i).payload());
        }
    }

    @Test
    void fan_out_is_delivered_in_sub_seq_order() throws Exception {
        Transform<Integer, String> split = r -> List.of(
                new Record<>(r.seq(), 1, r.payload() + "b"),
                new Record<>(r.seq(), 0, r.payload() + "a"));
        CollectingSink<String> sink = new CollectingSink<>();
        Pipeline<Integer, String> p = new PipelineBuilder<Integer, String>()
                .source(new ListSource<>(range(3)))
                .transform(split)
                .sink(sink)
                .workers(2)
                .build();
        pipeline = p;
        p.start();
        assertTrue(p.awaitCompletion(10, TimeUnit.SECONDS));

        List<String> payloads = sink.records().stream().map(Record::payload).toList();
        assertEquals(List.of("0a", "0b", "1a", "1b", "2a", "2b"), payloads);
    }

    @Test
    void transform_retries_then_succeeds() throws Exception {
        Map<Long, Integer> attempts = new ConcurrentHashMap<>();
        Transform<Integer, Integer> flaky = r -> {
            if (attempts.merge(r.seq(), 1, Integer::sum) == 1) throw new IOException("transient");
            return List.of(new Record<>(r.seq(), 0, r.payload()));
        };
        MetricRegistry registry = new MetricRegistry();
        CollectingSink<Integer> sink = new CollectingSink<>();
        Pipeline<Integer, Integer> p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(4)))
                .transform(flaky)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 10))
                .workers(2)
                .metrics(registry)
                .build();
        pipeline = p;
        p.start();
        assertTrue(p.awaitCompletion(10, TimeUnit.SECONDS));

        assertEquals(range(4), sink.records().stream().map(Record::payload).toList());
        assertEquals(4, registry.meter("pipeline.error.rate").getCount());
        assertEquals(4, registry.meter("pipeline.output.rate").getCount());
    }

    @Test
    void exhausted_record_goes_to_dead_letters_and_the_rest_still_flows() throws Exception {
        Transform<Integer, Integer> failsOnTwo = r -> {
            if (r.payload() == 2) throw new IllegalStateException("bad row");
            return List.of(new Record<>(r.seq(), 0, r.payload()));
        };
        CollectingSink<Integer> sink = new CollectingSink<>();
        CollectingDeadLetterSink<Integer> dlq = new CollectingDeadLetterSink<>();
        Pipeline<Integer, Integer> p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(5)))
                .transform(failsOnTwo)
                .sink(sink)
                .retry(new ExponentialBackoffRetryPolicy(3, 1, 10))
                .workers(3)
                .deadLetters(dlq, null)
                .build();
        pipeline = p;
        p.start();
        assertTrue(p.awaitCompletion(10, TimeUnit.SECONDS));

        assertEquals(List.of(0, 1, 3, 4), sink.records().stream().map(Record::payload).toList());
        assertEquals(1, dlq.failures().size());
        assertEquals(2L, dlq.failures().get(0).record().seq());
        assertEquals(5, p.delivered(), "the failed seq still counts as passed");
        assertEquals("transform", dlq.failures().get(0).stage());
    }

    @Test
    void sink_failure_is_reported_as_dead_letter() throws Exception {
        CollectingDeadLetterSink<Integer> dlq = new CollectingDeadLetterSink<>();
        Pipeline<Integer, Integer> p = new PipelineBuilder<Integer, Integer>()
                .source(new ListSource<>(range(2)))
                .transform(r -> List.of(r))
                .sink(r -> { throw new IOException("disk full"); })
                .workers(1)
                .sinkBatching(1, 100)
                .deadLetters(null, dlq)
                .build();
        pipeline = p;
        p.start();
        assertTrue(p.awaitCompletion(10, TimeUnit.SECONDS));

        assertEquals(2, dlq.failures().size());
        assertEquals("sink", dlq.failures().get(0).stage());
    }
}
