package io.layoffs.source;

import io.layoffs.core.Record;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourcesTest {
    @Test
    void drain_numbers_list_items_from_zero() {
        ListSource<String> source = new ListSource<>(List.of("a", "b", "c"));
        List<Record<String>> out = Sources.drain(source);

        assertEquals(List.of(Record.of(0, "a"), Record.of(1, "b"), Record.of(2, "c")), out);
        assertTrue(source.isFinished());
        assertTrue(source.poll().isEmpty());
    }
}
