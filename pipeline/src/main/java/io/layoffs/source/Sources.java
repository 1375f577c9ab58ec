package io.layoffs.source;

import io.layoffs.core.Record;
import io.layoffs.core.Source;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class Sources {
    private Sources() {}

    /**
     * Reads a finite source to the end. Only meant for sources that never report "temporarily empty"
     * before they finish, such as file or list backed ones.
     */
    public static <T> List<Record<T>> drain(Source<T> source) {
        List<Record<T>> out = new ArrayList<>();
        while (!source.isFinished()) {
            Optional<Record<T>> next = source.poll();
            if (next.isEmpty()) {
                if (source.isFinished()) break;
                Thread.onSpinWait();
                continue;
            }
            out.add(next.get());
        }
        return out;
    }
}
