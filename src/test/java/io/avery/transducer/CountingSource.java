package io.avery.transducer;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The integers from 1 to {@code size}, counting how many elements have been pulled across all iterations.
 */
final class CountingSource implements Iterable<Integer> {
    private final int size;
    private int pulled = 0;

    CountingSource(int size) {
        this.size = size;
    }

    int pulled() {
        return pulled;
    }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            int next = 1;

            @Override
            public boolean hasNext() {
                return next <= size;
            }

            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                pulled++;
                return next++;
            }
        };
    }
}
