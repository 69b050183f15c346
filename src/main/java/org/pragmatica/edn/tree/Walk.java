package org.pragmatica.edn.tree;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite sequence of cursors.
 *
 * <p>A walk is restartable: every {@link #iterator()} or {@link #stream()} call starts again from
 * the origin cursor, so a walk can be consumed any number of times.
 */
public final class Walk implements Iterable<Cursor> {
    private final Supplier<Iterator<Cursor>> source;

    private Walk(Supplier<Iterator<Cursor>> source) {
        this.source = source;
    }

    /**
     * The origin followed by every cursor obtained by repeatedly applying {@code step},
     * until {@code step} yields nothing.
     */
    public static Walk iterate(Cursor origin, Function<Cursor, Optional<Cursor>> step) {
        return new Walk(() -> new StepIterator(origin, step));
    }

    @Override
    public Iterator<Cursor> iterator() {
        return source.get();
    }

    public Stream<Cursor> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public Walk filter(Predicate<Cursor> predicate) {
        return new Walk(() -> stream().filter(predicate)
                                      .iterator());
    }

    public Walk skip(long count) {
        return new Walk(() -> stream().skip(count)
                                      .iterator());
    }

    public Optional<Cursor> first() {
        return stream().findFirst();
    }

    public Optional<Cursor> find(Predicate<Cursor> predicate) {
        return stream().filter(predicate)
                       .findFirst();
    }

    private static final class StepIterator implements Iterator<Cursor> {
        private final Function<Cursor, Optional<Cursor>> step;
        private Optional<Cursor> next;

        private StepIterator(Cursor origin, Function<Cursor, Optional<Cursor>> step) {
            this.step = step;
            this.next = Optional.of(origin);
        }

        @Override
        public boolean hasNext() {
            return next.isPresent();
        }

        @Override
        public Cursor next() {
            var current = next.orElseThrow(NoSuchElementException::new);
            next = step.apply(current);
            return current;
        }
    }
}
