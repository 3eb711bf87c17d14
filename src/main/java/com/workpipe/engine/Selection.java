package com.workpipe.engine;

/** Result of one {@link EventSelector#select()} call. */
public final class Selection<T> {
    public enum Kind {
        /** An item was taken from {@link #source}. */
        ITEM,
        /** {@link #source} is closed and drained; it will not be selected again. */
        CLOSED,
        /** A watched queue changed but no source had an event ready. */
        QUIET,
        /** The idle window elapsed with no queue activity at all. */
        IDLE
    }

    public final Kind kind;
    public final QueueSource<T> source;
    public final T item;

    private Selection(Kind kind, QueueSource<T> source, T item) {
        this.kind = kind;
        this.source = source;
        this.item = item;
    }

    static <T> Selection<T> item(QueueSource<T> source, T item) {
        return new Selection<>(Kind.ITEM, source, item);
    }

    static <T> Selection<T> closed(QueueSource<T> source) {
        return new Selection<>(Kind.CLOSED, source, null);
    }

    static <T> Selection<T> quiet() {
        return new Selection<>(Kind.QUIET, null, null);
    }

    static <T> Selection<T> idle() {
        return new Selection<>(Kind.IDLE, null, null);
    }

    public boolean from(QueueSource<T> queue) {
        return source == queue;
    }

    @Override
    public String toString() {
        return source == null ? kind.name() : kind + "(" + source.name() + ")";
    }
}
