package com.workpipe.engine;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO with a one-shot close. Callers should hold it through
 * {@link QueueSink} or {@link QueueSource} so each stage only sees its own end.
 */
public class WorkQueue<T> implements QueueSink<T>, QueueSource<T> {
    private final String name;
    private final int capacity;
    private final ArrayDeque<T> items;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private final List<Signal> watchers = new CopyOnWriteArrayList<>();

    private boolean closed = false;
    private int unfinished = 0;

    public WorkQueue(String name, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.name = name;
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    @Override
    public boolean offer(T item) {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            if (closed) throw new IllegalStateException(name + " is closed");
            if (items.size() >= capacity) return false;
            enqueue(item);
        } finally {
            lock.unlock();
        }
        ring();
        return true;
    }

    @Override
    public void put(T item) throws InterruptedException {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            while (!closed && items.size() >= capacity) notFull.await();
            if (closed) throw new IllegalStateException(name + " is closed");
            enqueue(item);
        } finally {
            lock.unlock();
        }
        ring();
    }

    private void enqueue(T item) {
        items.addLast(item);
        unfinished++;
        notEmpty.signal();
    }

    @Override
    public T take() throws InterruptedException {
        T item;
        lock.lock();
        try {
            while (!closed && items.isEmpty()) notEmpty.await();
            if (items.isEmpty()) return null;
            item = dequeue();
        } finally {
            lock.unlock();
        }
        ring();
        return item;
    }

    @Override
    public T poll() {
        T item;
        lock.lock();
        try {
            if (items.isEmpty()) return null;
            item = dequeue();
        } finally {
            lock.unlock();
        }
        ring();
        return item;
    }

    private T dequeue() {
        T item = items.pollFirst();
        notFull.signal();
        return item;
    }

    @Override
    public void markDone() {
        lock.lock();
        try {
            if (unfinished == 0) throw new IllegalStateException("markDone called more times than items on " + name);
            unfinished--;
        } finally {
            lock.unlock();
        }
        ring();
    }

    @Override
    public int unfinished() {
        lock.lock();
        try {
            return unfinished;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        ring();
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void watch(Signal signal) {
        watchers.add(signal);
    }

    // outside the queue lock, so a watcher never waits on us while we wait on it
    private void ring() {
        for (Signal s : watchers) {
            s.ring();
        }
    }

    @Override
    public String toString() {
        return name + "[" + size() + "/" + capacity + "]";
    }
}
