package com.zzf.gazer.stream;

import com.zzf.gazer.model.Chunk;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered, unbounded, single-consumer queue of chunks fed by one producer task.
 * Iteration ends when the producer finishes; {@link #close()} tells the producer to stop and release its connection.
 */
@Slf4j
public class ChunkStream implements Iterable<Chunk>, AutoCloseable {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Runnable cancelHook;
    private boolean consumedEnd;

    void push(Chunk chunk) {
        if (!finished.get()) {
            queue.add(chunk);
        }
    }

    void finish() {
        if (finished.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    void onCancel(Runnable hook) {
        this.cancelHook = hook;
        if (cancelled.get()) {
            hook.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Blocks for the next chunk; {@code null} once the stream has ended.
     */
    public Chunk next() throws InterruptedException {
        if (consumedEnd) {
            return null;
        }
        Object item = queue.take();
        return unwrap(item);
    }

    /**
     * Like {@link #next()} but gives up after the timeout, returning {@code null}. Use {@link #isDrained()} to tell the two apart.
     */
    public Chunk poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (consumedEnd) {
            return null;
        }
        Object item = queue.poll(timeout, unit);
        return item == null ? null : unwrap(item);
    }

    public boolean isDrained() {
        return consumedEnd;
    }

    private Chunk unwrap(Object item) {
        if (item == END) {
            consumedEnd = true;
            return null;
        }
        return (Chunk) item;
    }

    @Override
    public Iterator<Chunk> iterator() {
        return new Iterator<>() {
            private Chunk nextChunk;

            @Override
            public boolean hasNext() {
                if (nextChunk != null) {
                    return true;
                }
                try {
                    nextChunk = ChunkStream.this.next();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    close();
                    return false;
                }
                return nextChunk != null;
            }

            @Override
            public Chunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Chunk out = nextChunk;
                nextChunk = null;
                return out;
            }
        };
    }

    /**
     * Abandons the stream. Safe to call more than once and after the stream ended.
     */
    @Override
    public void close() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        Runnable hook = cancelHook;
        if (hook != null && !finished.get()) {
            log.debug("chunk stream cancelled by consumer");
            hook.run();
        }
    }
}
