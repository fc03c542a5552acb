package com.zzf.gazer.stream;

import com.zzf.gazer.model.Chunk;
import com.zzf.gazer.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChunkStreamTest {

    @Test
    public void testIterationPreservesOrderAndEnds() {
        ChunkStream stream = new ChunkStream();
        stream.push(Chunk.builder().content("a").build());
        stream.push(Chunk.builder().content("b").build());
        stream.finish();

        List<String> seen = new ArrayList<>();
        for (Chunk chunk : stream) {
            seen.add(chunk.getContent());
        }

        assertEquals(List.of("a", "b"), seen);
        assertTrue(stream.isDrained());
    }

    @Test
    public void testPushAfterFinishIsDropped() throws Exception {
        ChunkStream stream = new ChunkStream();
        stream.finish();
        stream.push(Chunk.builder().content("late").build());

        assertNull(stream.next());
    }

    @Test
    public void testCloseRunsCancelHookOnce() {
        ChunkStream stream = new ChunkStream();
        AtomicInteger calls = new AtomicInteger();
        stream.onCancel(calls::incrementAndGet);

        stream.close();
        stream.close();

        assertEquals(1, calls.get());
        assertTrue(stream.isCancelled());
    }

    @Test
    public void testHookRegisteredAfterCloseRunsImmediately() {
        ChunkStream stream = new ChunkStream();
        stream.close();
        AtomicInteger calls = new AtomicInteger();

        stream.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    public void testCloseAfterFinishDoesNotRunHook() {
        ChunkStream stream = new ChunkStream();
        AtomicInteger calls = new AtomicInteger();
        stream.onCancel(calls::incrementAndGet);
        stream.finish();

        stream.close();

        assertEquals(0, calls.get());
    }

    @Test
    public void testAbandonedStreamReleasesBlockedProducer() throws Exception {
        BlockingBody body = new BlockingBody("data: {\"choices\":[{\"delta\":{\"content\":\"hi\"}}]}\n");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ChunkStream stream = new StreamDecoder(JsonUtils.MAPPER, "p", "m").start(body, executor);

            assertEquals("hi", stream.poll(5, TimeUnit.SECONDS).getContent());
            stream.close();

            assertTrue(body.closed.await(5, TimeUnit.SECONDS));
            assertNull(stream.poll(5, TimeUnit.SECONDS));
            assertTrue(stream.isFinished());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Serves a prefix, then blocks until closed, like an idle network body.
     */
    static class BlockingBody extends InputStream {
        private final byte[] prefix;
        private int pos;
        final CountDownLatch closed = new CountDownLatch(1);

        BlockingBody(String prefix) {
            this.prefix = prefix.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        }

        @Override
        public int read() throws IOException {
            if (pos < prefix.length) {
                return prefix[pos++];
            }
            try {
                closed.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IOException("stream closed");
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (pos < prefix.length) {
                int n = Math.min(len, prefix.length - pos);
                System.arraycopy(prefix, pos, b, off, n);
                pos += n;
                return n;
            }
            int c = read();
            b[off] = (byte) c;
            return 1;
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
