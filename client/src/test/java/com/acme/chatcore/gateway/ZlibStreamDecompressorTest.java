package com.acme.chatcore.gateway;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZlibStreamDecompressorTest {

    /**
     * Compresses each message with a sync flush on one shared deflater, like the server does.
     */
    private static List<byte[]> compressStream(String... messages) {
        Deflater deflater = new Deflater();
        List<byte[]> out = new ArrayList<>();
        byte[] buf = new byte[64 * 1024];
        try {
            for (String message : messages) {
                deflater.setInput(message.getBytes(StandardCharsets.UTF_8));
                ByteArrayOutputStream chunk = new ByteArrayOutputStream();
                int n;
                do {
                    n = deflater.deflate(buf, 0, buf.length, Deflater.SYNC_FLUSH);
                    chunk.write(buf, 0, n);
                } while (n == buf.length);
                out.add(chunk.toByteArray());
            }
        } finally {
            deflater.end();
        }
        return out;
    }

    private static String text(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Test
    void shouldDecodeOnePayloadPerFlushedChunk() throws Exception {
        List<byte[]> chunks = compressStream("{\"op\":10}", "{\"op\":0,\"t\":\"READY\"}");
        try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor()) {
            List<byte[]> first = decompressor.feed(chunks.get(0));
            List<byte[]> second = decompressor.feed(chunks.get(1));

            assertEquals(1, first.size());
            assertEquals("{\"op\":10}", text(first.get(0)));
            assertEquals(1, second.size());
            assertEquals("{\"op\":0,\"t\":\"READY\"}", text(second.get(0)));
        }
    }

    @Test
    void shouldProduceSamePayloadWhenChunkIsSplit() throws Exception {
        String message = "{\"op\":0,\"d\":{\"content\":\"" + "x".repeat(500) + "\"}}";
        byte[] whole = compressStream(message).get(0);

        for (int cut = 1; cut < whole.length; cut++) {
            try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor()) {
                List<byte[]> head = decompressor.feed(Arrays.copyOfRange(whole, 0, cut));
                List<byte[]> tail = decompressor.feed(Arrays.copyOfRange(whole, cut, whole.length));

                assertTrue(head.isEmpty(), "nothing completes before the flush marker, cut=" + cut);
                assertEquals(1, tail.size(), "cut=" + cut);
                assertEquals(message, text(tail.get(0)));
            }
        }
    }

    @Test
    void shouldSplitTwoPayloadsDeliveredTogether() throws Exception {
        List<byte[]> chunks = compressStream("{\"op\":11}", "{\"op\":1}");
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        joined.write(chunks.get(0));
        joined.write(chunks.get(1));

        try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor()) {
            List<byte[]> payloads = decompressor.feed(joined.toByteArray());

            assertEquals(2, payloads.size());
            assertEquals("{\"op\":11}", text(payloads.get(0)));
            assertEquals("{\"op\":1}", text(payloads.get(1)));
        }
    }

    @Test
    void shouldDecodeByteAtATime() throws Exception {
        List<byte[]> chunks = compressStream("{\"a\":1}", "{\"b\":2}", "{\"c\":3}");
        List<String> decoded = new ArrayList<>();
        try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor()) {
            for (byte[] chunk : chunks) {
                for (byte b : chunk) {
                    decompressor.feed(new byte[] {b}).forEach(p -> decoded.add(text(p)));
                }
            }
        }
        assertEquals(List.of("{\"a\":1}", "{\"b\":2}", "{\"c\":3}"), decoded);
    }

    @Test
    void shouldEndEveryFlushWithTheMarker() {
        byte[] chunk = compressStream("{}").get(0);
        byte[] tail = Arrays.copyOfRange(chunk, chunk.length - 4, chunk.length);
        assertArrayEquals(ZlibStreamDecompressor.SYNC_FLUSH_SUFFIX, tail);
    }

    @Test
    void shouldRejectCorruptStream() {
        byte[] garbage = {0x12, 0x34, 0x56, 0x00, 0x00, (byte) 0xFF, (byte) 0xFF};
        try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor()) {
            assertThrows(DataFormatException.class, () -> decompressor.feed(garbage));
        }
    }

    @Test
    void shouldRejectPayloadAboveLimit() {
        byte[] chunk = compressStream("y".repeat(10_000)).get(0);
        try (ZlibStreamDecompressor decompressor = new ZlibStreamDecompressor(1_000)) {
            assertThrows(DataFormatException.class, () -> decompressor.feed(chunk));
        }
    }
}
