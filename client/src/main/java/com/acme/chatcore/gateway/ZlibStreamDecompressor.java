package com.acme.chatcore.gateway;

import com.acme.chatcore.util.ClientDefaults;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Splits one connection's zlib stream into payloads.
 *
 * <p>The whole connection shares a single inflater. Each payload ends with a sync flush,
 * whose trailing {@code 00 00 FF FF} marks the boundary; chunk boundaries carry no meaning,
 * so the marker is matched incrementally across chunks. Not thread-safe: one instance
 * per transport, fed by the shard's reader thread.</p>
 */
public final class ZlibStreamDecompressor implements AutoCloseable {
    static final byte[] SYNC_FLUSH_SUFFIX = {0x00, 0x00, (byte) 0xFF, (byte) 0xFF};
    // KMP prefix function of the suffix
    private static final int[] SUFFIX_PREFIX_FUNCTION = {0, 1, 0, 0};

    private final Inflater inflater = new Inflater();
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final byte[] buffer = new byte[8 * 1024];
    private final int maxPayloadBytes;
    private int matched;

    public ZlibStreamDecompressor() {
        this(ClientDefaults.MAX_FRAME_PAYLOAD);
    }

    public ZlibStreamDecompressor(int maxPayloadBytes) {
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * Feeds one raw chunk.
     *
     * @return the payloads completed by this chunk, possibly none
     * @throws DataFormatException if the stream is corrupt or a payload exceeds the size limit
     */
    public List<byte[]> feed(byte[] chunk) throws DataFormatException {
        List<byte[]> out = new ArrayList<>(1);
        int start = 0;
        for (int i = 0; i < chunk.length; i++) {
            matched = advance(matched, chunk[i]);
            if (matched == SYNC_FLUSH_SUFFIX.length) {
                pending.write(chunk, start, i + 1 - start);
                start = i + 1;
                matched = 0;
                byte[] payload = inflatePending();
                if (payload.length > 0) {
                    out.add(payload);
                }
            }
        }
        if (start < chunk.length) {
            pending.write(chunk, start, chunk.length - start);
            if (pending.size() > maxPayloadBytes) {
                throw new DataFormatException("Compressed payload exceeds " + maxPayloadBytes + " bytes");
            }
        }
        return out;
    }

    private static int advance(int state, byte b) {
        while (state > 0 && SYNC_FLUSH_SUFFIX[state] != b) {
            state = SUFFIX_PREFIX_FUNCTION[state - 1];
        }
        return SYNC_FLUSH_SUFFIX[state] == b ? state + 1 : state;
    }

    private byte[] inflatePending() throws DataFormatException {
        byte[] compressed = pending.toByteArray();
        pending.reset();
        inflater.setInput(compressed);
        ByteArrayOutputStream decoded = new ByteArrayOutputStream(Math.max(64, compressed.length * 4));
        while (true) {
            int n = inflater.inflate(buffer);
            if (n > 0) {
                decoded.write(buffer, 0, n);
                if (decoded.size() > maxPayloadBytes) {
                    throw new DataFormatException("Payload exceeds " + maxPayloadBytes + " bytes");
                }
            } else if (inflater.needsInput() || inflater.finished()) {
                break;
            } else if (inflater.needsDictionary()) {
                throw new DataFormatException("Preset dictionary not supported");
            }
        }
        return decoded.toByteArray();
    }

    @Override
    public void close() {
        inflater.end();
    }
}
