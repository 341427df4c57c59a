package com.questrail.hlrbridge.protocol.ipa.codec.impl;

import com.questrail.hlrbridge.protocol.ipa.IpaFrame;
import com.questrail.hlrbridge.protocol.ipa.IpaStream;
import com.questrail.hlrbridge.protocol.ipa.codec.IpaFrameDecoder;

import java.util.Arrays;
import java.util.Objects;

/**
 * AccumulatingIpaFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link IpaFrameDecoder} backed by one growable
 * byte array with read and write cursors.
 *
 * <p>Each call performs the following steps:</p>
 * <ol>
 *   <li>Append the chunk (compacting or growing the buffer if needed)</li>
 *   <li>While at least {@link IpaFraming#HEADER_LENGTH} bytes are buffered,
 *       read the header; stop if the payload is not complete yet</li>
 *   <li>Slice the frame out, advance the read cursor, deliver it</li>
 * </ol>
 *
 * <p>Not thread-safe; transports serialize callbacks per connection.</p>
 */
public final class AccumulatingIpaFrameDecoder implements IpaFrameDecoder
{
    private static final int INITIAL_CAPACITY = 1024;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;

    @Override
    public void decode(byte[] chunk, Sink sink)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(sink, "sink");

        append(chunk);

        while (end - start >= IpaFraming.HEADER_LENGTH) {
            final int length = IpaFraming.readLength(buffer, start);
            final int streamId = IpaFraming.readStreamId(buffer, start);
            final int frameEnd = start + IpaFraming.HEADER_LENGTH + length;

            if (frameEnd > end) {
                return;
            }

            final int bodyStart = start + IpaFraming.HEADER_LENGTH;
            start = frameEnd;
            if (start == end) {
                start = 0;
                end = 0;
            }

            if (streamId == IpaStream.OSMO.id()) {
                if (length == 0) {
                    sink.onMalformedFrame(streamId, "OSMO frame without extension byte");
                    continue;
                }
                // bodyStart is still valid: compaction only happens in append()
                int extension = buffer[bodyStart] & 0xFF;
                byte[] payload = Arrays.copyOfRange(buffer, bodyStart + 1, bodyStart + length);
                sink.onFrame(new IpaFrame(streamId, extension, payload));
            }
            else {
                byte[] payload = Arrays.copyOfRange(buffer, bodyStart, bodyStart + length);
                sink.onFrame(new IpaFrame(streamId, payload));
            }
        }
    }

    @Override
    public int bufferedBytes()
    {
        return end - start;
    }

    @Override
    public void reset()
    {
        start = 0;
        end = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private void append(byte[] chunk)
    {
        if (chunk.length == 0) {
            return;
        }
        if (buffer.length - end < chunk.length) {
            int live = end - start;
            if (buffer.length - live >= chunk.length) {
                System.arraycopy(buffer, start, buffer, 0, live);
            }
            else {
                byte[] grown = new byte[Math.max(buffer.length * 2, live + chunk.length)];
                System.arraycopy(buffer, start, grown, 0, live);
                buffer = grown;
            }
            start = 0;
            end = live;
        }
        System.arraycopy(chunk, 0, buffer, end, chunk.length);
        end += chunk.length;
    }
}
