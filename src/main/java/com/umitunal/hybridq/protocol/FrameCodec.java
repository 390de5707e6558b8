package com.umitunal.hybridq.protocol;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Length-prefixed framing: a 4 byte little-endian unsigned length followed by the document bytes.
 *
 * The limit bounds what this side is willing to read. Outgoing frames are never refused, so a
 * large status response reaches any peer whose own limit admits it.
 */
public class FrameCodec {
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    /** Largest frame a byte array can hold. */
    public static final int MAX_FRAME_BYTES = Integer.MAX_VALUE - 8;

    private static final int HEADER_BYTES = 4;

    private final int maxFrameBytes;

    public FrameCodec() {
        this(DEFAULT_MAX_FRAME_BYTES);
    }

    public FrameCodec(int maxFrameBytes) {
        if (maxFrameBytes <= 0 || maxFrameBytes > MAX_FRAME_BYTES) {
            throw new IllegalArgumentException("maxFrameBytes must be positive: " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Read the next frame.
     *
     * @return the frame payload, or null if the stream ended cleanly between frames
     * @throws HybridQueueException PROTOCOL_ERROR on a truncated or oversized frame
     */
    public byte[] readFrame(InputStream in) throws IOException, HybridQueueException {
        byte[] header = new byte[HEADER_BYTES];
        int first = in.read();
        if (first < 0) {
            return null;
        }
        header[0] = (byte) first;
        readFully(in, header, 1, HEADER_BYTES - 1);

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN).getInt());
        if (length > maxFrameBytes) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR,
                    "Frame of " + length + " bytes exceeds limit of " + maxFrameBytes);
        }

        byte[] payload = new byte[(int) length];
        readFully(in, payload, 0, payload.length);
        return payload;
    }

    public void writeFrame(OutputStream out, byte[] payload) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(payload.length);
        out.write(header.array());
        out.write(payload);
        out.flush();
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    private static void readFully(InputStream in, byte[] buffer, int offset, int length)
            throws IOException, HybridQueueException {
        int read = in.readNBytes(buffer, offset, length);
        if (read < length) {
            throw new HybridQueueException(ErrorKind.PROTOCOL_ERROR, "Connection closed inside a frame");
        }
    }
}
