package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.protocol.ErrorResponse;
import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.protocol.MessageCodec;
import com.umitunal.hybridq.protocol.Response;
import com.umitunal.hybridq.transport.Transport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Serves one client connection: handshake, then request/response pairs until the peer hangs up.
 * Any transport or protocol failure closes this connection only.
 */
class ConnectionHandler implements Runnable {
    private static final Logger LOG = LogManager.getLogger(ConnectionHandler.class);

    static final int HANDSHAKE_TIMEOUT_MILLIS = 30000;

    private final Socket socket;
    private final Transport transport;
    private final FrameCodec frames;
    private final MessageCodec codec;
    private final RequestDispatcher dispatcher;
    private final boolean dumpProtocol;
    private final Runnable onClose;

    ConnectionHandler(Socket socket, Transport transport, FrameCodec frames, MessageCodec codec,
                      RequestDispatcher dispatcher, boolean dumpProtocol, Runnable onClose) {
        this.socket = socket;
        this.transport = transport;
        this.frames = frames;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.dumpProtocol = dumpProtocol;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        String peer = String.valueOf(socket.getRemoteSocketAddress());
        LOG.debug("Accepted connection from {}", peer);

        try (Socket s = socket) {
            s.setSoTimeout(HANDSHAKE_TIMEOUT_MILLIS);
            transport.accept(s);
            s.setSoTimeout(0);

            InputStream in = new BufferedInputStream(s.getInputStream());
            OutputStream out = new BufferedOutputStream(s.getOutputStream());

            byte[] frame;
            while ((frame = frames.readFrame(in)) != null) {
                if (dumpProtocol) {
                    LOG.debug("[{}] request: {}", peer, new String(frame, StandardCharsets.UTF_8));
                }

                Response response;
                try {
                    response = dispatcher.dispatch(codec.decodeRequest(frame));
                } catch (HybridQueueException e) {
                    if (e.getKind() != ErrorKind.INVALID_REQUEST) {
                        throw e;
                    }
                    response = ErrorResponse.of(e);
                }

                byte[] encoded = codec.encodeResponse(response);
                if (dumpProtocol) {
                    LOG.debug("[{}] response: {}", peer, new String(encoded, StandardCharsets.UTF_8));
                }
                frames.writeFrame(out, encoded);
            }
            LOG.debug("Connection from {} closed by peer", peer);
        } catch (HybridQueueException e) {
            LOG.warn("Closing connection from {}: {}", peer, e);
        } catch (IOException e) {
            LOG.debug("Connection from {} dropped: {}", peer, e.getMessage());
        } finally {
            onClose.run();
        }
    }
}
