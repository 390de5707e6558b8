package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.protocol.MessageCodec;
import com.umitunal.hybridq.transport.Transport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the listening socket and serves every accepted connection on its own thread.
 * Connections share nothing but the request dispatcher and, through it, the job queue.
 */
public class DaemonController implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(DaemonController.class);

    private final Transport transport;
    private final InetAddress bindAddress;
    private final int port;
    private final FrameCodec frames;
    private final MessageCodec codec;
    private final RequestDispatcher dispatcher;
    private final boolean dumpProtocol;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong connectionCounter = new AtomicLong(0);
    private final Set<Socket> openConnections = ConcurrentHashMap.newKeySet();
    private final ExecutorService connections;

    private volatile ServerSocket serverSocket;
    private Thread acceptor;

    public DaemonController(Transport transport, InetAddress bindAddress, int port, FrameCodec frames,
                            MessageCodec codec, RequestDispatcher dispatcher, boolean dumpProtocol) {
        this.transport = transport;
        this.bindAddress = bindAddress;
        this.port = port;
        this.frames = frames;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.dumpProtocol = dumpProtocol;
        this.connections = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "connection-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Bind the listening socket and start accepting connections.
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        serverSocket = transport.bind(bindAddress, port);
        acceptor = new Thread(this::acceptLoop, "DaemonController-acceptor");
        acceptor.start();
        LOG.info("Listening on {} using {}", serverSocket.getLocalSocketAddress(), transport);
    }

    /**
     * @return the bound port, useful when the configured port was 0
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running.get()) {
                    LOG.error("Failed to accept connection: {}", e.getMessage());
                    continue;
                }
                break;
            }

            openConnections.add(socket);
            connections.execute(new ConnectionHandler(socket, transport, frames, codec, dispatcher, dumpProtocol,
                    () -> openConnections.remove(socket)));
        }
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOG.warn("Failed to close listening socket: {}", e.getMessage());
        }
        for (Socket socket : openConnections) {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.debug("Failed to close connection: {}", e.getMessage());
            }
        }
        connections.shutdownNow();
        try {
            if (!connections.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Connection handlers did not stop in time");
            }
            if (acceptor != null) {
                acceptor.join(5000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Stopped listening");
    }
}
