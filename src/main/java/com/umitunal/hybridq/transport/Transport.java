package com.umitunal.hybridq.transport;

import com.umitunal.hybridq.core.HybridQueueException;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Creates the byte-stream channels that requests and responses travel over.
 */
public interface Transport {

    /**
     * Open a listening socket.
     *
     * @param address local address to bind, or null for all addresses
     * @param port local port, 0 picks an ephemeral one
     */
    ServerSocket bind(InetAddress address, int port) throws IOException;

    /**
     * Finish setting up a socket returned by the listening socket, before any request is read.
     *
     * @throws HybridQueueException TLS_ERROR if the peer could not be authenticated
     */
    void accept(Socket socket) throws HybridQueueException;

    /**
     * Open a channel to a daemon.
     *
     * @throws HybridQueueException TLS_ERROR if the daemon could not be authenticated
     */
    Socket connect(String host, int port, int timeoutMillis) throws IOException, HybridQueueException;

    boolean isSecure();
}
