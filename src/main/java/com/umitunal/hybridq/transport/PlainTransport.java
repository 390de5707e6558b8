package com.umitunal.hybridq.transport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Unencrypted TCP, used when the daemon runs with --insecure.
 */
public class PlainTransport implements Transport {
    static final int BACKLOG = 50;

    @Override
    public ServerSocket bind(InetAddress address, int port) throws IOException {
        ServerSocket serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(address, port), BACKLOG);
        return serverSocket;
    }

    @Override
    public void accept(Socket socket) {
    }

    @Override
    public Socket connect(String host, int port, int timeoutMillis) throws IOException {
        Socket socket = new Socket();
        socket.connect(new InetSocketAddress(host, port), timeoutMillis);
        socket.setSoTimeout(timeoutMillis);
        return socket;
    }

    @Override
    public boolean isSecure() {
        return false;
    }

    @Override
    public String toString() {
        return "plain TCP";
    }
}
