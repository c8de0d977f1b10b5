/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.notifier.adapter.outbound.irc;

import lombok.extern.slf4j.Slf4j;

import javax.net.SocketFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plain TCP socket factory that connects with a timeout, bypasses any JVM-wide
 * SOCKS settings and remembers the sockets it created so the connection can be
 * torn down locally.
 */
@Slf4j
class TrackingSocketFactory extends SocketFactory {

    private final int connectTimeoutMs;
    private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();

    TrackingSocketFactory(int connectTimeoutMs) {
        this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
    }

    private Socket base() {
        Socket socket = new Socket(Proxy.NO_PROXY);
        sockets.add(socket);
        return socket;
    }

    private Socket connect(Socket socket, InetSocketAddress address) throws IOException {
        socket.connect(address, connectTimeoutMs);
        return socket;
    }

    @Override
    public Socket createSocket() {
        return base();
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException {
        return connect(base(), new InetSocketAddress(host, port));
    }

    @Override
    public Socket createSocket(String host, int port, InetAddress localHost, int localPort) throws IOException {
        Socket socket = base();
        socket.bind(new InetSocketAddress(localHost, localPort));
        return connect(socket, new InetSocketAddress(host, port));
    }

    @Override
    public Socket createSocket(InetAddress host, int port) throws IOException {
        return connect(base(), new InetSocketAddress(host, port));
    }

    @Override
    public Socket createSocket(InetAddress address, int port, InetAddress localAddress, int localPort)
            throws IOException {
        Socket socket = base();
        socket.bind(new InetSocketAddress(localAddress, localPort));
        return connect(socket, new InetSocketAddress(address, port));
    }

    int openSockets() {
        sockets.removeIf(Socket::isClosed);
        return sockets.size();
    }

    /**
     * Closes every socket created so far. Blocked readers on those sockets fail
     * with a {@link java.net.SocketException}.
     */
    void closeAll() {
        for (Socket socket : sockets) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("[IRC] Failed to close socket: {}", e.getMessage());
            }
        }
        sockets.clear();
    }
}
