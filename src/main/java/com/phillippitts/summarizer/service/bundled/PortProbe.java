package com.phillippitts.summarizer.service.bundled;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Checks whether a TCP port can be bound locally.
 */
@FunctionalInterface
public interface PortProbe {

    boolean isFree(int port);

    /**
     * Binds and immediately releases a listening socket on all interfaces.
     */
    static PortProbe socketBind() {
        return port -> {
            try (ServerSocket socket = new ServerSocket()) {
                socket.setReuseAddress(false);
                socket.bind(new InetSocketAddress(port));
                return true;
            } catch (IOException e) {
                return false;
            }
        };
    }
}
