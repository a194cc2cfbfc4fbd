package com.cybershieldx.agent.transport;

import java.net.URI;

/**
 * Opens duplex text connections to the server
 */
public interface Transport extends AutoCloseable {

    /**
     * Start connecting. The outcome is reported to the listener: onOpen once the
     * connection is usable, onClosed exactly once when it fails or ends.
     */
    TransportConnection connect(URI uri, TransportListener listener);

    @Override
    void close();
}
