package org.paycron.nodes;

import org.paycron.exceptions.ConnectionException;

import java.util.Optional;

/**
 * Server-streamed payment status. Lazy: each call to {@link #next()} reads
 * from the node until it closes the stream.
 */
public interface PaymentUpdateStream extends AutoCloseable {

    /** Next update, or empty once the node has closed the stream. */
    Optional<PaymentUpdate> next() throws ConnectionException;

    @Override
    void close();
}
