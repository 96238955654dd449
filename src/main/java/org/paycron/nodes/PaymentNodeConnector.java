package org.paycron.nodes;

import org.paycron.exceptions.ConnectionException;

/**
 * Opens a client for the payment node. Called once per firing.
 */
@FunctionalInterface
public interface PaymentNodeConnector {

    PaymentNodeClient connect(ConnectionConfig config) throws ConnectionException;
}
