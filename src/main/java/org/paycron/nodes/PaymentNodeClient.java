package org.paycron.nodes;

import org.paycron.exceptions.ConnectionException;

public interface PaymentNodeClient {

    NodeInfo getInfo() throws ConnectionException;

    PaymentUpdateStream sendPayment(PaymentInstruction instruction) throws ConnectionException;
}
