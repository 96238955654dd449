package org.paycron.nodes;

/**
 * What is submitted to the node for one firing.
 */
public record PaymentInstruction(String paymentRequest, int timeoutSeconds, long feeLimitSat) {}
