package org.paycron.nodes;

import org.paycron.exceptions.ConnectionException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * In-memory node replaying a fixed status stream. An update with status
 * {@code null} and reason {@code "BROKEN"} makes the stream fail at that point.
 */
public class FakePaymentNode implements PaymentNodeClient, PaymentNodeConnector {

    private final List<PaymentUpdate> script;
    private final List<PaymentInstruction> submitted = new ArrayList<>();
    private int connects;
    private boolean closed;

    public FakePaymentNode(PaymentUpdate... script) {
        this.script = List.of(script);
    }

    public static PaymentUpdate update(String status) {
        return PaymentUpdate.of(status, null);
    }

    public static PaymentUpdate failed(String reason) {
        return PaymentUpdate.of("FAILED", reason);
    }

    public static PaymentUpdate broken() {
        return new PaymentUpdate(PaymentOutcome.FAILED, null, "BROKEN");
    }

    @Override
    public synchronized PaymentNodeClient connect(ConnectionConfig config) {
        connects++;
        return this;
    }

    @Override
    public NodeInfo getInfo() {
        return new NodeInfo("fake", "02abc", true);
    }

    @Override
    public synchronized PaymentUpdateStream sendPayment(PaymentInstruction instruction) {
        submitted.add(instruction);
        Iterator<PaymentUpdate> it = script.iterator();
        return new PaymentUpdateStream() {
            @Override
            public Optional<PaymentUpdate> next() throws ConnectionException {
                if (!it.hasNext()) return Optional.empty();
                PaymentUpdate u = it.next();
                if (u.status() == null && "BROKEN".equals(u.failureReason())) {
                    throw new ConnectionException("stream reset");
                }
                return Optional.of(u);
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    public synchronized List<PaymentInstruction> submitted() {
        return List.copyOf(submitted);
    }

    public synchronized int connects() {
        return connects;
    }

    public boolean streamClosed() {
        return closed;
    }
}
