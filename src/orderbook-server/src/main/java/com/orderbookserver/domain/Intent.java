package com.orderbookserver.domain;

/**
 * A single client's request to buy or sell one unit of a commodity.
 *
 * Immutable. The sequence number is assigned when the intent enters the
 * matching thread and only serves diagnostics; queue position alone
 * determines priority.
 */
public class Intent {

    private final long clientId;
    private final Side side;
    private final Commodity commodity;
    private final long sequence;

    public Intent(long clientId, Side side, Commodity commodity) {
        this(clientId, side, commodity, 0);
    }

    private Intent(long clientId, Side side, Commodity commodity, long sequence) {
        this.clientId = clientId;
        this.side = side;
        this.commodity = commodity;
        this.sequence = sequence;
    }

    public Intent withSequence(long sequence) {
        return new Intent(clientId, side, commodity, sequence);
    }

    public long getClientId() {
        return clientId;
    }

    public Side getSide() {
        return side;
    }

    public Commodity getCommodity() {
        return commodity;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "Intent{" +
                "clientId=" + clientId +
                ", side=" + side +
                ", commodity=" + commodity +
                ", sequence=" + sequence +
                '}';
    }
}
