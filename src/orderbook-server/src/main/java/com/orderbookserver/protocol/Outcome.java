package com.orderbookserver.protocol;

import com.orderbookserver.domain.Commodity;

/**
 * An event produced for an inbound line, ready to be written to sessions.
 *
 * ACK and REJECT are addressed to the submitting client only; TRADE goes to
 * every connected session.
 */
public final class Outcome {

    public enum Type {
        ACK,
        TRADE,
        REJECT
    }

    private final Type type;
    private final Commodity commodity;
    private final RejectReason reason;
    private final long clientId;

    private Outcome(Type type, Commodity commodity, RejectReason reason, long clientId) {
        this.type = type;
        this.commodity = commodity;
        this.reason = reason;
        this.clientId = clientId;
    }

    public static Outcome ack(long clientId, Commodity commodity) {
        return new Outcome(Type.ACK, commodity, null, clientId);
    }

    public static Outcome trade(Commodity commodity) {
        return new Outcome(Type.TRADE, commodity, null, -1);
    }

    public static Outcome reject(long clientId, RejectReason reason) {
        return new Outcome(Type.REJECT, null, reason, clientId);
    }

    public boolean isBroadcast() {
        return type == Type.TRADE;
    }

    /**
     * Render this outcome as a single protocol line, without the terminator.
     */
    public String toLine() {
        switch (type) {
            case ACK:
                return "ACK:" + commodity.symbol();
            case TRADE:
                return "TRADE:" + commodity.symbol();
            default:
                return reason.wireText();
        }
    }

    public Type getType() {
        return type;
    }

    public Commodity getCommodity() {
        return commodity;
    }

    public RejectReason getReason() {
        return reason;
    }

    /**
     * @return the addressed client, or -1 for broadcasts
     */
    public long getClientId() {
        return clientId;
    }

    @Override
    public String toString() {
        return toLine();
    }
}
