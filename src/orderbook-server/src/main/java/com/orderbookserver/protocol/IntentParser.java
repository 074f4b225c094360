package com.orderbookserver.protocol;

import com.orderbookserver.domain.Commodity;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.domain.Side;

/**
 * Parses {@code <OPERATION>:<COMMODITY>} lines.
 *
 * A line must split on ':' into exactly two non-empty parts. The operation is
 * checked before the commodity, so {@code "asdf:CARROT"} is reported as an
 * unsupported operation.
 */
public final class IntentParser {

    private IntentParser() {
    }

    public static Intent parse(String line, long clientId) throws InvalidOrderException {
        if (line == null) {
            throw new InvalidOrderException(RejectReason.MALFORMED_MESSAGE);
        }
        String trimmed = stripCarriageReturn(line);

        int separator = trimmed.indexOf(':');
        if (separator <= 0
                || separator == trimmed.length() - 1
                || trimmed.indexOf(':', separator + 1) >= 0) {
            throw new InvalidOrderException(RejectReason.MALFORMED_MESSAGE);
        }

        Side side = Side.fromWire(trimmed.substring(0, separator));
        Commodity commodity = Commodity.fromSymbol(trimmed.substring(separator + 1));
        return new Intent(clientId, side, commodity);
    }

    private static String stripCarriageReturn(String line) {
        if (line.endsWith("\r")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }
}
