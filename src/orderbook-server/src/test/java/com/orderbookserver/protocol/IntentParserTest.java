package com.orderbookserver.protocol;

import com.orderbookserver.domain.Commodity;
import com.orderbookserver.domain.Intent;
import com.orderbookserver.domain.Side;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntentParserTest {

    @Test
    void parsesBuyAndSell() throws InvalidOrderException {
        Intent buy = IntentParser.parse("BUY:APPLE", 11);
        assertEquals(11, buy.getClientId());
        assertEquals(Side.BUY, buy.getSide());
        assertEquals(Commodity.APPLE, buy.getCommodity());

        Intent sell = IntentParser.parse("SELL:ONION", 12);
        assertEquals(Side.SELL, sell.getSide());
        assertEquals(Commodity.ONION, sell.getCommodity());
    }

    @Test
    void toleratesCarriageReturnTerminator() throws InvalidOrderException {
        assertEquals(Commodity.PEAR, IntentParser.parse("BUY:PEAR\r", 1).getCommodity());
    }

    @ParameterizedTest
    @ValueSource(strings = {"BUYTOMATO", "BUY:TOMATO:APPLE", ":APPLE", "BUY:", ":", ""})
    void malformedLines(String line) {
        InvalidOrderException e = assertThrows(InvalidOrderException.class,
                () -> IntentParser.parse(line, 1));
        assertEquals(RejectReason.MALFORMED_MESSAGE, e.getReason());
        assertEquals("Invalid order command.", e.getMessage());
    }

    @Test
    void unknownOperationIsReportedBeforeCommodity() {
        InvalidOrderException e = assertThrows(InvalidOrderException.class,
                () -> IntentParser.parse("asdf:CARROT", 1));
        assertEquals(RejectReason.UNSUPPORTED_OPERATION, e.getReason());
        assertEquals("Operation not supported.", e.getMessage());
    }

    @Test
    void unknownCommodity() {
        InvalidOrderException e = assertThrows(InvalidOrderException.class,
                () -> IntentParser.parse("BUY:CARROT", 1));
        assertEquals(RejectReason.UNSUPPORTED_COMMODITY, e.getReason());
        assertEquals("Commodity not supported.", e.getMessage());
    }

    @Test
    void outcomesRenderAsProtocolLines() {
        assertEquals("ACK:APPLE", Outcome.ack(1, Commodity.APPLE).toLine());
        assertEquals("TRADE:POTATO", Outcome.trade(Commodity.POTATO).toLine());
        assertEquals("Server busy.", Outcome.reject(1, RejectReason.BUSY).toLine());
    }
}
