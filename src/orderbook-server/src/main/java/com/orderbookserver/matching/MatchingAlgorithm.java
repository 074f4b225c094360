package com.orderbookserver.matching;

import com.orderbookserver.domain.Intent;
import com.orderbookserver.domain.MatchResult;
import com.orderbookserver.domain.OrderBook;

/**
 * Interface for order matching algorithms.
 * The matching algorithm takes an order book and an incoming intent, and
 * either pairs it with a resting intent or rests it in the book.
 */
public interface MatchingAlgorithm {
    MatchResult match(OrderBook book, Intent incoming);
}
