package com.orderbookserver.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;

/**
 * Manages order books for all commodities.
 * Books are created on first use and live for the rest of the process.
 */
public class OrderBookManager {

    private final EnumMap<Commodity, OrderBook> books;

    public OrderBookManager() {
        this.books = new EnumMap<>(Commodity.class);
    }

    /**
     * Get or create the OrderBook for the given commodity.
     * Thread-safe note: only called from the matching thread.
     */
    public OrderBook getOrCreateBook(Commodity commodity) {
        return books.computeIfAbsent(commodity, OrderBook::new);
    }

    /**
     * Get an existing OrderBook. Returns null if nothing was ever submitted
     * for the commodity.
     */
    public OrderBook getBook(Commodity commodity) {
        return books.get(commodity);
    }

    public Collection<OrderBook> getAllBooks() {
        return Collections.unmodifiableCollection(books.values());
    }
}
