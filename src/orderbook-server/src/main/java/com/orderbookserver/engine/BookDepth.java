package com.orderbookserver.engine;

import com.orderbookserver.domain.Commodity;

/**
 * Number of resting intents per side for one commodity at a point in time.
 */
public record BookDepth(Commodity commodity, int pendingBuys, int pendingSells) {}
