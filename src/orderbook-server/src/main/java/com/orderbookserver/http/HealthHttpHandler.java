package com.orderbookserver.http;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.orderbookserver.engine.BookDepth;
import com.orderbookserver.engine.MatchingCoordinator;
import com.orderbookserver.fanout.NotificationFanout;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * HTTP handler for GET /health.
 * Reports liveness, the number of connected sessions and the pending depth
 * of every commodity's book.
 */
public class HealthHttpHandler implements HttpHandler {

    private final MatchingCoordinator coordinator;
    private final NotificationFanout fanout;
    private final Gson gson;

    public HealthHttpHandler(MatchingCoordinator coordinator, NotificationFanout fanout) {
        this.coordinator = coordinator;
        this.fanout = fanout;
        this.gson = new Gson();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"Method not allowed\"}");
            return;
        }
        sendResponse(exchange, 200, gson.toJson(buildStatus()));
    }

    JsonObject buildStatus() {
        JsonObject status = new JsonObject();
        status.addProperty("status", "UP");
        status.addProperty("sessions", fanout.getSessionCount());

        JsonArray books = new JsonArray();
        for (BookDepth depth : coordinator.depthSnapshot()) {
            JsonObject book = new JsonObject();
            book.addProperty("commodity", depth.commodity().symbol());
            book.addProperty("pendingBuys", depth.pendingBuys());
            book.addProperty("pendingSells", depth.pendingSells());
            books.add(book);
        }
        status.add("books", books);
        return status;
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body)
            throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
