package com.pulsesentinel.service;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP endpoint that answers with queued status codes and records
 * every request it receives.
 */
class StubHttpServer implements AutoCloseable {

    private final HttpServer server;
    private final Queue<Integer> statuses = new ConcurrentLinkedQueue<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private volatile int defaultStatus = 200;
    private volatile String responseBody = "{}";

    StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            requests.add(new Request(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                    exchange.getRequestHeaders().getFirst("Content-Type"),
                    exchange.getRequestHeaders().getFirst("X-Source"), body));
            Integer queued = statuses.poll();
            int status = queued != null ? queued : defaultStatus;
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    StubHttpServer respondWith(Integer... codes) {
        statuses.addAll(List.of(codes));
        return this;
    }

    StubHttpServer defaultStatus(int status) {
        this.defaultStatus = status;
        return this;
    }

    StubHttpServer body(String body) {
        this.responseBody = body;
        return this;
    }

    String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    List<Request> requests() {
        return requests;
    }

    @Override
    public void close() {
        server.stop(0);
    }

    /**
     * One recorded request.
     */
    static final class Request {
        final String method;
        final String path;
        final String contentType;
        final String source;
        final String body;

        Request(String method, String path, String contentType, String source, String body) {
            this.method = method;
            this.path = path;
            this.contentType = contentType;
            this.source = source;
            this.body = body;
        }
    }
}
