package fr.lapetina.weather.aggregator.integration;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local HTTP server standing in for weather providers during tests.
 *
 * Routes are matched by longest path prefix. Unrouted paths answer 404.
 */
public final class StubWeatherServer implements AutoCloseable {

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final List<URI> requests = new CopyOnWriteArrayList<>();

    private StubWeatherServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stub-weather-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.createContext("/", this::handle);
    }

    public static StubWeatherServer start() throws IOException {
        StubWeatherServer stub = new StubWeatherServer();
        stub.server.start();
        return stub;
    }

    /**
     * Answers requests under {@code pathPrefix} with a JSON body.
     */
    public StubWeatherServer respond(String pathPrefix, int status, String body) {
        routes.put(pathPrefix, new Route(status, body, Duration.ZERO));
        return this;
    }

    public StubWeatherServer respondJson(String pathPrefix, String body) {
        return respond(pathPrefix, 200, body);
    }

    /**
     * Answers after a delay, to provoke client or orchestrator timeouts.
     */
    public StubWeatherServer respondSlowly(String pathPrefix, Duration delay, String body) {
        routes.put(pathPrefix, new Route(200, body, delay));
        return this;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public URI uri(String pathAndQuery) {
        return URI.create(baseUrl() + pathAndQuery);
    }

    public List<URI> getRequests() {
        return new ArrayList<>(requests);
    }

    public long requestCount(String pathPrefix) {
        return requests.stream().filter(uri -> uri.getPath().startsWith(pathPrefix)).count();
    }

    private void handle(HttpExchange exchange) throws IOException {
        URI uri = exchange.getRequestURI();
        requests.add(uri);

        Route route = findRoute(uri.getPath());
        if (route == null) {
            send(exchange, 404, "{\"error\":\"not found\"}");
            return;
        }
        if (!route.delay().isZero()) {
            try {
                Thread.sleep(route.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        send(exchange, route.status(), route.body());
    }

    private Route findRoute(String path) {
        String best = null;
        for (String prefix : routes.keySet()) {
            if (path.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best != null ? routes.get(best) : null;
    }

    private static void send(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        try {
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            }
        } finally {
            exchange.close();
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private record Route(int status, String body, Duration delay) {
    }
}
