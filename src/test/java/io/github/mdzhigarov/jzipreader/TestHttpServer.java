package io.github.mdzhigarov.jzipreader;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test HTTP server that serves in-memory files over HTTP/1.1, with Range request support that
 * can be switched off to mimic servers that always answer with the full body.
 */
public class TestHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(TestHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final int port;
    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final AtomicInteger rangeRequests = new AtomicInteger();
    private volatile boolean rangeSupport = true;
    private volatile String requiredAuthorization;

    public TestHttpServer() throws IOException {
        // Find an available port
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        port = server.getAddress().getPort();
        server.setExecutor(executor);
        server.createContext("/", new FileHandler());

        logger.info("Test HTTP server created on port {}", port);
    }

    public void start() {
        server.start();
        logger.info("Test HTTP server started on port {}", port);
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
        logger.info("Test HTTP server stopped");
    }

    public URL url(String path) throws MalformedURLException {
        return new URL("http://localhost:" + port + path);
    }

    public void addFile(String path, byte[] content) {
        files.put(path, content);
        logger.debug("Added file {} with {} bytes", path, content.length);
    }

    public void setRangeSupport(boolean rangeSupport) {
        this.rangeSupport = rangeSupport;
    }

    public void requireBasicAuth(String username, String password) {
        this.requiredAuthorization = "Basic " + Base64.getEncoder().encodeToString((username + ":" + password).getBytes());
    }

    public int getRangeRequestCount() {
        return rangeRequests.get();
    }

    private class FileHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestMethod = exchange.getRequestMethod();
            String requestPath = exchange.getRequestURI().getPath();
            logger.debug("HTTP {} request for path: {}", requestMethod, requestPath);

            exchange.getResponseHeaders().set("Server", "TestHttpServer/1.1");

            String authorization = requiredAuthorization;
            if (authorization != null && !authorization.equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
                sendEmpty(exchange, 401);
                return;
            }

            byte[] fileContent = files.get(requestPath);
            if (fileContent == null) {
                sendEmpty(exchange, 404);
                return;
            }

            if ("HEAD".equals(requestMethod)) {
                exchange.getResponseHeaders().set("Content-Length", String.valueOf(fileContent.length));
                exchange.getResponseHeaders().set("Accept-Ranges", rangeSupport ? "bytes" : "none");
                exchange.sendResponseHeaders(200, -1);
                exchange.close();
            } else if ("GET".equals(requestMethod)) {
                String rangeHeader = exchange.getRequestHeaders().getFirst("Range");
                if (rangeSupport && rangeHeader != null && rangeHeader.startsWith("bytes=")) {
                    handleRangeRequest(exchange, fileContent, rangeHeader);
                } else {
                    send(exchange, 200, fileContent);
                }
            } else {
                sendEmpty(exchange, 405);
            }
        }

        private void handleRangeRequest(HttpExchange exchange, byte[] fileContent, String rangeHeader) throws IOException {
            rangeRequests.incrementAndGet();
            String[] parts = rangeHeader.substring(6).split("-");
            int start;
            int end;
            try {
                start = Integer.parseInt(parts[0]);
                end = parts.length > 1 && !parts[1].isEmpty() ? Integer.parseInt(parts[1]) : fileContent.length - 1;
            } catch (NumberFormatException e) {
                sendEmpty(exchange, 400);
                return;
            }

            if (start < 0 || end >= fileContent.length || start > end) {
                sendEmpty(exchange, 416); // Range Not Satisfiable
                return;
            }

            byte[] rangeContent = new byte[end - start + 1];
            System.arraycopy(fileContent, start, rangeContent, 0, rangeContent.length);
            exchange.getResponseHeaders().set("Content-Range",
                String.format("bytes %d-%d/%d", start, end, fileContent.length));
            send(exchange, 206, rangeContent);

            logger.debug("Served range request: bytes {}-{} of {}", start, end, fileContent.length);
        }

        private void send(HttpExchange exchange, int status, byte[] body) throws IOException {
            exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }

        private void sendEmpty(HttpExchange exchange, int status) throws IOException {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        }
    }
}
