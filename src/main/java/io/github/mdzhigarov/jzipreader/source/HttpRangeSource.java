/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipreader.source;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SeekableSource} over a remote file, read with HTTP Range requests so that only the
 * parts of the archive that are actually needed travel over the network.
 *
 * <p>Reads are served from fixed, aligned blocks of {@code blockSize} bytes; the most recently
 * fetched block is cached, so the small sequential reads a header decode performs cost a single
 * request. The server must answer Range requests with 206 Partial Content.
 */
public class HttpRangeSource implements SeekableSource {

    private static final Logger logger = LoggerFactory.getLogger(HttpRangeSource.class);

    public static final int DEFAULT_BLOCK_SIZE = 64 * 1024;
    private static final String USER_AGENT = "jZipReader/1.0.0";

    private final URI uri;
    private final HttpClient httpClient;
    private final String basicAuth;
    private final int blockSize;
    private final long size;

    private long position;
    private long cachedBlockStart = -1;
    private byte[] cachedBlock;

    private HttpRangeSource(URI uri, HttpClient httpClient, String basicAuth, int blockSize) throws IOException {
        this.uri = uri;
        this.httpClient = httpClient;
        this.basicAuth = basicAuth;
        this.blockSize = blockSize;
        this.size = fetchSize();
    }

    public static Builder newBuilder(URL url) {
        return new Builder(url);
    }

    public URI getUri() {
        return uri;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long position) throws IOException {
        if (position < 0 || position > size) {
            throw new IOException("Seek position " + position + " outside [0, " + size + "] for " + uri);
        }
        this.position = position;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (length == 0) {
            return 0;
        }
        if (position >= size) {
            return -1;
        }

        long blockStart = (position / blockSize) * blockSize;
        if (blockStart != cachedBlockStart) {
            long blockEnd = Math.min(blockStart + blockSize, size) - 1;
            cachedBlock = fetchRange(blockStart, blockEnd);
            cachedBlockStart = blockStart;
        }

        int inBlock = (int) (position - blockStart);
        int n = Math.min(length, cachedBlock.length - inBlock);
        System.arraycopy(cachedBlock, inBlock, buffer, offset, n);
        position += n;
        return n;
    }

    @Override
    public void close() {
        cachedBlock = null;
        cachedBlockStart = -1;
    }

    /**
     * Gets the file size using an HTTP HEAD request.
     */
    private long fetchSize() throws IOException {
        logger.debug("Getting file size via HTTP HEAD request using HTTP version: {}", httpClient.version());
        HttpRequest request = newRequest()
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .build();

        HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
        logger.debug("HTTP HEAD response status: {} (Server HTTP version: {})", response.statusCode(), response.version());
        if (response.statusCode() != 200) {
            throw new IOException("Failed to get file size of " + uri + ". HTTP status: " + response.statusCode());
        }

        String contentLength = response.headers().firstValue("Content-Length").orElse(null);
        if (contentLength == null) {
            throw new IOException("Server did not provide Content-Length header for " + uri);
        }

        try {
            long length = Long.parseLong(contentLength);
            logger.debug("File size: {} bytes ({} MB)", length, length / 1024 / 1024);
            return length;
        } catch (NumberFormatException e) {
            throw new IOException("Invalid Content-Length header: " + contentLength, e);
        }
    }

    /**
     * Fetches the inclusive byte range {@code start-end} of the remote file.
     */
    private byte[] fetchRange(long start, long end) throws IOException {
        String rangeHeader = "bytes=" + start + "-" + end;
        logger.debug("HTTP Range request: {} (HTTP {})", rangeHeader, httpClient.version());

        HttpRequest request = newRequest()
            .header("Range", rangeHeader)
            .GET()
            .build();

        HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
        logger.debug("HTTP Range response: {} (Content-Length: {})",
                    response.statusCode(), response.headers().firstValue("Content-Length").orElse("unknown"));

        if (response.statusCode() == 206) { // Partial Content
            byte[] body = response.body();
            long expected = end - start + 1;
            if (body.length != expected) {
                throw new IOException("Range " + rangeHeader + " of " + uri + " returned "
                        + body.length + " bytes, expected " + expected);
            }
            return body;
        } else if (response.statusCode() == 200) {
            logger.error("Server doesn't support HTTP Range requests (returned 200 instead of 206)");
            throw new IOException("Server doesn't support HTTP Range requests (returned 200 instead of 206). " +
                    "Remote archives can only be read from servers that support HTTP Range requests.");
        } else {
            throw new IOException("HTTP request for " + uri + " failed with status: " + response.statusCode());
        }
    }

    private HttpRequest.Builder newRequest() {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(uri)
            .header("User-Agent", USER_AGENT)
            .header("Accept", "*/*");

        if (basicAuth != null) {
            requestBuilder.header("Authorization", "Basic " + basicAuth);
        }
        return requestBuilder;
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while requesting " + uri);
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    @Override
    public String toString() {
        return "HttpRangeSource{" + uri + "}";
    }

    /**
     * Builder for {@link HttpRangeSource}.
     */
    public static class Builder {
        private final URL url;
        private HttpClient httpClient;
        private String username;
        private String password;
        private int blockSize = DEFAULT_BLOCK_SIZE;

        Builder(URL url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        /**
         * (Optional) Sets basic authentication credentials. Both must be non-null to take effect.
         */
        public Builder withBasicAuth(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * (Optional) Provide a custom HttpClient instance. If not provided, a default one is created.
         */
        public Builder withHttpClient(HttpClient client) {
            this.httpClient = client;
            return this;
        }

        /**
         * (Optional) Size of the blocks fetched per Range request.
         */
        public Builder withBlockSize(int blockSize) {
            if (blockSize <= 0) {
                throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
            }
            this.blockSize = blockSize;
            return this;
        }

        /**
         * Opens the source. This performs the HEAD request that determines the file size.
         */
        public HttpRangeSource build() throws IOException {
            HttpClient client = this.httpClient != null ? this.httpClient :
                HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)  // Explicitly use HTTP/1.1 for Range request support
                    .connectTimeout(Duration.ofSeconds(30))
                    .build();
            String basicAuth = (username != null && password != null) ?
                Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8)) : null;

            URI uri;
            try {
                uri = url.toURI();
            } catch (URISyntaxException e) {
                throw new IOException("Invalid archive URL: " + url, e);
            }
            return new HttpRangeSource(uri, client, basicAuth, blockSize);
        }
    }
}
