// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.harness.config.HarnessConfig;
import org.hiero.harness.port.PortAllocator;

/**
 * A {@link NodeRpc} that talks JSON-RPC 1.0 over HTTP to a running node.
 */
public class JsonRpcNodeClient implements NodeRpc {

    private static final Logger log = LogManager.getLogger(JsonRpcNodeClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String AUTHORIZATION = "Authorization";
    private static final String APPLICATION_JSON = "application/json";

    private final HttpClient httpClient = HttpClient.newHttpClient();
    private final AtomicLong nextRequestId = new AtomicLong();
    private final int index;
    private final URI uri;
    private final String authorization;
    private final Duration requestTimeout;

    /**
     * Constructs a new client.
     *
     * @param index          the index of the node within its test network
     * @param host           the host on which the node's RPC server is listening
     * @param rpcPort        the RPC port of the node
     * @param credentials    the credentials accepted by the node
     * @param requestTimeout the timeout of a single request
     */
    public JsonRpcNodeClient(
            final int index,
            @NonNull final String host,
            final int rpcPort,
            @NonNull final RpcCredentials credentials,
            @NonNull final Duration requestTimeout) {
        this.index = index;
        this.uri = URI.create(String.format("http://%s:%d/", requireNonNull(host), rpcPort));
        this.authorization = basicAuth(requireNonNull(credentials));
        this.requestTimeout = requireNonNull(requestTimeout);
    }

    /**
     * Creates a client for node {@code index} of a test network, reading its credentials from the node's data
     * directory and its port from the allocator.
     *
     * @param index   the index of the node
     * @param dataDir the data directory of the node
     * @param ports   the port allocator of the test network
     * @param config  the harness configuration, supplying the RPC host and request timeout
     * @return the client
     */
    @NonNull
    public static JsonRpcNodeClient forNode(
            final int index,
            @NonNull final Path dataDir,
            @NonNull final PortAllocator ports,
            @NonNull final HarnessConfig config) {
        return forNode(index, dataDir, ports, config, null);
    }

    /**
     * Creates a client for node {@code index} of a test network. A non-null {@code rpcHost} of the form
     * {@code host:port} replaces both the configured host and the allocated port, any other value replaces the
     * host only.
     *
     * @param index   the index of the node
     * @param dataDir the data directory of the node
     * @param ports   the port allocator of the test network
     * @param config  the harness configuration, supplying the RPC host and request timeout
     * @param rpcHost the host override, or {@code null}
     * @return the client
     * @throws IllegalArgumentException if the override carries a port that is not a number
     * @throws IllegalStateException    if the data directory holds no RPC credentials
     */
    @NonNull
    public static JsonRpcNodeClient forNode(
            final int index,
            @NonNull final Path dataDir,
            @NonNull final PortAllocator ports,
            @NonNull final HarnessConfig config,
            @Nullable final String rpcHost) {
        requireNonNull(dataDir);
        requireNonNull(ports);
        requireNonNull(config);
        final RpcCredentials credentials = RpcCredentials.fromDataDir(dataDir);
        String host = config.rpcHost();
        int port = ports.rpcPort(index);
        if (rpcHost != null && !rpcHost.isEmpty()) {
            final String[] parts = rpcHost.split(":", -1);
            if (parts.length == 2) {
                host = parts[0];
                try {
                    port = Integer.parseInt(parts[1]);
                } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid port in RPC host " + rpcHost, e);
                }
            } else {
                host = rpcHost;
            }
        }
        return new JsonRpcNodeClient(index, host, port, credentials, config.rpcRequestTimeout());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int index() {
        return index;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @NonNull
    public JsonNode call(@NonNull final String method, @NonNull final Object... params) {
        requireNonNull(method);
        requireNonNull(params);
        final long id = nextRequestId.incrementAndGet();
        final String body = requestBody(id, method, params);
        log.debug("{} -> {} {}", name(), method, body);
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header(CONTENT_TYPE, APPLICATION_JSON)
                .header(AUTHORIZATION, authorization)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new RpcTransportException("Exception while calling %s on %s".formatted(method, name()), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcTransportException("Interrupted while calling %s on %s".formatted(method, name()), e);
        }
        return readResult(method, response);
    }

    @NonNull
    private static String requestBody(final long id, @NonNull final String method, @NonNull final Object[] params) {
        final ObjectNode request = MAPPER.createObjectNode();
        request.put("jsonrpc", "1.0");
        request.put("id", id);
        request.put("method", method);
        final ArrayNode paramArray = request.putArray("params");
        for (final Object param : params) {
            if (param instanceof BigDecimal) {
                paramArray.add((BigDecimal) param);
                continue;
            }
            final JsonNode node = MAPPER.valueToTree(param);
            paramArray.add(node == null ? NullNode.getInstance() : node);
        }
        try {
            return MAPPER.writeValueAsString(request);
        } catch (final IOException e) {
            throw new IllegalArgumentException("Parameters of %s are not serializable".formatted(method), e);
        }
    }

    @NonNull
    private JsonNode readResult(@NonNull final String method, @NonNull final HttpResponse<String> response) {
        final JsonNode envelope;
        try {
            envelope = MAPPER.readTree(response.body());
        } catch (final IOException e) {
            throw new RpcTransportException(
                    "Failed to read response of %s from %s with status code %d"
                            .formatted(method, name(), response.statusCode()),
                    e);
        }
        final boolean empty = envelope == null || envelope.isMissingNode();
        final JsonNode error = empty ? null : envelope.get("error");
        if (error != null && !error.isNull()) {
            throw new RpcException(
                    method, error.path("code").asInt(), error.path("message").asText(error.toString()));
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300 || empty) {
            throw new RpcTransportException("Failed to process %s on %s with status code %d"
                    .formatted(method, name(), response.statusCode()));
        }
        final JsonNode result = envelope.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    @NonNull
    private static String basicAuth(@NonNull final RpcCredentials credentials) {
        final String userPass = credentials.user() + ":" + credentials.password();
        return "Basic " + Base64.getEncoder().encodeToString(userPass.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("index", index)
                .add("uri", uri)
                .toString();
    }
}
