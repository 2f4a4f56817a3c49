package io.pactverifier.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.pactverifier.ErrorCode;
import io.pactverifier.VerifierException;
import io.pactverifier.internal.HttpUtil;
import io.pactverifier.internal.Json;
import io.pactverifier.model.ExpectedRequest;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Replays expected requests against the provider under test. Each request is sent exactly once.
 */
public final class ProviderInvoker {

    private static final Logger LOGGER = Logger.getLogger(ProviderInvoker.class.getName());

    private final HttpClient httpClient;
    private final URI baseUrl;
    private final Duration timeout;

    /**
     * @param httpClient client used for every provider call; timeouts configured on it apply as well.
     * @param baseUrl    root URL of the provider, e.g. {@code http://localhost:8080}.
     * @param timeout    per-request timeout, or {@code null} to rely on the client alone.
     */
    public ProviderInvoker(HttpClient httpClient, URI baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public URI baseUrl() {
        return baseUrl;
    }

    /**
     * @throws VerifierException {@link ErrorCode#TRANSPORT_ERROR} when no response could be obtained.
     */
    public ProviderResponse invoke(ExpectedRequest request) throws VerifierException {
        Objects.requireNonNull(request, "request");
        String method = request.method().toUpperCase(Locale.ROOT);

        URI target;
        byte[] body;
        try {
            target = resolve(request);
            body = encodeBody(request);
        } catch (IllegalArgumentException | JsonProcessingException ex) {
            throw new VerifierException(ErrorCode.TRANSPORT_ERROR,
                "build request " + method + " " + request.path() + ": " + ex.getMessage(), ex);
        }

        Map<String, String> headers = new LinkedHashMap<>(request.headers());
        if (request.hasBody() && request.body().isContainerNode() && request.header("Content-Type") == null) {
            headers.put("Content-Type", "application/json");
        }
        headers.keySet().stream()
            .filter(HttpUtil::isRestrictedHeader)
            .forEach(name -> LOGGER.fine(() -> "[pact-verifier] skipping restricted request header " + name));

        LOGGER.fine(() -> "[pact-verifier] " + method + " " + target);
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.send(httpClient, method, target, headers, body, timeout);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new VerifierException(ErrorCode.TRANSPORT_ERROR, method + " " + target + " interrupted", ex);
            }
            String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            throw new VerifierException(ErrorCode.TRANSPORT_ERROR, method + " " + target + ": " + reason, ex);
        } catch (IllegalArgumentException ex) {
            throw new VerifierException(ErrorCode.TRANSPORT_ERROR,
                "build request " + method + " " + target + ": " + ex.getMessage(), ex);
        }

        byte[] bytes = response.body();
        return new ProviderResponse(
            response.statusCode(),
            stripPseudoHeaders(response.headers().map()),
            bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8)
        );
    }

    URI resolve(ExpectedRequest request) {
        String base = baseUrl.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringBuilder url = new StringBuilder(base).append(encodePath(request.path()));
        if (!request.query().isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            for (Map.Entry<String, List<String>> param : request.query().entrySet()) {
                String name = URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8);
                if (param.getValue().isEmpty()) {
                    query.add(name);
                }
                for (String value : param.getValue()) {
                    query.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
                }
            }
            url.append('?').append(query);
        }
        return URI.create(url.toString());
    }

    /**
     * Quotes characters that are not legal in a URI path, such as spaces and non-ASCII characters. Escapes already
     * present in the recorded path are kept.
     */
    static String encodePath(String path) {
        try {
            return new URI(null, null, path, null).toASCIIString();
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid request path " + path + ": " + ex.getMessage(), ex);
        }
    }

    static byte[] encodeBody(ExpectedRequest request) throws JsonProcessingException {
        if (!request.hasBody()) {
            return null;
        }
        if (request.body().isTextual() && !isJson(request.header("Content-Type"))) {
            return request.body().asText().getBytes(StandardCharsets.UTF_8);
        }
        return Json.mapper().writeValueAsBytes(request.body());
    }

    private static boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    private static Map<String, List<String>> stripPseudoHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!name.startsWith(":")) {
                result.put(name, values);
            }
        });
        return result;
    }
}
