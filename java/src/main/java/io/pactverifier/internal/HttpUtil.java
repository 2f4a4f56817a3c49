package io.pactverifier.internal;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Helper methods for issuing raw HTTP exchanges through the JDK client.
 */
public final class HttpUtil {

    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade"
    );

    private HttpUtil() {
    }

    public static HttpResponse<byte[]> send(
        HttpClient client,
        String method,
        URI uri,
        Map<String, String> headers,
        byte[] body,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        }

        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getValue() == null || isRestrictedHeader(header.getKey())) {
                    continue;
                }
                builder.header(header.getKey(), header.getValue());
            }
        }

        if (timeout != null) {
            builder.timeout(timeout);
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    /**
     * Builds the value of an {@code Authorization} header for HTTP basic authentication.
     */
    public static String basicAuth(String username, String password) {
        String credentials = username + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Headers the JDK client manages itself and rejects when set explicitly.
     */
    public static boolean isRestrictedHeader(String name) {
        return name != null && RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }
}
