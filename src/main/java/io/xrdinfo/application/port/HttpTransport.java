package io.xrdinfo.application.port;

import io.xrdinfo.domain.error.ConnectionException;
import io.xrdinfo.domain.error.RequestTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Port for single blocking HTTP exchanges.
 * <p><strong>Why:</strong> Configuration fetching and metadata requests share one transport that owns TLS setup and
 * timeouts, and tests replace it with canned replies.</p>
 * <p><strong>Contract:</strong> exactly one request per call, no retries, no redirects. Any HTTP status is returned as
 * a reply; only transport failures raise.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface HttpTransport {

  /**
   * Executes one request.
   *
   * @param call request description
   * @return response with any status code
   * @throws RequestTimeoutException when the call exceeds {@link HttpCall#timeout()}
   * @throws ConnectionException on connection, TLS or I/O failure
   */
  HttpReply execute(HttpCall call) throws RequestTimeoutException, ConnectionException;

  /**
   * Outgoing request.
   *
   * @param method HTTP method
   * @param uri absolute target URI
   * @param headers request headers
   * @param body request body, or {@code null} for none
   * @param timeout per-call timeout
   */
  record HttpCall(String method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
    public HttpCall {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(uri, "uri");
      headers = Map.copyOf(headers);
      body = body == null ? null : body.clone();
      Objects.requireNonNull(timeout, "timeout");
    }

    public static HttpCall get(URI uri, Map<String, String> headers, Duration timeout) {
      return new HttpCall("GET", uri, headers, null, timeout);
    }

    public static HttpCall post(URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
      return new HttpCall("POST", uri, headers, body, timeout);
    }

    @Override
    public byte[] body() {
      return body == null ? null : body.clone();
    }
  }

  /**
   * Received response.
   *
   * @param status HTTP status code
   * @param headers response headers keyed case-insensitively
   * @param body response body
   */
  record HttpReply(int status, Map<String, List<String>> headers, byte[] body) {
    public HttpReply {
      TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
      headers = Collections.unmodifiableMap(copy);
      body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
      return body.clone();
    }

    public boolean isSuccess() {
      return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
      List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
      return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public String bodyText() {
      return new String(body, StandardCharsets.UTF_8);
    }
  }
}
