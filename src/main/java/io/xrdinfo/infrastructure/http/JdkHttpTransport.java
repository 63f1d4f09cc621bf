package io.xrdinfo.infrastructure.http;

import io.xrdinfo.application.port.HttpTransport;
import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.domain.error.ConnectionException;
import io.xrdinfo.domain.error.RequestTimeoutException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} on the JDK {@link HttpClient}.
 *
 * <p>Uses HTTP/1.1 without redirects. The connect timeout is the per-call timeout of the settings; each call also
 * carries its own request timeout.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

  private final HttpClient client;

  public JdkHttpTransport(ClientSettings settings) {
    Objects.requireNonNull(settings, "settings");
    HttpClient.Builder builder = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .connectTimeout(settings.timeout());
    settings.tls().ifPresent(tls -> builder.sslContext(SslContexts.create(tls)));
    this.client = builder.build();
  }

  JdkHttpTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public HttpReply execute(HttpCall call) throws RequestTimeoutException, ConnectionException {
    HttpRequest.Builder request = HttpRequest.newBuilder(call.uri()).timeout(call.timeout());
    for (Map.Entry<String, String> header : call.headers().entrySet()) {
      request.header(header.getKey(), header.getValue());
    }
    byte[] body = call.body();
    request.method(call.method(), body == null
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofByteArray(body));
    log.trace("{} {}", call.method(), call.uri());
    try {
      HttpResponse<byte[]> response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
      return new HttpReply(response.statusCode(), response.headers().map(), response.body());
    } catch (HttpTimeoutException ex) {
      throw new RequestTimeoutException(
          call.method() + " " + call.uri() + " timed out after " + call.timeout().toMillis() + " ms", ex);
    } catch (IOException ex) {
      throw new ConnectionException(call.method() + " " + call.uri() + " failed: " + describe(ex), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ConnectionException(call.method() + " " + call.uri() + " interrupted", ex);
    }
  }

  private static String describe(IOException ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
