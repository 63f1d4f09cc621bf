package io.xrdinfo.application.globalconf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xrdinfo.config.ClientSettings;
import io.xrdinfo.domain.error.ErrorKind;
import io.xrdinfo.domain.error.TrustException;
import io.xrdinfo.domain.error.XrdInfoException;
import io.xrdinfo.infrastructure.http.JdkHttpTransport;
import io.xrdinfo.infrastructure.time.SystemClockAdapter;
import io.xrdinfo.testutil.FixtureServer;
import io.xrdinfo.testutil.GlobalConfFixtures;
import io.xrdinfo.testutil.GlobalConfFixtures.DirectoryBuilder;
import io.xrdinfo.testutil.RecordingMetricsPort;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalConfLoaderTest {
  private final ClientSettings settings = ClientSettings.defaults();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final byte[] shared = GlobalConfFixtures.resource("/globalconf/shared-params-v2.xml");
  private FixtureServer server;

  @BeforeEach
  void startServer() throws Exception {
    server = FixtureServer.start();
  }

  @AfterEach
  void stopServer() {
    server.close();
  }

  private GlobalConfLoader loader() {
    JdkHttpTransport transport = new JdkHttpTransport(settings);
    return new GlobalConfLoader(
        new ConfigurationFetcher(transport, new DirectoryParser(), settings, metrics),
        new TrustVerifier(new SystemClockAdapter(), metrics),
        new SharedParamsParser(),
        settings,
        metrics);
  }

  private void serve(DirectoryBuilder builder) {
    server.route("/internalconf", 200, builder.contentType(), builder.body());
    server.route("/V2/20240514/shared-params.xml", 200, "text/xml", shared);
  }

  @Test
  void loadsVerifiedSharedParameters() throws Exception {
    serve(GlobalConfFixtures.directory().sharedParams(shared));

    LoadedConfiguration loaded = loader().load(GlobalConfFixtures.anchor(server.uri("/internalconf")));

    assertEquals(2, loaded.sharedParams().members().size());
    assertEquals("EE", loaded.configuration().instanceIdentifier());
    assertFalse(loaded.stale());
    assertEquals(1, metrics.count("globalconf.load.success"));
  }

  @Test
  void expiredDirectoryStillLoadsButIsStale() throws Exception {
    serve(GlobalConfFixtures.directory().expireDate(Instant.now().minusSeconds(60)).sharedParams(shared));

    LoadedConfiguration loaded = loader().load(GlobalConfFixtures.anchor(server.uri("/internalconf")));

    assertTrue(loaded.stale());
    assertEquals(2, loaded.sharedParams().members().size());
  }

  @Test
  void untrustedDirectoryIsNotReplacedByNextSource() throws Exception {
    FixtureServer second = FixtureServer.start();
    try {
      serve(GlobalConfFixtures.directory().signWith(GlobalConfFixtures.rogueKey()).sharedParams(shared));
      DirectoryBuilder good = GlobalConfFixtures.directory().sharedParams(shared);
      second.route("/internalconf", 200, good.contentType(), good.body());

      XrdInfoException ex = assertThrows(TrustException.class, () -> loader().load(
          GlobalConfFixtures.anchor(server.uri("/internalconf"), second.uri("/internalconf"))));

      assertEquals(ErrorKind.TRUST, ex.kind());
      assertTrue(second.requests().isEmpty());
      assertEquals(0, metrics.count("globalconf.load.success"));
    } finally {
      second.close();
    }
  }
}
