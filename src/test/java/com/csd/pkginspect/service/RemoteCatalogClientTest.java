package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.RemoteNotFoundException;
import com.csd.pkginspect.exception.TransientNetworkException;
import com.csd.pkginspect.model.StatisticsSnapshot;
import com.csd.pkginspect.model.VersionHistory;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteCatalogClientTest {

    private MockWebServer server;
    private WorkerPool pool;
    private RemoteCatalogClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        pool = new WorkerPool(2, 30);
        baseUrl = server.url("/").toString();
        client = RuntimeFixtures.catalog(pool, baseUrl);
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.close();
        server.shutdown();
    }

    @Test
    void fetchesAndCachesHistory() throws Exception {
        server.enqueue(new MockResponse()
                .setBody(RuntimeFixtures.historyPage("Feb 1, 2022", "2.0.0", "Jan 1, 2021", "1.0.0"))
                .addHeader("Content-Type", "text/html"));

        VersionHistory history = client.fetchHistory("demo");
        assertEquals(2, history.size());
        assertSame(history, client.fetchHistory("demo"));
        assertEquals(List.of("2.0.0", "1.0.0"),
                client.streamHistory("demo").map(r -> r.getVersion()).collect(Collectors.toList()));

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertEquals("/project/demo/", request.getPath());
        assertEquals("pkg-inspect-test", request.getHeader("User-Agent"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void httpErrorCarriesBothUrls() {
        server.enqueue(new MockResponse().setResponseCode(404));

        RemoteNotFoundException e = assertThrows(RemoteNotFoundException.class, () -> client.fetchHistory("nosuchpkg"));
        assertEquals(baseUrl + "project/nosuchpkg/#history", e.getPackageUrl());
        assertEquals(baseUrl + "pypi/nosuchpkg", e.getStatsUrl());
    }

    @Test
    void failedFetchIsNotCached() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setBody(RuntimeFixtures.historyPage("Jan 1, 2021", "1.0.0")));

        assertThrows(RemoteNotFoundException.class, () -> client.fetchHistory("flaky"));
        assertEquals(1, client.fetchHistory("flaky").size());
    }

    @Test
    void fetchesStatisticsForResolvedManager() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "<dl class=\"detail-card\"><dt>Stars</dt><dd>10</dd><dt>Forks</dt><dd>2</dd></dl>"));

        StatisticsSnapshot stats = client.fetchStatistics("left-pad", "NPM");
        assertEquals("npm", stats.getManager());
        assertEquals(10L, stats.get("Stars"));
        assertEquals("/npm/left-pad", server.takeRequest(5, TimeUnit.SECONDS).getPath());
    }

    @Test
    void slowResponseTimesOut() {
        RemoteCatalogClient impatient = new RemoteCatalogClient(WebClient.builder(),
                new ReleaseHistoryParser(pool, 30), new StatisticsParser(),
                baseUrl + "project/{package}/", baseUrl + "{manager}/{package}", "pypi", 1, 10, "pkg-inspect-test");
        server.enqueue(new MockResponse()
                .setBody(RuntimeFixtures.historyPage("Jan 1, 2021", "1.0.0"))
                .setBodyDelay(3, TimeUnit.SECONDS));

        TransientNetworkException e = assertThrows(TransientNetworkException.class, () -> impatient.fetchHistory("slow"));
        assertEquals(baseUrl + "project/slow/", e.getUrl());
    }

    @Test
    void managerFallsBackToDefault() {
        assertEquals("pypi", client.resolveManager(null));
        assertEquals("pypi", client.resolveManager("pypy"));
        assertEquals("maven", client.resolveManager("Maven"));
        assertEquals("pypi", client.resolveManager("not-an-ecosystem"));
    }

    @Test
    void droppedConnectionIsRetried() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setBody(RuntimeFixtures.historyPage("Jan 1, 2021", "1.0.0")));

        assertEquals(1, client.fetchHistory("unsteady").size());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void onlyConnectionFailuresAreTransient() {
        URI uri = URI.create(baseUrl);
        assertTrue(RemoteCatalogClient.isTransient(
                new WebClientRequestException(new ConnectException("refused"), HttpMethod.GET, uri, new HttpHeaders())));
        assertTrue(RemoteCatalogClient.isTransient(
                new WebClientRequestException(new IOException("reset"), HttpMethod.GET, uri, new HttpHeaders())));
        assertFalse(RemoteCatalogClient.isTransient(
                new WebClientRequestException(new UnknownHostException("catalog.invalid"), HttpMethod.GET, uri, new HttpHeaders())));
        assertFalse(RemoteCatalogClient.isTransient(new IllegalStateException("not a request failure")));
    }
}
