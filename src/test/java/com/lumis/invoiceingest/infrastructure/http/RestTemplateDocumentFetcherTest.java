package com.lumis.invoiceingest.infrastructure.http;

import com.lumis.invoiceingest.Fixtures;
import com.lumis.invoiceingest.application.InvoiceIngestionService.DocumentFetcher.FetchedDocument;
import com.lumis.invoiceingest.config.AppProperties;
import com.lumis.invoiceingest.config.RestTemplateConfig;
import com.lumis.invoiceingest.exception.FetchFailedException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.unit.DataSize;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RestTemplateDocumentFetcherTest {

    private static final MediaType HTML_UTF8 = new MediaType("text", "html", StandardCharsets.UTF_8);
    private static final String FINAL_URL =
            "https://dgi-fep.mef.gob.pa/Consultas/FacturasPorCUFE?chFE=" + Fixtures.CUFE;

    private AppProperties props;
    private MockRestServiceServer server;
    private RestTemplateDocumentFetcher fetcher;

    private HttpServer portal;
    private ExecutorService portalThreads;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        props = new AppProperties();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        fetcher = new RestTemplateDocumentFetcher(restTemplate, props);
    }

    @AfterEach
    void stopPortal() {
        if (portal != null) {
            portal.stop(0);
            portalThreads.shutdownNow();
        }
    }

    /** A local portal and a fetcher using the real, non-mocked portal client. */
    private RestTemplateDocumentFetcher startPortal(AppProperties portalProps) throws IOException {
        portal = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        portalThreads = Executors.newCachedThreadPool();
        portal.setExecutor(portalThreads);
        portal.start();
        RestTemplate client = new RestTemplateConfig().invoicePortalRestTemplate(new RestTemplateBuilder(), portalProps);
        return new RestTemplateDocumentFetcher(client, portalProps);
    }

    private String portalUrl(String path) {
        return "http://127.0.0.1:" + portal.getAddress().getPort() + path;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static AppProperties shortDeadline() {
        AppProperties portalProps = new AppProperties();
        portalProps.getFetch().setConnectTimeout(Duration.ofSeconds(2));
        portalProps.getFetch().setReadTimeout(Duration.ofSeconds(2));
        portalProps.getFetch().setDeadline(Duration.ofSeconds(1));
        return portalProps;
    }

    @Test
    void shouldReturnBodyAndSameUrlWithoutRedirect() {
        server.expect(requestTo(Fixtures.QR_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.ACCEPT_LANGUAGE, props.getFetch().getAcceptLanguage()))
                .andExpect(header(HttpHeaders.USER_AGENT, props.getFetch().getUserAgent()))
                .andRespond(withSuccess("<h4>FACTURA ELECTRÓNICA</h4>", HTML_UTF8));

        FetchedDocument document = fetcher.fetch(Fixtures.QR_URL);

        assertThat(document.body()).contains("FACTURA ELECTRÓNICA");
        assertThat(document.finalUrl()).isEqualTo(Fixtures.QR_URL);
        assertThat(document.redirected()).isFalse();
        server.verify();
    }

    @Test
    void shouldFollowRelativeRedirectAndReportFinalUrl() {
        server.expect(requestTo(Fixtures.QR_URL))
                .andRespond(withStatus(HttpStatus.FOUND)
                        .location(URI.create("/Consultas/FacturasPorCUFE?chFE=" + Fixtures.CUFE)));
        server.expect(requestTo(FINAL_URL))
                .andRespond(withSuccess("<h4>FACTURA</h4>", HTML_UTF8));

        FetchedDocument document = fetcher.fetch(Fixtures.QR_URL);

        assertThat(document.finalUrl()).isEqualTo(FINAL_URL);
        assertThat(document.requestedUrl()).isEqualTo(Fixtures.QR_URL);
        assertThat(document.redirected()).isTrue();
        server.verify();
    }

    @Test
    void shouldFailOnRedirectWithoutLocation() {
        server.expect(requestTo(Fixtures.QR_URL)).andRespond(withStatus(HttpStatus.MOVED_PERMANENTLY));

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("without Location");
    }

    @Test
    void shouldStopAfterMaxRedirects() {
        props.getFetch().setMaxRedirects(1);
        server.expect(requestTo("https://dgi-fep.mef.gob.pa/a"))
                .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("https://dgi-fep.mef.gob.pa/b")));
        server.expect(requestTo("https://dgi-fep.mef.gob.pa/b"))
                .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("https://dgi-fep.mef.gob.pa/c")));

        assertThatThrownBy(() -> fetcher.fetch("https://dgi-fep.mef.gob.pa/a"))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("more than 1 redirects");
    }

    @Test
    void shouldDetectRedirectLoop() {
        server.expect(requestTo("https://dgi-fep.mef.gob.pa/a"))
                .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("https://dgi-fep.mef.gob.pa/b")));
        server.expect(requestTo("https://dgi-fep.mef.gob.pa/b"))
                .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("https://dgi-fep.mef.gob.pa/a")));

        assertThatThrownBy(() -> fetcher.fetch("https://dgi-fep.mef.gob.pa/a"))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("redirect loop");
    }

    @Test
    void shouldFailOnServerError() {
        server.expect(requestTo(Fixtures.QR_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOfSatisfying(FetchFailedException.class,
                        e -> assertThat(e.getUrl()).isEqualTo(Fixtures.QR_URL))
                .hasMessageStartingWith("Fetch failed: ")
                .hasMessageContaining("500");
    }

    @Test
    void shouldFailOnTimeout() {
        server.expect(requestTo(Fixtures.QR_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("Read timed out");
    }

    @Test
    void shouldRejectNonTextBody() {
        server.expect(requestTo(Fixtures.QR_URL))
                .andRespond(withSuccess(new byte[]{(byte) 0x89, 'P', 'N', 'G'}, MediaType.IMAGE_PNG));

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("content type");
    }

    @Test
    void shouldRejectEmptyBody() {
        server.expect(requestTo(Fixtures.QR_URL)).andRespond(withSuccess("   ", HTML_UTF8));

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("empty body");
    }

    @Test
    void shouldRejectBodyLargerThanLimit() {
        props.getFetch().setMaxBodySize(DataSize.ofBytes(16));
        server.expect(requestTo(Fixtures.QR_URL)).andRespond(withSuccess("x".repeat(100), HTML_UTF8));

        assertThatThrownBy(() -> fetcher.fetch(Fixtures.QR_URL))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("body larger than");
    }

    @Test
    void shouldGiveUpOnBodyTricklingPastDeadline() throws IOException {
        RestTemplateDocumentFetcher realFetcher = startPortal(shortDeadline());
        portal.createContext("/slow", exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, 20);
            try (OutputStream out = exchange.getResponseBody()) {
                for (int i = 0; i < 20; i++) {
                    out.write('x');
                    out.flush();
                    pause(250);
                }
            } catch (IOException e) {
                // client hung up
            }
        });

        long started = System.currentTimeMillis();
        assertThatThrownBy(() -> realFetcher.fetch(portalUrl("/slow")))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("deadline of 1000 ms exceeded");

        // every single read stays well under the 2s read timeout, only the overall deadline stops it
        assertThat(System.currentTimeMillis() - started).isLessThan(4000);
    }

    @Test
    void shouldApplyOneDeadlineAcrossRedirectHops() throws IOException {
        RestTemplateDocumentFetcher realFetcher = startPortal(shortDeadline());
        for (int i = 1; i <= 3; i++) {
            String next = "/hop" + (i + 1);
            portal.createContext("/hop" + i, exchange -> {
                pause(600);
                exchange.getResponseHeaders().set("Location", next);
                exchange.sendResponseHeaders(302, -1);
                exchange.close();
            });
        }
        portal.createContext("/hop4", exchange -> {
            byte[] page = "<h4>FACTURA</h4>".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, page.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(page);
            }
        });

        assertThatThrownBy(() -> realFetcher.fetch(portalUrl("/hop1")))
                .isInstanceOf(FetchFailedException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    void shouldFetchFromRealPortalWithinDeadline() throws IOException {
        RestTemplateDocumentFetcher realFetcher = startPortal(shortDeadline());
        portal.createContext("/ok", exchange -> {
            byte[] page = "<h4>FACTURA ELECTRÓNICA</h4>".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, page.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(page);
            }
        });

        FetchedDocument document = realFetcher.fetch(portalUrl("/ok"));

        assertThat(document.body()).contains("FACTURA ELECTRÓNICA");
        assertThat(document.redirected()).isFalse();
    }
}
