package com.lumis.invoiceingest.infrastructure.http;

import com.lumis.invoiceingest.application.InvoiceIngestionService;
import com.lumis.invoiceingest.config.AppProperties;
import com.lumis.invoiceingest.exception.FetchFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieves a DGI confirmation page and reports where it finally came from.
 * <p>
 * The whole retrieval, every redirect hop and the body read included, runs against one
 * deadline ({@code app.fetch.deadline}). The socket read timeout only bounds a single read,
 * so a server trickling bytes is cut off here instead.
 */
@Component
public class RestTemplateDocumentFetcher implements InvoiceIngestionService.DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateDocumentFetcher.class);

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final int READ_CHUNK = 8192;

    private final RestTemplate restTemplate;
    private final AppProperties.Fetch config;

    public RestTemplateDocumentFetcher(@Qualifier("invoicePortalRestTemplate") RestTemplate restTemplate,
                                       AppProperties props) {
        this.restTemplate = restTemplate;
        this.config = props.getFetch();
    }

    private record Hop(HttpStatusCode status, URI location, MediaType contentType, byte[] body) {}

    @Override
    public FetchedDocument fetch(String url) {
        URI current = toUri(url);
        Set<URI> visited = new HashSet<>();
        long deadline = System.nanoTime() + config.getDeadline().toNanos();

        for (int hop = 0; hop <= config.getMaxRedirects(); hop++) {
            if (!visited.add(current)) {
                throw new FetchFailedException(url, "redirect loop at " + current);
            }
            checkDeadline(url, deadline);

            Hop response;
            try {
                log.debug("GET {} (hop {})", current, hop);
                response = restTemplate.execute(current, HttpMethod.GET, this::applyBrowserHeaders,
                        r -> readHop(url, r, deadline));
            } catch (RestClientException e) {
                log.warn("Fetching {} failed: {}", current, e.getMessage());
                throw new FetchFailedException(url, "request to " + current + " failed", e);
            }
            if (response == null) {
                throw new FetchFailedException(url, "no response from " + current);
            }

            HttpStatusCode status = response.status();
            if (status.is3xxRedirection()) {
                if (response.location() == null) {
                    throw new FetchFailedException(url, "HTTP " + status.value() + " without Location header");
                }
                current = current.resolve(response.location());
                continue;
            }
            if (!status.is2xxSuccessful()) {
                throw new FetchFailedException(url, "HTTP " + status.value() + " from " + current);
            }

            String body = decode(url, response);
            String finalUrl = current.toString();
            FetchedDocument document = new FetchedDocument(body, finalUrl, url);
            if (document.redirected()) {
                log.info("Invoice URL redirected: {} -> {}", url, finalUrl);
            } else {
                log.debug("Invoice URL fetched without redirect: {}", url);
            }
            return document;
        }
        throw new FetchFailedException(url, "more than " + config.getMaxRedirects() + " redirects");
    }

    private void applyBrowserHeaders(ClientHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        headers.set(HttpHeaders.USER_AGENT, config.getUserAgent());
        headers.set(HttpHeaders.ACCEPT, ACCEPT);
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, config.getAcceptLanguage());
    }

    private Hop readHop(String url, ClientHttpResponse response, long deadline) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        HttpHeaders headers = response.getHeaders();
        if (!status.is2xxSuccessful()) {
            return new Hop(status, headers.getLocation(), null, null);
        }
        MediaType contentType = headers.getContentType();
        if (contentType != null && !isText(contentType)) {
            throw new FetchFailedException(url, "unexpected content type " + contentType);
        }
        return new Hop(status, null, contentType, readBody(url, response.getBody(), deadline));
    }

    private byte[] readBody(String url, InputStream in, long deadline) throws IOException {
        long limit = config.getMaxBodySize().toBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_CHUNK];
        int read;
        try {
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                if (out.size() > limit) {
                    throw new FetchFailedException(url, "body larger than " + config.getMaxBodySize());
                }
                checkDeadline(url, deadline);
            }
        } catch (FetchFailedException e) {
            // Closing the response would otherwise drain the rest of the body first
            try {
                in.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return out.toByteArray();
    }

    private void checkDeadline(String url, long deadline) {
        if (System.nanoTime() - deadline >= 0) {
            log.warn("Fetching {} exceeded its deadline of {} ms", url, config.getDeadline().toMillis());
            throw new FetchFailedException(url, "deadline of " + config.getDeadline().toMillis() + " ms exceeded");
        }
    }

    private static String decode(String url, Hop response) {
        byte[] bytes = response.body();
        if (bytes == null || bytes.length == 0) {
            throw new FetchFailedException(url, "empty body");
        }
        MediaType contentType = response.contentType();
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        String body = new String(bytes, charset);
        if (body.isBlank()) {
            throw new FetchFailedException(url, "empty body");
        }
        return body;
    }

    private static boolean isText(MediaType type) {
        return "text".equals(type.getType())
                || List.of(MediaType.APPLICATION_XHTML_XML, MediaType.APPLICATION_XML)
                .stream().anyMatch(type::isCompatibleWith);
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            // Scanned QR URLs sometimes carry unescaped characters
            try {
                return UriComponentsBuilder.fromHttpUrl(url.trim()).encode().build().toUri();
            } catch (IllegalArgumentException nested) {
                throw new FetchFailedException(url, "malformed URL", nested);
            }
        }
    }
}
