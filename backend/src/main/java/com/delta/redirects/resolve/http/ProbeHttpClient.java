package com.delta.redirects.resolve.http;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class ProbeHttpClient {
    private final ResolverProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public ProbeHttpClient(
        ResolverProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getProbe().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getPipeline().getBatchSize());
    }

    public HttpFetchResult probe(String url) {
        return probe(
            url,
            properties.getProbe().getRequestTimeoutSeconds(),
            properties.getProbe().getMaxRedirects()
        );
    }

    /**
     * GETs {@code url}, following up to {@code maxRedirects} redirects by hand. Any HTTP
     * status is a response; only transport failures leave {@code statusCode} at 0. When the
     * headers of a hop arrived before the transport failed, that hop's status and URI are kept.
     */
    public HttpFetchResult probe(String url, int timeoutSeconds, int maxRedirects) {
        Instant startedAt = Instant.now();
        URI current = normalizeUri(url);
        if (current == null || current.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        int redirects = 0;
        AtomicInteger headerStatus = new AtomicInteger();
        try {
            globalLimiter.acquire();
            acquired = true;
            while (true) {
                headerStatus.set(0);
                HttpRequest request = HttpRequest.newBuilder(current)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("User-Agent", properties.getUserAgent())
                    .header("Accept", "*/*")
                    .GET()
                    .build();
                HttpResponse<Void> response = sendWithDeadline(request, headerStatus, timeoutSeconds);
                int status = response.statusCode();
                Optional<String> location = response.headers().firstValue("Location");
                if (!isRedirect(status) || location.isEmpty()) {
                    return fetchResult(url, current, status, null, redirects, startedAt, null, null);
                }
                URI next = resolveLocation(current, location.get());
                if (next == null) {
                    return fetchResult(url, current, status, null, redirects, startedAt,
                        "invalid_redirect", "Unparseable Location header: " + location.get());
                }
                if (redirects >= maxRedirects) {
                    return fetchResult(url, current, status, null, redirects, startedAt,
                        "too_many_redirects", "Redirect limit " + maxRedirects + " reached");
                }
                redirects++;
                current = next;
            }
        } catch (HttpTimeoutException e) {
            return partialOrError(url, current, headerStatus.get(), redirects, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return partialOrError(url, current, headerStatus.get(), redirects, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return partialOrError(url, current, headerStatus.get(), redirects, startedAt, "http_error", describe(e));
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    // HttpRequest.timeout stops at the headers; the deadline here also bounds the body
    private HttpResponse<Void> sendWithDeadline(HttpRequest request, AtomicInteger headerStatus, int timeoutSeconds)
        throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<Void>> future = client.sendAsync(request, info -> {
            headerStatus.set(info.statusCode());
            return HttpResponse.BodySubscribers.discarding();
        });
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpTimeoutException("Request did not complete within " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IOException(cause);
        }
    }

    public HttpFetchResult postJson(String url, String jsonBody, String bearerToken, int timeoutSeconds) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody, StandardCharsets.UTF_8));
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken.trim());
        }
        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return fetchResult(url, response.uri(), response.statusCode(), response.body(), 0, startedAt, null, null);
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private URI resolveLocation(URI current, String location) {
        try {
            return current.resolve(new URI(location.trim()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    private HttpFetchResult partialOrError(
        String url,
        URI current,
        int headerStatus,
        int redirects,
        Instant startedAt,
        String code,
        String message
    ) {
        if (headerStatus > 0) {
            return fetchResult(url, current, headerStatus, null, redirects, startedAt, code, message);
        }
        return errorResult(url, startedAt, code, message);
    }

    private HttpFetchResult fetchResult(
        String url,
        URI finalUri,
        int status,
        String body,
        int redirects,
        Instant startedAt,
        String errorCode,
        String errorMessage
    ) {
        return new HttpFetchResult(
            url,
            finalUri,
            status,
            body,
            redirects,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            errorCode,
            errorMessage
        );
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            0,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return quoteIllegalCharacters(value);
        }
    }

    // raw spaces or non-ASCII path segments: let the multi-argument constructor quote them
    private URI quoteIllegalCharacters(String value) {
        try {
            URL parsed = new URL(value);
            return new URI(
                parsed.getProtocol(),
                parsed.getUserInfo(),
                parsed.getHost(),
                parsed.getPort(),
                parsed.getPath(),
                parsed.getQuery(),
                parsed.getRef()
            );
        } catch (MalformedURLException | URISyntaxException e) {
            return null;
        }
    }
}
