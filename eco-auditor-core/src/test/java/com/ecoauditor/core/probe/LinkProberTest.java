package com.ecoauditor.core.probe;

import com.ecoauditor.core.util.CancellationSignal;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Probes against a local HTTP server.
 */
class LinkProberTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private final AtomicInteger errorRequests = new AtomicInteger();
    private final CountDownLatch holdReceived = new CountDownLatch(1);

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/ok", exchange -> respond(exchange, 200));
        server.createContext("/missing", exchange -> respond(exchange, 404));
        server.createContext("/error", exchange -> {
            errorRequests.incrementAndGet();
            respond(exchange, 500);
        });
        server.createContext("/get-only", exchange ->
            respond(exchange, "HEAD".equals(exchange.getRequestMethod()) ? 405 : 200));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", "/ok");
            respond(exchange, 301);
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200);
        });
        server.createContext("/hold", exchange -> {
            holdReceived.countDown();
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200);
        });
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void probe_reachableAndFailingUrls_recordsOutcomePerUrl() {
        // Given
        ProbeSettings settings = new ProbeSettings(4, 1_000, 0, 0, 10_000);

        // When
        ProbeResults results;
        try (LinkProber prober = new LinkProber(settings)) {
            results = prober.probe(List.of(baseUrl + "/ok", baseUrl + "/missing", baseUrl + "/moved", baseUrl + "/ok"),
                CancellationSignal.create());
        }

        // Then
        assertThat(results.outcomes()).hasSize(3);
        assertThat(results.get(baseUrl + "/ok").isReachable()).isTrue();
        assertThat(results.get(baseUrl + "/moved").statusCode()).isEqualTo(301);
        assertThat(results.get(baseUrl + "/moved").isReachable()).isTrue();
        assertThat(results.get(baseUrl + "/missing").describe()).isEqualTo("HTTP 404");
        assertThat(results.interrupted()).isFalse();
    }

    @Test
    void probe_serverError_isRetriedThenMarkedExhausted() {
        // Given
        ProbeSettings settings = new ProbeSettings(2, 1_000, 2, 10, 10_000);

        // When
        ProbeOutcome outcome;
        try (LinkProber prober = new LinkProber(settings)) {
            outcome = prober.probe(List.of(baseUrl + "/error"), CancellationSignal.create()).get(baseUrl + "/error");
        }

        // Then
        assertThat(errorRequests.get()).isEqualTo(3);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.retriesExhausted()).isTrue();
        assertThat(outcome.describe()).isEqualTo("HTTP 500 (failed after 3 attempts)");
    }

    @Test
    void linkCheck_okErrorAndSilentUrlsTogether_recordsEachOutcomeWithinBudget() {
        // Given
        int timeoutMs = 300;
        int budgetMs = 2_000;
        ProbeSettings settings = new ProbeSettings(3, timeoutMs, 2, 10, budgetMs);
        long start = System.currentTimeMillis();

        // When
        ProbeResults results;
        try (LinkProber prober = new LinkProber(settings)) {
            results = prober.probe(List.of(baseUrl + "/ok", baseUrl + "/error", baseUrl + "/slow"),
                CancellationSignal.create());
        }
        long elapsed = System.currentTimeMillis() - start;

        // Then
        assertThat(results.outcomes()).hasSize(3);
        assertThat(results.get(baseUrl + "/ok").statusCode()).isEqualTo(200);
        ProbeOutcome error = results.get(baseUrl + "/error");
        assertThat(error.statusCode()).isEqualTo(500);
        assertThat(error.retriesExhausted()).isTrue();
        assertThat(results.get(baseUrl + "/slow").status()).isEqualTo(ProbeStatus.TIMEOUT);
        assertThat(results.interrupted()).isFalse();
        assertThat(elapsed).isLessThanOrEqualTo(budgetMs + timeoutMs);
    }

    @Test
    void linkCheck_cancelledWhileInFlight_abandonsRunningAndQueuedRequests() throws Exception {
        // Given
        ProbeSettings settings = new ProbeSettings(1, 5_000, 0, 0, 10_000);
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture<Void> canceller = CompletableFuture.runAsync(() -> cancelOnceHeld(signal));
        long start = System.currentTimeMillis();

        // When
        ProbeResults results;
        try (LinkProber prober = new LinkProber(settings)) {
            results = prober.probe(List.of(baseUrl + "/hold", baseUrl + "/missing", baseUrl + "/ok"), signal);
        }
        canceller.get(5, TimeUnit.SECONDS);

        // Then
        assertThat(System.currentTimeMillis() - start).isLessThan(2_500);
        assertThat(results.interrupted()).isTrue();
        assertThat(results.outcomes().values())
            .hasSize(3)
            .allSatisfy(outcome -> {
                assertThat(outcome.status()).isEqualTo(ProbeStatus.TIMEOUT);
                assertThat(outcome.attempts()).isZero();
                assertThat(outcome.detail()).isEqualTo("audit cancelled");
            });
    }

    @Test
    void probe_headRejected_fallsBackToGet() {
        // Given
        ProbeSettings settings = new ProbeSettings(1, 1_000, 0, 0, 10_000);

        // When
        ProbeOutcome outcome;
        try (LinkProber prober = new LinkProber(settings)) {
            outcome = prober.probe(List.of(baseUrl + "/get-only"), CancellationSignal.create())
                .get(baseUrl + "/get-only");
        }

        // Then
        assertThat(outcome.statusCode()).isEqualTo(200);
    }

    @Test
    void probe_slowServer_recordsTimeoutWithoutRetrying() {
        // Given
        ProbeSettings settings = new ProbeSettings(2, 300, 2, 10, 10_000);
        long start = System.currentTimeMillis();

        // When
        ProbeOutcome outcome;
        try (LinkProber prober = new LinkProber(settings)) {
            outcome = prober.probe(List.of(baseUrl + "/slow"), CancellationSignal.create()).get(baseUrl + "/slow");
        }

        // Then
        assertThat(outcome.status()).isEqualTo(ProbeStatus.TIMEOUT);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(System.currentTimeMillis() - start).isLessThan(2_500);
    }

    @Test
    void probe_budgetExhausted_abandonsPendingProbes() {
        // Given
        ProbeSettings settings = new ProbeSettings(2, 5_000, 0, 0, 400);
        long start = System.currentTimeMillis();

        // When
        ProbeResults results;
        try (LinkProber prober = new LinkProber(settings)) {
            results = prober.probe(List.of(baseUrl + "/slow", baseUrl + "/ok"), CancellationSignal.create());
        }

        // Then
        assertThat(System.currentTimeMillis() - start).isLessThan(2_500);
        assertThat(results.get(baseUrl + "/ok").isReachable()).isTrue();
        ProbeOutcome slow = results.get(baseUrl + "/slow");
        assertThat(slow.status()).isEqualTo(ProbeStatus.TIMEOUT);
        assertThat(slow.detail()).isEqualTo("probe budget exhausted");
        assertThat(results.interrupted()).isFalse();
    }

    @Test
    void probe_cancelledSignal_marksResultsInterrupted() {
        // Given
        ProbeSettings settings = new ProbeSettings(2, 1_000, 0, 0, 10_000);
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        // When
        ProbeResults results;
        try (LinkProber prober = new LinkProber(settings)) {
            results = prober.probe(List.of(baseUrl + "/ok", baseUrl + "/missing"), signal);
        }

        // Then
        assertThat(results.interrupted()).isTrue();
        assertThat(results.outcomes().values())
            .hasSize(2)
            .allSatisfy(outcome -> {
                assertThat(outcome.status()).isEqualTo(ProbeStatus.TIMEOUT);
                assertThat(outcome.attempts()).isZero();
            });
    }

    @Test
    void probe_malformedUrl_isRecordedWithoutRequest() {
        // Given
        ProbeSettings settings = new ProbeSettings(1, 1_000, 0, 0, 10_000);

        // When
        ProbeOutcome outcome;
        try (LinkProber prober = new LinkProber(settings)) {
            outcome = prober.probe(List.of("http//broken"), CancellationSignal.create()).get("http//broken");
        }

        // Then
        assertThat(outcome.status()).isEqualTo(ProbeStatus.MALFORMED_URL);
        assertThat(outcome.isReachable()).isFalse();
    }

    @Test
    void probe_noUrls_returnsEmptyResults() {
        try (LinkProber prober = new LinkProber(new ProbeSettings(1, 1_000, 0, 0, 1_000))) {
            assertThat(prober.probe(List.of(), CancellationSignal.create()).outcomes()).isEmpty();
        }
    }

    private void cancelOnceHeld(CancellationSignal signal) {
        try {
            if (holdReceived.await(5, TimeUnit.SECONDS)) {
                signal.cancel();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void respond(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }
}
