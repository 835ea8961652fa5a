package com.ecoauditor.core.probe;

import com.ecoauditor.core.util.CancellationSignal;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Concurrent reachability checks for external URLs.
 *
 * <p>Each unique URL is probed at most once per run by a bounded worker pool. A probe sends
 * {@code HEAD} and falls back to {@code GET} when the server rejects the method.
 * Connection errors and 5xx answers are retried with linear backoff; 4xx answers, timeouts
 * and malformed URLs are recorded immediately.
 *
 * <p>The whole run is bounded by {@link ProbeSettings#budgetMs()}: when the budget elapses,
 * or the run is cancelled, in-flight calls are cancelled and every URL without an outcome is
 * recorded as {@link ProbeStatus#TIMEOUT}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (LinkProber prober = new LinkProber(ProbeSettings.from(config))) {
 *     ProbeResults results = prober.probe(urls, CancellationSignal.create());
 *     results.outcomes().forEach((url, outcome) -> ...);
 * }
 * }</pre>
 */
public class LinkProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LinkProber.class);

    private static final String USER_AGENT = "eco-auditor/1.0 (link check)";

    private final ProbeSettings settings;
    private final OkHttpClient client;

    public LinkProber(ProbeSettings settings) {
        this.settings = settings;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(settings.timeoutMs(), TimeUnit.MILLISECONDS)
            .readTimeout(settings.timeoutMs(), TimeUnit.MILLISECONDS)
            .callTimeout(settings.timeoutMs(), TimeUnit.MILLISECONDS)
            .followRedirects(false)
            .followSslRedirects(false)
            .retryOnConnectionFailure(false)
            .build();
    }

    /**
     * Probes every URL once.
     *
     * @param urls URLs to probe; duplicates are ignored
     * @param cancellation external cancellation signal
     * @return outcome for every requested URL
     */
    public ProbeResults probe(Collection<String> urls, CancellationSignal cancellation) {
        SortedSet<String> unique = new TreeSet<>(urls);
        if (unique.isEmpty()) {
            return ProbeResults.empty();
        }

        log.info("Probing {} URLs (concurrency: {}, timeout: {} ms, retries: {}, budget: {} ms)",
            unique.size(), settings.concurrency(), settings.timeoutMs(), settings.retries(), settings.budgetMs());

        ConcurrentMap<String, ProbeOutcome> outcomes = new ConcurrentHashMap<>();
        Set<Call> inFlight = ConcurrentHashMap.newKeySet();
        AtomicBoolean aborted = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(settings.concurrency(), unique.size()), new ProbeThreadFactory());

        Runnable abort = () -> {
            aborted.set(true);
            pool.shutdownNow();
            inFlight.forEach(Call::cancel);
        };
        cancellation.onCancel(abort);

        boolean budgetExhausted = false;
        try {
            for (String url : unique) {
                if (cancellation.isCancelled()) {
                    break;
                }
                pool.execute(() -> probeOne(url, outcomes, inFlight, aborted));
            }
            pool.shutdown();
            if (!pool.awaitTermination(settings.budgetMs(), TimeUnit.MILLISECONDS)) {
                budgetExhausted = true;
                log.warn("Probe budget of {} ms exhausted; abandoning {} pending probes",
                    settings.budgetMs(), unique.size() - outcomes.size());
                abort.run();
            }
        } catch (RejectedExecutionException e) {
            log.debug("Probe submission stopped: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort.run();
        } finally {
            cancellation.removeListener(abort);
        }

        String reason = cancellation.isCancelled() ? "audit cancelled"
            : budgetExhausted ? "probe budget exhausted" : "probe abandoned";
        for (String url : unique) {
            outcomes.putIfAbsent(url, ProbeOutcome.timeout(url, 0, reason));
        }

        ProbeResults results = new ProbeResults(new TreeMap<>(outcomes), cancellation.isCancelled());
        if (log.isDebugEnabled()) {
            results.outcomes().forEach((url, outcome) -> log.debug("  {} -> {}", url, outcome.describe()));
        }
        long dead = results.outcomes().values().stream().filter(outcome -> !outcome.isReachable()).count();
        log.info("Probed {} URLs: {} reachable, {} failing", unique.size(), unique.size() - dead, dead);
        return results;
    }

    private void probeOne(String url, Map<String, ProbeOutcome> outcomes, Set<Call> inFlight,
                          AtomicBoolean aborted) {
        HttpUrl target = HttpUrl.parse(url);
        if (target == null) {
            outcomes.putIfAbsent(url, ProbeOutcome.malformed(url, "not an absolute http(s) URL"));
            return;
        }

        int attempt = 0;
        while (true) {
            attempt++;
            if (aborted.get() || Thread.currentThread().isInterrupted()) {
                return;
            }
            ProbeOutcome outcome = attempt(url, target, attempt, inFlight, aborted);
            if (outcome == null) {
                // Aborted by the budget or by the cancellation signal.
                return;
            }
            if (!outcome.isTransient()) {
                outcomes.putIfAbsent(url, outcome);
                return;
            }
            if (attempt > settings.retries()) {
                outcomes.putIfAbsent(url, settings.retries() > 0 ? outcome.exhausted() : outcome);
                return;
            }
            log.debug("Transient failure for {} ({}); retry {} of {}",
                url, outcome.describe(), attempt, settings.retries());
            try {
                Thread.sleep((long) attempt * settings.retryBackoffMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private ProbeOutcome attempt(String url, HttpUrl target, int attempt, Set<Call> inFlight, AtomicBoolean aborted) {
        try {
            int code = execute(target, "HEAD", inFlight, aborted);
            if (code == 405 || code == 501) {
                code = execute(target, "GET", inFlight, aborted);
            }
            return ProbeOutcome.responded(url, code, attempt);
        } catch (CancelledProbeException e) {
            return null;
        } catch (InterruptedIOException e) {
            return ProbeOutcome.timeout(url, attempt, "no response within " + settings.timeoutMs() + " ms");
        } catch (IOException e) {
            return ProbeOutcome.connectionError(url, attempt, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private int execute(HttpUrl target, String method, Set<Call> inFlight, AtomicBoolean aborted) throws IOException {
        Request request = new Request.Builder()
            .url(target)
            .method(method, null)
            .header("User-Agent", USER_AGENT)
            .build();
        Call call = client.newCall(request);
        inFlight.add(call);
        try (Response response = call.execute()) {
            return response.code();
        } catch (IOException e) {
            // The call timeout also cancels the call, so only an abort of the run counts here.
            if (aborted.get()) {
                throw new CancelledProbeException();
            }
            throw e;
        } finally {
            inFlight.remove(call);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static final class CancelledProbeException extends IOException {
        CancelledProbeException() {
            super("probe cancelled");
        }
    }

    private static final class ProbeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "link-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
