package dev.fastapply.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.error.ErrorKind;
import dev.fastapply.error.QueueException;
import dev.fastapply.metrics.QueueMetrics;
import dev.fastapply.model.Automation;
import dev.fastapply.model.QueueEntry;
import dev.fastapply.model.QueueEntryStatus;
import dev.fastapply.model.QueueStats;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Automation worker reached over its JSON HTTP API.
 */
@Slf4j
@Component
public class HttpAutomationWorkerClient implements AutomationWorkerClient {

    private static final String AUTOMATIONS_PATH = "/api/v1/automations";
    private static final String AUTOMATION_URLS_PATH = AUTOMATIONS_PATH + "/{id}/urls";
    private static final String QUEUE_STATS_PATH = AUTOMATIONS_PATH + "/{id}/queue-stats";
    private static final int LIST_LIMIT = 100;

    private final WebClient webClient;
    private final QueueMetrics metrics;
    private final SwipeQueueProperties.Http http;

    public HttpAutomationWorkerClient(WebClient.Builder webClientBuilder, SwipeQueueProperties properties,
            QueueMetrics metrics) {
        this.http = properties.getHttp();
        this.metrics = metrics;

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(http.getTimeout());

        WebClient.Builder builder = webClientBuilder
                .baseUrl(properties.getWorkerBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);

        String apiToken = properties.getApiToken();
        if (apiToken != null && !apiToken.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiToken);
        } else {
            log.warn("No automation worker API token configured; requests are sent unauthenticated");
        }
        this.webClient = builder.build();
    }

    @Override
    public Mono<Automation> createAutomation(CreateAutomationRequest request) {
        Mono<Automation> call = webClient.post()
                .uri(AUTOMATIONS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(Automation.class);

        // Creation is not idempotent: only retry when the worker refused the request outright
        return timed("create_automation", call, this::isRateLimited);
    }

    @Override
    public Flux<Automation> findAutomations(String profileId) {
        Mono<AutomationListResponse> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(AUTOMATIONS_PATH)
                        .queryParam("applicationMode", CreateAutomationRequest.DIRECT_URLS)
                        .queryParam("isActive", true)
                        .queryParam("limit", LIST_LIMIT)
                        .build())
                .retrieve()
                .bodyToMono(AutomationListResponse.class);

        return timed("list_automations", call, this::isRetryable)
                .flatMapMany(response -> Flux.fromIterable(response.getData()))
                .filter(automation -> profileId.equals(automation.getProfileId())
                        && CreateAutomationRequest.DIRECT_URLS.equals(automation.getApplicationMode()));
    }

    @Override
    public Mono<AddUrlsResponse> addUrls(String automationId, AddUrlsRequest request) {
        Mono<AddUrlsResponse> call = webClient.post()
                .uri(AUTOMATION_URLS_PATH, automationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(AddUrlsResponse.class);

        return timed("add_urls", call, this::isRetryable)
                .doOnNext(response -> log.debug("Automation {} accepted {} URLs ({} duplicates)",
                        automationId, response.added(), response.duplicates()));
    }

    @Override
    public Mono<QueueStats> getQueueStats(String automationId) {
        Mono<QueueStats> call = webClient.get()
                .uri(QUEUE_STATS_PATH, automationId)
                .retrieve()
                .bodyToMono(QueueStats.class);

        return timed("queue_stats", call, this::isRetryable);
    }

    @Override
    public Flux<QueueEntry> getQueueEntries(String automationId, QueueEntryStatus status) {
        Mono<QueueEntryListResponse> call = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(AUTOMATION_URLS_PATH);
                    if (status != null) {
                        uriBuilder.queryParam("status", status.wireName());
                    }
                    return uriBuilder.build(automationId);
                })
                .retrieve()
                .bodyToMono(QueueEntryListResponse.class);

        return timed("queue_entries", call, this::isRetryable)
                .flatMapMany(response -> Flux.fromIterable(response.getData()));
    }

    /**
     * Apply timeout, bounded exponential backoff, latency metrics and error mapping to a call.
     */
    private <T> Mono<T> timed(String endpoint, Mono<T> call, Predicate<Throwable> retryable) {
        long start = System.currentTimeMillis();
        return call
                .timeout(http.getTimeout())
                .retryWhen(Retry.backoff(Math.max(0, http.getMaxAttempts() - 1), http.getInitialBackoff())
                        .maxBackoff(http.getMaxBackoff())
                        .filter(retryable)
                        .doBeforeRetry(signal -> log.warn("{} attempt {} failed: {}", endpoint,
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnError(e -> metrics.recordWorkerError(endpoint))
                .onErrorMap(e -> !(e instanceof QueueException), e -> toQueueException(endpoint, e))
                .doOnTerminate(() -> metrics.recordWorkerLatency(endpoint, System.currentTimeMillis() - start));
    }

    /**
     * Server errors, rate limiting, timeouts and connection failures are worth another attempt;
     * other client errors are not.
     */
    private boolean isRetryable(Throwable e) {
        if (e instanceof WebClientResponseException) {
            return ((WebClientResponseException) e).getStatusCode().is5xxServerError() || isRateLimited(e);
        }
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private boolean isRateLimited(Throwable e) {
        return e instanceof WebClientResponseException
                && statusOf(e) == HttpStatus.TOO_MANY_REQUESTS.value();
    }

    private QueueException toQueueException(String endpoint, Throwable e) {
        if (e instanceof WebClientResponseException) {
            int status = statusOf(e);
            if (status == HttpStatus.NOT_FOUND.value()) {
                return new QueueException(ErrorKind.STALE_PROFILE,
                        endpoint + ": automation no longer exists", e);
            }
            return new QueueException(ErrorKind.NETWORK_ERROR, endpoint + " failed with HTTP " + status, e);
        }
        if (e instanceof TimeoutException) {
            return new QueueException(ErrorKind.NETWORK_ERROR, endpoint + " timed out", e);
        }
        return new QueueException(ErrorKind.NETWORK_ERROR, endpoint + " failed: " + e.getMessage(), e);
    }

    private static int statusOf(Throwable e) {
        return ((WebClientResponseException) e).getStatusCode().value();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AutomationListResponse {
        private List<Automation> data = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class QueueEntryListResponse {
        private List<QueueEntry> data = new ArrayList<>();
    }
}
