package com.providergateway.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.providergateway.config.GlobalExceptionHandler;
import com.providergateway.error.ErrorKind;
import com.providergateway.error.GatewayException;
import com.providergateway.model.ChatModels;
import com.providergateway.model.HealthStatus;
import com.providergateway.model.ProbeTrigger;
import com.providergateway.model.Provider;
import com.providergateway.model.ProviderDefinition;
import com.providergateway.model.TestResult;
import com.providergateway.service.CacheService;
import com.providergateway.service.HealthMonitor;
import com.providergateway.service.ProviderRegistry;
import com.providergateway.service.RateLimitService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final CacheService cacheService;
    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    /**
     * Liveness.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "healthy",
                "timestamp", Instant.now().toString(),
                "service", "provider-gateway"
        )));
    }

    /**
     * Liveness plus the health state of every provider.
     */
    @GetMapping("/health/detailed")
    public Mono<ResponseEntity<Map<String, Object>>> detailedHealth() {
        Map<String, Object> providers = new LinkedHashMap<>();
        for (Provider provider : registry.getProviders()) {
            HealthStatus status = healthMonitor.getStatus(provider.getId());
            providers.put(provider.getSlug(), Map.of(
                    "enabled", provider.isEnabled(),
                    "type", provider.getType().getWireName(),
                    "state", status.getState().wireName(),
                    "consecutiveFailures", status.getConsecutiveFailures()));
        }
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "healthy",
                "timestamp", Instant.now().toString(),
                "service", "provider-gateway",
                "providers", providers
        )));
    }

    /**
     * Models that currently have a routable provider.
     */
    @GetMapping("/v1/models")
    public Mono<ResponseEntity<ChatModels.ModelList>> listModels() {
        List<ChatModels.ModelInfo> models = registry.listRoutableModels().stream()
                .filter(candidate -> healthMonitor.isRoutable(candidate.provider().getId()))
                .map(candidate -> ChatModels.ModelInfo.builder()
                        .id(candidate.mapping().getExternalId())
                        .created(candidate.provider().getCreatedAt() != null
                                ? candidate.provider().getCreatedAt().getEpochSecond() : null)
                        .ownedBy(candidate.provider().getSlug())
                        .maxTokens(candidate.mapping().getMaxTokens())
                        .contextWindow(candidate.mapping().getContextWindow())
                        .build())
                .collect(Collectors.toList());
        return Mono.just(ResponseEntity.ok(ChatModels.ModelList.builder().data(models).build()));
    }

    @GetMapping("/admin/providers")
    public List<ProviderView> listProviders() {
        return registry.getProviders().stream()
                .map(this::view)
                .collect(Collectors.toList());
    }

    @PostMapping("/admin/providers")
    public ResponseEntity<ProviderView> createProvider(@RequestBody ProviderDefinition definition) {
        Provider provider = registry.register(definition);
        log.info("Provider {} registered through the admin API", provider.getSlug());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(provider));
    }

    @GetMapping("/admin/providers/{slug}")
    public ProviderView getProvider(@PathVariable String slug) {
        return view(find(slug));
    }

    @PutMapping("/admin/providers/{slug}")
    public ProviderView updateProvider(@PathVariable String slug, @RequestBody ProviderDefinition definition) {
        return view(registry.update(slug, definition));
    }

    /**
     * Removal waits for in-flight requests; 202 means it is still pending.
     */
    @DeleteMapping("/admin/providers/{slug}")
    public ResponseEntity<Map<String, Object>> deleteProvider(@PathVariable String slug) {
        Provider provider = find(slug);
        boolean removed = registry.remove(slug);
        return ResponseEntity.status(removed ? HttpStatus.OK : HttpStatus.ACCEPTED).body(Map.of(
                "id", provider.getId(),
                "status", removed ? "removed" : "pending_removal"
        ));
    }

    @PostMapping("/admin/providers/{slug}/enable")
    public ProviderView enableProvider(@PathVariable String slug) {
        return view(registry.setEnabled(slug, true));
    }

    @PostMapping("/admin/providers/{slug}/disable")
    public ProviderView disableProvider(@PathVariable String slug) {
        return view(registry.setEnabled(slug, false));
    }

    /**
     * Manual probe; joins a probe already running for the provider.
     */
    @PostMapping("/admin/providers/{slug}/test")
    public Mono<TestResult> testProvider(@PathVariable String slug) {
        return healthMonitor.probe(slug, ProbeTrigger.MANUAL);
    }

    @GetMapping("/admin/providers/{slug}/tests")
    public List<TestResult> testHistory(@PathVariable String slug) {
        return healthMonitor.getHistory(find(slug).getId());
    }

    @GetMapping("/admin/health")
    public Map<String, Object> healthOverview() {
        Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        for (Provider provider : registry.getProviders()) {
            statuses.put(provider.getSlug(), healthMonitor.getStatus(provider.getId()));
        }
        return Map.of(
                "statistics", healthMonitor.getStatistics(),
                "providers", statuses
        );
    }

    @DeleteMapping("/admin/cache")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache(
            @RequestParam(defaultValue = "*") String pattern) {
        return cacheService.invalidateCache(pattern)
                .map(count -> ResponseEntity.ok(Map.of(
                        "status", "success",
                        "cleared", count
                )));
    }

    @DeleteMapping("/admin/ratelimit/{identifier}")
    public ResponseEntity<Map<String, Object>> resetRateLimit(@PathVariable String identifier) {
        boolean existed = rateLimitService.resetLimit(identifier);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "existed", existed
        ));
    }

    @GetMapping("/admin/ratelimit/{identifier}")
    public ResponseEntity<Map<String, Object>> getRateLimitInfo(@PathVariable String identifier) {
        RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identifier);
        return ResponseEntity.ok(Map.of(
                "limit", info.limit(),
                "remaining", info.remaining(),
                "resetSeconds", info.resetSeconds()
        ));
    }

    /**
     * Invalid provider configuration is the caller's fault here, unlike on the client API.
     */
    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ChatModels.ErrorResponse> handleAdminFailure(GatewayException ex) {
        HttpStatusCode status = ex.getKind() == ErrorKind.CONFIGURATION_INVALID
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : ex.getKind().getStatus();
        return GlobalExceptionHandler.toResponse(ex, status);
    }

    private Provider find(String slug) {
        return registry.getProvider(slug)
                .orElseThrow(() -> new GatewayException(ErrorKind.NOT_FOUND, "Unknown provider " + slug,
                        "Provider not found: " + slug, null, null, null));
    }

    private ProviderView view(Provider provider) {
        return ProviderView.from(provider, healthMonitor.getStatus(provider.getId()),
                registry.isPendingRemoval(provider.getId()), objectMapper);
    }
}
