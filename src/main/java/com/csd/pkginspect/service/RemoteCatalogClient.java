package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.exception.RemoteNotFoundException;
import com.csd.pkginspect.exception.TransientNetworkException;
import com.csd.pkginspect.model.ReleaseRecord;
import com.csd.pkginspect.model.StatisticsSnapshot;
import com.csd.pkginspect.model.VersionHistory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Client for the two remote package documents: the release history page and the ecosystem
 * statistics page. Both are fetched once per package (and manager) and kept for the session.
 */
@Service
@Slf4j
public class RemoteCatalogClient {

    /** Ecosystems the statistics site knows about. */
    public static final List<String> PACKAGE_MANAGERS = List.of(
            "npm", "Maven", "PyPI", "NuGet", "Go", "Packagist", "Rubygems", "Cargo", "CocoaPods", "Bower",
            "Pub", "CPAN", "CRAN", "Clojars", "conda", "Hackage", "Hex", "Meteor", "Homebrew", "Puppet",
            "Carthage", "SwiftPM", "Julia", "Elm", "Dub", "Racket", "Nimble", "Haxelib", "PureScript",
            "Alcatraz", "Inqlude"
    );

    private final WebClient webClient;
    private final ReleaseHistoryParser historyParser;
    private final StatisticsParser statisticsParser;
    private final String historyUrlTemplate;
    private final String statsUrlTemplate;
    private final String defaultManager;
    private final Duration timeout;
    private final Duration retryDelay;

    private final ComputeOnceCache<String, String> historyDocuments = new ComputeOnceCache<>("history-document");
    private final ComputeOnceCache<String, VersionHistory> histories = new ComputeOnceCache<>("history");
    private final ComputeOnceCache<String, StatisticsSnapshot> statistics = new ComputeOnceCache<>("statistics");

    public RemoteCatalogClient(WebClient.Builder webClientBuilder,
                               ReleaseHistoryParser historyParser,
                               StatisticsParser statisticsParser,
                               @Value("${pkginspect.remote.history-url:https://pypi.org/project/{package}/#history}") String historyUrlTemplate,
                               @Value("${pkginspect.remote.stats-url:https://libraries.io/{manager}/{package}}") String statsUrlTemplate,
                               @Value("${pkginspect.remote.default-manager:pypi}") String defaultManager,
                               @Value("${pkginspect.timeout-seconds:300}") long timeoutSeconds,
                               @Value("${pkginspect.remote.retry-delay-millis:500}") long retryDelayMillis,
                               @Value("${pkginspect.remote.user-agent:pkg-inspect}") String userAgent) {
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
        this.historyParser = historyParser;
        this.statisticsParser = statisticsParser;
        this.historyUrlTemplate = historyUrlTemplate;
        this.statsUrlTemplate = statsUrlTemplate;
        this.defaultManager = defaultManager.toLowerCase(Locale.ROOT);
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.retryDelay = Duration.ofMillis(retryDelayMillis);
    }

    public VersionHistory fetchHistory(String packageName) {
        String name = requireName(packageName);
        return histories.get(name, key -> historyParser.parse(key, historyDocument(key)));
    }

    /**
     * Lazy view over the release records. The document itself is still fetched once and shared with
     * {@link #fetchHistory}.
     */
    public Stream<ReleaseRecord> streamHistory(String packageName) {
        String name = requireName(packageName);
        return historyParser.stream(historyDocument(name));
    }

    public StatisticsSnapshot fetchStatistics(String packageName, String manager) {
        String name = requireName(packageName);
        String resolved = resolveManager(manager);
        return statistics.get(resolved + ":" + name, key -> {
            String html = fetch(statsUrl(name, resolved), name, resolved);
            return statisticsParser.parse(name, resolved, html);
        });
    }

    public String packageUrl(String packageName) {
        return historyUrlTemplate.replace("{package}", requireName(packageName));
    }

    public String statsUrl(String packageName, String manager) {
        return statsUrlTemplate
                .replace("{manager}", resolveManager(manager))
                .replace("{package}", requireName(packageName));
    }

    /**
     * Lower-cased ecosystem name closest to {@code manager}, or the configured default when nothing is close.
     */
    public String resolveManager(String manager) {
        if (StringUtils.isBlank(manager)) {
            return defaultManager;
        }
        return FuzzyMatcher.bestMatch(manager.trim(), PACKAGE_MANAGERS, FuzzyMatcher.LOOSE_THRESHOLD)
                .map(m -> m.toLowerCase(Locale.ROOT))
                .orElseGet(() -> {
                    log.warn("Unknown package manager '{}', falling back to {}", manager, defaultManager);
                    return defaultManager;
                });
    }

    private String historyDocument(String name) {
        return historyDocuments.get(name, key -> fetch(packageUrl(key), key, defaultManager));
    }

    private String fetch(String url, String packageName, String manager) {
        log.info("Fetching {}", url);
        return webClient.get()
                .uri(URI.create(url))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, retryDelay)
                        .filter(RemoteCatalogClient::isTransient)
                        .doBeforeRetry(signal -> log.warn("Connection to {} failed ({}), retry #{}",
                                url, signal.failure().getMessage(), signal.totalRetries() + 1)))
                .onErrorMap(WebClientResponseException.class, e -> {
                    log.error("Remote lookup for {} failed with HTTP {}", url, e.getStatusCode().value());
                    return new RemoteNotFoundException("The package (" + packageName + ") could not be fetched from " + url
                            + " (HTTP " + e.getStatusCode().value() + ")",
                            packageUrl(packageName), statsUrl(packageName, manager), e);
                })
                .onErrorMap(TimeoutException.class, e -> {
                    log.error("Remote lookup for {} timed out after {}s", url, timeout.toSeconds());
                    return new TransientNetworkException("Request to " + url + " timed out after "
                            + timeout.toSeconds() + "s", url, e);
                })
                .defaultIfEmpty("")
                .block();
    }

    // connection drops, resets and refusals; an unknown host will not heal by retrying
    static boolean isTransient(Throwable error) {
        if (!(error instanceof WebClientRequestException)) {
            return false;
        }
        Throwable cause = error.getCause();
        return cause instanceof IOException && !(cause instanceof UnknownHostException);
    }

    private static String requireName(String packageName) {
        if (StringUtils.isBlank(packageName)) {
            throw new InvalidArgumentException("A package name must be specified.");
        }
        return packageName.trim();
    }
}
