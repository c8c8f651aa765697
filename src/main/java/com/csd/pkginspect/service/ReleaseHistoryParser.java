package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.DocumentFormatException;
import com.csd.pkginspect.model.ReleaseRecord;
import com.csd.pkginspect.model.VersionHistory;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Extracts (date, version) release records from a release-history page. Each {@code div.release}
 * block yields at most one record; date and version are always taken from the same block.
 */
@Slf4j
@Component
public class ReleaseHistoryParser {

    public static final Pattern DATE_PATTERN = Pattern.compile("[A-Z][a-z]{2}\\s\\d{1,2},\\s\\d{4}");

    static final String RELEASE_BLOCK = "div.release";
    static final String VERSION_SELECTOR = ".release__version";
    static final String DATE_SELECTOR = "time, .release__version-date";

    private final WorkerPool workerPool;
    private final Duration extractionTimeout;

    public ReleaseHistoryParser(WorkerPool workerPool,
                                @Value("${pkginspect.long-timeout-seconds:900}") long extractionTimeoutSeconds) {
        this.workerPool = workerPool;
        this.extractionTimeout = Duration.ofSeconds(extractionTimeoutSeconds);
    }

    /**
     * Parses every release block on the worker pool and keeps document order.
     */
    public VersionHistory parse(String packageName, String html) {
        List<Element> blocks = releaseBlocks(html);
        List<ReleaseRecord> records = workerPool.map(blocks, ReleaseHistoryParser::extract, extractionTimeout)
                .stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        log.info("Parsed {} releases for {} out of {} release blocks", records.size(), packageName, blocks.size());
        return new VersionHistory(packageName, records);
    }

    /**
     * Same records as {@link #parse}, extracted one block at a time as the stream is consumed.
     */
    public Stream<ReleaseRecord> stream(String html) {
        return releaseBlocks(html).stream()
                .map(ReleaseHistoryParser::extract)
                .filter(Objects::nonNull);
    }

    private static List<Element> releaseBlocks(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        Elements blocks = doc.select(RELEASE_BLOCK);
        log.debug("Found {} release blocks", blocks.size());
        return blocks;
    }

    /**
     * One record for the block, or null when the block has no release version or is a pre-release.
     */
    static ReleaseRecord extract(Element block) {
        String versionText = Optional.ofNullable(block.selectFirst(VERSION_SELECTOR))
                .map(Element::text)
                .orElse(block.text());
        if (VersionUtil.isPreRelease(versionText)) {
            log.debug("Skipping pre-release block '{}'", versionText);
            return null;
        }
        Optional<String> version = VersionUtil.findVersion(versionText);
        if (version.isEmpty()) {
            return null;
        }

        String dateText = Optional.ofNullable(block.selectFirst(DATE_SELECTOR))
                .map(Element::text)
                .orElse(block.text());
        Matcher date = DATE_PATTERN.matcher(dateText);
        if (!date.find()) {
            date = DATE_PATTERN.matcher(block.text());
            if (!date.find()) {
                throw new DocumentFormatException("Release block for version " + version.get()
                        + " carries no release date: '" + block.text() + "'");
            }
        }
        try {
            return ReleaseRecord.of(date.group(), version.get());
        } catch (IllegalArgumentException e) {
            throw new DocumentFormatException("Release block for version " + version.get()
                    + " has an unreadable date '" + date.group() + "'", e);
        }
    }
}
