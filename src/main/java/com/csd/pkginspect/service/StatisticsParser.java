package com.csd.pkginspect.service;

import com.csd.pkginspect.model.StatisticsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the ecosystem statistics card ({@code dl.detail-card}) of a package page into key/value pairs.
 */
@Slf4j
@Component
public class StatisticsParser {

    public static final List<String> STAT_KEYS = List.of(
            "Contributors",
            "Dependencies",
            "Dependent packages",
            "Dependent repositories",
            "Forks",
            "Repository size",
            "SourceRank",
            "Stars",
            "Total releases",
            "Watchers"
    );

    static final String CARD_SELECTOR = "dl.detail-card";

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern GROUPED_INTEGER = Pattern.compile("\\d{1,3}(,\\d{3})+");
    private static final Pattern SIZE = Pattern.compile("\\d+(\\.\\d+)?\\s*[A-Za-z]+");

    public StatisticsSnapshot parse(String packageName, String manager, String html) {
        List<String> tokens = tokens(html);
        Map<String, Object> values = new LinkedHashMap<>();

        int start = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (FuzzyMatcher.bestMatch(tokens.get(i), STAT_KEYS, FuzzyMatcher.LOOSE_THRESHOLD).isPresent()) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            log.warn("No statistics found for {} ({})", packageName, manager);
            return new StatisticsSnapshot(packageName, manager, values);
        }

        for (int i = start; i + 1 < tokens.size(); i += 2) {
            Optional<String> key = FuzzyMatcher.bestMatch(tokens.get(i), STAT_KEYS);
            if (key.isPresent()) {
                values.put(key.get(), convert(tokens.get(i + 1)));
            } else {
                log.debug("Dropping statistics pair '{}' = '{}'", tokens.get(i), tokens.get(i + 1));
            }
        }
        log.info("Parsed {} statistics for {} ({})", values.size(), packageName, manager);
        return new StatisticsSnapshot(packageName, manager, values);
    }

    static List<String> tokens(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        List<String> tokens = new ArrayList<>();
        for (Element card : doc.select(CARD_SELECTOR)) {
            for (Element child : card.children()) {
                String text = child.text().trim();
                if (!text.isEmpty()) {
                    tokens.add(text);
                }
            }
        }
        return tokens;
    }

    /**
     * {@code 42} and {@code 1,023} become {@link Long}, {@code 12.4 MB} becomes a
     * {@link com.csd.pkginspect.model.ByteSize}; anything else is returned as is.
     */
    static Object convert(String value) {
        String trimmed = value.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed);
        }
        if (GROUPED_INTEGER.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed.replace(",", ""));
        }
        if (SIZE.matcher(trimmed).matches()) {
            String unit = trimmed.replaceAll("[\\d.\\s]", "");
            if (ByteSizeConverter.isSizeUnit(unit) || "B".equalsIgnoreCase(unit) || "bytes".equalsIgnoreCase(unit)) {
                return ByteSizeConverter.fromString(trimmed);
            }
        }
        return trimmed;
    }
}
