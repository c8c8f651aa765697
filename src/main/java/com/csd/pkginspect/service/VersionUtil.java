package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import org.apache.maven.artifact.versioning.ComparableVersion;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class VersionUtil {

    /** Recognizes a release version token such as {@code 1.5} or {@code 4.25.1}. */
    public static final Pattern VERSION_PATTERN = Pattern.compile("\\d+\\.\\d+(\\.\\d+)?");

    // captures the whole dotted run so 1.2.3.4 is not cut to 1.2.3
    private static final Pattern VERSION_TOKEN = Pattern.compile("\\d+\\.\\d+(?:\\.\\d+)*");

    public static final Pattern PRE_RELEASE_PATTERN =
            Pattern.compile("(beta|dev|pre[-_ ]?release|rc)", Pattern.CASE_INSENSITIVE);

    public static final String MIN_VERSION = "0.0.0";

    private VersionUtil() {}

    public static int compare(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return new ComparableVersion(a.trim()).compareTo(new ComparableVersion(b.trim()));
    }

    public static ComparableVersion parse(String version) {
        if (version == null || version.isBlank() || !VERSION_TOKEN.matcher(version).find()) {
            throw new InvalidArgumentException("The specified version '" + version + "' is not a valid version format to parse.");
        }
        return new ComparableVersion(version.trim());
    }

    /**
     * First version token inside free text, e.g. {@code 2.25.1} out of {@code requests-2.25.1.dist-info}.
     */
    public static Optional<String> findVersion(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = VERSION_TOKEN.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    public static boolean looksLikeVersion(String text) {
        return text != null && VERSION_TOKEN.matcher(text.trim()).matches();
    }

    /**
     * True for text carrying a pre-release marker, either a keyword ({@code rc}, {@code dev}, {@code beta},
     * {@code pre-release}) or a qualifier glued onto the numeric part ({@code 2.0.0a1}).
     */
    public static boolean isPreRelease(String text) {
        if (text == null) {
            return false;
        }
        if (PRE_RELEASE_PATTERN.matcher(text).find()) {
            return true;
        }
        Matcher m = VERSION_TOKEN.matcher(text);
        return m.find() && m.end() < text.length() && Character.isLetter(text.charAt(m.end()));
    }
}
