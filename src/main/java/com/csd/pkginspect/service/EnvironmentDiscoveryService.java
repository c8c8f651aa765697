package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.DiscoveryException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.PackageKind;
import com.csd.pkginspect.model.RuntimeVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the installed runtimes under the configured root and the packages installed in each of them.
 * Everything is memoized for the lifetime of the instance.
 */
@Slf4j
@Service
public class EnvironmentDiscoveryService {

    static final Pattern RUNTIME_DIR_PATTERN = Pattern.compile("\\d+\\.\\d+");
    static final Pattern NOISE_PATTERN = Pattern.compile("pyobjc", Pattern.CASE_INSENSITIVE);
    static final String SITE_PACKAGES = "site-packages";

    static final Comparator<PackageDirectory> BY_NAME = Comparator
            .comparing((PackageDirectory d) -> d.getPackageName().toLowerCase(Locale.ROOT))
            .thenComparing(PackageDirectory::getPackageName);

    private final Path runtimeRoot;
    private final ComputeOnceCache<Path, Map<RuntimeVersion, Path>> runtimeCache = new ComputeOnceCache<>("runtimes");
    private final ComputeOnceCache<RuntimeVersion, List<Path>> sitePackagesCache = new ComputeOnceCache<>("site-packages");
    private final ComputeOnceCache<RuntimeVersion, List<PackageDirectory>> packagesCache = new ComputeOnceCache<>("packages");

    public EnvironmentDiscoveryService(
            @Value("${pkginspect.runtime-root:/Library/Frameworks/Python.framework/Versions}") String runtimeRoot) {
        this.runtimeRoot = Path.of(runtimeRoot);
    }

    public List<RuntimeVersion> listRuntimes() {
        return new ArrayList<>(runtimes().keySet());
    }

    public Path runtimeHome(RuntimeVersion runtime) {
        Path home = runtimes().get(runtime);
        if (home == null) {
            throw new NotFoundException("The specified runtime version (" + runtime
                    + ") is either not installed or cannot be found under " + runtimeRoot);
        }
        return home;
    }

    public List<Path> sitePackagesFor(RuntimeVersion runtime) {
        return sitePackagesCache.get(runtime, rt -> findSitePackages(runtimeHome(rt)));
    }

    /**
     * Installed packages of one runtime, sorted by name, computed once.
     */
    public List<PackageDirectory> packagesFor(RuntimeVersion runtime) {
        return packagesCache.get(runtime, this::scanPackages);
    }

    /**
     * Lazily lists the packages of one runtime. Descriptor directories come first so a later module
     * file with the same normalized name is dropped.
     */
    public Stream<PackageDirectory> streamPackages(RuntimeVersion runtime) {
        Set<String> seen = ConcurrentHashMap.newKeySet();
        return Stream.of(PackageKind.DESCRIPTOR_DIRECTORY, PackageKind.MODULE_FILE)
                .flatMap(kind -> sitePackagesFor(runtime).stream()
                        .flatMap(this::entriesOf)
                        .map(entry -> toPackageDirectory(runtime, entry))
                        .filter(Objects::nonNull)
                        .filter(dir -> dir.getKind() == kind))
                .filter(dir -> seen.add(dir.getNormalizedName()));
    }

    /**
     * Eager view over every runtime, in runtime order.
     */
    public Map<RuntimeVersion, List<PackageDirectory>> allPackages() {
        Map<RuntimeVersion, List<PackageDirectory>> all = new LinkedHashMap<>();
        for (RuntimeVersion runtime : listRuntimes()) {
            all.put(runtime, packagesFor(runtime));
        }
        return all;
    }

    protected List<PackageDirectory> scanPackages(RuntimeVersion runtime) {
        log.info("=== Scanning installed packages for runtime {} ===", runtime);
        try (Stream<PackageDirectory> packages = streamPackages(runtime)) {
            List<PackageDirectory> result = packages.sorted(BY_NAME).collect(Collectors.toList());
            log.info("Found {} packages for runtime {}", result.size(), runtime);
            return List.copyOf(result);
        } catch (UncheckedIOException e) {
            throw new DiscoveryException("Failed to list the packages installed for runtime " + runtime, e);
        }
    }

    private Map<RuntimeVersion, Path> runtimes() {
        return runtimeCache.get(runtimeRoot, this::scanRuntimes);
    }

    private Map<RuntimeVersion, Path> scanRuntimes(Path root) {
        if (!Files.isDirectory(root)) {
            throw new DiscoveryException("Runtime root " + root + " does not exist or is not a directory");
        }
        Map<RuntimeVersion, Path> found = new TreeMap<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .sorted()
                    .forEach(dir -> {
                        Matcher m = RUNTIME_DIR_PATTERN.matcher(dir.getFileName().toString());
                        if (m.find()) {
                            found.putIfAbsent(RuntimeVersion.of(m.group()), dir);
                        }
                    });
        } catch (IOException | UncheckedIOException e) {
            throw new DiscoveryException("Failed to list runtime root " + root, e);
        }
        if (found.isEmpty()) {
            throw new DiscoveryException("No runtime version directories were found under " + root);
        }
        log.info("Discovered runtimes {} under {}", found.keySet(), root);
        return found;
    }

    private List<Path> findSitePackages(Path home) {
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(home, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (SITE_PACKAGES.equals(String.valueOf(dir.getFileName()))) {
                        found.add(dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new DiscoveryException("Failed to walk runtime directory " + home, e);
        }
        found.sort(Comparator.naturalOrder());
        log.debug("site-packages under {}: {}", home, found);
        return List.copyOf(found);
    }

    private Stream<Path> entriesOf(Path sitePackages) {
        try {
            return Files.list(sitePackages).sorted();
        } catch (IOException e) {
            log.warn("Skipping unreadable site-packages {}: {}", sitePackages, e.getMessage());
            return Stream.empty();
        }
    }

    private PackageDirectory toPackageDirectory(RuntimeVersion runtime, Path entry) {
        try {
            String fileName = entry.getFileName().toString();
            if (NOISE_PATTERN.matcher(fileName).find()) {
                return null;
            }
            PackageKind kind = PackageKind.fromFileName(fileName);
            if (kind == null) {
                return null;
            }
            boolean shapeMatches = kind == PackageKind.DESCRIPTOR_DIRECTORY
                    ? Files.isDirectory(entry)
                    : Files.isRegularFile(entry);
            if (!shapeMatches) {
                return null;
            }
            String name = packageNameOf(fileName);
            return PackageDirectory.builder()
                    .runtime(runtime)
                    .packageName(name)
                    .normalizedName(normalize(name))
                    .path(entry)
                    .kind(kind)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Skipping package entry {}: {}", entry, e.getMessage());
            return null;
        }
    }

    /**
     * {@code requests-2.25.1.dist-info} gives {@code requests}, {@code six.py} gives {@code six}.
     */
    public static String packageNameOf(String fileName) {
        String name = fileName;
        PackageKind kind = PackageKind.fromFileName(fileName);
        if (kind != null) {
            name = name.substring(0, name.length() - kind.getSuffix().length());
        }
        return name.split("-", 2)[0];
    }

    public static String normalize(String packageName) {
        return packageName.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
    }
}
