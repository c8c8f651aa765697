package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.PackageDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers questions about the importable module behind an installed package: where its source lives,
 * the source text, and its leading docstring.
 */
@Slf4j
@Component
public class ModuleIntrospector {

    static final String TOP_LEVEL_FILE = "top_level.txt";

    private static final Pattern DOCSTRING = Pattern.compile("[rRuU]?(\"\"\"|''')(.*?)\\1", Pattern.DOTALL);

    /**
     * Importable top-level name: first line of {@code top_level.txt} when present, otherwise the package name.
     */
    public String topLevelName(PackageDirectory dir) {
        if (dir.isDescriptorDirectory()) {
            Path topLevel = dir.getPath().resolve(TOP_LEVEL_FILE);
            if (Files.isRegularFile(topLevel)) {
                try {
                    List<String> lines = Files.readAllLines(topLevel, StandardCharsets.UTF_8);
                    for (String line : lines) {
                        if (!line.isBlank()) {
                            return line.trim();
                        }
                    }
                } catch (IOException e) {
                    throw new NotFoundException("Failed to read " + topLevel, e);
                }
            }
        }
        return dir.getPackageName();
    }

    public Optional<Path> sourceFile(PackageDirectory dir) {
        if (!dir.isDescriptorDirectory()) {
            return Optional.of(dir.getPath());
        }
        String name = topLevelName(dir);
        Path sitePackages = dir.getSitePackages();
        Path packageInit = sitePackages.resolve(name).resolve("__init__.py");
        if (Files.isRegularFile(packageInit)) {
            return Optional.of(packageInit);
        }
        Path module = sitePackages.resolve(name + ".py");
        if (Files.isRegularFile(module)) {
            return Optional.of(module);
        }
        log.debug("No module source found for {} under {}", name, sitePackages);
        return Optional.empty();
    }

    public Optional<String> sourceCode(PackageDirectory dir) {
        return sourceFile(dir).map(this::read);
    }

    public Optional<String> docstring(PackageDirectory dir) {
        return sourceCode(dir).flatMap(ModuleIntrospector::leadingDocstring);
    }

    static Optional<String> leadingDocstring(String source) {
        // skip leading comment and blank lines
        int start = 0;
        for (String line : source.split("\n", -1)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                start += line.indexOf(trimmed.charAt(0));
                break;
            }
            start += line.length() + 1;
        }
        if (start >= source.length()) {
            return Optional.empty();
        }
        Matcher m = DOCSTRING.matcher(source);
        m.region(start, source.length());
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(m.group(2).strip());
    }

    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NotFoundException("Failed to read module source " + file, e);
        }
    }
}
