package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.ByteSize;
import com.csd.pkginspect.model.PackageDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.stream.Stream;

/**
 * Local facts about an installed package directory: when it was installed and how much disk it takes.
 */
@Slf4j
@Service
public class PackageMetricsService {

    public LocalDateTime dateInstalled(PackageDirectory dir) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(dir.getPath(), BasicFileAttributes.class);
            FileTime time = attrs.creationTime() != null ? attrs.creationTime() : attrs.lastModifiedTime();
            return LocalDateTime.ofInstant(time.toInstant(), ZoneId.systemDefault());
        } catch (IOException e) {
            throw new NotFoundException("Failed to read the install date of " + dir.getPath(), e);
        }
    }

    public ByteSize totalSize(PackageDirectory dir) {
        Path root = dir.getPath();
        try (Stream<Path> files = Files.walk(root)) {
            long total = files.filter(Files::isRegularFile).mapToLong(PackageMetricsService::sizeOf).sum();
            log.debug("{} occupies {} bytes", root, total);
            return ByteSizeConverter.fromBytes(total);
        } catch (IOException | UncheckedIOException e) {
            throw new NotFoundException("Failed to measure the size of " + root, e);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
