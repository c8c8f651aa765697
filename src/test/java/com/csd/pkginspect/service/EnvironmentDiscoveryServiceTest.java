package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.DiscoveryException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.PackageKind;
import com.csd.pkginspect.model.RuntimeVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentDiscoveryServiceTest {

    @TempDir
    Path root;

    @Test
    void listsRuntimesInVersionOrder() throws Exception {
        RuntimeFixtures.createLayout(root);
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());
        assertEquals(List.of(RuntimeVersion.of("3.8"), RuntimeVersion.of("3.12")), discovery.listRuntimes());
        assertEquals(root.resolve("3.12"), discovery.runtimeHome(RuntimeVersion.of("3.12")));
        assertThrows(NotFoundException.class, () -> discovery.runtimeHome(RuntimeVersion.of("2.7")));
    }

    @Test
    void findsSitePackagesAndSkipsNoise() throws Exception {
        RuntimeFixtures.createLayout(root);
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());

        List<Path> sites = discovery.sitePackagesFor(RuntimeVersion.of("3.8"));
        assertEquals(1, sites.size());
        assertTrue(sites.get(0).endsWith("site-packages"));

        List<String> names38 = discovery.packagesFor(RuntimeVersion.of("3.8")).stream()
                .map(PackageDirectory::getPackageName)
                .collect(Collectors.toList());
        assertEquals(List.of("six"), names38);
    }

    @Test
    void descriptorDirectoryWinsOverModuleFile() throws Exception {
        RuntimeFixtures.createLayout(root);
        Files.writeString(root.resolve("3.12/lib/python3.12/site-packages/requests.py"), "# shadow\n");
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());

        List<PackageDirectory> packages = discovery.packagesFor(RuntimeVersion.of("3.12"));
        assertEquals(List.of("requests", "six"),
                packages.stream().map(PackageDirectory::getPackageName).collect(Collectors.toList()));
        assertEquals(PackageKind.DESCRIPTOR_DIRECTORY, packages.get(0).getKind());
        assertEquals(PackageKind.MODULE_FILE, packages.get(1).getKind());
        assertSame(packages, discovery.packagesFor(RuntimeVersion.of("3.12")));
    }

    @Test
    void streamingMatchesEagerListing() throws Exception {
        RuntimeFixtures.createLayout(root);
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());
        long streamed = discovery.streamPackages(RuntimeVersion.of("3.12")).count();
        assertEquals(discovery.packagesFor(RuntimeVersion.of("3.12")).size(), streamed);
        assertEquals(2, discovery.allPackages().size());
    }

    @Test
    void missingRootFails() {
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.resolve("nope").toString());
        assertThrows(DiscoveryException.class, discovery::listRuntimes);
    }

    @Test
    void rootWithoutRuntimesFails() throws Exception {
        Files.createDirectories(root.resolve("Headers"));
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());
        assertThrows(DiscoveryException.class, discovery::listRuntimes);
    }

    @Test
    void packageNamesFromEntries() {
        assertEquals("requests", EnvironmentDiscoveryService.packageNameOf("requests-2.25.1.dist-info"));
        assertEquals("six", EnvironmentDiscoveryService.packageNameOf("six.py"));
        assertEquals("zope_interface", EnvironmentDiscoveryService.normalize("Zope.Interface"));
        assertEquals("typing_extensions", EnvironmentDiscoveryService.normalize("typing-extensions"));
    }
}
