package com.csd.pkginspect.service;

import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.RuntimeVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleIntrospectorTest {

    @TempDir
    Path root;

    @Test
    void followsTopLevelToPackageInit() throws Exception {
        RuntimeFixtures.createLayout(root);
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());
        PackageDirectory requests = discovery.packagesFor(RuntimeVersion.of("3.12")).get(0);

        ModuleIntrospector introspector = new ModuleIntrospector();
        assertEquals("requests", introspector.topLevelName(requests));
        assertTrue(introspector.sourceFile(requests).orElseThrow().endsWith("requests/__init__.py"));
        assertEquals("Requests HTTP Library", introspector.docstring(requests).orElseThrow());
        assertTrue(introspector.sourceCode(requests).orElseThrow().contains("import urllib3"));
    }

    @Test
    void moduleFileIsItsOwnSource() throws Exception {
        RuntimeFixtures.createLayout(root);
        EnvironmentDiscoveryService discovery = new EnvironmentDiscoveryService(root.toString());
        PackageDirectory six = discovery.packagesFor(RuntimeVersion.of("3.8")).get(0);

        ModuleIntrospector introspector = new ModuleIntrospector();
        assertEquals(six.getPath(), introspector.sourceFile(six).orElseThrow());
        assertEquals("Python 2 and 3 compatibility utilities", introspector.docstring(six).orElseThrow());
    }

    @Test
    void docstringMustLeadTheModule() {
        assertTrue(ModuleIntrospector.leadingDocstring("import os\n\"\"\"late\"\"\"\n").isEmpty());
        assertEquals("single", ModuleIntrospector.leadingDocstring("#!/usr/bin/env python\n'''single'''\n").orElseThrow());
        assertTrue(ModuleIntrospector.leadingDocstring("\n\n").isEmpty());
    }
}
