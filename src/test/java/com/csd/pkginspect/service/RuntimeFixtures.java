package com.csd.pkginspect.service;

import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Synthetic runtime root shared by the service tests:
 * runtime 3.8 has {@code six} and a pyobjc entry, runtime 3.12 has {@code requests 2.25.1} and {@code six}.
 */
final class RuntimeFixtures {

    static final String REQUESTS_METADATA = String.join("\n",
            "Metadata-Version: 2.1",
            "Name: requests",
            "Version: 2.25.1",
            "Summary: Python HTTP for Humans.",
            "Home-page: https://requests.readthedocs.io",
            "Author: Kenneth Reitz",
            "License: Apache 2.0",
            "Platform: UNKNOWN",
            "Classifier: Programming Language :: Python",
            "Classifier: License :: OSI Approved :: Apache Software License",
            "Requires-Python: >=2.7",
            "Requires-Dist: idna (<3,>=2.5)",
            "",
            "Requests is an elegant and simple HTTP library.",
            "Version: 9.9.9",
            "");

    static final String REQUESTS_INIT = String.join("\n",
            "# -*- coding: utf-8 -*-",
            "",
            "\"\"\"",
            "Requests HTTP Library",
            "\"\"\"",
            "",
            "import urllib3",
            "");

    private RuntimeFixtures() {}

    static Path createLayout(Path root) throws IOException {
        Path site38 = Files.createDirectories(root.resolve("3.8/lib/python3.8/site-packages"));
        Files.writeString(site38.resolve("six.py"), "\"\"\"Python 2 and 3 compatibility utilities\"\"\"\n", StandardCharsets.UTF_8);
        Files.createDirectories(site38.resolve("pyobjc_core-9.0.dist-info"));

        Path site312 = Files.createDirectories(root.resolve("3.12/lib/python3.12/site-packages"));
        Path distInfo = Files.createDirectories(site312.resolve("requests-2.25.1.dist-info"));
        Files.writeString(distInfo.resolve("METADATA"), REQUESTS_METADATA, StandardCharsets.UTF_8);
        Files.writeString(distInfo.resolve("top_level.txt"), "requests\n", StandardCharsets.UTF_8);
        Files.writeString(distInfo.resolve("INSTALLER"), "pip\n", StandardCharsets.UTF_8);
        Path module = Files.createDirectories(site312.resolve("requests"));
        Files.writeString(module.resolve("__init__.py"), REQUESTS_INIT, StandardCharsets.UTF_8);
        Files.writeString(site312.resolve("six.py"), "import sys\n", StandardCharsets.UTF_8);

        // not a runtime directory
        Files.createDirectories(root.resolve("Current"));
        return root;
    }

    static RemoteCatalogClient catalog(WorkerPool pool, String baseUrl) {
        return new RemoteCatalogClient(WebClient.builder(),
                new ReleaseHistoryParser(pool, 30),
                new StatisticsParser(),
                baseUrl + "project/{package}/#history",
                baseUrl + "{manager}/{package}",
                "pypi",
                5,
                10,
                "pkg-inspect-test");
    }

    // unresolvable host, so an accidental request fails at once instead of being retried
    static RemoteCatalogClient offlineCatalog(WorkerPool pool) {
        return catalog(pool, "http://catalog.invalid/");
    }

    static String historyPage(String... releases) {
        StringBuilder html = new StringBuilder("<html><body><div class=\"release-timeline\">");
        for (int i = 0; i + 1 < releases.length; i += 2) {
            html.append("<div class=\"release\">")
                    .append("<p class=\"release__version\">").append(releases[i + 1]).append("</p>")
                    .append("<p class=\"release__version-date\"><time>").append(releases[i]).append("</time></p>")
                    .append("</div>");
        }
        return html.append("</div></body></html>").toString();
    }
}
