package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.DocumentFormatException;
import com.csd.pkginspect.model.ReleaseRecord;
import com.csd.pkginspect.model.VersionHistory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ReleaseHistoryParserTest {

    private static final String HISTORY = """
            <html><body>
            <div class="release-timeline">
              <div class="release">
                <p class="release__version">3.0.0rc1 <span class="badge">pre-release</span></p>
                <p class="release__version-date"><time datetime="2023-03-01T00:00:00">Mar 1, 2023</time></p>
              </div>
              <div class="release">
                <p class="release__version">2.0.0</p>
                <p class="release__version-date"><time datetime="2022-02-01T00:00:00">Feb 1, 2022</time></p>
              </div>
              <div class="release">
                <p>yanked upload</p>
              </div>
              <div class="release">
                <p class="release__version">1.0.0</p>
                <p class="release__version-date"><time datetime="2021-01-01T00:00:00">Jan 1, 2021</time></p>
              </div>
            </div>
            </body></html>
            """;

    private WorkerPool pool;
    private ReleaseHistoryParser parser;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(2, 30);
        parser = new ReleaseHistoryParser(pool, 30);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void pairsDateAndVersionPerBlockAndSkipsPreReleases() {
        VersionHistory history = parser.parse("demo", HISTORY);
        assertEquals(List.of(
                new ReleaseRecord(LocalDate.of(2022, 2, 1), "2.0.0"),
                new ReleaseRecord(LocalDate.of(2021, 1, 1), "1.0.0")), history.getRecords());
    }

    @Test
    void streamYieldsSameRecordsLazily() {
        List<String> versions = parser.stream(HISTORY).map(ReleaseRecord::getVersion).collect(Collectors.toList());
        assertEquals(List.of("2.0.0", "1.0.0"), versions);
    }

    @Test
    void blockWithoutVersionMarkupFallsBackToBlockText() {
        String html = "<div class=\"release\">1.4.2 released Apr 12, 2020</div>";
        VersionHistory history = parser.parse("demo", html);
        assertEquals(1, history.size());
        assertEquals("1.4.2", history.getRecords().get(0).getVersion());
        assertEquals(LocalDate.of(2020, 4, 12), history.getRecords().get(0).getDate());
    }

    @Test
    void versionWithoutDateFailsLoudly() {
        String html = "<div class=\"release\"><p class=\"release__version\">1.0.0</p></div>";
        assertThrows(DocumentFormatException.class, () -> parser.parse("demo", html));
    }

    @Test
    void emptyDocumentGivesEmptyHistory() {
        assertTrue(parser.parse("demo", "<html></html>").isEmpty());
        assertTrue(parser.parse("demo", null).isEmpty());
    }
}
