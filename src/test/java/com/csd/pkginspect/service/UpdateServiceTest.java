package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.ReleaseRecord;
import com.csd.pkginspect.model.VersionHistory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UpdateServiceTest {

    private final UpdateService updateService = new UpdateService(null);

    private final VersionHistory history = new VersionHistory("demo", List.of(
            ReleaseRecord.of("Jan 1, 2021", "1.0.0"),
            ReleaseRecord.of("Feb 1, 2022", "2.0.0")));

    @Test
    void updatesAfterOlderVersion() {
        assertEquals(List.of("2.0.0"), updateService.updatesAfter(history, "1.0.0"));
    }

    @Test
    void noUpdatesAfterLatest() {
        assertTrue(updateService.updatesAfter(history, "2.0.0").isEmpty());
        assertTrue(updateService.updatesAfter(history, updateService.latest(history).getVersion()).isEmpty());
    }

    @Test
    void unknownCurrentVersionIsNotFound() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> updateService.updatesAfter(history, "1.5.0"));
        assertTrue(e.getMessage().contains("'1.5.0' was not found in 'demo'"));
    }

    @Test
    void duplicatesAndPreReleasesAreIgnored() {
        VersionHistory noisy = new VersionHistory("demo", List.of(
                ReleaseRecord.of("Jan 1, 2021", "1.0.0"),
                ReleaseRecord.of("Jan 9, 2021", "1.0.0"),
                ReleaseRecord.of("Jan 5, 2022", "2.0.0rc1"),
                ReleaseRecord.of("Feb 1, 2022", "2.0.0"),
                ReleaseRecord.of("Mar 1, 2022", "2.1.0")));
        assertEquals(List.of("2.0.0", "2.1.0"), updateService.updatesAfter(noisy, "1.0.0"));
        assertTrue(updateService.isLatest(noisy, "2.1"));
        assertFalse(updateService.isLatest(noisy, "2.0.0"));
    }

    @Test
    void backportReleasedLastHasNoUpdates() {
        VersionHistory backported = new VersionHistory("demo", List.of(
                ReleaseRecord.of("Jan 1, 2021", "1.9.0"),
                ReleaseRecord.of("Feb 1, 2022", "2.0.0"),
                ReleaseRecord.of("Mar 1, 2022", "1.9.5")));
        String latest = updateService.latest(backported).getVersion();
        assertEquals("1.9.5", latest);
        assertTrue(updateService.isLatest(backported, latest));
        assertTrue(updateService.updatesAfter(backported, latest).isEmpty());
        assertEquals(List.of("1.9.5", "2.0.0"), updateService.updatesAfter(backported, "1.9.0"));
    }
}
