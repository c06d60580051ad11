package com.collectvoice.recording.service;

import com.collectvoice.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingFileOrganizerTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 1);

    @TempDir
    Path workDir;

    @Test
    void pathsAreDatedAndKeyedByCall() {
        RecordingFileOrganizer organizer = new RecordingFileOrganizer(TestFixtures.properties(workDir));
        UUID callId = UUID.fromString("2b1f6c1e-7a4e-4d0b-9a51-3f0f1f9b8c11");

        assertThat(organizer.egressFilepath("outbound-1555-abc", DAY, 1_740_823_200L))
                .isEqualTo("egress-recordings/2025/03/01/outbound-1555-abc_1740823200.mp4");
        assertThat(organizer.remoteKey("recordings", DAY, callId))
                .isEqualTo("recordings/2025/03/01/2b1f6c1e-7a4e-4d0b-9a51-3f0f1f9b8c11.mp4");
    }

    @Test
    void egressOutputIsMovedIntoDatedDirectory() throws Exception {
        RecordingFileOrganizer organizer = new RecordingFileOrganizer(TestFixtures.properties(workDir));
        UUID callId = UUID.randomUUID();
        Path source = workDir.resolve("egress/room_1.mp4");
        Files.createDirectories(source.getParent());
        Files.write(source, new byte[] {1, 2, 3});

        Path target = organizer.organize("room_1.mp4", DAY, callId);

        assertThat(target).isEqualTo(workDir.resolve("recordings/2025/03/01/" + callId + ".mp4"));
        assertThat(target).exists().hasBinaryContent(new byte[] {1, 2, 3});
        assertThat(source).doesNotExist();
    }

    @Test
    void missingEgressOutputLeavesNoFile() {
        RecordingFileOrganizer organizer = new RecordingFileOrganizer(TestFixtures.properties(workDir));

        Path target = organizer.organize("missing.mp4", DAY, UUID.randomUUID());

        assertThat(target).doesNotExist();
        assertThat(target.getParent()).isDirectory();
    }
}
