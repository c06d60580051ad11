package com.collectvoice.recording.service;

import com.collectvoice.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.UUID;

@Component
public class RecordingFileOrganizer {

    private static final Logger log = LoggerFactory.getLogger(RecordingFileOrganizer.class);

    private final Path basePath;
    private final Path egressOutputDir;

    public RecordingFileOrganizer(AppProperties properties) {
        this.basePath = Path.of(properties.recording().basePath());
        this.egressOutputDir = Path.of(properties.recording().egressOutputDir());
    }

    public String datePath(LocalDate date) {
        return "%04d/%02d/%02d".formatted(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public String egressFilepath(String roomName, LocalDate date, long epochSeconds) {
        return "egress-recordings/" + datePath(date) + "/" + roomName + "_" + epochSeconds + ".mp4";
    }

    public String remoteKey(String prefix, LocalDate date, UUID callId) {
        return prefix + "/" + datePath(date) + "/" + callId + ".mp4";
    }

    public Path organize(String egressFilename, LocalDate date, UUID callId) {
        Path target = basePath.resolve(datePath(date)).resolve(callId + ".mp4");
        try {
            Files.createDirectories(target.getParent());
            if (egressFilename == null || egressFilename.isBlank()) {
                return target;
            }
            Path source = egressOutputDir.resolve(egressFilename);
            if (Files.exists(source)) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("Moved recording {} to {}", source, target);
            } else {
                log.warn("Recording output {} not found locally", source);
            }
            return target;
        } catch (IOException exception) {
            throw new IllegalStateException("Unable to organize recording for call " + callId, exception);
        }
    }
}
