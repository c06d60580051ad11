package com.collectvoice.calls.service;

import com.collectvoice.calls.capture.FrameSample;
import com.collectvoice.config.AppProperties;
import com.collectvoice.disposition.model.DispositionEvent;
import com.collectvoice.disposition.model.DispositionSnapshot;
import com.collectvoice.disposition.model.TranscriptItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class TranscriptArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(TranscriptArtifactWriter.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path outputDir;

    public TranscriptArtifactWriter(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        this.outputDir = Path.of(appProperties.capture().outputDir());
    }

    public static String baseName(String roomName, Instant startTime) {
        return roomName + "_" + STAMP.format(startTime);
    }

    public Path wavPath(String roomName, Instant startTime) {
        return outputDir.resolve(baseName(roomName, startTime) + ".wav");
    }

    public Path write(CallSession session, DispositionSnapshot snapshot, List<FrameSample> frameSamples, Instant callEnd)
            throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("room", session.roomName());
        document.put("phone", session.dialInfo().callTo());
        document.put("transcript", transcriptRows(snapshot.transcript()));
        document.put("disposition", dispositionRows(snapshot));
        document.put("audio_frames", frameSamples);
        document.put("call_start", epochSeconds(session.startTime()));
        document.put("call_end", epochSeconds(callEnd));

        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(baseName(session.roomName(), session.startTime()) + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), document);
        log.info("Transcript saved to {}", target);
        return target;
    }

    private List<Map<String, Object>> transcriptRows(List<TranscriptItem> transcript) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TranscriptItem item : transcript) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("speaker", item.speaker().name().toLowerCase(Locale.ROOT));
            row.put("text", item.text());
            row.put("timestamp", epochSeconds(item.timestamp()));
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> dispositionRows(DispositionSnapshot snapshot) {
        List<Map<String, Object>> history = new ArrayList<>();
        for (DispositionEvent event : snapshot.history()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", epochSeconds(event.timestamp()));
            entry.put("disposition", event.disposition().label());
            history.add(entry);
        }
        Map<String, Object> rows = new LinkedHashMap<>();
        rows.put("disposition", snapshot.dispositionLabel());
        rows.put("connection_status", snapshot.connectionStatus() == null ? null : snapshot.connectionStatus().name());
        rows.put("disposition_history", history);
        rows.put("call_duration", snapshot.callDurationSeconds());
        return rows;
    }

    private static double epochSeconds(Instant instant) {
        return instant.toEpochMilli() / 1000.0;
    }
}
