package com.collectvoice.recording.service;

import java.nio.file.Path;
import java.time.Duration;

public interface ObjectStorageService {

    boolean isEnabled();

    void upload(Path localPath, String remoteKey);

    String presignedUrl(String remoteKey, Duration ttl);

    String publicUrl(String remoteKey);
}
