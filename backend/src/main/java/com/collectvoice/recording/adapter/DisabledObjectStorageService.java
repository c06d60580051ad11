package com.collectvoice.recording.adapter;

import com.collectvoice.recording.service.ObjectStorageService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;

@Service
@ConditionalOnProperty(value = "app.storage.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledObjectStorageService implements ObjectStorageService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void upload(Path localPath, String remoteKey) {
        throw new IllegalStateException("Object storage is disabled");
    }

    @Override
    public String presignedUrl(String remoteKey, Duration ttl) {
        throw new IllegalStateException("Object storage is disabled");
    }

    @Override
    public String publicUrl(String remoteKey) {
        throw new IllegalStateException("Object storage is disabled");
    }
}
