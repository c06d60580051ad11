package com.collectvoice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        LiveKit livekit,
        Sip sip,
        Call call,
        Recording recording,
        Storage storage,
        Retry retry,
        Capture capture,
        Classifier classifier
) {

    public record LiveKit(
            String url,
            String apiKey,
            String apiSecret,
            String agentName,
            long tokenTtlSeconds
    ) {}

    public record Sip(
            String outboundTrunkId,
            Duration participantJoinTimeout
    ) {}

    public record Call(
            Duration hardTimeout,
            Duration recordingGracePeriod,
            Duration teardownJoinTimeout
    ) {}

    public record Recording(
            String basePath,
            String egressOutputDir,
            Duration pollInterval,
            int maxPollErrors,
            Duration staleAfter
    ) {}

    public record Storage(
            boolean enabled,
            String bucket,
            String region,
            String accessKey,
            String secretKey,
            String prefix,
            boolean usePresignedUrls,
            Duration presignedUrlTtl,
            boolean deleteLocalAfterUpload
    ) {

        public boolean hasCredentials() {
            return isSet(bucket) && isSet(accessKey) && isSet(secretKey);
        }

        private static boolean isSet(String value) {
            return value != null && !value.isBlank();
        }
    }

    public record Retry(
            String queueKey,
            int maxAttempts
    ) {}

    public record Capture(
            boolean enabled,
            String outputDir,
            int frameQueueCapacity,
            int maxFrameSamples
    ) {}

    public record Classifier(
            String rulesLocation
    ) {}
}
