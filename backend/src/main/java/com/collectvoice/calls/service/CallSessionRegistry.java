package com.collectvoice.calls.service;

import com.collectvoice.config.AppProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CallSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(CallSessionRegistry.class);

    private final Map<UUID, CallSessionController> sessions = new ConcurrentHashMap<>();
    private final Duration shutdownTimeout;

    public CallSessionRegistry(AppProperties appProperties) {
        this.shutdownTimeout = appProperties.call().teardownJoinTimeout()
                .plus(appProperties.call().recordingGracePeriod());
    }

    public void register(CallSessionController controller) {
        UUID callId = controller.session().callId();
        if (sessions.putIfAbsent(callId, controller) != null) {
            throw new IllegalStateException("Call " + callId + " is already active");
        }
    }

    public Optional<CallSessionController> find(UUID callId) {
        return Optional.ofNullable(sessions.get(callId));
    }

    public void deregister(UUID callId) {
        sessions.remove(callId);
    }

    public int activeCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdownAll() {
        List<CallSessionController> active = List.copyOf(sessions.values());
        if (!active.isEmpty()) {
            log.info("Ending {} active calls on shutdown", active.size());
        }
        for (CallSessionController controller : active) {
            controller.shutdown(shutdownTimeout);
        }
        sessions.clear();
    }
}
