package com.collectvoice.calls.service;

import com.collectvoice.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CallSessionRegistryTest {

    @TempDir
    Path workDir;

    @Mock
    private CallSessionController controller;

    private final UUID callId = UUID.randomUUID();
    private CallSessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CallSessionRegistry(TestFixtures.properties(workDir));
        CallSession session = new CallSession(callId, "outbound-1555-abc", DialInfo.parse("+1555", null, null),
                "{}", null, Instant.EPOCH);
        when(controller.session()).thenReturn(session);
    }

    @Test
    void registeredCallCanBeFoundUntilDeregistered() {
        registry.register(controller);

        assertThat(registry.find(callId)).contains(controller);
        assertThat(registry.activeCount()).isEqualTo(1);

        registry.deregister(callId);

        assertThat(registry.find(callId)).isEmpty();
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void sameCallCannotBeRegisteredTwice() {
        registry.register(controller);

        assertThatThrownBy(() -> registry.register(controller)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shutdownEndsRemainingCalls() {
        registry.register(controller);

        registry.shutdownAll();

        verify(controller).shutdown(Duration.ofMillis(2_200));
        assertThat(registry.activeCount()).isZero();
    }
}
