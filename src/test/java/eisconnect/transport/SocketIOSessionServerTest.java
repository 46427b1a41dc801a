package eisconnect.transport;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import eisconnect.domain.Ack;
import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.core.BatterySessionEngine;
import eisconnect.error.StorageException;
import eisconnect.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SocketIOSessionServerTest {

    @Mock
    private BatterySessionEngine engine;

    @Mock
    private SocketIOClient client;

    @Mock
    private AckRequest ackRequest;

    private SocketIOSessionServer server;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        server = new SocketIOSessionServer("127.0.0.1", 0, engine);
        when(client.getSessionId()).thenReturn(UUID.randomUUID());
    }

    @Test
    @DisplayName("Should throw exception for null engine")
    void testConstructorNullEngine() {
        assertThatThrownBy(() -> new SocketIOSessionServer("127.0.0.1", 3000, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("engine cannot be null");
    }

    @Test
    @DisplayName("Should not be running before start")
    void testInitialState() {
        assertThat(server.isRunning()).isFalse();
        assertThat(server.getConnectedClients()).isZero();
        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should decode metadata and forward start_session to the engine")
    void testHandleStartSession() {
        when(engine.startSession(any())).thenReturn(Ack.inProgress("Session started"));

        Map<String, Object> reply = server.handleStartSession(
                "{\"BatteryId\":\"B01\",\"TestId\":\"Test_1\",\"SocPercent\":50,\"VThreshold\":0.05,"
                        + "\"ZThreshold\":0.1,\"DeviationPercent\":25}");

        verify(engine).startSession(argThat((SessionMeta meta) -> meta.batteryId().equals("B01")
                && meta.socPercent() == 50));
        assertThat(reply).containsEntry("success", true).containsEntry("message", "Session started");
    }

    @Test
    @DisplayName("Should answer push_sample validation failures with an error reply")
    void testHandlePushSampleValidationError() {
        when(engine.pushSample(any(Sample.class)))
                .thenThrow(new ValidationException("Session not started", "session", "null"));

        Map<String, Object> reply = server.handlePushSample("{\"FrequencyHz\":1000}");

        assertThat(reply)
                .containsEntry("success", false)
                .containsEntry("kind", "VALIDATION")
                .containsEntry("message", "Session not started");
    }

    @Test
    @DisplayName("Should answer malformed payloads without calling the engine")
    void testHandleMalformedPayload() {
        Map<String, Object> reply = server.handlePushSample("{broken");

        assertThat(reply).containsEntry("success", false).containsEntry("field", "sample");
        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("Should forward end_session and report storage errors")
    void testHandleEndSession() {
        when(engine.endSession()).thenReturn(Ack.completed("Session completed"));
        assertThat(server.handleEndSession()).containsEntry("status", "COMPLETED");

        when(engine.startSession(any()))
                .thenThrow(new StorageException("Failed to initialize session storage: disk", new IOException("disk")));
        assertThat(server.handleStartSession("{\"BatteryId\":\"B01\"}"))
                .containsEntry("kind", "STORAGE")
                .containsKey("details");
    }

    @Test
    @DisplayName("Should reply through the acknowledgement when requested")
    void testReplyWithAck() {
        when(ackRequest.isAckRequested()).thenReturn(true);
        Map<String, Object> response = Map.of("success", true);

        server.reply(client, ackRequest, "push_sample", response);

        verify(ackRequest).sendAckData(response);
        verify(client, never()).sendEvent(anyString(), (Object) any());
    }

    @Test
    @DisplayName("Should emit error event when no acknowledgement is requested")
    void testReplyWithoutAck() {
        when(ackRequest.isAckRequested()).thenReturn(false);
        Map<String, Object> failure = Map.of("success", false);

        server.reply(client, ackRequest, "push_sample", failure);
        server.reply(client, ackRequest, "push_sample", Map.of("success", true));

        verify(client).sendEvent("push_sample_error", failure);
        verify(ackRequest, never()).sendAckData(any(Object[].class));
    }
}
