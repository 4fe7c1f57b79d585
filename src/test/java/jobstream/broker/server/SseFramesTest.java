package jobstream.broker.server;

import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.util.Json;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SseFramesTest {

    private final SseFrames plain = new SseFrames(0);

    @Test
    void eventFrameCarriesIdAndName() {
        JobEvent event = new JobEvent("J1", 4, EventType.DIFF_CHUNK, Json.object().put("section", "intro"), 1000L);

        String frame = plain.event(event);

        assertEquals("id: 4\n"
                + "event: diff_chunk\n"
                + "data: {\"job_id\":\"J1\",\"seq\":4,\"ts\":1000,\"type\":\"diff_chunk\",\"payload\":{\"section\":\"intro\"}}\n"
                + "\n", frame);
    }

    @Test
    void heartbeatAndDoneHaveNoId() {
        String heartbeat = plain.heartbeat("J1", 9);
        assertTrue(heartbeat.startsWith("event: heartbeat\n"));
        assertTrue(heartbeat.contains("\"seq\":9"));
        assertFalse(heartbeat.contains("id: "));

        String done = plain.done("J1", 9, JobStatus.COMPLETED);
        assertTrue(done.startsWith("event: done\n"));
        assertTrue(done.contains("\"payload\":{\"status\":\"completed\"}"));
        assertFalse(done.contains("id: "));
        assertTrue(done.endsWith("\n\n"));
    }

    @Test
    void retryLine() {
        assertEquals("retry: 3000\n\n", plain.retry(3000));
    }

    @Test
    void smallFramesArePaddedWithComment() {
        SseFrames padded = new SseFrames(2048);

        String frame = padded.heartbeat("J1", 1);

        assertEquals(2048, frame.getBytes(StandardCharsets.UTF_8).length);
        assertTrue(frame.startsWith(":"));
        assertTrue(frame.endsWith("\n\n"));
        String afterComment = frame.substring(frame.indexOf('\n') + 1);
        assertEquals(plain.heartbeat("J1", 1).length(), afterComment.length());
    }

    @Test
    void largeFramesAreNotPadded() {
        SseFrames padded = new SseFrames(16);
        JobEvent event = new JobEvent("J1", 1, EventType.AGENT_CHUNK, Json.object().put("chunk", "x".repeat(64)), 1L);

        assertEquals(plain.event(event), padded.event(event));
    }
}
