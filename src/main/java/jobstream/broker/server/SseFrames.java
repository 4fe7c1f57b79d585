package jobstream.broker.server;

import jobstream.broker.api.v1.dto.StreamRecord;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.util.Json;

import java.nio.charset.StandardCharsets;

/**
 * Text framing of stream records as Server-Sent Events.
 *
 * Log events carry {@code id: <seq>} so browsers resume with Last-Event-ID;
 * heartbeat and closing records carry no id and never move the client's
 * cursor. Frames shorter than the padding threshold get a leading comment
 * line so proxies that buffer small chunks flush each record.
 */
public final class SseFrames {

    private final int paddingBytes;

    public SseFrames(int paddingBytes) {
        this.paddingBytes = Math.max(0, paddingBytes);
    }

    public String retry(long millis) {
        return "retry: " + millis + "\n\n";
    }

    public String event(JobEvent event) {
        return frame(String.valueOf(event.seq()), event.type().wireName(), StreamRecord.from(event));
    }

    public String heartbeat(String jobId, long cursor) {
        StreamRecord record = StreamRecord.heartbeat(jobId, cursor);
        return frame(null, record.type(), record);
    }

    public String done(String jobId, long cursor, JobStatus status) {
        StreamRecord record = StreamRecord.done(jobId, cursor, status);
        return frame(null, record.type(), record);
    }

    private String frame(String id, String eventName, StreamRecord record) {
        StringBuilder frame = new StringBuilder(128);
        if (id != null) {
            frame.append("id: ").append(id).append('\n');
        }
        frame.append("event: ").append(eventName).append('\n');
        frame.append("data: ").append(Json.writeValue(record)).append('\n');
        frame.append('\n');
        return pad(frame.toString());
    }

    private String pad(String frame) {
        if (paddingBytes == 0) {
            return frame;
        }
        int size = frame.getBytes(StandardCharsets.UTF_8).length;
        if (size >= paddingBytes) {
            return frame;
        }
        // ":" + spaces + "\n"
        int spaces = Math.max(0, paddingBytes - size - 2);
        return ":" + " ".repeat(spaces) + "\n" + frame;
    }
}
