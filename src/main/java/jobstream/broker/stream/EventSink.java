package jobstream.broker.stream;

import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;

/**
 * Transport end of one stream session.
 *
 * A sink owns a serial executor; the session runs all of its state changes
 * there and only calls the write methods from it. Writes are in call order.
 */
public interface EventSink {

    /** False while the transport's outbound buffer is above its high-water mark. */
    boolean isWritable();

    /** Write one log event. */
    void send(JobEvent event);

    /** Write a keep-alive record carrying the session's cursor. */
    void sendHeartbeat(String jobId, long cursor);

    /** Write the closing signal; {@code status} is the job's final status. */
    void sendDone(String jobId, long cursor, JobStatus status);

    /** End the stream. Idempotent. */
    void close();

    /** Run a task on the sink's serial executor. */
    void execute(Runnable task);
}
