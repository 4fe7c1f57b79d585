package jobstream.broker.stream;

/**
 * Callbacks from the stream manager to whoever drains a subscriber.
 * Both are invoked while the manager holds the job's registry lock and
 * must only hand work off, never block.
 */
public interface SubscriberListener {

    /** New events were queued. */
    void onEventsAvailable(Subscriber subscriber);

    /** The subscriber was detached by the manager (overrun or job closed). */
    void onClosed(Subscriber subscriber, Subscriber.CloseReason reason);
}
