package io.relay.delivery;

/**
 * Receives deliveries claimed by the {@link DeliveryPoller}.
 *
 * @see DeliveryDispatcher
 */
public interface DeliveryHandler {

    /**
     * Accepts a claimed delivery.
     *
     * @return {@code true} if accepted, {@code false} to signal back-pressure; the poller then
     *     hands the claim back and stops the current batch
     */
    boolean handle(QueuedDelivery delivery);

    /**
     * Returns how many deliveries this handler can accept right now. The poller never claims
     * more rows than this, and skips the cycle when it is {@code 0}.
     */
    default int availableCapacity() {
        return Integer.MAX_VALUE;
    }
}
