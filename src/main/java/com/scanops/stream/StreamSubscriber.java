package com.scanops.stream;

/**
 * Receives the events of one channel, backlog first, in emission order.
 */
public interface StreamSubscriber {

    void onEvent(StreamEvent event);

    /**
     * Called once when the channel is torn down after its grace window.
     */
    default void onClose() {
    }
}
