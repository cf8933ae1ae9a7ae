package com.questrail.harness.transport;

import com.questrail.harness.api.Signal;

/**
 * Callback sink for inbound traffic that is not a response to a request.
 *
 * <p>Netty-backed channels deliver these callbacks on the channel's event
 * loop; implementations must not block.</p>
 */
public interface ControlChannelListener
{
    ControlChannelListener NONE = new ControlChannelListener() {
        @Override
        public void onSignal(Signal signal) {
        }

        @Override
        public void onClosed(Throwable cause) {
        }
    };

    /**
     * Called for every push message received on the channel.
     */
    void onSignal(Signal signal);

    /**
     * Called once when the channel stops being usable.
     *
     * @param cause failure cause, or {@code null} for an orderly close
     */
    void onClosed(Throwable cause);
}
