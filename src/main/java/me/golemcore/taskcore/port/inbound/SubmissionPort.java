package me.golemcore.taskcore.port.inbound;

import java.util.function.Consumer;

/**
 * Entry point used by transports to hand work to the core.
 *
 * <p>
 * Items submitted to the same lane are processed strictly in submission order.
 * The result is delivered through {@code onResult} on a lane worker thread.
 */
public interface SubmissionPort {

    void submit(String laneId, String payload, Consumer<String> onResult);
}
