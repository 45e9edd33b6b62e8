package typegraph.execution;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import typegraph.Internal;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A point in time after which field fetches that are still running are cancelled and fetches that have not
 * started yet fail straight away. Used when an execution with a timeout asks for partial results.
 */
@Internal
public class ExecutionDeadline {

    private final Duration timeout;
    private final Sinks.One<Duration> expiry = Sinks.one();
    private final Disposable timer;
    private volatile boolean expired;

    public ExecutionDeadline(Duration timeout, Scheduler scheduler) {
        this.timeout = timeout;
        this.timer = scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void expire() {
        expired = true;
        expiry.tryEmitValue(timeout);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isExpired() {
        return expired;
    }

    /**
     * @return a mono that emits once the deadline has passed, immediately for subscribers that come later
     */
    public Mono<Duration> whenExpired() {
        return expiry.asMono();
    }

    public TimeoutException newTimeoutException() {
        return new TimeoutException("The execution deadline of " + timeout.toMillis() + "ms has passed");
    }

    /**
     * Stops the timer once the execution has finished
     */
    public void cancel() {
        timer.dispose();
    }
}
