package dev.resumeranker.ai;

import dev.resumeranker.config.AiConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounds the number of outstanding AI provider requests with a fair semaphore.
 * Permits are acquired off the event loop and released exactly once when the guarded call
 * completes, fails or is cancelled.
 */
@Slf4j
@Component
public class AiRequestGate {

    private static final int WAITING = 0;
    private static final int HELD = 1;
    private static final int CLOSED = 2;

    private final Semaphore semaphore;
    private final int maxConcurrent;

    public AiRequestGate(AiConfig aiConfig) {
        this.maxConcurrent = Math.max(1, aiConfig.getMaxConcurrentRequests());
        this.semaphore = new Semaphore(maxConcurrent, true);
    }

    /**
     * Run the call once a permit is available.
     */
    public <T> Mono<T> guard(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            AtomicInteger state = new AtomicInteger(WAITING);
            return Mono.fromCallable(() -> {
                        semaphore.acquireUninterruptibly();
                        if (!state.compareAndSet(WAITING, HELD)) {
                            // subscriber went away while we were blocked
                            semaphore.release();
                        }
                        return Boolean.TRUE;
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(acquired -> call.get())
                    .doFinally(signal -> {
                        if (state.getAndSet(CLOSED) == HELD) {
                            semaphore.release();
                        }
                    });
        });
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}
