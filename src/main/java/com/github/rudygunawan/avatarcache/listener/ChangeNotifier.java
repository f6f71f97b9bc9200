package com.github.rudygunawan.avatarcache.listener;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multicasts cache snapshots to any number of independent subscribers.
 *
 * <p>Backed by a {@link SubmissionPublisher}: every subscriber gets its own bounded buffer and
 * is drained by its own task on the notification executor. {@link #publish} never blocks; a
 * snapshot that does not fit in a saturated subscriber's buffer is dropped for that subscriber
 * only. There is no replay, so a subscriber only sees snapshots published after it subscribed.
 */
public class ChangeNotifier {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.avatarcache.ProfilePictureCache");

    private final SubmissionPublisher<Map<String, Optional<String>>> publisher;
    private final Flow.Publisher<Map<String, Optional<String>>> publisherView;
    private final AtomicLong droppedCount = new AtomicLong(0);

    /**
     * Creates a notifier.
     *
     * @param executor the executor that runs subscriber deliveries
     * @param bufferSize the per-subscriber buffer capacity
     */
    public ChangeNotifier(Executor executor, int bufferSize) {
        this.publisher = new SubmissionPublisher<>(Objects.requireNonNull(executor, "executor cannot be null"), bufferSize);
        // Hide submit/close from callers that only need to subscribe.
        this.publisherView = publisher::subscribe;
    }

    /**
     * Returns the executor used when none is configured: the common pool when it has more than
     * one thread, otherwise a new thread per delivery task.
     */
    public static Executor defaultExecutor() {
        if (ForkJoinPool.getCommonPoolParallelism() > 1) {
            return ForkJoinPool.commonPool();
        }
        return task -> {
            Thread t = new Thread(task, "avatar-cache-notifier");
            t.setDaemon(true);
            t.start();
        };
    }

    /**
     * Offers a snapshot to every current subscriber without blocking. Delivery failures are
     * logged and counted as drops; they never reach the caller.
     *
     * @param snapshot an unmodifiable snapshot of the cache
     */
    public void publish(Map<String, Optional<String>> snapshot) {
        if (publisher.isClosed()) {
            return;
        }
        try {
            publisher.offer(snapshot, (subscriber, dropped) -> {
                droppedCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.WARNING)) {
                    LOGGER.warning("Dropped cache snapshot for slow subscriber " + subscriber
                            + ", entries=" + dropped.size());
                }
                return false;
            });
        } catch (RuntimeException e) {
            // Rejected by the notification executor, or closed concurrently.
            droppedCount.incrementAndGet();
            LOGGER.log(Level.WARNING, "Failed to deliver cache snapshot, entries=" + snapshot.size(), e);
        }
    }

    /**
     * Registers a listener.
     *
     * @return a handle that stops delivery when cancelled
     */
    public ProfilePictureSubscription subscribe(ProfilePictureListener listener) {
        ListenerSubscriber subscriber = new ListenerSubscriber(Objects.requireNonNull(listener, "listener cannot be null"));
        publisher.subscribe(subscriber);
        return subscriber;
    }

    /**
     * Returns a publisher view for callers that want to plug in their own
     * {@link Flow.Subscriber}.
     */
    public Flow.Publisher<Map<String, Optional<String>>> publisher() {
        return publisherView;
    }

    public int subscriberCount() {
        return publisher.getNumberOfSubscribers();
    }

    /**
     * Returns how many deliveries were dropped, either because a subscriber buffer was full or
     * because the notification executor rejected the delivery.
     */
    public long droppedCount() {
        return droppedCount.get();
    }

    /**
     * Completes every subscriber. Later calls to {@link #publish} are ignored.
     */
    public void close() {
        publisher.close();
    }

    private static final class ListenerSubscriber
            implements Flow.Subscriber<Map<String, Optional<String>>>, ProfilePictureSubscription {
        private final ProfilePictureListener listener;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile Flow.Subscription subscription;

        ListenerSubscriber(ProfilePictureListener listener) {
            this.listener = listener;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (cancelled.get()) {
                subscription.cancel();
            } else {
                subscription.request(Long.MAX_VALUE);
            }
        }

        @Override
        public void onNext(Map<String, Optional<String>> snapshot) {
            if (cancelled.get()) {
                return;
            }
            try {
                listener.onUpdate(snapshot);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "ProfilePictureListener threw exception, entries=" + snapshot.size(), e);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            cancelled.set(true);
            LOGGER.log(Level.WARNING, "Profile picture subscription terminated with error", throwable);
        }

        @Override
        public void onComplete() {
            cancelled.set(true);
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                Flow.Subscription current = subscription;
                if (current != null) {
                    current.cancel();
                }
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
