package com.github.yoep.paging.core.channel;

import com.github.yoep.paging.core.environment.PlatformProvider;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * An ordered, single consumer channel which delivers the published values on the renderer thread.
 * <p>
 * Values can be published from any thread. They're queued in publication order and drained on the renderer thread of the
 * {@link PlatformProvider}, which guarantees FIFO delivery even when publishers run on different threads.
 * Values published while no consumer is subscribed are dropped.
 *
 * @param <T> The value type of the channel.
 */
@Slf4j
@ToString(of = "name")
public class PagingChannel<T> {
    private final String name;
    private final PlatformProvider platformProvider;
    private final Queue<T> pending = new ConcurrentLinkedQueue<>();
    private final AtomicReference<ChannelSubscription> subscription = new AtomicReference<>();

    public PagingChannel(String name, PlatformProvider platformProvider) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(platformProvider, "platformProvider cannot be null");
        this.name = name;
        this.platformProvider = platformProvider;
    }

    /**
     * Subscribe the given consumer on this channel.
     *
     * @param consumer The consumer which receives the published values.
     * @return Returns the subscription of the consumer.
     * @throws IllegalStateException Is thrown when the channel already has an active subscriber.
     */
    public Subscription subscribe(Consumer<T> consumer) {
        Objects.requireNonNull(consumer, "consumer cannot be null");
        var newSubscription = new ChannelSubscription(consumer);

        if (!subscription.compareAndSet(null, newSubscription)) {
            throw new IllegalStateException("Channel " + name + " already has an active subscriber");
        }

        log.trace("Consumer subscribed on channel {}", name);
        return newSubscription;
    }

    /**
     * Check if this channel has an active subscriber.
     *
     * @return Returns true when a consumer is subscribed, else false.
     */
    public boolean hasSubscriber() {
        return subscription.get() != null;
    }

    /**
     * Publish a new value on this channel.
     * The value will be delivered asynchronously on the renderer thread.
     *
     * @param value The value to publish.
     */
    public void publish(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        pending.add(value);
        platformProvider.runOnRenderer(this::drain);
    }

    private void drain() {
        T value;

        while ((value = pending.poll()) != null) {
            deliver(value);
        }
    }

    private void deliver(T value) {
        var active = subscription.get();

        if (active == null) {
            log.trace("Dropping value {} of channel {}, no active subscriber", value, name);
            return;
        }

        try {
            active.consumer.accept(value);
        } catch (Exception ex) {
            log.error("Channel {} consumer failed to process {}, {}", name, value, ex.getMessage(), ex);
        }
    }

    private class ChannelSubscription implements Subscription {
        private final Consumer<T> consumer;

        private ChannelSubscription(Consumer<T> consumer) {
            this.consumer = consumer;
        }

        @Override
        public void unsubscribe() {
            if (subscription.compareAndSet(this, null)) {
                log.trace("Consumer unsubscribed from channel {}", name);
            }
        }

        @Override
        public boolean isUnsubscribed() {
            return subscription.get() != this;
        }
    }
}
