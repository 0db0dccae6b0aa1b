package com.payment.plan.core;

import com.payment.plan.api.ConcurrentPlanUpdateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per gateway subscription inside this process. Subscriptions hash onto a fixed
 * set of lock stripes, so memory stays bounded; unrelated subscriptions sharing a stripe only wait
 * on each other for the duration of one transition. Waiting is bounded by
 * {@code payment-plan.lock.timeout-ms}.
 */
@Slf4j
@Component
public class SubscriptionLockManager {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    @Value("${payment-plan.lock.timeout-ms:5000}")
    private long timeoutMs = 5000;

    public SubscriptionLockManager() {
        this(DEFAULT_STRIPES);
    }

    SubscriptionLockManager(int stripeCount) {
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String subscriptionId, Supplier<T> work) {
        ReentrantLock lock = stripeFor(subscriptionId);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentPlanUpdateException("Interrupted waiting for lock on subscription " + subscriptionId, e);
        }
        if (!acquired) {
            log.warn("Timed out after {}ms waiting for lock on subscriptionId={}", timeoutMs, subscriptionId);
            throw new ConcurrentPlanUpdateException("Timed out waiting for lock on subscription " + subscriptionId);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String subscriptionId) {
        int hash = subscriptionId == null ? 0 : subscriptionId.hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
