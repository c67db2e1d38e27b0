package com.rebalancr.backend.rebalance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process advisory lock per portfolio, plus the cancellation token of the run holding it.
 */
@Slf4j
@Component
public class PortfolioLockRegistry {

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, CancellationToken> tokens = new ConcurrentHashMap<>();

    public Optional<Lease> tryAcquire(Long portfolioId, Duration wait) {
        ReentrantLock lock = locks.computeIfAbsent(portfolioId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = wait == null || wait.isZero() || wait.isNegative()
                    ? lock.tryLock()
                    : lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            log.info("Portfolio {} is already being rebalanced", portfolioId);
            return Optional.empty();
        }
        if (lock.getHoldCount() > 1) {
            lock.unlock();
            log.info("Portfolio {} is already being rebalanced on this thread", portfolioId);
            return Optional.empty();
        }
        CancellationToken token = new CancellationToken();
        tokens.put(portfolioId, token);
        return Optional.of(new Lease(portfolioId, lock, token));
    }

    public boolean cancel(Long portfolioId) {
        CancellationToken token = tokens.get(portfolioId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for portfolio {}", portfolioId);
        return true;
    }

    public boolean isLocked(Long portfolioId) {
        ReentrantLock lock = locks.get(portfolioId);
        return lock != null && lock.isLocked();
    }

    public final class Lease implements AutoCloseable {

        private final Long portfolioId;
        private final ReentrantLock lock;
        private final CancellationToken token;

        private Lease(Long portfolioId, ReentrantLock lock, CancellationToken token) {
            this.portfolioId = portfolioId;
            this.lock = lock;
            this.token = token;
        }

        public CancellationToken token() {
            return token;
        }

        @Override
        public void close() {
            tokens.remove(portfolioId, token);
            lock.unlock();
        }
    }
}
