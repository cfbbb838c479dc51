package com.demandengine.service;

import com.demandengine.engine.model.ScopeId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-scope locks shared by every writer of scope state. A scope always maps
 * to the same stripe; unrelated scopes may share one. The number of locks is fixed.
 */
@Component
public class ScopeLocks {

    private final ReentrantLock[] stripes;

    public ScopeLocks(@Value("${engine.locks.stripes:64}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("engine.locks.stripes must be > 0");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(ScopeId scope, Supplier<T> action) {
        ReentrantLock lock = lockFor(scope);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(ScopeId scope) {
        return stripes[Math.floorMod(scope.key().hashCode(), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
