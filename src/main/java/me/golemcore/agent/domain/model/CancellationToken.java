package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded from a turn down into every tool
 * execution. Cancelling never interrupts work by force: the turn checks the
 * token between stream chunks, tools check it (or register a listener) around
 * their own I/O.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a fresh token that is cancelled only by an explicit
     * {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Cancels the token and notifies listeners once.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            runListener(listener);
        }
        listeners.clear();
    }

    /**
     * Registers a listener invoked on cancellation. If the token is already
     * cancelled the listener runs immediately.
     *
     * @return a handle that removes the listener when run
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] Cancellation listener failed: {}", e.getMessage());
        }
    }
}
