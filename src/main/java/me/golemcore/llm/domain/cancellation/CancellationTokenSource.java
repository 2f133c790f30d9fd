package me.golemcore.llm.domain.cancellation;

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
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owner side of a {@link CancellationToken}. Cancelling is idempotent: only the
 * first call records its reason and notifies listeners.
 */
@Slf4j
public class CancellationTokenSource {

    private final AtomicReference<Cancellation> state = new AtomicReference<>();
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();

    private final CancellationToken token = new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
            return state.get() != null;
        }

        @Override
        public String getReason() {
            Cancellation cancellation = state.get();
            return cancellation != null ? cancellation.reason() : null;
        }

        @Override
        public Registration onCancelled(Consumer<String> listener) {
            listeners.add(listener);
            // cancel() may have drained the list between the check and the add
            Cancellation cancellation = state.get();
            if (cancellation != null && listeners.remove(listener)) {
                notifyListener(listener, cancellation.reason());
                return () -> {
                };
            }
            return () -> listeners.remove(listener);
        }
    };

    public CancellationToken getToken() {
        return token;
    }

    public boolean isCancellationRequested() {
        return state.get() != null;
    }

    public void cancel() {
        cancel(null);
    }

    public void cancel(String cancelReason) {
        if (!state.compareAndSet(null, new Cancellation(cancelReason))) {
            return;
        }
        log.debug("[Cancel] Cancellation requested: {}", cancelReason);
        for (Consumer<String> listener : listeners) {
            if (listeners.remove(listener)) {
                notifyListener(listener, cancelReason);
            }
        }
    }

    private static void notifyListener(Consumer<String> listener, String cancelReason) {
        try {
            listener.accept(cancelReason);
        } catch (RuntimeException e) {
            log.warn("[Cancel] Cancellation listener failed: {}", e.getMessage(), e);
        }
    }

    private record Cancellation(String reason) {
    }
}
