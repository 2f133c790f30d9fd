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

import me.golemcore.llm.domain.exception.CancelledException;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Cooperative cancellation signal observed by the tool loop before each step,
 * between upstream chunks, and before each tool execution.
 */
public interface CancellationToken {

    /**
     * Token that is never cancelled.
     */
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
            return false;
        }

        @Override
        public String getReason() {
            return null;
        }

        @Override
        public Registration onCancelled(Consumer<String> listener) {
            return () -> {
            };
        }
    };

    boolean isCancellationRequested();

    /**
     * Returns the reason passed to cancel, or null.
     */
    String getReason();

    /**
     * Registers a listener invoked once with the reason when cancellation is
     * requested. If the token is already cancelled the listener runs
     * immediately on the calling thread.
     */
    Registration onCancelled(Consumer<String> listener);

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancelledException(getReason());
        }
    }

    /**
     * Emits the cancellation reason (or {@code "cancelled"}) once cancellation is
     * requested. Disposing the subscription removes the listener.
     */
    default Mono<String> whenCancelled() {
        return Mono.create(sink -> {
            Registration registration = onCancelled(reason -> sink.success(reason != null ? reason : "cancelled"));
            sink.onDispose(registration::dispose);
        });
    }

    /**
     * Handle for removing a listener registered with {@link #onCancelled}.
     */
    @FunctionalInterface
    interface Registration {
        void dispose();
    }
}
