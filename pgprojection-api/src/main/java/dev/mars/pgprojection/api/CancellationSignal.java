package dev.mars.pgprojection.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared by detection, slicing, folding and batch execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class CancellationSignal {

    /** A signal that can never be cancelled. */
    public static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private volatile boolean cancelled;

    public CancellationSignal() {
        this(true);
    }

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (cancellable) {
            cancelled = true;
        }
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
