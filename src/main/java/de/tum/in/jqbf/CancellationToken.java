/*
 * This file is part of JQBF.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JQBF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JQBF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JQBF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jqbf;

import javax.annotation.Nullable;

/**
 * Cooperative cancellation flag of a branch. A token counts as cancelled once it or any of its
 * ancestors has been cancelled.
 */
final class CancellationToken {
    private static final CancellationToken NEVER = new CancellationToken(null);

    @Nullable
    private final CancellationToken parent;

    private volatile boolean cancelled;

    private CancellationToken(@Nullable CancellationToken parent) {
        this.parent = parent;
    }

    /**
     * Returns a token which is never cancelled.
     */
    static CancellationToken never() {
        return NEVER;
    }

    static CancellationToken root() {
        return new CancellationToken(null);
    }

    CancellationToken child() {
        return new CancellationToken(this);
    }

    void cancel() {
        assert this != NEVER;
        cancelled = true;
    }

    boolean isCancelled() {
        CancellationToken token = this;
        while (token != null) {
            if (token.cancelled) {
                return true;
            }
            token = token.parent;
        }
        return false;
    }
}
