/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Records how to undo each step of a multi-step graph mutation, so that a mutation which fails partway through can be
 * rolled back to exactly the state it started from. Undo actions run in reverse order of recording.
 */
final class UndoJournal {
    private static final UndoJournal UNTRACKED = new UndoJournal(false);

    private final boolean tracking;
    private final Deque<Runnable> undoActions = new ArrayDeque<>();

    private UndoJournal(boolean tracking) {
        this.tracking = tracking;
    }

    /** Creates a journal that records undo actions. */
    static UndoJournal tracking() {
        return new UndoJournal(true);
    }

    /** Returns a journal that ignores everything: for mutations that have nothing to roll back to (e.g. creation). */
    static UndoJournal untracked() {
        return UNTRACKED;
    }

    void record(Runnable undoAction) {
        if (tracking) {
            undoActions.push(undoAction);
        }
    }

    /** Runs all recorded undo actions, most recent first, and forgets them. */
    void rollback() {
        while (!undoActions.isEmpty()) {
            undoActions.pop().run();
        }
    }
}
