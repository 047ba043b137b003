package org.iscc.omero.tracker;

import org.iscc.omero.domain.Cursor;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cursor store used when no state file is configured.
 * Not persistent - state is lost on restart.
 */
public class InMemoryCursorStore implements CursorStore {

    private final AtomicReference<Cursor> current = new AtomicReference<>();

    @Override
    public Optional<Cursor> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void save(Cursor cursor) {
        current.set(cursor);
    }
}
