package org.iscc.omero.tracker;

import org.iscc.omero.domain.Cursor;

import java.util.Optional;

/**
 * Checkpoint of the polling cursor, so a restart resumes without rescanning.
 */
public interface CursorStore {

    /**
     * Last saved cursor, if any.
     */
    Optional<Cursor> load();

    /**
     * Persist the cursor. Failures are reported by the implementation and never
     * roll back the in-memory cursor.
     */
    void save(Cursor cursor);
}
