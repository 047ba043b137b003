package org.iscc.omero.fingerprint;

public interface HasherFactory {
    StreamingHasher create();
}
