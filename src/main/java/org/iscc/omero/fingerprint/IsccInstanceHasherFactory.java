package org.iscc.omero.fingerprint;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class IsccInstanceHasherFactory implements HasherFactory {

    @Override
    public StreamingHasher create() {
        return new IsccInstanceHasher();
    }
}
