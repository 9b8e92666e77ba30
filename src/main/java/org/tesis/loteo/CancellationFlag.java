package org.tesis.loteo;

import java.util.concurrent.atomic.AtomicBoolean;

// cancelación cooperativa: el motor la consulta en cada borde de generación
public final class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
