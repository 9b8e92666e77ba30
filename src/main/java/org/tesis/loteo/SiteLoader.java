package org.tesis.loteo;

import java.io.IOException;

// fuente del predio y sus restricciones; debe rechazar límites degenerados antes de optimizar
public interface SiteLoader {

    SiteInput load() throws IOException;
}
