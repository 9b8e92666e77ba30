package org.tesis.loteo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class TesisLoteoTest {

    private static String resource(String name) throws Exception {
        return Paths.get(TesisLoteoTest.class.getResource("/" + name).toURI()).toString();
    }

    @Test
    void testMain_EndToEnd() throws Exception {
        assertDoesNotThrow(() -> TesisLoteo.main(new String[]{
                resource("sitio.csv"), resource("restricciones.properties"), resource("corrida.properties")}));
    }

    @Test
    void testMain_InvalidBoundaryStopsBeforeRunning(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("malo.csv");
        Files.writeString(csv, "entity_type,entity_id,ring,point_idx,x,y\n"
                + "BOUNDARY,B,0,0,0,0\nBOUNDARY,B,0,1,10,10\nBOUNDARY,B,0,2,10,0\nBOUNDARY,B,0,3,0,10\n",
                StandardCharsets.UTF_8);
        assertThrows(InvalidBoundaryException.class, () -> TesisLoteo.main(new String[]{csv.toString()}));
    }

    @Test
    void testMain_UnknownConfigKey(@TempDir Path dir) throws Exception {
        Path cfg = dir.resolve("malo.properties");
        Files.writeString(cfg, "poblacion = 10\n", StandardCharsets.UTF_8);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TesisLoteo.main(new String[]{resource("sitio.csv"), resource("restricciones.properties"), cfg.toString()}));
        assertTrue(e.getMessage().contains("poblacion"));
    }
}
