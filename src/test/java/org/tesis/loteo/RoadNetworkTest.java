package org.tesis.loteo;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import static org.junit.jupiter.api.Assertions.*;

class RoadNetworkTest {

    private static LineString line(double... xy) {
        Coordinate[] c = new Coordinate[xy.length / 2];
        for (int i=0;i<c.length;i++) c[i] = new Coordinate(xy[2*i], xy[2*i+1]);
        return Sites.GF.createLineString(c);
    }

    private static int nodeAt(RoadNetwork n, double x, double y) {
        for (int i=0;i<n.nodeCount();i++) if (n.nodeX(i) == x && n.nodeY(i) == y) return i;
        return -1;
    }

    @Test
    void testEmpty() {
        RoadNetwork n = RoadNetwork.empty();
        assertEquals(0, n.nodeCount());
        assertEquals(0, n.edgeCount());
        assertEquals(0, n.componentCount());
        assertEquals(0.0, n.totalLength());
    }

    @Test
    void testTeeJunctionSplitsEdge() {
        RoadNetwork n = new RoadNetwork.Builder()
                .add(line(0, 0, 10, 0), 20, RoadClass.PRIMARY)
                .add(line(5, 0, 5, 8), 12, RoadClass.SECONDARY)
                .build();
        assertEquals(4, n.nodeCount());
        assertEquals(3, n.edgeCount());
        assertEquals(1, n.componentCount());
        assertEquals(3, n.degree(nodeAt(n, 5, 0)));
        assertEquals(18.0, n.totalLength(), 1e-12);
        int primaries = 0;
        for (int e=0;e<n.edgeCount();e++) if (n.edgeClass(e) == RoadClass.PRIMARY) {
            primaries++;
            assertEquals(20.0, n.edgeWidth(e));
            assertEquals(5.0, n.edgeLength(e), 1e-12);
        }
        assertEquals(2, primaries);
        for (int e=0;e<n.edgeCount();e++) {
            assertNotEquals(n.edgeFrom(e), n.edgeTo(e));
            assertTrue(n.edgeTo(e) < n.nodeCount());
        }
    }

    @Test
    void testCrossingNeedsJunction() {
        RoadNetwork.Builder b = new RoadNetwork.Builder()
                .add(line(0, 0, 10, 0), 12, RoadClass.SECONDARY)
                .add(line(5, -5, 5, 5), 12, RoadClass.SECONDARY);
        assertEquals(2, b.build().componentCount());

        RoadNetwork n = b.junction(5, 0).build();
        assertEquals(1, n.componentCount());
        assertEquals(4, n.edgeCount());
        assertEquals(4, n.degree(nodeAt(n, 5, 0)));
        assertEquals(20.0, n.totalLength(), 1e-12);
    }

    @Test
    void testSnapping() {
        RoadNetwork n = new RoadNetwork.Builder()
                .add(line(0, 0, 10, 0), 12, RoadClass.LOCAL)
                .add(line(10 + 1e-8, 0, 10, 10), 12, RoadClass.LOCAL)
                .build();
        assertEquals(3, n.nodeCount());
        assertEquals(1, n.componentCount());
    }

    @Test
    void testPolylineAndRepeatedPoints() {
        RoadNetwork n = new RoadNetwork.Builder()
                .add(line(0, 0, 3, 0, 3, 0, 3, 4), 12, RoadClass.LOCAL)
                .build();
        assertEquals(3, n.nodeCount());
        assertEquals(2, n.edgeCount());
        assertEquals(7.0, n.totalLength(), 1e-12);
    }
}
