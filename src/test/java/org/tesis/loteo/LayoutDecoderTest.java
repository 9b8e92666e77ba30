package org.tesis.loteo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LayoutDecoderTest {

    private final LayoutDecoder decoder = new LayoutDecoder();

    // ========== Predio rectangular bisecado ==========

    @Test
    @DisplayName("1000x500 con vía principal de 20: muchos lotes, todos con área y frente mínimos")
    void testDecode_BisectedRectangle() {
        SiteInput site = Sites.bisected();
        Layout l = decoder.decode(GenomeRepair.canonical(), site);

        assertTrue(l.lotCount() >= 15, "lotes=" + l.lotCount());
        for (Lot lot : l.lots()) {
            assertTrue(lot.area() >= 2000 - 1e-5, lot.toString());
            assertTrue(lot.frontage() >= 20 - 1e-6, lot.toString());
            assertTrue(lot.quality() >= 0 && lot.quality() <= 100, lot.toString());
        }
        List<Road> primary = l.roads().stream().filter(r -> r.roadClass() == RoadClass.PRIMARY).toList();
        assertFalse(primary.isEmpty());
        for (Road r : primary) {
            assertEquals(20.0, r.width());
            for (Coordinate c : r.centerline().getCoordinates()) assertEquals(250.0, c.y, 1e-9);
        }
        assertTrue(new ConstraintValidator(site.constraints()).validate(l).feasible());
    }

    @Test
    void testDecode_NoRotationOnAxisAlignedSite() {
        Layout l = decoder.decode(GenomeRepair.canonical(), Sites.rectangle(1000, 500, ConstraintSet.empty()));
        Road primary = l.roads().stream().filter(r -> r.roadClass() == RoadClass.PRIMARY).findFirst().orElseThrow();
        Coordinate[] c = primary.centerline().getCoordinates();
        assertEquals(c[0].y, c[c.length-1].y, 1e-9, "la banda muerta del ángulo deja la vía horizontal");
    }

    @Test
    void testDecode_LocalRoadSwitch() {
        double[] on = GenomeRepair.canonical().toArray();
        double[] off = on.clone();
        off[Genome.LOCAL_ROADS] = 0.0;

        Layout withLocal = decoder.decode(Genome.of(on), Sites.bisected());
        Layout without = decoder.decode(Genome.of(off), Sites.bisected());

        assertTrue(withLocal.roads().stream().anyMatch(r -> r.roadClass() == RoadClass.LOCAL));
        assertTrue(without.roads().stream().noneMatch(r -> r.roadClass() == RoadClass.LOCAL));
        assertTrue(withLocal.lotCount() > without.lotCount());
    }

    @Test
    void testDecode_NetworkIsConnected() {
        Layout l = decoder.decode(GenomeRepair.canonical(), Sites.bisected());
        RoadNetwork net = l.network();
        assertTrue(net.edgeCount() > 0);
        assertEquals(1, net.componentCount());
        assertEquals(l.totalRoadLength(), net.totalLength(), 1e-6);
    }

    @Test
    void testDecode_MaxLotSizeForcesNarrowerLots() {
        ConstraintSet cs = ConstraintSet.builder()
                .put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(1500))
                .put(ConstraintSet.MAX_LOT_SIZE, Rule.hardAtMost(2500))
                .build();
        Layout l = decoder.decode(GenomeRepair.canonical(), Sites.rectangle(1000, 500, cs));
        assertTrue(l.lotCount() > 0);
        for (Lot lot : l.lots()) {
            assertTrue(lot.area() <= 2500 + 1e-5, lot.toString());
            assertTrue(lot.area() >= 1500 - 1e-5, lot.toString());
        }
    }

    @Test
    void testDecode_PreferredZoneTagsOffice() {
        SiteInput site = Sites.bisected().withPreferredZones(List.of(Sites.rect(0, 0, 300, 500)));
        Layout l = decoder.decode(GenomeRepair.canonical(), site);
        int offices = 0;
        for (Lot lot : l.lots()) {
            double minX = lot.polygon().getEnvelopeInternal().getMinX();
            double cx = lot.polygon().getCentroid().getX();
            if (cx < 280) assertEquals(ZoneType.OFFICE, lot.zone(), lot.toString());
            if (minX > 300 + 1e-6) assertNotEquals(ZoneType.OFFICE, lot.zone(), lot.toString());
            if (lot.zone() == ZoneType.OFFICE) offices++;
        }
        assertTrue(offices > 0);
    }

    @Test
    @DisplayName("Lotes con calidad sobre el tope nunca se convierten en parque")
    void testDecode_GreenCapProtectsGoodLots() {
        ConstraintSet base = ConstraintSet.builder().put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(2000)).build();
        ConstraintSet green = ConstraintSet.builder()
                .put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(2000))
                .put(ConstraintSet.GREEN_SPACE_RATIO, Rule.hardAtLeast(0.99))
                .build();
        double[] g = GenomeRepair.canonical().toArray();
        g[Genome.GREEN_CAP] = 1.0;
        Layout plain = decoder.decode(Genome.of(g), Sites.rectangle(1000, 500, base));
        Layout withGreen = decoder.decode(Genome.of(g), Sites.rectangle(1000, 500, green));

        assertTrue(plain.lots().stream().allMatch(lot -> lot.quality() >= LayoutDecoder.GREEN_CAP_MAX));
        assertEquals(plain.lotCount(), withGreen.lotCount());
        assertEquals(0.0, withGreen.greenArea(GreenArea.Kind.PARK));
    }

    // ========== Invariantes geométricos ==========

    @Test
    @DisplayName("Lotes y vías no se superponen y todo queda dentro del límite")
    void testDecode_DisjointAndContained() {
        Random rng = new Random(3);
        ConstraintSet min1500 = ConstraintSet.builder().put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(1500)).build();
        LineString guide = Sites.GF.createLineString(new Coordinate[]{ new Coordinate(0, 200), new Coordinate(600, 200) });
        List<SiteInput> sites = List.of(
                Sites.bisected(),
                Sites.irregular(ConstraintSet.builder().put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(1200)).build()),
                Sites.rectangle(400, 900, ConstraintSet.empty()),
                Sites.rectangle(600, 400, min1500)
                        .withExclusionZones(List.of(Sites.rect(250, 150, 300, 190)))
                        .withRoadGuides(List.of(guide)));
        for (SiteInput site : sites) {
            for (int t=0;t<20;t++) {
                Genome g = t == 0 ? GenomeRepair.canonical() : GeneticOperators.randomGenome(rng);
                assertLayoutInvariants(decoder.decode(g, site), g);
            }
        }
    }

    @Test
    @DisplayName("Layouts girados: el resto se calcula sin errores topológicos y nunca se vacían por ello")
    void testRemainder_RotatedLayouts() {
        Random rng = new Random(11);
        SiteInput site = Sites.rectangle(400, 900, ConstraintSet.empty());
        int withLots = 0;
        for (int t=0;t<60;t++) {
            Genome g = GeneticOperators.randomGenome(rng);
            Layout l = decoder.decode(g, site);
            if (l.lotCount() > 0) withLots++;
            double rest = l.remainder().getArea();
            assertTrue(rest >= 0, "resto negativo " + g);
            assertTrue(rest <= l.boundary().area() - l.sellableArea() + 1e-6 * l.boundary().area(), "resto excede lo libre " + g);
            for (Lot lot : l.lots()) {
                for (Road road : l.roads()) {
                    assertTrue(GeomUtils.intersection(lot.polygon(), road.footprint()).getArea() < 1e-6, "lote sobre vía " + g);
                }
            }
        }
        assertTrue(withLots >= 55, "layouts con lotes: " + withLots);
    }

    @Test
    @DisplayName("Una franja que solo toca la zona excluida no rompe los recortes")
    void testDecode_StripTouchingExclusion() {
        ConstraintSet cs = ConstraintSet.builder().put(ConstraintSet.MIN_LOT_SIZE, Rule.hardAtLeast(1500)).build();
        LineString guide = Sites.GF.createLineString(new Coordinate[]{ new Coordinate(0, 200), new Coordinate(600, 200) });
        SiteInput site = Sites.rectangle(600, 400, cs)
                .withExclusionZones(List.of(Sites.rect(250, 150, 300, 190)))
                .withRoadGuides(List.of(guide));
        Random rng = new Random(17);
        for (int t=0;t<50;t++) {
            Genome g = t == 0 ? GenomeRepair.canonical() : GenomeRepair.repair(GeneticOperators.randomGenome(rng));
            Layout l = decoder.decode(g, site);
            assertTrue(l.lotCount() > 0, "sin lotes " + g);
            for (Lot lot : l.lots()) {
                assertTrue(GeomUtils.intersection(lot.polygon(), site.exclusionZones().get(0)).getArea() < 1e-6, lot.toString());
            }
        }
    }

    @Test
    void testDecode_Deterministic() {
        SiteInput site = Sites.irregular(ConstraintSet.empty());
        Genome g = GeneticOperators.randomGenome(new Random(5));
        Layout a = decoder.decode(g, site);
        Layout b = decoder.decode(g, site);
        assertEquals(a.lotCount(), b.lotCount());
        assertEquals(a.roads().size(), b.roads().size());
        for (int i=0;i<a.lotCount();i++) {
            assertTrue(a.lots().get(i).polygon().equalsExact(b.lots().get(i).polygon()));
            assertEquals(a.lots().get(i).quality(), b.lots().get(i).quality());
        }
        assertEquals(a.greenArea(), b.greenArea());
    }

    @Test
    void testDecode_UnrepairedGenomeIsRepairedFirst() {
        SiteInput site = Sites.bisected();
        Genome raw = Genome.of(Double.NaN, 7, -1);
        Layout l = decoder.decode(raw, site);
        assertEquals(GenomeRepair.repair(raw), l.genome());
    }

    // ========== Sitios degenerados ==========

    @Test
    @DisplayName("Si la franja perimetral consume el predio, el layout no tiene lotes")
    void testDecode_InsetConsumesSite() {
        Layout l = decoder.decode(GenomeRepair.canonical(), Sites.rectangle(30, 15, ConstraintSet.empty()));
        assertEquals(0, l.lotCount());
        assertTrue(l.roads().isEmpty());
        assertEquals(0, l.network().edgeCount());
    }

    @Test
    void testDecode_NoRoomForPrimaryRoad() {
        ConstraintSet cs = ConstraintSet.builder().put(ConstraintSet.BUFFER_WIDTH, Rule.hardAtLeast(1)).build();
        Layout l = decoder.decode(GenomeRepair.canonical(), Sites.rectangle(300, 18, cs));
        assertEquals(0, l.lotCount());
        assertTrue(l.roads().isEmpty());
        assertTrue(l.greenArea(GreenArea.Kind.BUFFER) > 0);
    }

    static void assertLayoutInvariants(Layout l, Genome g) {
        Geometry boundary = l.boundary().polygon().buffer(1e-6);
        List<Geometry> roads = new ArrayList<>();
        for (Road r : l.roads()) {
            roads.add(r.footprint());
            assertTrue(boundary.covers(r.footprint()), "vía fuera del límite " + g);
        }
        Geometry roadUnion = GeomUtils.union(roads, Sites.GF);
        double lotArea = 0;
        List<Geometry> lots = new ArrayList<>();
        for (Lot lot : l.lots()) {
            assertTrue(boundary.covers(lot.polygon()), "lote fuera del límite " + g);
            assertTrue(GeomUtils.intersection(lot.polygon(), roadUnion).getArea() < 1e-6, "lote sobre vía " + lot + " " + g);
            lotArea += lot.area();
            lots.add(lot.polygon());
        }
        assertEquals(lotArea, GeomUtils.union(lots, Sites.GF).getArea(), 1e-6 * Math.max(1, lotArea), "lotes superpuestos " + g);
        for (GreenArea green : l.greens()) assertTrue(boundary.covers(green.polygon()), "verde fuera del límite " + g);
        double used = l.sellableArea() + l.roadArea() + l.greenArea();
        assertTrue(used <= l.boundary().area() * (1 + 1e-9) + 1e-6, "áreas asignadas exceden el límite " + g);
        assertTrue(l.remainder().getArea() >= -1e-9);
    }
}
