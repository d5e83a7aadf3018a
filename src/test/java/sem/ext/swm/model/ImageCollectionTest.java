package sem.ext.swm.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sem.ext.swm.TestRecords;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for collection construction and derived summary fields.
 */
class ImageCollectionTest {

    private static CollectionMember member(ImageRecord record, String mode) {
        return new CollectionMember(record.getReference(), record, mode, mode.toUpperCase(), null, null);
    }

    @Test
    @DisplayName("Fewer than two members is rejected")
    void testRejectsSingleMember() {
        ImageRecord only = TestRecords.record("a.tif", "SED", 0, 0, 100);
        assertThrows(IllegalArgumentException.class,
                () -> new ImageCollection("x", CollectionKind.MODE_GRID, List.of(member(only, "sed")), null));
        assertThrows(IllegalArgumentException.class,
                () -> new ImageCollection("x", CollectionKind.MODE_GRID, List.of(), null));
    }

    @Test
    void testSummaryFromFirstMember() {
        ImageRecord sed = TestRecords.builder("a.tif", "SED", 12, 34, 100).emissionCurrentUa(1.0).build();
        ImageRecord bsd = TestRecords.builder("b.tif", "BSD", 12, 34, 50).highVoltageKv(20.0).build();
        ImageRecord sed2 = TestRecords.builder("c.tif", "SED", 12, 34, 100)
                .additionalParams(Map.of(ImageRecord.EMISSION_CURRENT_KEY, 2.0)).build();

        ImageCollection collection = new ImageCollection("grid", CollectionKind.MODE_GRID,
                List.of(member(sed, "sed"), member(bsd, "bsd"), member(sed2, "sed")), "test");

        assertEquals(3, collection.size());
        assertEquals(12.0, collection.getReferenceX());
        assertEquals(34.0, collection.getReferenceY());
        assertEquals(100.0, collection.getReferenceFieldOfViewWidth());
        assertEquals(75.0, collection.getReferenceFieldOfViewHeight());
        assertEquals(15.0, collection.getHighVoltageKv());
        assertEquals(List.of("sed", "bsd"), collection.getModes());
        assertEquals(new VaryingParameters(true, true, false), collection.getVaryingParameters());
        assertEquals(1270.0, collection.getMagnifications().get(0), 1e-9);
        assertEquals(2540.0, collection.getMagnifications().get(1), 1e-9);
    }

    @Test
    void testMatchRectsInChainOrder() {
        ImageRecord low = TestRecords.record("low.tif", "SED", 0, 0, 100);
        ImageRecord mid = TestRecords.record("mid.tif", "SED", 0, 0, 20);
        ImageRecord high = TestRecords.record("high.tif", "SED", 0, 0, 5);
        MatchRect first = new MatchRect(400, 300, 205, 154);
        MatchRect second = new MatchRect(380, 290, 256, 192);

        ImageCollection pyramid = new ImageCollection("p", CollectionKind.PYRAMID, List.of(
                member(low, "sed"),
                new CollectionMember(mid.getReference(), mid, "sed", "SED", null, first),
                new CollectionMember(high.getReference(), high, "sed", "SED", null, second)), null);

        assertEquals(List.of(first, second), pyramid.getMatchRects());
    }

    @Test
    @DisplayName("withMember returns a new collection and leaves the original alone")
    void testWithMember() {
        ImageRecord a = TestRecords.record("a.tif", "SED", 0, 0, 100);
        ImageRecord b = TestRecords.record("b.tif", "BSD", 0, 0, 100);
        ImageRecord c = TestRecords.builder("c.tif", "BSD", 0, 0, 100).highVoltageKv(5.0).build();
        ImageCollection original = new ImageCollection("g", CollectionKind.MODE_GRID,
                List.of(member(a, "sed"), member(b, "bsd")), null);

        ImageCollection updated = original.withMember(1, member(c, "bsd"));

        assertNotSame(original, updated);
        assertEquals(List.of("/session/a.tif", "/session/b.tif"), List.copyOf(original.getMemberReferences()));
        assertEquals(List.of("/session/a.tif", "/session/c.tif"), List.copyOf(updated.getMemberReferences()));
        assertFalse(original.getVaryingParameters().highVoltage());
        assertTrue(updated.getVaryingParameters().highVoltage());
    }

    @Test
    void testMemberAlternativesAreCopied() {
        ImageRecord a = TestRecords.record("a.tif", "SED", 0, 0, 100);
        CollectionMember member = new CollectionMember(a.getReference(), a, "sed", "SED", null, null);
        assertTrue(member.alternatives().isEmpty());
        assertFalse(member.hasAlternatives());
        assertThrows(UnsupportedOperationException.class, () -> member.alternatives().add("x"));
    }

    @Test
    void testMatchRectRejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> new MatchRect(0, 0, -1, 5));
        assertDoesNotThrow(() -> new MatchRect(0, 0, 0, 0));
    }
}
