package sem.ext.swm.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sem.ext.swm.TestRecords;
import sem.ext.swm.controller.ModeCollectionBuilder.CandidateGroup;
import sem.ext.swm.controller.ModeCollectionBuilder.GroupSource;
import sem.ext.swm.modality.ModeClassifier;
import sem.ext.swm.model.CollectionKind;
import sem.ext.swm.model.CollectionMember;
import sem.ext.swm.model.ImageCollection;
import sem.ext.swm.model.ImageRecord;
import sem.ext.swm.preferences.DiscoveryConfig;
import sem.ext.swm.service.CollectionStore;
import sem.ext.swm.service.InMemoryMetadataStore;
import sem.ext.swm.utilities.ChemImagePairing;
import sem.ext.swm.utilities.SpatialMatcher;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for mode grid discovery and the alternative swap.
 */
@ExtendWith(MockitoExtension.class)
class ModeCollectionBuilderTest {

    @Mock
    private CollectionStore collectionStore;

    private DiscoveryConfig config;
    private ModeClassifier classifier;
    private SpatialMatcher matcher;
    private ChemImagePairing pairing;
    private ModeCollectionBuilder builder;

    @BeforeEach
    void setUp() {
        config = DiscoveryConfig.defaults();
        classifier = new ModeClassifier(config);
        matcher = new SpatialMatcher(config, classifier);
        pairing = new ChemImagePairing(config);
        builder = new ModeCollectionBuilder(config, classifier, matcher, pairing, null, collectionStore);
    }

    private List<ImageCollection> discover(ImageRecord... records) {
        return builder.discoverCollections(new InMemoryMetadataStore(List.of(records)));
    }

    private static List<String> references(ImageCollection collection) {
        return collection.getMembers().stream().map(CollectionMember::reference).toList();
    }

    // ==================== Tag groups ====================

    @Test
    @DisplayName("A tag spelling a position key does not share that position grid's id")
    void testTagAndPositionIdsStayDistinct() {
        ImageRecord taggedSed = TestRecords.tagged("ts.tif", "SED", 500, 0, "1.5_2.5");
        ImageRecord taggedBsd = TestRecords.tagged("tb.tif", "BSD", 900, 0, "1.5_2.5");
        ImageRecord sed = TestRecords.record("s.tif", "SED", 1.5, 2.5, 100);
        ImageRecord bsd = TestRecords.record("b.tif", "BSD", 1.5, 2.5, 100);

        List<ImageCollection> found = discover(taggedSed, taggedBsd, sed, bsd);

        assertEquals(List.of("mode_grid_1.5_2.5", "mode_grid_1.5_2.5_2"),
                found.stream().map(ImageCollection::getId).toList());
        assertEquals(List.of(taggedSed.getReference(), taggedBsd.getReference()), references(found.get(0)));
        assertEquals(List.of(sed.getReference(), bsd.getReference()), references(found.get(1)));
    }

    @Test
    @DisplayName("Tag A with sed, bsd, sed gives one grid of 3 members and 2 modes")
    void testTagGroup() {
        ImageRecord s1 = TestRecords.tagged("s1.tif", "SED", 0, 0, "A");
        ImageRecord b = TestRecords.builder("b.tif", "BSD", 300, 0, 100)
                .highVoltageKv(20.0).collectionTag("A").build();
        ImageRecord s3 = TestRecords.tagged("s3.tif", "SED", 600, 0, "A");

        List<ImageCollection> found = discover(s1, b, s3);

        assertEquals(1, found.size());
        ImageCollection grid = found.get(0);
        assertEquals(CollectionKind.MODE_GRID, grid.getKind());
        assertEquals("mode_grid_A", grid.getId());
        assertEquals(3, grid.size());
        assertEquals(List.of("sed", "bsd"), grid.getModes());
        assertEquals(List.of("/session/s1.tif", "/session/s3.tif", "/session/b.tif"), references(grid));
        assertEquals(List.of("/session/s3.tif"), grid.getMembers().get(0).alternatives());
        assertEquals(List.of("/session/s1.tif"), grid.getMembers().get(1).alternatives());
        assertTrue(grid.getMembers().get(2).alternatives().isEmpty());
        assertTrue(grid.getVaryingParameters().highVoltage());
        assertFalse(grid.getVaryingParameters().emissionCurrent());
        assertFalse(grid.getVaryingParameters().integrations());
        assertEquals(0.0, grid.getReferenceX());
        assertEquals("SED 15 kV", grid.getMembers().get(0).displayName());
        assertEquals("BSD 20 kV", grid.getMembers().get(2).displayName());
    }

    @Test
    void testSingleModeTagGroupDiscarded() {
        ImageRecord a = TestRecords.tagged("a.tif", "SED", 0, 0, "B");
        ImageRecord b = TestRecords.tagged("b.tif", "SED", 500, 0, "B");
        assertTrue(builder.discoverByTag(List.of(a, b)).isEmpty());
        assertTrue(discover(a, b).isEmpty());
    }

    @Test
    void testSingleImageTagDiscarded() {
        ImageRecord a = TestRecords.tagged("a.tif", "SED", 0, 0, "C");
        ImageRecord b = TestRecords.tagged("b.tif", "BSD", 500, 0, "D");
        assertTrue(builder.discoverByTag(List.of(a, b)).isEmpty());
    }

    @Test
    void testInvalidRecordsExcludedFromTags() {
        ImageRecord a = TestRecords.tagged("a.tif", "SED", 0, 0, "E");
        ImageRecord invalid = TestRecords.builder("b.tif", "BSD", 0, 0, 100)
                .fieldOfView(null, null).collectionTag("E").build();
        assertTrue(builder.discoverByTag(List.of(a, invalid)).isEmpty());
    }

    // ==================== Position groups ====================

    @Test
    @DisplayName("Images at exactly the same position form a grid")
    void testPositionGroup() {
        ImageRecord sed = TestRecords.record("sed.tif", "SED", 1.5, 2.5, 100);
        ImageRecord bsd = TestRecords.record("bsd.tif", "BSD", 1.5, 2.5, 100);
        ImageRecord elsewhere = TestRecords.record("other.tif", "BSD", 1.6, 2.5, 100);

        List<ImageCollection> found = discover(bsd, sed, elsewhere);

        assertEquals(1, found.size());
        assertEquals("mode_grid_1.5_2.5", found.get(0).getId());
        assertEquals(List.of("/session/sed.tif", "/session/bsd.tif"), references(found.get(0)));
    }

    @Test
    @DisplayName("A chemical image joins its source image's group wherever it was recorded")
    void testChemicalImagePairing() {
        ImageRecord site = TestRecords.record("site3.tiff", "SED", 0, 0, 100);
        ImageRecord chem = TestRecords.record("site3_ChemiSEM.tiff", "SED", 5000, 5000, 100);

        List<CandidateGroup> groups = builder.discoverByPosition(List.of(site, chem));

        assertEquals(1, groups.size());
        assertEquals(GroupSource.POSITION, groups.get(0).source());
        ImageCollection grid = builder.buildCollection(groups.get(0));
        assertEquals("mode_grid_0.0_0.0", grid.getId());
        assertEquals(List.of("sed", "chemsem"), grid.getModes());
    }

    @Test
    void testUnpairedChemicalImageGroupsByOwnPosition() {
        ImageRecord chem = TestRecords.record("lonely_ChemiSEM.tif", "SED", 7, 7, 100);
        ImageRecord bsd = TestRecords.record("bsd.tif", "BSD", 7, 7, 100);

        List<CandidateGroup> groups = builder.discoverByPosition(List.of(chem, bsd));

        assertEquals(1, groups.size());
        assertEquals(2, groups.get(0).records().size());
    }

    @Test
    void testSingleModePositionGroupDiscarded() {
        ImageRecord a = TestRecords.record("a.tif", "SED", 3, 3, 100);
        ImageRecord b = TestRecords.record("b.tif", "SED", 3, 3, 100);
        assertTrue(builder.discoverByPosition(List.of(a, b)).isEmpty());
    }

    // ==================== Merging and sorting ====================

    @Test
    @DisplayName("A position group with the same images as a tag group is dropped")
    void testMergePrefersTags() {
        ImageRecord sed = TestRecords.tagged("sed.tif", "SED", 4, 4, "T");
        ImageRecord bsd = TestRecords.tagged("bsd.tif", "BSD", 4, 4, "T");

        List<ImageCollection> found = discover(sed, bsd);

        assertEquals(1, found.size());
        assertEquals("mode_grid_T", found.get(0).getId());
    }

    @Test
    void testMergeKeepsDistinctGroups() {
        ImageRecord sed = TestRecords.tagged("sed.tif", "SED", 4, 4, "T");
        ImageRecord bsd = TestRecords.tagged("bsd.tif", "BSD", 4, 4, "T");
        ImageRecord topo = TestRecords.record("topo.tif", "EDX", 4, 4, 100);

        List<CandidateGroup> merged = builder.merge(
                builder.discoverByTag(List.of(sed, bsd, topo)),
                builder.discoverByPosition(List.of(sed, bsd, topo)));

        assertEquals(2, merged.size());
        assertEquals(GroupSource.TAG, merged.get(0).source());
        assertEquals(GroupSource.POSITION, merged.get(1).source());
    }

    @Test
    @DisplayName("Unlisted modes sort after listed ones in encounter order")
    void testPreferredOrder() {
        ImageRecord foo = TestRecords.record("foo.tif", "FOO", 0, 0, 100);
        ImageRecord sed = TestRecords.record("sed.tif", "SED", 0, 0, 100);
        ImageRecord xray = TestRecords.record("xray.tif", "XRAY", 0, 0, 100);
        ImageRecord bsd = TestRecords.record("bsd.tif", "BSD", 0, 0, 100);

        ImageCollection grid = builder.buildCollection(
                new CandidateGroup(GroupSource.POSITION, "0_0", List.of(foo, sed, xray, bsd)));

        assertEquals(List.of("sed", "bsd", "foo", "xray"), grid.getModes());
    }

    @Test
    void testModeSortKeyUsesPrefix() {
        assertEquals(2, builder.modeSortKey("topo-h"));
        assertEquals(1, builder.modeSortKey("bsd-all"));
        assertEquals(ModeCollectionBuilder.UNLISTED_MODE_KEY, builder.modeSortKey("mix"));
    }

    // ==================== Alternative swap ====================

    private ImageCollection sedBsdSed() {
        ImageRecord s1 = TestRecords.tagged("s1.tif", "SED", 0, 0, "A");
        ImageRecord b = TestRecords.tagged("b.tif", "BSD", 300, 0, "A");
        ImageRecord s3 = TestRecords.builder("s3.tif", "SED", 600, 0, 100)
                .highVoltageKv(5.0).collectionTag("A").build();
        return discover(s1, b, s3).get(0);
    }

    @Test
    @DisplayName("Swapping in an alternative exchanges the two images")
    void testSwapAlternative() {
        ImageCollection grid = sedBsdSed();
        when(collectionStore.save(eq("mode_grid_A"), any())).thenReturn(true);

        ImageCollection swapped = builder.switchImageAlternative(grid, 0, "/session/s3.tif");

        assertNotSame(grid, swapped);
        assertEquals(List.of("/session/s3.tif", "/session/s1.tif", "/session/b.tif"), references(swapped));
        assertEquals(List.of("/session/s1.tif"), swapped.getMembers().get(0).alternatives());
        assertEquals(List.of("/session/s3.tif"), swapped.getMembers().get(1).alternatives());
        assertEquals("SED 5 kV", swapped.getMembers().get(0).displayName());
        assertEquals(5.0, swapped.getHighVoltageKv());
        assertEquals(600.0, swapped.getReferenceX());
        // the original is untouched
        assertEquals(List.of("/session/s1.tif", "/session/s3.tif", "/session/b.tif"), references(grid));
        verify(collectionStore).save("mode_grid_A", swapped);
    }

    @Test
    @DisplayName("Swapping with a foreign reference returns the same collection")
    void testSwapForeignReference() {
        ImageCollection grid = sedBsdSed();

        assertSame(grid, builder.switchImageAlternative(grid, 0, "/session/unknown.tif"));
        assertSame(grid, builder.switchImageAlternative(grid, 2, "/session/s3.tif"));
        assertSame(grid, builder.switchImageAlternative(grid, 0, null));
        verifyNoInteractions(collectionStore);
    }

    @Test
    void testSwapSlotOutOfRange() {
        ImageCollection grid = sedBsdSed();
        assertSame(grid, builder.switchImageAlternative(grid, 3, "/session/s3.tif"));
        assertSame(grid, builder.switchImageAlternative(grid, -1, "/session/s3.tif"));
    }

    @Test
    void testSwapNeedsMetadata() {
        ImageRecord s1 = TestRecords.tagged("s1.tif", "SED", 0, 0, "A");
        ImageRecord b = TestRecords.tagged("b.tif", "BSD", 300, 0, "A");
        ImageRecord s3 = TestRecords.tagged("s3.tif", "SED", 600, 0, "A");
        ModeCollectionBuilder detached = new ModeCollectionBuilder(config, classifier, matcher, pairing,
                new InMemoryMetadataStore(List.of(s1, b)), null);
        ImageCollection grid = detached.buildCollection(
                new CandidateGroup(GroupSource.TAG, "A", List.of(s1, b, s3)));

        assertSame(grid, detached.switchImageAlternative(grid, 0, "/session/s3.tif"));
    }

    @Test
    void testSwapRejectsPyramids() {
        ImageCollection grid = sedBsdSed();
        ImageCollection pyramid = new ImageCollection("p", CollectionKind.PYRAMID, grid.getMembers(), null);
        assertSame(pyramid, builder.switchImageAlternative(pyramid, 0, "/session/s3.tif"));
    }

    @Test
    void testWorkflowName() {
        assertEquals("ModeGrid", builder.name());
    }
}
