package org.rephoto.alignment.correspondence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link CorrespondenceStore} class.
 */
public class CorrespondenceStoreTest {

    private CorrespondenceStore store;

    @Before
    public void setup() {
        store = new CorrespondenceStore();
    }

    @Test
    public void testIdsAreMonotonicAndNeverReused() {

        final long pointId = store.addPoint(p(1, 2), p(3, 4));
        final long lineId = store.addLine(p(0, 0), p(10, 0), p(1, 1), p(11, 1));
        final long faceId = store.addFace(square(0), square(5));

        Assert.assertEquals("invalid point id", 1, pointId);
        Assert.assertEquals("invalid line id", 2, lineId);
        Assert.assertEquals("invalid face id", 3, faceId);

        store.remove(lineId);

        final long nextId = store.addPoint(p(7, 7), p(8, 8));
        Assert.assertEquals("removed id should not be reused", 4, nextId);
        Assert.assertEquals("invalid size", 3, store.size());
        Assert.assertEquals("every mutation should increment the generation", 5, store.getGeneration());

        Assert.assertEquals(CorrespondenceKind.POINT, store.kindOf(pointId));
        Assert.assertEquals(CorrespondenceKind.FACE, store.kindOf(faceId));
        Assert.assertFalse("removed id should be gone", store.contains(lineId));
    }

    @Test
    public void testFlattenToPointPairsUsesInsertionAndPointOrder() {

        store.addFace(square(0), square(100));
        store.addPoint(p(1, 2), p(3, 4));
        store.addLine(p(0, 0), p(10, 0), p(1, 1), p(11, 1));

        final List<PointPair> pairs = store.flattenToPointPairs();

        Assert.assertEquals("invalid number of pairs", 7, pairs.size());

        final ImagePoint[] cornersA = square(0);
        final ImagePoint[] cornersB = square(100);
        for (int i = 0; i < 4; i++) {
            Assert.assertEquals("invalid face corner " + i + " A point", cornersA[i], pairs.get(i).getA());
            Assert.assertEquals("invalid face corner " + i + " B point", cornersB[i], pairs.get(i).getB());
        }
        Assert.assertEquals(new PointPair(p(1, 2), p(3, 4)), pairs.get(4));
        Assert.assertEquals(new PointPair(p(0, 0), p(1, 1)), pairs.get(5));
        Assert.assertEquals(new PointPair(p(10, 0), p(11, 1)), pairs.get(6));

        Assert.assertEquals("flattening should not mutate the store", 3, store.getGeneration());
    }

    @Test
    public void testInvalidFaceLeavesStoreUnchanged() {

        final ImagePoint[] threeCorners = { p(0, 0), p(1, 0), p(1, 1) };
        try {
            store.addFace(threeCorners, square(0));
            Assert.fail("face with 3 corners should be rejected");
        } catch (final InvalidShapeException e) {
            Assert.assertTrue(true); // test passed
        }

        try {
            store.addFace(square(0), null);
            Assert.fail("face without B corners should be rejected");
        } catch (final InvalidShapeException e) {
            Assert.assertTrue(true); // test passed
        }

        Assert.assertEquals("invalid size", 0, store.size());
        Assert.assertEquals("failed adds should not change the generation", 0, store.getGeneration());
        Assert.assertFalse("failed adds should not mark the store dirty", store.isDirty());
        Assert.assertEquals("failed adds should not consume ids", 1, store.addPoint(p(0, 0), p(0, 0)));
    }

    @Test
    public void testUnknownIdIsRejected() {

        store.addPoint(p(1, 1), p(2, 2));

        try {
            store.update(99, ImageSide.A, 0, p(5, 5));
            Assert.fail("update of unknown id should fail");
        } catch (final CorrespondenceNotFoundException e) {
            Assert.assertEquals("invalid id in exception", 99, e.getId());
        }

        try {
            store.remove(99);
            Assert.fail("remove of unknown id should fail");
        } catch (final CorrespondenceNotFoundException e) {
            Assert.assertEquals("invalid id in exception", 99, e.getId());
        }

        try {
            store.kindOf(99);
            Assert.fail("kindOf unknown id should fail");
        } catch (final CorrespondenceNotFoundException e) {
            Assert.assertEquals("invalid id in exception", 99, e.getId());
        }

        Assert.assertEquals("failed operations should not change the generation", 1, store.getGeneration());
    }

    @Test
    public void testUpdate() {

        final long lineId = store.addLine(p(0, 0), p(10, 0), p(1, 1), p(11, 1));

        store.update(lineId, ImageSide.B, 1, p(20, 2));

        final Correspondence line = store.get(lineId);
        Assert.assertEquals("B end point should be updated", p(20, 2), line.getPoint(ImageSide.B, 1));
        Assert.assertEquals("A end point should be unchanged", p(10, 0), line.getPoint(ImageSide.A, 1));
        Assert.assertEquals("invalid generation", 2, store.getGeneration());

        try {
            store.update(lineId, ImageSide.A, 2, p(0, 0));
            Assert.fail("index 2 should be out of range for a line");
        } catch (final InvalidShapeException e) {
            Assert.assertTrue(true); // test passed
        }
    }

    @Test
    public void testDirtyFlag() {

        Assert.assertFalse("new store should not be dirty", store.isDirty());

        store.addPoint(p(1, 1), p(2, 2));
        final long solvedGeneration = store.getGeneration();
        Assert.assertTrue("mutated store should be dirty", store.isDirty());

        store.addPoint(p(3, 3), p(4, 4));

        Assert.assertFalse("stale generation should not clear dirty flag", store.markSolved(solvedGeneration));
        Assert.assertTrue("store should still be dirty", store.isDirty());

        Assert.assertTrue("current generation should clear dirty flag", store.markSolved(store.getGeneration()));
        Assert.assertFalse("store should be clean", store.isDirty());
    }

    @Test
    public void testClear() {

        store.addPoint(p(1, 1), p(2, 2));
        store.addPoint(p(3, 3), p(4, 4));

        store.clear();

        Assert.assertEquals("invalid size", 0, store.size());
        Assert.assertEquals("clear should be a single mutation", 3, store.getGeneration());
        Assert.assertEquals("ids should not restart after clear", 3, store.addPoint(p(5, 5), p(6, 6)));
    }

    @Test
    public void testReplaceAll() {

        store.addPoint(p(1, 1), p(2, 2));

        final List<Correspondence> correspondences = Arrays.asList(
                Correspondence.point(5, p(1, 1), p(2, 2)),
                Correspondence.line(2, p(0, 0), p(10, 0), p(1, 1), p(11, 1)));

        store.replaceAll(correspondences);

        Assert.assertEquals("invalid size", 2, store.size());
        Assert.assertFalse("previous content should be gone", store.contains(1));
        Assert.assertEquals("order should be preserved",
                            Arrays.asList(5L, 2L),
                            ids(store.snapshot().getCorrespondences()));
        Assert.assertEquals("next id should follow the largest loaded id", 6, store.addPoint(p(0, 0), p(0, 0)));
    }

    @Test
    public void testReplaceAllWithDuplicateIdsLeavesStoreUnchanged() {

        store.addPoint(p(1, 1), p(2, 2));
        final long generation = store.getGeneration();

        final List<Correspondence> correspondences = Arrays.asList(
                Correspondence.point(3, p(1, 1), p(2, 2)),
                Correspondence.point(3, p(5, 5), p(6, 6)));

        try {
            store.replaceAll(correspondences);
            Assert.fail("duplicate ids should be rejected");
        } catch (final InvalidShapeException e) {
            Assert.assertTrue(true); // test passed
        }

        Assert.assertEquals("store should be unchanged", 1, store.size());
        Assert.assertTrue("store should be unchanged", store.contains(1));
        Assert.assertEquals("generation should be unchanged", generation, store.getGeneration());
    }

    @Test
    public void testSnapshotIsIsolatedFromLaterMutations() {

        store.addPoint(p(1, 1), p(2, 2));

        final CorrespondenceSnapshot snapshot = store.snapshot();

        store.addPoint(p(3, 3), p(4, 4));
        store.remove(1);

        Assert.assertEquals("invalid snapshot generation", 1, snapshot.getGeneration());
        Assert.assertEquals("snapshot should not see later mutations", 1, snapshot.size());
        Assert.assertEquals("invalid snapshot pairs", 1, snapshot.flattenToPointPairs().size());

        try {
            snapshot.getCorrespondences().clear();
            Assert.fail("snapshot should be read-only");
        } catch (final UnsupportedOperationException e) {
            Assert.assertTrue(true); // test passed
        }
    }

    @Test
    public void testListenersSeeEachGeneration() {

        final List<Long> notifiedGenerations = new ArrayList<>();
        final CorrespondenceStoreListener listener = (changedStore, generation) -> notifiedGenerations.add(generation);
        store.addListener(listener);

        final long id = store.addPoint(p(1, 1), p(2, 2));
        store.update(id, ImageSide.A, 0, p(9, 9));
        store.remove(id);

        store.removeListener(listener);
        store.clear();

        Assert.assertEquals("invalid notifications", Arrays.asList(1L, 2L, 3L), notifiedGenerations);
    }

    static ImagePoint p(final double x,
                        final double y) {
        return new ImagePoint(x, y);
    }

    static ImagePoint[] square(final double offset) {
        return new ImagePoint[] {
                p(offset, offset), p(offset + 10, offset), p(offset + 10, offset + 10), p(offset, offset + 10)
        };
    }

    private static List<Long> ids(final List<Correspondence> correspondences) {
        final List<Long> ids = new ArrayList<>();
        for (final Correspondence correspondence : correspondences) {
            ids.add(correspondence.getId());
        }
        return ids;
    }

}
