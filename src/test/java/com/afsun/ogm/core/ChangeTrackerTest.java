package com.afsun.ogm.core;

import com.afsun.ogm.core.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.afsun.ogm.core.SessionTest.props;
import static org.junit.jupiter.api.Assertions.*;

class ChangeTrackerTest {

    private Session session;
    private ChangeTracker tracker;

    @BeforeEach
    void setUp() {
        session = new SessionFactory(MediaSchema.schema(), new InMemoryGraphStore()).open();
        tracker = session.getChangeTracker();
    }

    @Test
    void testMarkIsIdempotent() {
        Entity tag = session.create("Tag");
        tracker.markDirty(tag, "name");
        tracker.markDirty(tag, "name");
        tracker.markDirty(tag, "items");
        tracker.markDirty(tag, "items");

        assertEquals(1, tracker.size());
        assertEquals(Arrays.asList("name", "items"), new ArrayList<>(tracker.dirtyNames(tag)));
    }

    @Test
    void testPropertyAndAssociationNamesSeparated() {
        Entity ada = session.create("Person", props("name", "Ada"));
        Entity heat = session.create("Movie", props("title", "Heat"));
        ada.reference("favorite").set(heat);

        DirtyRecord record = tracker.snapshot().get(ada);
        assertEquals(Collections.singleton("name"), record.getProperties());
        assertEquals(Collections.singleton("favorite"), record.getAssociations());
        assertTrue(tracker.snapshot().get(heat).getAssociations().isEmpty());
    }

    @Test
    void testNewEntityWithoutChangesIsDirty() {
        Entity tag = session.create("Tag");
        assertTrue(tracker.isDirty(tag));
        assertTrue(tracker.dirtyNames(tag).isEmpty());
    }

    @Test
    void testSnapshotOrderAndCopy() {
        Entity first = session.create("Tag", props("name", "a"));
        Entity second = session.create("Tag", props("name", "b"));
        Entity third = session.create("Tag", props("name", "c"));
        first.set("name", "a2");

        Map<Entity, DirtyRecord> snapshot = tracker.snapshot();
        List<Entity> order = new ArrayList<>(snapshot.keySet());
        assertSame(first, order.get(0));
        assertSame(second, order.get(1));
        assertSame(third, order.get(2));

        tracker.clear(second);
        assertEquals(3, snapshot.size());
        assertEquals(2, tracker.size());
        assertEquals(Collections.singleton("name"), snapshot.get(first).getProperties());
    }

    @Test
    void testRecordsClearedAfterCommit() {
        Entity tag = session.create("Tag", props("name", "a"));
        session.commit();
        assertFalse(tracker.isDirty(tag));
        assertEquals(0, tracker.size());

        tag.set("name", "b");
        assertEquals(Collections.singleton("name"), tracker.dirtyNames(tag));
        session.commit();
        assertTrue(tracker.dirtyNames(tag).isEmpty());
    }

    @Test
    void testUnreferencedTransientIsCollected() throws InterruptedException {
        session.create("Tag", props("name", "forgotten"));
        assertEquals(1, tracker.size());

        for (int i = 0; i < 100 && tracker.size() > 0; i++) {
            byte[][] garbage = new byte[64][];
            for (int j = 0; j < garbage.length; j++) {
                garbage[j] = new byte[16 * 1024];
            }
            System.gc();
            Thread.sleep(10);
        }

        assertEquals(0, tracker.size());
        assertTrue(session.commit().isEmpty());
        assertEquals(0, session.getStore().statistics().getNodeCount());
    }
}
