package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.DetachedEntityException;
import com.afsun.ogm.core.exceptions.OgmException;
import com.afsun.ogm.core.exceptions.StoreException;
import com.afsun.ogm.core.exceptions.TypeMismatchException;
import com.afsun.ogm.core.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private InMemoryGraphStore store;
    private SessionFactory factory;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        factory = new SessionFactory(MediaSchema.schema(), store);
    }

    @Test
    void testIdentityWithinSession() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        session.commit();
        Long handle = ada.getHandle();

        assertNotNull(handle);
        assertEquals(EntityState.MANAGED, ada.getState());
        assertSame(ada, session.resolve(handle));

        Session other = factory.open();
        Entity first = other.resolve(handle);
        Entity second = other.resolve(handle);
        assertSame(first, second);
        assertNotSame(ada, first);
        assertEquals("Ada", first.get("name"));
    }

    @Test
    void testSessionIds() {
        assertNotEquals(factory.open().getId(), factory.open().getId());
    }

    @Test
    void testGraphPropertyNames() {
        Session session = factory.open();
        Entity pilot = session.create("Episode", props("title", "Pilot", "airDate", LocalDate.of(2005, 9, 13)));
        session.commit();

        Map<String, Object> stored = store.fetchNode(pilot.getHandle()).getProperties();
        assertEquals("Pilot", stored.get("episode_title"));
        assertFalse(stored.containsKey("title"));

        Entity reloaded = factory.open().resolve(pilot.getHandle());
        assertEquals("Pilot", reloaded.get("title"));
        assertEquals(LocalDate.of(2005, 9, 13), reloaded.get("airDate"));
    }

    @Test
    void testResolveUnknownLabel() {
        Long handle = store.createNode("Song", props("title", "Hey Jude"));
        OgmException e = assertThrows(OgmException.class, () -> factory.open().resolve(handle));
        assertEquals("UNKNOWN_LABEL", e.getErrorCode());
    }

    @Test
    void testResolveUnknownHandle() {
        StoreException e = assertThrows(StoreException.class, () -> factory.open().resolve(99L));
        assertEquals("NODE_NOT_FOUND", e.getErrorCode());
    }

    @Test
    void testCreateWithInvalidProperty() {
        Session session = factory.open();
        assertThrows(TypeMismatchException.class, () -> session.create("Person", props("name", 42)));
        assertThrows(IllegalArgumentException.class, () -> session.create("Person", props("age", 42)));
        assertThrows(IllegalArgumentException.class, () -> session.create("Song"));
        assertTrue(session.commit().isEmpty());
        assertEquals(0, store.statistics().getNodeCount());
    }

    @Test
    void testSetValidation() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));

        assertThrows(TypeMismatchException.class, () -> ada.set("name", 1815));
        assertEquals("Ada", ada.get("name"));
        assertThrows(IllegalArgumentException.class, () -> ada.set("born", 1815));
        assertThrows(IllegalArgumentException.class, () -> ada.set("mentor", "Babbage"));
    }

    @Test
    void testSetSameValueIsNotDirty() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        session.commit();
        assertFalse(session.isDirty(ada));

        ada.set("name", "Ada");
        assertFalse(session.isDirty(ada));

        ada.set("name", "Ada Lovelace");
        assertTrue(session.isDirty(ada));
        assertEquals(Collections.singletonList(ada), session.dirtyEntities());
    }

    @Test
    void testUpdateWritesChangedProperties() {
        Session session = factory.open();
        Entity lost = session.create("Series", props("title", "Lost", "year", 2004, "finished", false));
        session.commit();

        lost.set("finished", true);
        lost.set("year", null);
        CommitResult result = session.commit();

        assertEquals(1, result.getNodesUpdated());
        assertEquals(0, result.getNodesCreated());
        Map<String, Object> stored = store.fetchNode(lost.getHandle()).getProperties();
        assertEquals(true, stored.get("finished"));
        assertEquals("Lost", stored.get("title"));
        assertFalse(stored.containsKey("year"));
        assertTrue(session.commit().isEmpty());
    }

    @Test
    void testFindAll() {
        Session setup = factory.open();
        setup.create("Person", props("name", "Ada"));
        setup.create("Person", props("name", "Alan"));
        setup.create("Series", props("title", "Lost"));
        setup.create("Movie", props("title", "Heat"));
        setup.commit();

        Session session = factory.open();
        List<Entity> adas = session.findAll("Person", props("name", "Ada"));
        assertEquals(1, adas.size());
        assertSame(adas.get(0), session.resolve(adas.get(0).getHandle()));

        assertEquals(2, session.findAll("Person", null).size());
        assertEquals(2, session.findAll("Media", Collections.emptyMap()).size());
        assertEquals(1, session.findAll("Movie", null).size());
        assertThrows(IllegalArgumentException.class, () -> session.findAll("Person", props("age", 3)));
    }

    @Test
    void testFindUsesInMemoryValues() {
        Session setup = factory.open();
        setup.create("Person", props("name", "Alan"));
        setup.commit();

        Session session = factory.open();
        Entity alan = session.findOne("Person", props("name", "Alan")).get();
        alan.set("name", "Alan Turing");
        Entity grace = session.create("Person", props("name", "Grace"));

        assertFalse(session.findOne("Person", props("name", "Alan")).isPresent());
        assertSame(alan, session.findOne("Person", props("name", "Alan Turing")).get());
        assertSame(grace, session.findOne("Person", props("name", "Grace")).get());
        assertEquals(2, session.findAll("Person", null).size());
    }

    @Test
    void testFindOrCreate() {
        Session setup = factory.open();
        setup.create("Person", props("name", "Ada"));
        setup.commit();

        Session session = factory.open();
        Entity ada = session.findOrCreate("Person", props("name", "Ada"));
        assertEquals(EntityState.MANAGED, ada.getState());
        assertSame(ada, session.findOrCreate("Person", props("name", "Ada")));

        Entity grace = session.findOrCreate("Person", props("name", "Grace"));
        assertTrue(grace.isTransient());
        assertSame(grace, session.findOrCreate("Person", props("name", "Grace")));

        Optional<Entity> nobody = session.findOne("Person", props("name", "Nobody"));
        assertFalse(nobody.isPresent());

        session.commit();
        assertEquals(2, store.findNodes("Person", null).size());
    }

    @Test
    void testFindOrCreateMatchesUniqueProperties() {
        Session setup = factory.open();
        setup.create("Series", props("title", "Lost", "year", 2004));
        setup.commit();

        Session session = factory.open();
        Entity lost = session.findOrCreate("Series", props("title", "Lost", "year", 1999));
        assertEquals(EntityState.MANAGED, lost.getState());
        assertEquals(2004, lost.get("year"));
    }

    @Test
    void testRefresh() {
        Session writer = factory.open();
        Entity ada = writer.create("Person", props("name", "Ada"));
        writer.commit();

        Session reader = factory.open();
        Entity copy = reader.resolve(ada.getHandle());

        ada.set("name", "Ada Lovelace");
        writer.commit();
        assertEquals("Ada", copy.get("name"));

        reader.refresh(copy);
        assertEquals("Ada Lovelace", copy.get("name"));

        copy.set("name", "Countess");
        assertThrows(IllegalStateException.class, () -> reader.refresh(copy));
        Entity fresh = reader.create("Person");
        assertThrows(IllegalStateException.class, () -> reader.refresh(fresh));
    }

    @Test
    void testEvict() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        session.commit();

        ada.set("name", "Changed");
        session.evict(ada);

        assertEquals(EntityState.DETACHED, ada.getState());
        assertFalse(session.isDirty(ada));
        assertThrows(DetachedEntityException.class, () -> ada.set("name", "Again"));

        Entity reloaded = session.resolve(ada.getHandle());
        assertNotSame(ada, reloaded);
        assertEquals("Ada", reloaded.get("name"));
        assertTrue(session.commit().isEmpty());
    }

    @Test
    void testEvictTransientUnlinksFromOwner() {
        Session session = factory.open();
        Entity lost = session.create("Series", props("title", "Lost"));
        session.commit();

        Entity pilot = session.create("Episode", props("title", "Pilot"));
        lost.orderedList("episodes").append(pilot);
        session.evict(pilot);

        assertEquals(EntityState.DETACHED, pilot.getState());
        assertTrue(lost.orderedList("episodes").isEmpty());
        CommitResult result = session.commit();
        assertEquals(0, result.getNodesCreated());
        assertEquals(0, result.getRelationshipsCreated());
        assertFalse(session.isDirty(lost));
        assertEquals(1, store.statistics().getNodeCount());
        assertEquals(0, store.statistics().getRelationshipCount());
    }

    @Test
    void testCommitRejectsEvictedTarget() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        session.commit();

        Entity heat = session.create("Movie", props("title", "Heat"));
        ada.reference("favorite").set(heat);
        session.evict(heat);

        assertThrows(DetachedEntityException.class, session::commit);
        assertTrue(session.isDirty(ada));
        assertEquals(1, store.statistics().getNodeCount());

        ada.reference("favorite").set(null);
        session.commit();
        assertEquals(0, store.statistics().getRelationshipCount());
        assertFalse(session.isDirty(ada));
    }

    @Test
    void testCloseDetachesEntities() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        session.commit();
        Entity pending = session.create("Person", props("name", "Alan"));
        session.close();

        assertFalse(session.isOpen());
        assertEquals(EntityState.DETACHED, ada.getState());
        assertEquals(EntityState.DETACHED, pending.getState());
        assertThrows(DetachedEntityException.class, () -> ada.set("name", "x"));
        assertThrows(DetachedEntityException.class, () -> session.resolve(ada.getHandle()));
        assertThrows(DetachedEntityException.class, session::commit);
        session.close();

        assertEquals(1, store.statistics().getNodeCount());
        assertEquals("Ada", factory.open().resolve(ada.getHandle()).get("name"));
    }

    @Test
    void testTryWithResources() {
        Long handle;
        try (Session session = factory.open()) {
            Entity tag = session.create("Tag", props("name", "drama"));
            session.commit();
            handle = tag.getHandle();
        }
        assertEquals("drama", store.fetchNode(handle).getProperties().get("name"));
    }

    static Map<String, Object> props(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
