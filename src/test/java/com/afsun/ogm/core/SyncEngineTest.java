package com.afsun.ogm.core;

import com.afsun.ogm.core.store.Direction;
import com.afsun.ogm.core.store.InMemoryGraphStore;
import com.afsun.ogm.core.store.RelationshipRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.afsun.ogm.core.SessionTest.props;
import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {

    private InMemoryGraphStore store;
    private SessionFactory factory;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        factory = new SessionFactory(MediaSchema.schema(), store);
    }

    @Test
    void testRoundTrip() {
        Session session = factory.open();
        Entity lost = session.create("Series", props("title", "Lost", "year", 2004, "finished", true));
        Entity pilot = session.create("Episode",
                props("title", "Pilot", "season", 1, "number", 1, "airDate", LocalDate.of(2004, 9, 22)));
        Entity drama = session.create("Tag", props("name", "drama"));
        lost.orderedList("episodes").append(pilot);
        lost.unorderedSet("tags").add(drama);

        CommitResult result = session.commit();
        assertEquals(3, result.getNodesCreated());
        assertEquals(2, result.getRelationshipsCreated());
        assertTrue(result.getTraceId().startsWith("CM-"));
        assertTrue(session.dirtyEntities().isEmpty());

        Session reader = factory.open();
        Entity copy = reader.findOne("Series", props("title", "Lost")).get();
        assertEquals(2004, copy.get("year"));
        assertEquals(true, copy.get("finished"));
        Entity episode = copy.orderedList("episodes").get(0);
        assertEquals("Pilot", episode.get("title"));
        assertEquals(LocalDate.of(2004, 9, 22), episode.get("airDate"));
        assertSame(copy, episode.reference("series").get());
        Entity tag = copy.unorderedSet("tags").toList().get(0);
        assertEquals("drama", tag.get("name"));
        assertTrue(tag.unorderedSet("items").contains(copy));
    }

    @Test
    void testSharedEdgeWrittenOnce() {
        Session session = factory.open();
        Entity lost = session.create("Series", props("title", "Lost"));
        Entity pilot = session.create("Episode", props("title", "Pilot"));
        pilot.reference("series").set(lost);
        assertTrue(session.isDirty(lost));
        assertTrue(session.isDirty(pilot));

        CommitResult result = session.commit();

        assertEquals(1, result.getRelationshipsCreated());
        assertEquals(1, store.statistics().getRelationshipCount());
        RelationshipRecord edge = store.fetchRelationships(lost.getHandle(), "HAS_EPISODE", Direction.OUTGOING).get(0);
        assertEquals(pilot.getHandle(), edge.getTo());
        assertEquals(0L, edge.getProperties().get("_ogm_order_episodes"));
    }

    @Test
    void testOrderedListPreserved() {
        Session session = factory.open();
        Entity lost = session.create("Series", props("title", "Lost"));
        List<Entity> created = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            created.add(session.create("Episode", props("number", i)));
        }
        OrderedAssociation episodes = lost.orderedList("episodes");
        episodes.append(created.get(1));
        episodes.append(created.get(3));
        episodes.insert(0, created.get(2));
        episodes.insert(1, created.get(0));
        session.commit();

        assertEquals(Arrays.asList(3, 1, 2, 4), numbers(factory.open().resolve(lost.getHandle())));
    }

    @Test
    void testReorderReplacesOnlyMovedEdges() {
        Long handle = seriesWithEpisodes(3);

        Session session = factory.open();
        Entity lost = session.resolve(handle);
        OrderedAssociation episodes = lost.orderedList("episodes");
        List<Entity> members = episodes.toList();
        episodes.reorder(Arrays.asList(members.get(1), members.get(2), members.get(0)));
        CommitResult result = session.commit();

        assertEquals(1, result.getRelationshipsCreated());
        assertEquals(1, result.getRelationshipsDeleted());
        assertEquals(3, store.statistics().getRelationshipCount());
        assertEquals(Arrays.asList(2, 3, 1), numbers(factory.open().resolve(handle)));

        episodes.reorder(Arrays.asList(members.get(0), members.get(1), members.get(2)));
        session.commit();
        assertEquals(Arrays.asList(1, 2, 3), numbers(factory.open().resolve(handle)));
        assertEquals(3, store.statistics().getRelationshipCount());
    }

    @Test
    void testRemoveFromMiddle() {
        Long handle = seriesWithEpisodes(3);

        Session session = factory.open();
        OrderedAssociation episodes = session.resolve(handle).orderedList("episodes");
        Entity middle = episodes.get(1);
        episodes.remove(middle);
        CommitResult result = session.commit();

        assertEquals(0, result.getRelationshipsCreated());
        assertEquals(1, result.getRelationshipsDeleted());
        assertEquals(Arrays.asList(1, 3), numbers(factory.open().resolve(handle)));
        assertNull(factory.open().resolve(middle.getHandle()).reference("series").get());
    }

    @Test
    void testAppendAfterReload() {
        Long handle = seriesWithEpisodes(2);

        Session session = factory.open();
        Entity lost = session.resolve(handle);
        lost.orderedList("episodes").insert(0, session.create("Episode", props("number", 0)));
        lost.orderedList("episodes").append(session.create("Episode", props("number", 3)));
        session.commit();

        assertEquals(Arrays.asList(0, 1, 2, 3), numbers(factory.open().resolve(handle)));
    }

    @Test
    void testBothSidesOrdered() {
        Session session = factory.open();
        Entity heat = session.create("Movie", props("title", "Heat"));
        Entity ronin = session.create("Movie", props("title", "Ronin"));
        Entity deNiro = session.create("Person", props("name", "De Niro"));
        Entity pacino = session.create("Person", props("name", "Pacino"));
        heat.orderedList("cast").append(pacino);
        heat.orderedList("cast").append(deNiro);
        deNiro.orderedList("filmography").insert(0, ronin);
        CommitResult result = session.commit();
        assertEquals(3, result.getRelationshipsCreated());

        Session reader = factory.open();
        Entity heatCopy = reader.resolve(heat.getHandle());
        Entity deNiroCopy = reader.resolve(deNiro.getHandle());
        assertEquals(Arrays.asList("Pacino", "De Niro"), names(heatCopy.orderedList("cast").toList(), "name"));
        assertEquals(Arrays.asList("Ronin", "Heat"), names(deNiroCopy.orderedList("filmography").toList(), "title"));

        deNiroCopy.orderedList("filmography").reorder(Arrays.asList(heatCopy, reader.resolve(ronin.getHandle())));
        reader.commit();

        Session third = factory.open();
        assertEquals(Arrays.asList("Heat", "Ronin"),
                names(third.resolve(deNiro.getHandle()).orderedList("filmography").toList(), "title"));
        assertEquals(Arrays.asList("Pacino", "De Niro"),
                names(third.resolve(heat.getHandle()).orderedList("cast").toList(), "name"));
    }

    @Test
    void testSingleReferenceReplacement() {
        Session session = factory.open();
        Entity ada = session.create("Person", props("name", "Ada"));
        Entity lost = session.create("Series", props("title", "Lost"));
        Entity heat = session.create("Movie", props("title", "Heat"));
        ada.reference("favorite").set(lost);
        session.commit();

        ada.reference("favorite").set(heat);
        CommitResult result = session.commit();
        assertEquals(1, result.getRelationshipsCreated());
        assertEquals(1, result.getRelationshipsDeleted());

        Entity favorite = factory.open().resolve(ada.getHandle()).reference("favorite").get();
        assertEquals("Heat", favorite.get("title"));
        assertEquals("Movie", favorite.getType().getName());
    }

    @Test
    void testMovingBetweenOwnersAcrossSessions() {
        Session setup = factory.open();
        Entity lost = setup.create("Series", props("title", "Lost"));
        Entity fringe = setup.create("Series", props("title", "Fringe"));
        Entity pilot = setup.create("Episode", props("number", 1));
        lost.orderedList("episodes").append(pilot);
        setup.commit();

        Session session = factory.open();
        session.resolve(fringe.getHandle()).orderedList("episodes").append(session.resolve(pilot.getHandle()));
        CommitResult result = session.commit();
        assertEquals(1, result.getRelationshipsCreated());
        assertEquals(1, result.getRelationshipsDeleted());

        Session reader = factory.open();
        assertTrue(reader.resolve(lost.getHandle()).orderedList("episodes").isEmpty());
        assertEquals("Fringe", reader.resolve(pilot.getHandle()).reference("series").get().get("title"));
    }

    @Test
    void testNothingToCommit() {
        Session session = factory.open();
        assertTrue(session.commit().isEmpty());
        session.create("Tag", props("name", "drama"));
        assertEquals(1, session.commit().getOperationCount());
        assertTrue(session.commit().isEmpty());
    }

    @Test
    void testEntityWithoutPropertiesIsPersisted() {
        Session session = factory.open();
        Entity empty = session.create("Episode");
        session.commit();
        assertNotNull(empty.getHandle());
        assertTrue(store.fetchNode(empty.getHandle()).getProperties().isEmpty());
    }

    private Long seriesWithEpisodes(int count) {
        Session session = factory.open();
        Entity series = session.create("Series", props("title", "Lost"));
        for (int i = 1; i <= count; i++) {
            series.orderedList("episodes").append(session.create("Episode", props("number", i)));
        }
        session.commit();
        return series.getHandle();
    }

    private static List<Object> numbers(Entity series) {
        return names(series.orderedList("episodes").toList(), "number");
    }

    private static List<Object> names(List<Entity> entities, String property) {
        List<Object> result = new ArrayList<>();
        for (Entity e : entities) {
            result.add(e.get(property));
        }
        return result;
    }
}
