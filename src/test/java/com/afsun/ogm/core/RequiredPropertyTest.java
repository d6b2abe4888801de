package com.afsun.ogm.core;

import com.afsun.ogm.core.exceptions.RequiredPropertyException;
import com.afsun.ogm.core.schema.Schema;
import com.afsun.ogm.core.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.afsun.ogm.core.SessionTest.props;
import static com.afsun.ogm.core.schema.Cardinality.SINGLE;
import static com.afsun.ogm.core.schema.PropertyKind.STRING;
import static com.afsun.ogm.core.store.Direction.OUTGOING;
import static org.junit.jupiter.api.Assertions.*;

class RequiredPropertyTest {

    private InMemoryGraphStore store;
    private SessionFactory factory;

    /**
     * 媒体库加上字幕类型：language 为必填属性
     */
    static Schema subtitleSchema() {
        return MediaSchema.builder()
                .type("Subtitle", t -> t
                        .property("language", STRING)
                        .property("path", STRING)
                        .required("language")
                        .relationship("episode", "Episode", SINGLE, OUTGOING, "SUBTITLE_OF"))
                .build();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        factory = new SessionFactory(subtitleSchema(), store);
    }

    @Test
    void testCommitRejectsMissingRequired() {
        Session session = factory.open();
        Entity subtitle = session.create("Subtitle", props("path", "/pilot.srt"));

        RequiredPropertyException e = assertThrows(RequiredPropertyException.class, session::commit);
        assertEquals("REQUIRED_PROPERTY", e.getErrorCode());
        assertEquals("Subtitle", e.getTypeName());
        assertEquals(Collections.singletonList("language"), e.getMissingProperties());
        assertEquals(0, store.statistics().getNodeCount());
        assertTrue(session.isDirty(subtitle));
        assertEquals(EntityState.TRANSIENT, subtitle.getState());

        subtitle.set("language", "en");
        assertEquals(1, session.commit().getNodesCreated());
        assertEquals("en", store.fetchNode(subtitle.getHandle()).getProperties().get("language"));
    }

    @Test
    void testRequiredCheckedOnUpdate() {
        Session session = factory.open();
        Entity subtitle = session.create("Subtitle", props("language", "en", "path", "/pilot.srt"));
        session.commit();

        subtitle.set("language", null);
        assertThrows(RequiredPropertyException.class, session::commit);
        assertEquals("en", store.fetchNode(subtitle.getHandle()).getProperties().get("language"));

        subtitle.set("language", "fr");
        session.commit();
        assertEquals("fr", store.fetchNode(subtitle.getHandle()).getProperties().get("language"));
    }

    @Test
    void testInvalidStoredNodeCanBeDeleted() {
        Long handle = store.createNode("Subtitle", props("path", "/orphan.srt"));
        Session session = factory.open();
        Entity orphan = session.resolve(handle);
        assertFalse(session.isDirty(orphan));

        orphan.set("path", "/moved.srt");
        assertThrows(RequiredPropertyException.class, session::commit);

        session.delete(orphan);
        assertEquals(1, session.commit().getNodesDeleted());
        assertEquals(0, store.statistics().getNodeCount());
    }

    @Test
    void testTypesWithoutRequiredAreUnaffected() {
        Session session = factory.open();
        session.create("Tag");
        session.create("Episode");
        assertEquals(2, session.commit().getNodesCreated());
    }
}
