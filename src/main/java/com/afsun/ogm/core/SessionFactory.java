package com.afsun.ogm.core;

import com.afsun.ogm.core.schema.Schema;
import com.afsun.ogm.core.store.GraphStore;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 创建绑定到同一 Schema 与图存储的会话
 *
 * @author afsun
 */
public class SessionFactory {

    private final Schema schema;
    private final GraphStore store;
    private final AtomicLong counter = new AtomicLong();

    public SessionFactory(Schema schema, GraphStore store) {
        this.schema = schema;
        this.store = store;
    }

    public Session open() {
        return new Session("S-" + counter.incrementAndGet(), schema, store);
    }

    public Schema getSchema() {
        return schema;
    }

    public GraphStore getStore() {
        return store;
    }
}
