package com.afsun.ogm.config;

import com.afsun.ogm.core.SessionFactory;
import com.afsun.ogm.core.schema.Schema;
import com.afsun.ogm.core.schema.SchemaBuilder;
import com.afsun.ogm.core.store.GraphStore;
import com.afsun.ogm.core.store.InMemoryGraphStore;
import com.afsun.ogm.neo4j.store.Neo4jGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * 装配 Schema、图存储与会话工厂
 *
 * @author afsun
 */
@Configuration
@Slf4j
public class OgmConfiguration {

    @Bean
    public Schema ogmSchema(ObjectProvider<SchemaContributor> contributors) {
        SchemaBuilder builder = new SchemaBuilder();
        contributors.orderedStream().forEach(contributor -> contributor.contribute(builder));
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ogm.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public GraphStore inMemoryGraphStore() {
        log.info("使用内存图存储");
        return new InMemoryGraphStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ogm.store", name = "type", havingValue = "neo4j")
    public GraphStore neo4jGraphStore(Neo4jClient neo4jClient, PlatformTransactionManager transactionManager,
                                      OgmProperties properties) {
        log.info("使用 Neo4j 图存储, 事务超时: {}", properties.getNeo4j().getTimeout());
        return new Neo4jGraphStore(neo4jClient, transactionManager, properties.getNeo4j().getTimeout());
    }

    @Bean
    public SessionFactory sessionFactory(Schema schema, GraphStore graphStore) {
        return new SessionFactory(schema, graphStore);
    }
}
