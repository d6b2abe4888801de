package com.afsun.ogm.neo4j.store;

import com.afsun.ogm.core.exceptions.OgmException;
import com.afsun.ogm.core.exceptions.ReferentialIntegrityException;
import com.afsun.ogm.core.exceptions.StoreException;
import com.afsun.ogm.core.exceptions.StoreTimeoutException;
import com.afsun.ogm.core.exceptions.StoreUnavailableException;
import com.afsun.ogm.core.store.Direction;
import com.afsun.ogm.core.store.GraphStore;
import com.afsun.ogm.core.store.NodeRecord;
import com.afsun.ogm.core.store.RelationshipRecord;
import com.afsun.ogm.core.store.StoreStatistics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 基于 Neo4j 的图存储。句柄为 Neo4j 内部 id，所有操作在带超时的事务中执行，
 * 一次提交的全部操作共享同一个事务。
 *
 * @author afsun
 */
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    public static final String STORE_TYPE = "neo4j";

    private final Neo4jClient neo4jClient;

    private final TransactionTemplate transactionTemplate;

    public Neo4jGraphStore(Neo4jClient neo4jClient, PlatformTransactionManager transactionManager, Duration timeout) {
        this.neo4jClient = neo4jClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) Math.max(1, timeout.getSeconds()));
    }

    @Override
    public Long createNode(String label, Map<String, Object> properties) {
        String cypher = "CREATE (n:" + quote(label) + ") SET n = $props RETURN id(n) AS handle";
        Long handle = inTransaction(() -> neo4jClient.query(cypher)
                .bind(withoutNulls(properties)).to("props")
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("handle").asLong())
                .one()
                .orElseThrow(() -> new StoreException("STORE_ERROR", "创建节点未返回句柄: {}", label)));
        log.debug("创建节点 {}:{}", handle, label);
        return handle;
    }

    @Override
    public void updateNode(Long handle, Map<String, Object> properties) {
        if (properties == null || properties.isEmpty()) {
            return;
        }
        // SET n += 中的 null 值会删除对应属性
        String cypher = "MATCH (n) WHERE id(n) = $handle SET n += $props RETURN id(n) AS handle";
        Optional<Long> updated = inTransaction(() -> neo4jClient.query(cypher)
                .bind(handle).to("handle")
                .bind(new HashMap<>(properties)).to("props")
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("handle").asLong())
                .one());
        if (!updated.isPresent()) {
            throw nodeNotFound(handle);
        }
        log.debug("更新节点 {} 属性={}", handle, properties.keySet());
    }

    @Override
    public void deleteNode(Long handle) {
        inTransaction(() -> {
            String countCypher = "MATCH (n) WHERE id(n) = $handle OPTIONAL MATCH (n)-[r]-() RETURN count(r) AS degree";
            Long degree = neo4jClient.query(countCypher)
                    .bind(handle).to("handle")
                    .fetchAs(Long.class)
                    .mappedBy((typeSystem, record) -> record.get("degree").asLong())
                    .one()
                    .orElseThrow(() -> nodeNotFound(handle));
            if (degree > 0) {
                throw new ReferentialIntegrityException(handle, degree.intValue());
            }
            neo4jClient.query("MATCH (n) WHERE id(n) = $handle DELETE n")
                    .bind(handle).to("handle")
                    .run();
            return null;
        });
        log.debug("删除节点 {}", handle);
    }

    @Override
    public Long createRelationship(String type, Long from, Long to, Map<String, Object> properties) {
        String cypher = "MATCH (a) WHERE id(a) = $from MATCH (b) WHERE id(b) = $to " +
                "CREATE (a)-[r:" + quote(type) + "]->(b) SET r = $props RETURN id(r) AS handle";
        Long handle = inTransaction(() -> neo4jClient.query(cypher)
                .bind(from).to("from")
                .bind(to).to("to")
                .bind(withoutNulls(properties)).to("props")
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("handle").asLong())
                .one()
                .orElseThrow(() -> new StoreException("NODE_NOT_FOUND", "关系端点不存在: {} -> {}", from, to)));
        log.debug("创建关系 {} ({})-[:{}]->({})", handle, from, type, to);
        return handle;
    }

    @Override
    public void deleteRelationship(Long handle) {
        int deleted = inTransaction(() -> neo4jClient.query("MATCH ()-[r]->() WHERE id(r) = $handle DELETE r")
                .bind(handle).to("handle")
                .run()
                .counters()
                .relationshipsDeleted());
        if (deleted == 0) {
            throw new StoreException("RELATIONSHIP_NOT_FOUND", "关系不存在: {}", handle);
        }
        log.debug("删除关系 {}", handle);
    }

    @Override
    public NodeRecord fetchNode(Long handle) {
        String cypher = "MATCH (n) WHERE id(n) = $handle RETURN labels(n) AS labels, properties(n) AS props";
        return inTransaction(() -> neo4jClient.query(cypher)
                .bind(handle).to("handle")
                .fetchAs(NodeRecord.class)
                .mappedBy((typeSystem, record) -> {
                    List<String> labels = record.get("labels").asList(Value::asString);
                    String label = labels.isEmpty() ? null : labels.get(0);
                    return new NodeRecord(handle, label, new LinkedHashMap<>(record.get("props").asMap()));
                })
                .one()
                .orElseThrow(() -> nodeNotFound(handle)));
    }

    @Override
    public List<RelationshipRecord> fetchRelationships(Long handle, String type, Direction direction) {
        String rel = type == null ? "[r]" : "[r:" + quote(type) + "]";
        String pattern;
        switch (direction) {
            case OUTGOING:
                pattern = "(n)-" + rel + "->(m)";
                break;
            case INCOMING:
                pattern = "(n)<-" + rel + "-(m)";
                break;
            default:
                pattern = "(n)-" + rel + "-(m)";
                break;
        }
        String cypher = "MATCH (n) WHERE id(n) = $handle MATCH " + pattern + " " +
                "RETURN id(r) AS handle, type(r) AS type, id(startNode(r)) AS fromId, id(endNode(r)) AS toId, " +
                "id(m) AS otherEnd, properties(r) AS props ORDER BY id(r)";
        Collection<RelationshipRecord> records = inTransaction(() -> {
            requireNode(handle);
            return neo4jClient.query(cypher)
                    .bind(handle).to("handle")
                    .fetchAs(RelationshipRecord.class)
                    .mappedBy((typeSystem, record) -> new RelationshipRecord(
                            record.get("handle").asLong(),
                            record.get("type").asString(),
                            record.get("fromId").asLong(),
                            record.get("toId").asLong(),
                            record.get("otherEnd").asLong(),
                            new LinkedHashMap<>(record.get("props").asMap())))
                    .all();
        });
        return new ArrayList<>(records);
    }

    @Override
    public List<Long> findNodes(String label, Map<String, Object> filter) {
        StringBuilder cypher = new StringBuilder("MATCH (n");
        if (label != null) {
            cypher.append(':').append(quote(label));
        }
        cypher.append(')');
        Map<String, Object> parameters = new HashMap<>();
        if (filter != null && !filter.isEmpty()) {
            List<String> conditions = new ArrayList<>();
            int i = 0;
            for (Map.Entry<String, Object> e : filter.entrySet()) {
                String parameter = "p" + i++;
                conditions.add("n." + quote(e.getKey()) + " = $" + parameter);
                parameters.put(parameter, e.getValue());
            }
            cypher.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        cypher.append(" RETURN id(n) AS handle ORDER BY handle");
        Collection<Long> handles = inTransaction(() -> neo4jClient.query(cypher.toString())
                .bindAll(parameters)
                .fetchAs(Long.class)
                .mappedBy((typeSystem, record) -> record.get("handle").asLong())
                .all());
        return new ArrayList<>(handles);
    }

    @Override
    public StoreStatistics statistics() {
        return inTransaction(() -> {
            long nodeCount = neo4jClient.query("MATCH (n) RETURN count(n) AS cnt")
                    .fetchAs(Long.class)
                    .mappedBy((typeSystem, record) -> record.get("cnt").asLong())
                    .one()
                    .orElse(0L);
            long relationshipCount = neo4jClient.query("MATCH ()-[r]->() RETURN count(r) AS cnt")
                    .fetchAs(Long.class)
                    .mappedBy((typeSystem, record) -> record.get("cnt").asLong())
                    .one()
                    .orElse(0L);
            Map<String, Long> labels = neo4jClient
                    .query("MATCH (n) UNWIND labels(n) AS label RETURN label, count(*) AS cnt ORDER BY label")
                    .fetch()
                    .all()
                    .stream()
                    .collect(Collectors.toMap(row -> (String) row.get("label"), row -> (Long) row.get("cnt"),
                            (a, b) -> a, LinkedHashMap::new));
            return new StoreStatistics(STORE_TYPE, nodeCount, relationshipCount, labels);
        });
    }

    @Override
    public boolean supportsTransactions() {
        return true;
    }

    @Override
    public void executeInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    private void requireNode(Long handle) {
        boolean exists = neo4jClient.query("MATCH (n) WHERE id(n) = $handle RETURN id(n) AS handle")
                .bind(handle).to("handle")
                .fetch()
                .one()
                .isPresent();
        if (!exists) {
            throw nodeNotFound(handle);
        }
    }

    /**
     * 在事务中执行（已有事务时加入），并将驱动与 Spring 的异常转换为存储异常
     */
    private <T> T inTransaction(Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (OgmException e) {
            throw e;
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            throw new StoreTimeoutException("Neo4j 操作超时: {}", e.getMessage(), e);
        } catch (DataAccessResourceFailureException | ServiceUnavailableException e) {
            throw new StoreUnavailableException("Neo4j 不可用: {}", e.getMessage(), e);
        } catch (DataAccessException | TransactionException | Neo4jException e) {
            if (isTimeout(e)) {
                throw new StoreTimeoutException("Neo4j 事务超时: {}", e.getMessage(), e);
            }
            log.error("Neo4j 操作失败", e);
            throw new StoreException("STORE_ERROR", "Neo4j 操作失败: {}", e.getMessage(), e);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t : ExceptionUtils.getThrowableList(e)) {
            if (t instanceof Neo4jException) {
                String code = ((Neo4jException) t).code();
                if (code != null && code.contains("TransactionTimedOut")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static StoreException nodeNotFound(Long handle) {
        return new StoreException("NODE_NOT_FOUND", "节点不存在: {}", handle);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> properties) {
        Map<String, Object> result = new HashMap<>();
        if (properties != null) {
            properties.forEach((k, v) -> {
                if (v != null) {
                    result.put(k, v);
                }
            });
        }
        return result;
    }

    /**
     * 标签、关系类型与属性名不能作为参数传入，以反引号转义后拼接
     */
    static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("标识符不能为空");
        }
        return "`" + identifier.replace("`", "``") + "`";
    }
}
