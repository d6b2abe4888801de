package com.afsun.ogm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 对象图映射配置
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "ogm")
public class OgmProperties {

    private Store store = new Store();

    private Neo4j neo4j = new Neo4j();

    @Data
    public static class Store {
        /**
         * 图存储类型：memory（内存，默认）或 neo4j
         */
        private String type = "memory";
    }

    @Data
    public static class Neo4j {
        /**
         * 单个事务的超时时间，超时后提交抛出 StoreTimeoutException
         */
        private Duration timeout = Duration.ofSeconds(30);
    }
}
