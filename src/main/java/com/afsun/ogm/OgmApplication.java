package com.afsun.ogm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 对象图映射服务主类
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.ogm")
@ConfigurationPropertiesScan
public class OgmApplication {
    public static void main(String[] args) {
        SpringApplication.run(OgmApplication.class, args);
    }
}
