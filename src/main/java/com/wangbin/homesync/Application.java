package com.wangbin.homesync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
@Slf4j
public class Application {

    public static void main(String[] args) {
        try {
            SpringApplication.run(Application.class, args);
            log.info("=== 设备同步服务启动成功 ===");
        } catch (Exception e) {
            log.error("=== 启动失败: {} ===", e.getMessage(), e);
            throw e;
        }
    }
}
