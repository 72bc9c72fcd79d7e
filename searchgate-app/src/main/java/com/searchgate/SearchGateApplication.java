package com.searchgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tavily 搜索网关 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.searchgate")
@EnableScheduling
public class SearchGateApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录，启动前确保 data/ 存在
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(SearchGateApplication.class, args);
    }
}
