package com.semantic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * AI 客服回答语义比对 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.semantic")
@EnableScheduling
public class SemanticCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemanticCheckerApplication.class, args);
    }
}
