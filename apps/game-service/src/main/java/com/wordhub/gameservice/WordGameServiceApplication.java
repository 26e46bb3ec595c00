package com.wordhub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * game-service 启动入口。
 * 开启 @EnableScheduling 供超时扫描使用。
 */
@SpringBootApplication
@EnableScheduling
public class WordGameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordGameServiceApplication.class, args);
    }
}
