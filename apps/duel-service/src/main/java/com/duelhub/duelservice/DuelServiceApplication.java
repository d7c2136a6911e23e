package com.duelhub.duelservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * duel-service 启动入口。
 */
@SpringBootApplication
public class DuelServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DuelServiceApplication.class, args);
    }
}
