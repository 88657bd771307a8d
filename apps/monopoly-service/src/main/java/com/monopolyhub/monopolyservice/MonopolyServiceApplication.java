package com.monopolyhub.monopolyservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * monopoly-service 启动入口。
 * 引擎只以 {@link com.monopolyhub.monopolyservice.games.monopoly.service.MonopolyService} 的形式暴露给上层（展示层/协议层）。
 */
@SpringBootApplication
public class MonopolyServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonopolyServiceApplication.class, args);
    }
}
