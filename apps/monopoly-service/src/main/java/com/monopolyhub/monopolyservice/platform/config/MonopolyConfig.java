package com.monopolyhub.monopolyservice.platform.config;

import com.monopolyhub.monopolyservice.engine.core.DiceRoller;
import com.monopolyhub.monopolyservice.engine.core.RandomDiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.application.MonopolyEngine;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * MonopolyConfig
 * ---------------------------------------
 * 规则参数与引擎装配：
 *  - monopoly.* 配置绑定为不可变的 {@link GameSettings}；
 *  - 配置了 monopoly.dice.seed 时骰子与洗牌可复现，否则使用 SecureRandom。
 */
@Slf4j
@Configuration
public class MonopolyConfig {

    @Value("${monopoly.starting-cash:1500}")
    private int startingCash;

    @Value("${monopoly.go-salary:200}")
    private int goSalary;

    @Value("${monopoly.jail-fine:50}")
    private int jailFine;

    @Value("${monopoly.max-jail-turns:3}")
    private int maxJailTurns;

    @Value("${monopoly.max-doubles:3}")
    private int maxDoubles;

    @Value("${monopoly.auction.min-bid:10}")
    private int auctionMinBid;

    @Value("${monopoly.pool.houses:32}")
    private int houses;

    @Value("${monopoly.pool.hotels:12}")
    private int hotels;

    /** 为空表示不固定种子 */
    @Value("${monopoly.dice.seed:#{null}}")
    private Long diceSeed;

    @Bean
    public GameSettings gameSettings() {
        GameSettings settings = GameSettings.builder()
                .startingCash(startingCash)
                .goSalary(goSalary)
                .jailFine(jailFine)
                .maxJailTurns(maxJailTurns)
                .maxDoubles(maxDoubles)
                .auctionMinBid(auctionMinBid)
                .houses(houses)
                .hotels(hotels)
                .build();
        log.info("大富翁规则参数: {}", settings);
        return settings;
    }

    @Bean
    public DiceRoller diceRoller() {
        return new RandomDiceRoller(random("dice"));
    }

    @Bean
    public MonopolyEngine monopolyEngine(GameSettings gameSettings, DiceRoller diceRoller) {
        return new MonopolyEngine(gameSettings, diceRoller, random("shuffle"));
    }

    private Random random(String purpose) {
        if (diceSeed == null) {
            return new SecureRandom();
        }
        log.info("使用固定随机种子: purpose={}, seed={}", purpose, diceSeed);
        return new Random(diceSeed);
    }
}
