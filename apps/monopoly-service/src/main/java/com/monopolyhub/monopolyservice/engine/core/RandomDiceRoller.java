package com.monopolyhub.monopolyservice.engine.core;

import java.util.Random;

/**
 * 基于 {@link Random} 的默认骰子实现，两颗骰子相互独立、均匀分布。
 */
public class RandomDiceRoller implements DiceRoller {

    private final Random random;

    public RandomDiceRoller(Random random) {
        this.random = random;
    }

    @Override
    public DiceRoll roll() {
        // Random 本身线程安全；不同房间并发掷骰互不影响
        return new DiceRoll(random.nextInt(6) + 1, random.nextInt(6) + 1);
    }
}
