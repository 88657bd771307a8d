package com.monopolyhub.monopolyservice.engine.core;

/**
 * 骰子抽象：引擎只通过它获取随机性。
 * - 生产环境使用 {@link RandomDiceRoller}；
 * - 测试中可以注入固定序列，保证结算可复现。
 */
public interface DiceRoller {

    DiceRoll roll();
}
