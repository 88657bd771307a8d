package com.monopolyhub.monopolyservice.engine.core;

/**
 * 一次掷骰结果：两颗 1~6 的骰子。
 */
public record DiceRoll(int first, int second) {

    public DiceRoll {
        if (first < 1 || first > 6 || second < 1 || second > 6) {
            throw new IllegalArgumentException("骰子点数必须在 1~6 之间: " + first + "," + second);
        }
    }

    /** 点数之和 */
    public int total() {
        return first + second;
    }

    /** 是否为对子 */
    public boolean doubles() {
        return first == second;
    }
}
