package com.monopolyhub.monopolyservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：每个动作都在副本上执行，成功后才替换原状态，失败时原状态保持不变。
 * - 具体游戏（如 MonopolyState）实现此接口。
 */
public interface GameState extends Cloneable {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
