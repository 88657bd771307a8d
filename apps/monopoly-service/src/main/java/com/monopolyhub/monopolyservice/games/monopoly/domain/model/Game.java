package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 一局游戏实体（会话）。
 * - state：已提交的对局状态；动作在其副本上执行，成功后整体替换，读操作无需加锁；
 * - lock：同一对局同一时刻只允许一个动作在途，抢不到锁直接拒绝（不排队）。
 */
@Getter
public class Game {

    private final String gameId;
    private final long createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    @Setter
    private volatile MonopolyState state;

    public Game(String gameId, long createdAt, MonopolyState state) {
        this.gameId = gameId;
        this.createdAt = createdAt;
        this.state = state;
    }
}
