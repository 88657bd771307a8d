package com.monopolyhub.monopolyservice.games.monopoly.domain.repository;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Game;

import java.util.List;
import java.util.Optional;

/**
 * MonopolySessionRepository
 * ----------------------------------------
 * 对局会话仓储（Session Registry）
 * - 进程级的 gameId -> Game 映射；
 * - 不同 gameId 的并发创建必须安全；
 * - 当前实现基于内存，不做持久化。
 * ----------------------------------------
 */
public interface MonopolySessionRepository {

    /**
     * 保存新对局
     * @param game 对局实体
     * @throws IllegalStateException gameId 已存在
     */
    void create(Game game);

    /**
     * 查询对局
     * @param gameId 对局ID
     * @return 可选的 Game（不存在则 empty）
     */
    Optional<Game> get(String gameId);

    /**
     * 全部对局，按创建时间升序
     */
    List<Game> list();
}
