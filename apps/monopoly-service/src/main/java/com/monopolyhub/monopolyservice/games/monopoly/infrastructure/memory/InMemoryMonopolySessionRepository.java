package com.monopolyhub.monopolyservice.games.monopoly.infrastructure.memory;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Game;
import com.monopolyhub.monopolyservice.games.monopoly.domain.repository.MonopolySessionRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 基于 ConcurrentHashMap 的对局仓储。
 * 对局之间不共享可变状态，这里只负责登记与查找。
 */
@Repository
public class InMemoryMonopolySessionRepository implements MonopolySessionRepository {

    private final Map<String, Game> games = new ConcurrentHashMap<>();

    @Override
    public void create(Game game) {
        Game previous = games.putIfAbsent(game.getGameId(), game);
        if (previous != null) {
            throw new IllegalStateException("对局ID重复: " + game.getGameId());
        }
    }

    @Override
    public Optional<Game> get(String gameId) {
        if (gameId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(games.get(gameId));
    }

    @Override
    public List<Game> list() {
        return games.values().stream()
                .sorted(Comparator.comparingLong(Game::getCreatedAt).thenComparing(Game::getGameId))
                .collect(Collectors.toList());
    }
}
