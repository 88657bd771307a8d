package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Game;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 对局列表的单行摘要信息。
 */
@Data
@AllArgsConstructor
public class SessionSummary {
    private String gameId;
    private List<String> players;
    private String currentPlayer;
    private boolean gameOver;
    private String winner;
    private long createdAt;

    public static SessionSummary from(Game game) {
        MonopolyState s = game.getState();
        return new SessionSummary(
                game.getGameId(),
                s.getPlayers().stream().map(Player::getName).collect(Collectors.toList()),
                s.current().getName(),
                s.isOver(),
                s.getWinner(),
                game.getCreatedAt());
    }
}
