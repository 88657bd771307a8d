package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.engine.core.DiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.ManagementResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PurchaseResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeRequest;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;
import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * 大富翁规则引擎门面：把各解析器装配在一起，对外提供全部对局动作。
 * 无状态，可被所有对局共享；每个方法只修改传入的 {@link MonopolyState}。
 */
public class MonopolyEngine {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 8;

    @Getter
    private final GameSettings settings;
    private final Random shuffle;
    private final TurnEngine turns;
    private final TransactionResolver transactions;
    private final TradeResolver trades;

    public MonopolyEngine(GameSettings settings, DiceRoller dice, Random shuffle) {
        this.settings = settings;
        this.shuffle = shuffle;
        BankruptcyResolver bankruptcy = new BankruptcyResolver();
        LandingResolver landing = new LandingResolver(settings, dice, bankruptcy);
        this.turns = new TurnEngine(settings, dice, landing, bankruptcy);
        this.transactions = new TransactionResolver(turns, new AuctionResolver(settings));
        this.trades = new TradeResolver();
    }

    /** 校验玩家名单（2~8 人，非空且不重复）并开新局 */
    public MonopolyState newGame(List<String> playerNames) {
        if (playerNames == null || playerNames.size() < MIN_PLAYERS || playerNames.size() > MAX_PLAYERS) {
            throw MonopolyException.of(ErrorKind.INVALID_PLAYER_COUNT, GameMessages.INVALID_PLAYER_COUNT);
        }
        Set<String> seen = new HashSet<>();
        for (String name : playerNames) {
            if (name == null || name.isBlank() || !seen.add(name)) {
                throw MonopolyException.of(ErrorKind.INVALID_PLAYER_COUNT, GameMessages.INVALID_PLAYER_NAMES);
            }
        }
        return MonopolyState.newGame(playerNames, settings, shuffle);
    }

    public TurnOutcome roll(MonopolyState state, String player) {
        return turns.roll(state, player);
    }

    public TurnOutcome payJail(MonopolyState state, String player) {
        return turns.payJail(state, player);
    }

    public TurnOutcome useJailCard(MonopolyState state, String player) {
        return turns.useJailCard(state, player);
    }

    public TurnOutcome endTurn(MonopolyState state, String player) {
        return turns.endTurn(state, player);
    }

    public PurchaseResult buy(MonopolyState state, String player, String property) {
        return transactions.buy(state, player, property);
    }

    public AuctionResult decline(MonopolyState state, String player, String property, Map<String, Integer> bids) {
        return transactions.decline(state, player, property, bids);
    }

    public ManagementResult mortgage(MonopolyState state, String player, String property) {
        return transactions.mortgage(state, player, property);
    }

    public ManagementResult unmortgage(MonopolyState state, String player, String property) {
        return transactions.unmortgage(state, player, property);
    }

    public ManagementResult build(MonopolyState state, String player, String property) {
        return transactions.build(state, player, property);
    }

    public ManagementResult sellBuilding(MonopolyState state, String player, String property) {
        return transactions.sellBuilding(state, player, property);
    }

    public TradeResult proposeTrade(MonopolyState state, String proposer, String counterparty, TradeRequest request) {
        return trades.propose(state, proposer, counterparty, request);
    }

    public TradeResult acceptTrade(MonopolyState state, String player, String tradeId) {
        return trades.accept(state, player, tradeId);
    }

    public TradeResult rejectTrade(MonopolyState state, String player, String tradeId) {
        return trades.reject(state, player, tradeId);
    }
}
