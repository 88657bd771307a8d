package com.monopolyhub.monopolyservice.games.monopoly.service.impl;

import com.monopolyhub.monopolyservice.games.monopoly.application.MonopolyEngine;
import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.GameSnapshot;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.ManagementResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PlayerPropertiesView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PropertyView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PurchaseResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SessionSummary;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SpaceView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeRequest;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Game;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.repository.MonopolySessionRepository;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.InvariantViolationException;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;
import com.monopolyhub.monopolyservice.games.monopoly.service.MonopolyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;


@Slf4j
@Service
@RequiredArgsConstructor
public class MonopolyServiceImpl implements MonopolyService {

    private final MonopolySessionRepository sessions;
    private final MonopolyEngine engine;

    /**
     * 新建对局
     */
    @Override
    public String createGame(List<String> playerNames) {
        // 1) 名单校验 + 初始局面（洗牌）
        MonopolyState state = engine.newGame(playerNames);
        // 2) 登记会话
        String gameId = UUID.randomUUID().toString();
        sessions.create(new Game(gameId, System.currentTimeMillis(), state));
        log.info("创建对局: gameId={}, players={}", gameId, playerNames);
        return gameId;
    }

    @Override
    public List<SessionSummary> listGames() {
        return sessions.list().stream().map(SessionSummary::from).collect(Collectors.toList());
    }

    @Override
    public GameSnapshot getState(String gameId) {
        Game game = requireGame(gameId);
        return GameSnapshot.of(game.getGameId(), game.getCreatedAt(), game.getState());
    }

    @Override
    public PlayerPropertiesView getPlayerProperties(String gameId, String playerName) {
        MonopolyState state = requireGame(gameId).getState();
        Player player = state.player(playerName);
        int diceTotal = state.getLastRoll() == null ? 0 : state.getLastRoll().total();
        List<PropertyView> properties = state.getLedger().deedsOf(player.getName()).stream()
                .map(d -> PropertyView.of(state.getLedger(), d, diceTotal))
                .collect(Collectors.toList());
        return new PlayerPropertiesView(player.getName(), properties, properties.size());
    }

    @Override
    public List<SpaceView> boardCatalog() {
        return BoardCatalog.spaces().stream().map(SpaceView::of).collect(Collectors.toList());
    }

    // ==================== 回合 ====================

    @Override
    public TurnOutcome roll(String gameId, String playerName) {
        return logTurn(gameId, execute(gameId, "roll", playerName, s -> engine.roll(s, playerName)));
    }

    @Override
    public TurnOutcome payJail(String gameId, String playerName) {
        return logTurn(gameId, execute(gameId, "payJail", playerName, s -> engine.payJail(s, playerName)));
    }

    @Override
    public TurnOutcome useJailCard(String gameId, String playerName) {
        return logTurn(gameId, execute(gameId, "useJailCard", playerName, s -> engine.useJailCard(s, playerName)));
    }

    @Override
    public TurnOutcome endTurn(String gameId, String playerName) {
        return logTurn(gameId, execute(gameId, "endTurn", playerName, s -> engine.endTurn(s, playerName)));
    }

    // ==================== 购买 ====================

    @Override
    public PurchaseResult buy(String gameId, String playerName, String property) {
        PurchaseResult result = execute(gameId, "buy", playerName, s -> engine.buy(s, playerName, property));
        log.info("购买地产: gameId={}, player={}, property={}, price={}",
                gameId, result.player(), result.property(), result.price());
        return result;
    }

    @Override
    public AuctionResult decline(String gameId, String playerName, String property, Map<String, Integer> bids) {
        AuctionResult result = execute(gameId, "decline", playerName, s -> engine.decline(s, playerName, property, bids));
        log.info("拍卖结束: gameId={}, property={}, winner={}, price={}, rejected={}",
                gameId, result.property(), result.winner(), result.price(), result.rejectedBids());
        return result;
    }

    // ==================== 资产管理 ====================

    @Override
    public ManagementResult mortgage(String gameId, String playerName, String property) {
        return logManagement(gameId, execute(gameId, "mortgage", playerName, s -> engine.mortgage(s, playerName, property)));
    }

    @Override
    public ManagementResult unmortgage(String gameId, String playerName, String property) {
        return logManagement(gameId, execute(gameId, "unmortgage", playerName, s -> engine.unmortgage(s, playerName, property)));
    }

    @Override
    public ManagementResult build(String gameId, String playerName, String property) {
        return logManagement(gameId, execute(gameId, "build", playerName, s -> engine.build(s, playerName, property)));
    }

    @Override
    public ManagementResult sellBuilding(String gameId, String playerName, String property) {
        return logManagement(gameId, execute(gameId, "sellBuilding", playerName, s -> engine.sellBuilding(s, playerName, property)));
    }

    // ==================== 交易 ====================

    @Override
    public TradeResult proposeTrade(String gameId, String proposer, String counterparty, TradeRequest request) {
        TradeResult result = execute(gameId, "proposeTrade", proposer,
                s -> engine.proposeTrade(s, proposer, counterparty, request));
        log.info("发起交易: gameId={}, tradeId={}, proposer={}, counterparty={}",
                gameId, result.offer().getTradeId(), proposer, counterparty);
        return result;
    }

    @Override
    public TradeResult acceptTrade(String gameId, String playerName, String tradeId) {
        TradeResult result = execute(gameId, "acceptTrade", playerName, s -> engine.acceptTrade(s, playerName, tradeId));
        log.info("交易成交: gameId={}, tradeId={}, offer={}", gameId, tradeId, result.offer());
        return result;
    }

    @Override
    public TradeResult rejectTrade(String gameId, String playerName, String tradeId) {
        TradeResult result = execute(gameId, "rejectTrade", playerName, s -> engine.rejectTrade(s, playerName, tradeId));
        log.info("交易取消: gameId={}, tradeId={}, by={}", gameId, tradeId, playerName);
        return result;
    }

    // ==================== 内部 ====================

    private Game requireGame(String gameId) {
        return sessions.get(gameId)
                .orElseThrow(() -> MonopolyException.of(ErrorKind.SESSION_NOT_FOUND, GameMessages.SESSION_NOT_FOUND, gameId));
    }

    /**
     * 原子执行一个动作：
     * 1) 抢对局锁，抢不到直接拒绝；
     * 2) 在状态副本上执行；
     * 3) 断言不变量后整体替换已提交状态。任何异常都不提交，原状态保持不变。
     */
    private <T> T execute(String gameId, String action, String playerName, Function<MonopolyState, T> op) {
        Game game = requireGame(gameId);
        if (!game.getLock().tryLock()) {
            throw MonopolyException.of(ErrorKind.SESSION_BUSY, GameMessages.SESSION_BUSY, gameId);
        }
        try {
            MonopolyState working = game.getState().copy();
            T result = op.apply(working);
            working.getLedger().assertInvariants(working.getPlayers());
            game.setState(working);
            return result;
        } catch (MonopolyException e) {
            log.debug("动作被拒绝: gameId={}, action={}, player={}, kind={}, msg={}",
                    gameId, action, playerName, e.getKind(), e.getMessage());
            throw e;
        } catch (InvariantViolationException e) {
            log.warn("动作已回滚（不变量被破坏）: gameId={}, action={}, player={}", gameId, action, playerName, e);
            throw e;
        } finally {
            game.getLock().unlock();
        }
    }

    private TurnOutcome logTurn(String gameId, TurnOutcome outcome) {
        log.debug("回合动作: gameId={}, player={}, action={}, events={}",
                gameId, outcome.getPlayer(), outcome.getAction(), outcome.getEvents());
        for (String bankrupt : outcome.getBankruptPlayers()) {
            log.info("玩家破产: gameId={}, player={}", gameId, bankrupt);
        }
        if (outcome.isGameOver()) {
            log.info("对局结束: gameId={}, winner={}", gameId, outcome.getWinner());
        }
        return outcome;
    }

    private ManagementResult logManagement(String gameId, ManagementResult result) {
        log.debug("资产管理: gameId={}, player={}, action={}, property={}, amount={}",
                gameId, result.player(), result.action(), result.property(), result.amount());
        return result;
    }
}
