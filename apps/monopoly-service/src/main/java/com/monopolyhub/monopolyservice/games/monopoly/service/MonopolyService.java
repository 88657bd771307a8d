package com.monopolyhub.monopolyservice.games.monopoly.service;

import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.AuctionResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.GameSnapshot;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.ManagementResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PlayerPropertiesView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.PurchaseResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SessionSummary;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.SpaceView;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeRequest;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;

import java.util.List;
import java.util.Map;

/**
 * 大富翁对局服务：展示层/协议层调用引擎的唯一入口。
 * 所有修改类操作都是原子的：失败（抛出 MonopolyException）时对局状态不变；
 * 同一对局同一时刻只允许一个操作在途，并发调用直接以 SESSION_BUSY 拒绝。
 */
public interface MonopolyService {

    /** 新建对局；玩家 2~8 人，名字非空且不重复；返回 gameId */
    String createGame(List<String> playerNames);

    /** 全部对局摘要，按创建时间排序 */
    List<SessionSummary> listGames();

    /** 只读全量快照 */
    GameSnapshot getState(String gameId);

    /** 某位玩家的地产详情（颜色、建筑、抵押、当前租金、是否垄断） */
    PlayerPropertiesView getPlayerProperties(String gameId, String playerName);

    /** 静态棋盘目录（40 格） */
    List<SpaceView> boardCatalog();

    // ---------- 回合 ----------

    TurnOutcome roll(String gameId, String playerName);

    TurnOutcome payJail(String gameId, String playerName);

    TurnOutcome useJailCard(String gameId, String playerName);

    /** 结束回合，交给下一位未破产玩家 */
    TurnOutcome endTurn(String gameId, String playerName);

    // ---------- 购买 ----------

    PurchaseResult buy(String gameId, String playerName, String property);

    /**
     * 放弃购买并立即拍卖。
     * @param bids 玩家名 -> 出价（密封一次性出价；可为空表示无人出价）
     */
    AuctionResult decline(String gameId, String playerName, String property, Map<String, Integer> bids);

    // ---------- 资产管理 ----------

    ManagementResult mortgage(String gameId, String playerName, String property);

    ManagementResult unmortgage(String gameId, String playerName, String property);

    ManagementResult build(String gameId, String playerName, String property);

    ManagementResult sellBuilding(String gameId, String playerName, String property);

    // ---------- 交易 ----------

    TradeResult proposeTrade(String gameId, String proposer, String counterparty, TradeRequest request);

    TradeResult acceptTrade(String gameId, String playerName, String tradeId);

    TradeResult rejectTrade(String gameId, String playerName, String tradeId);
}
