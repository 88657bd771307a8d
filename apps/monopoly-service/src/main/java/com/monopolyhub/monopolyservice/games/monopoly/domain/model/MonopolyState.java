package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.engine.core.DiceRoll;
import com.monopolyhub.monopolyservice.engine.core.GameState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.DeckType;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.TurnPhase;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * 对局状态：整盘对局的“单一事实来源”。
 * - 玩家（顺序即行动顺序，整局固定）、当前玩家、回合阶段；
 * - 账本（现金/地产/建筑池）与两副卡组；
 * - 连续对子计数、待决购买、待处理交易、终局标志与胜者。
 * 状态本身不做规则校验，规则在 application 包的各个解析器中。
 */
@Data
public class MonopolyState implements GameState {

    private final List<Player> players;
    private final Ledger ledger;
    private CardDeck chance;
    private CardDeck communityChest;

    private int currentIndex;
    private TurnPhase phase = TurnPhase.AWAITING_ACTION;
    /** 本回合连续对子次数 */
    private int doublesStreak;
    /** 落点结算完成后是否还能再掷一次（非狱中掷出对子） */
    private boolean extraRoll;
    /** 最近一次掷骰（公用事业租金用） */
    private DiceRoll lastRoll;
    /** 等待 buy/decline 的格子位置 */
    private Integer pendingPurchase;
    /** 待处理的交易 */
    private TradeOffer pendingTrade;
    private long tradeSeq;

    private boolean over;
    private String winner;

    public MonopolyState(List<Player> players, Ledger ledger, CardDeck chance, CardDeck communityChest) {
        this.players = players;
        this.ledger = ledger;
        this.chance = chance;
        this.communityChest = communityChest;
    }

    /** 开新局：按给定顺序建玩家，洗两副卡组 */
    public static MonopolyState newGame(List<String> names, GameSettings settings, Random shuffle) {
        List<Player> players = names.stream()
                .map(n -> new Player(n, settings.getStartingCash()))
                .collect(Collectors.toCollection(ArrayList::new));
        return new MonopolyState(players,
                new Ledger(settings.getHouses(), settings.getHotels()),
                StandardDecks.shuffledChance(shuffle),
                StandardDecks.shuffledCommunityChest(shuffle));
    }

    // --------- 读方法 ----------

    public Player current() {
        return players.get(currentIndex);
    }

    public Player player(String name) {
        return players.stream()
                .filter(p -> p.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> MonopolyException.of(ErrorKind.PLAYER_NOT_FOUND, GameMessages.PLAYER_NOT_FOUND, name));
    }

    public List<Player> activePlayers() {
        return players.stream().filter(Player::active).collect(Collectors.toList());
    }

    public CardDeck deck(DeckType type) {
        return type == DeckType.CHANCE ? chance : communityChest;
    }

    // --------- 通用前置校验 ----------

    public void requireNotOver() {
        if (over) {
            throw MonopolyException.of(ErrorKind.GAME_OVER, GameMessages.GAME_ALREADY_OVER);
        }
    }

    /** 必须是当前玩家（返回该玩家） */
    public Player requireCurrent(String name) {
        Player p = player(name);
        if (p != current()) {
            throw MonopolyException.of(ErrorKind.NOT_CURRENT_PLAYER, GameMessages.NOT_YOUR_TURN, name, current().getName());
        }
        return p;
    }

    public void requirePhase(TurnPhase expected, String action) {
        if (phase != expected) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.INVALID_PHASE, phase, action);
        }
    }

    /** 资产管理与交易：待决购买时或玩家在狱中均不可执行 */
    public void requireFreeToManage(Player player, String action) {
        if (phase == TurnPhase.AWAITING_PURCHASE_DECISION) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.INVALID_PHASE, phase, action);
        }
        if (player.isInJail()) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.IN_JAIL_RESTRICTED, player.getName(), action);
        }
    }

    // --------- 状态变更 ----------

    /** 结束对局并设置赢家（可为 null：所有人都破产） */
    public void finish(String winnerName) {
        this.over = true;
        this.winner = winnerName;
        this.phase = TurnPhase.TURN_END;
        this.pendingPurchase = null;
        this.pendingTrade = null;
    }

    public long nextTradeSeq() {
        return ++tradeSeq;
    }

    /** 深拷贝：玩家、账本、卡组、待处理交易全部复制 */
    @Override
    public MonopolyState copy() {
        List<Player> ps = players.stream().map(Player::copy).collect(Collectors.toCollection(ArrayList::new));
        MonopolyState s = new MonopolyState(ps, ledger.copy(), chance.copy(), communityChest.copy());
        s.currentIndex = currentIndex;
        s.phase = phase;
        s.doublesStreak = doublesStreak;
        s.extraRoll = extraRoll;
        s.lastRoll = lastRoll; // DiceRoll 是不可变 record
        s.pendingPurchase = pendingPurchase;
        s.pendingTrade = pendingTrade == null ? null : pendingTrade.copy();
        s.tradeSeq = tradeSeq;
        s.over = over;
        s.winner = winner;
        return s;
    }
}
