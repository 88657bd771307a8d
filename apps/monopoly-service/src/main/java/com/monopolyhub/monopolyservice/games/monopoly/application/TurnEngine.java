package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.engine.core.DiceRoll;
import com.monopolyhub.monopolyservice.engine.core.DiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.RentMode;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.TurnPhase;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 回合状态机：掷骰、移动、落点分派、监狱、对子加掷、轮转。
 * <p>
 * AWAITING_ACTION -(roll)-> MOVED -(落点结算)-> AWAITING_ACTION（对子加掷）
 * | AWAITING_PURCHASE_DECISION | TURN_END -(endTurn)-> 下一位的 AWAITING_ACTION。
 * <p>
 * 所有方法直接修改传入的状态；原子性（副本 + 提交）由服务层保证。
 */
@Slf4j
public class TurnEngine {

    private final GameSettings settings;
    private final DiceRoller dice;
    private final LandingResolver landing;
    private final BankruptcyResolver bankruptcy;

    public TurnEngine(GameSettings settings, DiceRoller dice, LandingResolver landing, BankruptcyResolver bankruptcy) {
        this.settings = settings;
        this.dice = dice;
        this.landing = landing;
        this.bankruptcy = bankruptcy;
    }

    public TurnOutcome roll(MonopolyState state, String playerName) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requirePhase(TurnPhase.AWAITING_ACTION, "roll");

        TurnOutcome outcome = new TurnOutcome(player.getName(), "roll");
        int startCash = player.getCash();
        int startPos = player.getPosition();

        DiceRoll roll = dice.roll();
        state.setLastRoll(roll);
        state.setExtraRoll(false);
        outcome.setDice(List.of(roll.first(), roll.second()));
        outcome.setDoubles(roll.doubles());
        outcome.event(GameMessages.format(GameMessages.EVENT_ROLLED,
                player.getName(), roll.first(), roll.second(), roll.total()));
        log.debug("掷骰: player={}, dice={}+{}, inJail={}", player.getName(), roll.first(), roll.second(), player.isInJail());

        if (player.isInJail()) {
            rollInJail(state, player, roll, outcome);
        } else {
            rollFree(state, player, roll, outcome);
        }
        return finish(state, player, startCash, startPos, outcome);
    }

    /** 狱中掷骰：对子出狱并移动（不加掷）；连续失败到上限时强制缴罚金后移动 */
    private void rollInJail(MonopolyState state, Player player, DiceRoll roll, TurnOutcome outcome) {
        if (roll.doubles()) {
            releaseFromJail(player);
            outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_DOUBLES, player.getName()));
            moveAndResolve(state, player, roll, false, outcome);
            return;
        }
        int attempts = player.getJailTurns() + 1;
        player.setJailTurns(attempts);
        if (attempts < settings.getMaxJailTurns()) {
            outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_STAY, player.getName(), attempts));
            state.setPhase(TurnPhase.TURN_END);
            return;
        }
        outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_FORCED_FINE, player.getName(), attempts, settings.getJailFine()));
        if (!bankruptcy.collect(state, player, null, settings.getJailFine(), outcome)) {
            return;
        }
        releaseFromJail(player);
        moveAndResolve(state, player, roll, false, outcome);
    }

    private void rollFree(MonopolyState state, Player player, DiceRoll roll, TurnOutcome outcome) {
        if (roll.doubles()) {
            int streak = state.getDoublesStreak() + 1;
            state.setDoublesStreak(streak);
            if (streak >= settings.getMaxDoubles()) {
                outcome.event(GameMessages.format(GameMessages.EVENT_SPEEDING, player.getName(), streak));
                landing.sendToJail(state, player, outcome);
                state.setPhase(TurnPhase.TURN_END);
                return;
            }
        }
        moveAndResolve(state, player, roll, roll.doubles(), outcome);
    }

    private void moveAndResolve(MonopolyState state, Player player, DiceRoll roll, boolean mayRollAgain, TurnOutcome outcome) {
        landing.advance(state, player, roll.total(), outcome);
        state.setPhase(TurnPhase.MOVED);
        landing.resolve(state, player, RentMode.STANDARD, outcome);
        if (state.isOver() || player.isBankrupt()) {
            return;
        }
        if (player.isInJail()) {
            state.setPhase(TurnPhase.TURN_END);
            return;
        }
        state.setExtraRoll(mayRollAgain);
        if (mayRollAgain) {
            outcome.setExtraRoll(true);
            outcome.event(GameMessages.format(GameMessages.EVENT_EXTRA_ROLL, player.getName()));
        }
        if (state.getPendingPurchase() != null) {
            state.setPhase(TurnPhase.AWAITING_PURCHASE_DECISION);
        } else {
            state.setPhase(afterResolution(state));
        }
    }

    /** 落点（含购买决定）结算完毕后的阶段：有加掷则继续等待掷骰，否则回合结束 */
    TurnPhase afterResolution(MonopolyState state) {
        if (state.isExtraRoll()) {
            state.setExtraRoll(false);
            return TurnPhase.AWAITING_ACTION;
        }
        return TurnPhase.TURN_END;
    }

    public TurnOutcome payJail(MonopolyState state, String playerName) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requirePhase(TurnPhase.AWAITING_ACTION, "payJail");
        requireInJail(player);
        int fine = settings.getJailFine();
        if (player.getCash() < fine) {
            throw MonopolyException.of(ErrorKind.INSUFFICIENT_FUNDS, GameMessages.INSUFFICIENT_FUNDS,
                    player.getName(), fine, player.getCash());
        }
        TurnOutcome outcome = new TurnOutcome(player.getName(), "payJail");
        int startCash = player.getCash();
        state.getLedger().debit(player, fine);
        releaseFromJail(player);
        outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_PAID, player.getName(), fine));
        return finish(state, player, startCash, player.getPosition(), outcome);
    }

    public TurnOutcome useJailCard(MonopolyState state, String playerName) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requirePhase(TurnPhase.AWAITING_ACTION, "useJailCard");
        requireInJail(player);
        if (player.getJailCards().isEmpty()) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.NO_JAIL_CARD, player.getName());
        }
        TurnOutcome outcome = new TurnOutcome(player.getName(), "useJailCard");
        Card card = player.getJailCards().remove(0);
        state.deck(card.deck()).returnToBottom(card);
        releaseFromJail(player);
        outcome.event(GameMessages.format(GameMessages.EVENT_JAIL_CARD_USED, player.getName()));
        return finish(state, player, player.getCash(), player.getPosition(), outcome);
    }

    public TurnOutcome endTurn(MonopolyState state, String playerName) {
        state.requireNotOver();
        Player player = state.requireCurrent(playerName);
        state.requirePhase(TurnPhase.TURN_END, "endTurn");
        TurnOutcome outcome = new TurnOutcome(player.getName(), "endTurn");
        passTurn(state, outcome);
        return finish(state, player, player.getCash(), player.getPosition(), outcome);
    }

    /** 轮到下一位未破产玩家（环绕），重置回合内计数 */
    void passTurn(MonopolyState state, TurnOutcome outcome) {
        List<Player> players = state.getPlayers();
        int n = players.size();
        int next = state.getCurrentIndex();
        for (int i = 1; i <= n; i++) {
            int idx = (state.getCurrentIndex() + i) % n;
            if (players.get(idx).active()) {
                next = idx;
                break;
            }
        }
        state.setCurrentIndex(next);
        state.setPhase(TurnPhase.AWAITING_ACTION);
        state.setDoublesStreak(0);
        state.setExtraRoll(false);
        state.setPendingPurchase(null);
        outcome.event(GameMessages.format(GameMessages.EVENT_TURN_PASSED, state.current().getName()));
    }

    /**
     * 填充结果里的变化量与结束时的局面。
     * 当前玩家在自己的回合里破产时，直接把回合交给下一位。
     */
    TurnOutcome finish(MonopolyState state, Player player, int startCash, int startPos, TurnOutcome outcome) {
        if (!state.isOver() && state.current().isBankrupt()) {
            passTurn(state, outcome);
        }
        outcome.setCash(player.getCash());
        outcome.setCashDelta(player.getCash() - startCash);
        outcome.setPosition(player.getPosition());
        outcome.setPositionDelta(player.getPosition() - startPos);
        outcome.setInJail(player.isInJail());
        outcome.setPhase(state.getPhase().name());
        outcome.setCurrentPlayer(state.current().getName());
        outcome.setGameOver(state.isOver());
        outcome.setWinner(state.getWinner());
        return outcome;
    }

    private static void requireInJail(Player player) {
        if (!player.isInJail()) {
            throw MonopolyException.of(ErrorKind.INVALID_PHASE, GameMessages.NOT_IN_JAIL, player.getName());
        }
    }

    private static void releaseFromJail(Player player) {
        player.setInJail(false);
        player.setJailTurns(0);
    }
}
