package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.engine.core.DiceRoll;
import com.monopolyhub.monopolyservice.engine.core.DiceRoller;
import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.RentMode;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.BoardCatalog;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.GameSettings;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.RentCalculator;

import java.util.List;

/**
 * 移动与落点结算。
 * 移动原语（前进/直达/后退/入狱）供掷骰与卡牌共用；落点按格子类型穷举分派。
 */
public class LandingResolver {

    private final GameSettings settings;
    private final DiceRoller dice;
    private final BankruptcyResolver bankruptcy;
    private final CardResolver cards;

    public LandingResolver(GameSettings settings, DiceRoller dice, BankruptcyResolver bankruptcy) {
        this.settings = settings;
        this.dice = dice;
        this.bankruptcy = bankruptcy;
        this.cards = new CardResolver(this, bankruptcy);
    }

    // ----------- 移动原语 -----------

    /** 按掷骰点数前进；跨越起点领薪水（只领一次） */
    public void advance(MonopolyState state, Player player, int steps, TurnOutcome outcome) {
        int old = player.getPosition();
        int next = (old + steps) % BoardCatalog.SIZE;
        if (steps >= BoardCatalog.SIZE - old) {
            passGo(state, player, outcome);
        }
        place(player, next, outcome);
    }

    /** 卡牌直达某格；collectGo 为 true 且绕过起点时领薪水 */
    public void moveTo(MonopolyState state, Player player, int target, boolean collectGo, TurnOutcome outcome) {
        int old = player.getPosition();
        if (collectGo && target <= old) {
            passGo(state, player, outcome);
        }
        place(player, target, outcome);
    }

    /** 后退若干格，不领薪水 */
    public void moveBack(Player player, int steps, TurnOutcome outcome) {
        int next = Math.floorMod(player.getPosition() - steps, BoardCatalog.SIZE);
        place(player, next, outcome);
    }

    /** 入狱：直接到监狱格，不领薪水，清空连续对子，本回合结束 */
    public void sendToJail(MonopolyState state, Player player, TurnOutcome outcome) {
        player.setPosition(BoardCatalog.JAIL);
        player.setInJail(true);
        player.setJailTurns(0);
        state.setDoublesStreak(0);
        state.setExtraRoll(false);
        outcome.setSentToJail(true);
        outcome.setLandedPosition(BoardCatalog.JAIL);
        outcome.setLandedOn(BoardCatalog.space(BoardCatalog.JAIL).name());
        outcome.event(GameMessages.format(GameMessages.EVENT_SENT_TO_JAIL, player.getName()));
    }

    private void passGo(MonopolyState state, Player player, TurnOutcome outcome) {
        state.getLedger().credit(player, settings.getGoSalary());
        outcome.setPassedGo(true);
        outcome.event(GameMessages.format(GameMessages.EVENT_PASSED_GO, player.getName(), settings.getGoSalary()));
    }

    private void place(Player player, int index, TurnOutcome outcome) {
        player.setPosition(index);
        Space space = BoardCatalog.space(index);
        outcome.setLandedPosition(index);
        outcome.setLandedOn(space.name());
        outcome.event(GameMessages.format(GameMessages.EVENT_MOVED, player.getName(), index, space.name()));
    }

    // ----------- 落点结算 -----------

    public void resolve(MonopolyState state, Player player, RentMode mode, TurnOutcome outcome) {
        Space space = BoardCatalog.space(player.getPosition());
        switch (space.kind()) {
            case PROPERTY, RAILROAD, UTILITY -> resolveOwnable(state, player, space, mode, outcome);
            case TAX -> bankruptcy.collect(state, player, null, space.taxAmount(), outcome);
            case CHANCE -> cards.draw(state, player, state.getChance(), outcome);
            case COMMUNITY_CHEST -> cards.draw(state, player, state.getCommunityChest(), outcome);
            case GO_TO_JAIL -> sendToJail(state, player, outcome);
            case GO, JAIL, FREE_PARKING -> {
                // 无效果
            }
        }
    }

    private void resolveOwnable(MonopolyState state, Player player, Space space, RentMode mode, TurnOutcome outcome) {
        Deed deed = state.getLedger().deed(space.index());
        if (deed.getOwner() == null) {
            state.setPendingPurchase(space.index());
            outcome.setPurchaseOffer(space.name());
            outcome.event(GameMessages.format(GameMessages.EVENT_OFFER, space.name(), space.price()));
            return;
        }
        if (deed.ownedBy(player.getName()) || deed.isMortgaged()) {
            return;
        }
        int rent = switch (mode) {
            case STANDARD -> RentCalculator.rent(state.getLedger(), deed,
                    state.getLastRoll() == null ? 0 : state.getLastRoll().total());
            case CARD_RAILROAD_DOUBLE -> RentCalculator.railroadCardRent(state.getLedger(), deed);
            case CARD_UTILITY_TEN_TIMES -> {
                DiceRoll roll = dice.roll();
                outcome.setUtilityDice(List.of(roll.first(), roll.second()));
                outcome.event(GameMessages.format(GameMessages.EVENT_UTILITY_DICE,
                        player.getName(), roll.first(), roll.second(), roll.total()));
                yield RentCalculator.utilityCardRent(deed, roll.total());
            }
        };
        if (rent > 0) {
            bankruptcy.collect(state, player, state.player(deed.getOwner()), rent, outcome);
        }
    }
}
