package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeRequest;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TradeResult;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ErrorKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.TradeOffer;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.MonopolyException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 玩家间交易：当前玩家发起，对方接受或拒绝。
 * 每局同一时刻最多一份待处理报价；接受时重新校验双方资产，再一次性交换。
 */
public class TradeResolver {

    public static final String PROPOSED = "PROPOSED";
    public static final String ACCEPTED = "ACCEPTED";
    public static final String REJECTED = "REJECTED";

    public TradeResult propose(MonopolyState state, String proposerName, String counterpartyName, TradeRequest request) {
        state.requireNotOver();
        Player proposer = state.requireCurrent(proposerName);
        state.requireFreeToManage(proposer, "proposeTrade");
        if (state.getPendingTrade() != null) {
            throw tradeError(GameMessages.TRADE_PENDING, state.getPendingTrade().getTradeId());
        }
        Player counterparty = state.player(counterpartyName);
        if (counterparty == proposer) {
            throw tradeError(GameMessages.TRADE_SELF);
        }
        if (counterparty.isBankrupt()) {
            throw tradeError(GameMessages.PLAYER_BANKRUPT, counterparty.getName());
        }
        if (request == null) {
            throw tradeError(GameMessages.TRADE_EMPTY);
        }

        TradeOffer offer = TradeOffer.builder()
                .proposer(proposer.getName())
                .counterparty(counterparty.getName())
                .giveProperties(canonicalNames(request.getGiveProperties()))
                .giveCash(request.getGiveCash())
                .giveJailCards(request.getGiveJailCards())
                .requestProperties(canonicalNames(request.getRequestProperties()))
                .requestCash(request.getRequestCash())
                .requestJailCards(request.getRequestJailCards())
                .build();
        if (offer.getGiveCash() < 0 || offer.getRequestCash() < 0
                || offer.getGiveJailCards() < 0 || offer.getRequestJailCards() < 0) {
            throw tradeError(GameMessages.TRADE_NEGATIVE);
        }
        if (offer.isEmpty()) {
            throw tradeError(GameMessages.TRADE_EMPTY);
        }
        validateSide(state, proposer, offer.getGiveProperties(), offer.getGiveCash(), offer.getGiveJailCards());
        validateSide(state, counterparty, offer.getRequestProperties(), offer.getRequestCash(), offer.getRequestJailCards());

        offer.setTradeId("T" + state.nextTradeSeq());
        state.setPendingTrade(offer);
        return new TradeResult(PROPOSED, offer.copy(), proposer.getCash(), counterparty.getCash());
    }

    public TradeResult accept(MonopolyState state, String playerName, String tradeId) {
        state.requireNotOver();
        TradeOffer offer = requirePending(state, tradeId);
        Player player = state.player(playerName);
        if (!offer.getCounterparty().equals(player.getName())) {
            throw tradeError(GameMessages.TRADE_NOT_COUNTERPARTY, offer.getCounterparty(), tradeId);
        }
        Player proposer = state.player(offer.getProposer());
        Player counterparty = player;
        // 报价之后局面可能已变化，接受前重新校验
        validateSide(state, proposer, offer.getGiveProperties(), offer.getGiveCash(), offer.getGiveJailCards());
        validateSide(state, counterparty, offer.getRequestProperties(), offer.getRequestCash(), offer.getRequestJailCards());

        Ledger ledger = state.getLedger();
        moveProperties(ledger, offer.getGiveProperties(), counterparty);
        moveProperties(ledger, offer.getRequestProperties(), proposer);
        ledger.transfer(proposer, counterparty, offer.getGiveCash());
        ledger.transfer(counterparty, proposer, offer.getRequestCash());
        moveJailCards(proposer, counterparty, offer.getGiveJailCards());
        moveJailCards(counterparty, proposer, offer.getRequestJailCards());

        state.setPendingTrade(null);
        return new TradeResult(ACCEPTED, offer.copy(), proposer.getCash(), counterparty.getCash());
    }

    /** 对方拒绝，或发起人撤回 */
    public TradeResult reject(MonopolyState state, String playerName, String tradeId) {
        state.requireNotOver();
        TradeOffer offer = requirePending(state, tradeId);
        Player player = state.player(playerName);
        if (!offer.involves(player.getName())) {
            throw tradeError(GameMessages.TRADE_NOT_PARTY, player.getName(), tradeId);
        }
        state.setPendingTrade(null);
        return new TradeResult(REJECTED, offer.copy(),
                state.player(offer.getProposer()).getCash(), state.player(offer.getCounterparty()).getCash());
    }

    private TradeOffer requirePending(MonopolyState state, String tradeId) {
        TradeOffer offer = state.getPendingTrade();
        if (offer == null || !offer.getTradeId().equals(tradeId)) {
            throw MonopolyException.of(ErrorKind.TRADE_NOT_FOUND, GameMessages.TRADE_NOT_FOUND, tradeId);
        }
        return offer;
    }

    /** 一方拿出的资产：地产归其所有且所在颜色组无建筑；现金与出狱卡足够 */
    private void validateSide(MonopolyState state, Player owner, List<String> properties, int cash, int jailCards) {
        Ledger ledger = state.getLedger();
        for (String name : properties) {
            Space space = TransactionResolver.requireOwnable(name);
            Deed deed = ledger.deed(space.index());
            if (!deed.ownedBy(owner.getName())) {
                throw MonopolyException.of(ErrorKind.NOT_PROPERTY_OWNER, GameMessages.NOT_PROPERTY_OWNER, owner.getName(), space.name());
            }
            if (space.kind() == SpaceKind.PROPERTY && ledger.groupHasBuildings(space.color())) {
                throw tradeError(GameMessages.GROUP_HAS_BUILDINGS, space.color());
            }
        }
        if (owner.getCash() < cash) {
            throw MonopolyException.of(ErrorKind.INSUFFICIENT_FUNDS, GameMessages.INSUFFICIENT_FUNDS,
                    owner.getName(), cash, owner.getCash());
        }
        if (owner.jailCardCount() < jailCards) {
            throw tradeError(GameMessages.NO_JAIL_CARD, owner.getName());
        }
    }

    /** 名字规范化为棋盘上的正式名称并去重 */
    private static List<String> canonicalNames(List<String> names) {
        if (names == null) {
            return new ArrayList<>();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            result.add(TransactionResolver.requireOwnable(name).name());
        }
        return new ArrayList<>(result);
    }

    /** 地产连同抵押状态一起过户 */
    private static void moveProperties(Ledger ledger, List<String> names, Player to) {
        for (String name : names) {
            Space space = TransactionResolver.requireOwnable(name);
            ledger.assign(ledger.deed(space.index()), to.getName());
        }
    }

    private static void moveJailCards(Player from, Player to, int count) {
        for (int i = 0; i < count; i++) {
            Card card = from.getJailCards().remove(0);
            to.getJailCards().add(card);
        }
    }

    private static MonopolyException tradeError(String template, Object... args) {
        return MonopolyException.of(ErrorKind.INVALID_TRADE, template, args);
    }
}
