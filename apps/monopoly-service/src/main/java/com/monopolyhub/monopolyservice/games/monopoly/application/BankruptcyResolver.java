package com.monopolyhub.monopolyservice.games.monopoly.application;

import com.monopolyhub.monopolyservice.games.monopoly.domain.constants.GameMessages;
import com.monopolyhub.monopolyservice.games.monopoly.domain.dto.TurnOutcome;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Card;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Deed;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Ledger;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.MonopolyState;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Player;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 破产与胜负结算。
 * 强制付款（租金、税、卡牌、罚金）统一走 {@link #collect}：
 * - 现金足够：直接支付；
 * - 现金不足：付出全部现金后立即破产（变现需由调用方在付款前主动完成）。
 * 破产给玩家：全部地产（含建筑、抵押状态）与出狱卡转给债主；
 * 破产给银行：地产收归银行、建筑回池、抵押解除，出狱卡放回卡组。
 */
@Slf4j
public class BankruptcyResolver {

    /**
     * 强制付款。
     * @param creditor 债主；null 表示银行
     * @return true 表示足额支付；false 表示付款人已破产
     */
    public boolean collect(MonopolyState state, Player payer, Player creditor, int amount, TurnOutcome outcome) {
        if (amount <= 0 || payer.isBankrupt()) {
            return true;
        }
        Ledger ledger = state.getLedger();
        if (payer.getCash() >= amount) {
            ledger.transfer(payer, creditor, amount);
            if (creditor == null) {
                outcome.event(GameMessages.format(GameMessages.EVENT_PAID_BANK, payer.getName(), amount));
            } else {
                outcome.event(GameMessages.format(GameMessages.EVENT_PAID_RENT, payer.getName(), creditor.getName(), amount));
            }
            return true;
        }
        // 付款截断为全部现金
        int paid = payer.getCash();
        ledger.transfer(payer, creditor, paid);
        log.debug("强制付款不足: payer={}, owed={}, paid={}, creditor={}",
                payer.getName(), amount, paid, creditor == null ? "BANK" : creditor.getName());
        declareBankrupt(state, payer, creditor, outcome);
        return false;
    }

    /** 宣告破产并转移资产，随后检查终局 */
    public void declareBankrupt(MonopolyState state, Player debtor, Player creditor, TurnOutcome outcome) {
        Ledger ledger = state.getLedger();
        if (debtor.getCash() > 0) {
            ledger.transfer(debtor, creditor, debtor.getCash());
        }
        for (Deed deed : ledger.deedsOf(debtor.getName())) {
            if (creditor != null) {
                ledger.assign(deed, creditor.getName());
            } else {
                ledger.releaseToBank(deed);
            }
        }
        List<Card> cards = new ArrayList<>(debtor.getJailCards());
        debtor.getJailCards().clear();
        for (Card card : cards) {
            if (creditor != null) {
                creditor.getJailCards().add(card);
            } else {
                state.deck(card.deck()).returnToBottom(card);
            }
        }
        debtor.setBankrupt(true);
        debtor.setInJail(false);
        debtor.setJailTurns(0);

        if (state.getPendingTrade() != null && state.getPendingTrade().involves(debtor.getName())) {
            state.setPendingTrade(null);
        }
        outcome.getBankruptPlayers().add(debtor.getName());
        outcome.event(creditor == null
                ? GameMessages.format(GameMessages.EVENT_BANKRUPT_TO_BANK, debtor.getName())
                : GameMessages.format(GameMessages.EVENT_BANKRUPT_TO_PLAYER, debtor.getName(), creditor.getName()));
        checkGameOver(state, outcome);
    }

    /** 只剩 <= 1 名未破产玩家时终局 */
    public void checkGameOver(MonopolyState state, TurnOutcome outcome) {
        if (state.isOver()) {
            return;
        }
        List<Player> active = state.activePlayers();
        if (active.size() <= 1) {
            String winner = active.isEmpty() ? null : active.get(0).getName();
            state.finish(winner);
            outcome.event(GameMessages.format(GameMessages.EVENT_GAME_OVER, winner));
        }
    }
}
