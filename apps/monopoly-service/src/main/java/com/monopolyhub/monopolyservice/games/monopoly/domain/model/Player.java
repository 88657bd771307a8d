package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 玩家实体。地产归属记录在 {@link Ledger} 中，这里只保存现金与棋子状态。
 */
@Data
public class Player {

    /** 名字（对局内唯一） */
    private final String name;
    /** 现金；只在一次强制付款的结算过程中可能短暂不足，结算完成后必须 >= 0 或已破产 */
    private int cash;
    /** 棋盘位置 0~39 */
    private int position;
    /** 是否在狱中 */
    private boolean inJail;
    /** 狱中已掷骰失败次数 0~3 */
    private int jailTurns;
    /** 持有的出狱卡（记住来源卡组，使用后放回对应卡组） */
    private final List<Card> jailCards = new ArrayList<>();
    /** 是否已破产（破产后永久跳过） */
    private boolean bankrupt;

    public Player(String name, int cash) {
        this.name = name;
        this.cash = cash;
    }

    public int jailCardCount() {
        return jailCards.size();
    }

    public boolean active() {
        return !bankrupt;
    }

    public Player copy() {
        Player p = new Player(name, cash);
        p.position = position;
        p.inJail = inJail;
        p.jailTurns = jailTurns;
        p.jailCards.addAll(jailCards); // Card 不可变
        p.bankrupt = bankrupt;
        return p;
    }
}
