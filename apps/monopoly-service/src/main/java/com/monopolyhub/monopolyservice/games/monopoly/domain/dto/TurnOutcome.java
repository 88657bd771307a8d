package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次回合动作（roll / payJail / useJailCard / endTurn）的结构化结果。
 * events 按发生顺序记录本次动作引起的全部连锁效果。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnOutcome {

    private String player;
    private String action;

    /** 两颗骰子点数；未掷骰时为 null */
    private List<Integer> dice;
    private Boolean doubles;
    /** 卡牌"前往最近的公用事业"为计算 10 倍租金而重新掷的骰子 */
    private List<Integer> utilityDice;

    /** 最终落点 */
    private Integer landedPosition;
    private String landedOn;
    private boolean passedGo;

    /** 动作玩家的现金变化（动作结束值 - 开始值） */
    private int cashDelta;
    private int cash;
    /** 位置变化（新位置 - 旧位置） */
    private int positionDelta;
    private int position;

    private final List<String> cardsDrawn = new ArrayList<>();
    private final List<String> events = new ArrayList<>();
    private final List<String> bankruptPlayers = new ArrayList<>();

    private boolean sentToJail;
    private boolean inJail;
    private boolean extraRoll;
    /** 待决购买的地产名（落在无主地产时） */
    private String purchaseOffer;

    /** 动作结束后的阶段与当前玩家 */
    private String phase;
    private String currentPlayer;
    private boolean gameOver;
    private String winner;

    public TurnOutcome(String player, String action) {
        this.player = player;
        this.action = action;
    }

    public void event(String message) {
        events.add(message);
    }
}
