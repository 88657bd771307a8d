package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 规则参数（由 application.yml 的 monopoly.* 绑定）。
 * 不可变，所有对局共享。
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor
public class GameSettings {

    /** 初始现金 */
    @Builder.Default
    private final int startingCash = 1500;
    /** 经过/停在起点获得的薪水 */
    @Builder.Default
    private final int goSalary = 200;
    /** 出狱罚金 */
    @Builder.Default
    private final int jailFine = 50;
    /** 狱中掷骰失败多少次后强制缴纳罚金 */
    @Builder.Default
    private final int maxJailTurns = 3;
    /** 连续多少次对子触发超速入狱 */
    @Builder.Default
    private final int maxDoubles = 3;
    /** 拍卖最低出价 */
    @Builder.Default
    private final int auctionMinBid = 10;
    /** 房屋总量 */
    @Builder.Default
    private final int houses = 32;
    /** 旅馆总量 */
    @Builder.Default
    private final int hotels = 12;

    /** 标准规则 */
    public static GameSettings defaults() {
        return GameSettings.builder().build();
    }
}
