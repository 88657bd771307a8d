package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ColorGroup;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;

import java.util.List;

/**
 * 棋盘上的一个格子（不可变，全局共享）。
 * - rents：仅 PROPERTY 使用，按建筑数量索引 0~5（5 = 旅馆）；
 * - color：仅 PROPERTY 有值；
 * - taxAmount：仅 TAX 有值。
 */
public record Space(int index,
                    String name,
                    SpaceKind kind,
                    ColorGroup color,
                    int price,
                    List<Integer> rents,
                    int houseCost,
                    int taxAmount) {

    public Space {
        rents = rents == null ? List.of() : List.copyOf(rents);
    }

    static Space special(int index, String name, SpaceKind kind) {
        return new Space(index, name, kind, null, 0, List.of(), 0, 0);
    }

    static Space tax(int index, String name, int amount) {
        return new Space(index, name, SpaceKind.TAX, null, 0, List.of(), 0, amount);
    }

    static Space property(int index, String name, ColorGroup color, int price, int houseCost, Integer... rents) {
        return new Space(index, name, SpaceKind.PROPERTY, color, price, List.of(rents), houseCost, 0);
    }

    static Space railroad(int index, String name) {
        return new Space(index, name, SpaceKind.RAILROAD, null, 200, List.of(), 0, 0);
    }

    static Space utility(int index, String name) {
        return new Space(index, name, SpaceKind.UTILITY, null, 150, List.of(), 0, 0);
    }

    public boolean ownable() {
        return kind.ownable();
    }

    /** 抵押价 = 售价的一半 */
    public int mortgageValue() {
        return price / 2;
    }

    /** 某建筑等级下的表定租金（0 = 空地基础租金，5 = 旅馆） */
    public int rentAt(int buildings) {
        return rents.get(buildings);
    }
}
