package com.monopolyhub.monopolyservice.games.monopoly.domain.enums;

/**
 * 地产颜色组。size 为凑成垄断所需的地产数量。
 */
public enum ColorGroup {

    BROWN(2),
    LIGHT_BLUE(3),
    PINK(3),
    ORANGE(3),
    RED(3),
    YELLOW(3),
    GREEN(3),
    DARK_BLUE(2);

    private final int size;

    ColorGroup(int size) {
        this.size = size;
    }

    public int size() {
        return size;
    }
}
