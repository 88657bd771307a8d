package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ColorGroup;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ColorGroup.*;

/**
 * 棋盘目录：40 个格子的静态定义（美国版地名）。
 * 只读，所有对局共享。
 */
public final class BoardCatalog {

    /** 棋盘格子数 */
    public static final int SIZE = 40;
    /** 起点 */
    public static final int GO = 0;
    /** 监狱（探监）位置 */
    public static final int JAIL = 10;
    /** “入狱”格子 */
    public static final int GO_TO_JAIL = 30;

    private static final List<Space> SPACES;
    private static final Map<ColorGroup, List<Space>> GROUPS;

    static {
        List<Space> s = new ArrayList<>(SIZE);
        s.add(Space.special(0, "GO", SpaceKind.GO));
        s.add(Space.property(1, "Mediterranean Avenue", BROWN, 60, 50, 2, 10, 30, 90, 160, 250));
        s.add(Space.special(2, "Community Chest", SpaceKind.COMMUNITY_CHEST));
        s.add(Space.property(3, "Baltic Avenue", BROWN, 60, 50, 4, 20, 60, 180, 320, 450));
        s.add(Space.tax(4, "Income Tax", 200));
        s.add(Space.railroad(5, "Reading Railroad"));
        s.add(Space.property(6, "Oriental Avenue", LIGHT_BLUE, 100, 50, 6, 30, 90, 270, 400, 550));
        s.add(Space.special(7, "Chance", SpaceKind.CHANCE));
        s.add(Space.property(8, "Vermont Avenue", LIGHT_BLUE, 100, 50, 6, 30, 90, 270, 400, 550));
        s.add(Space.property(9, "Connecticut Avenue", LIGHT_BLUE, 120, 50, 8, 40, 100, 300, 450, 600));
        s.add(Space.special(10, "Jail", SpaceKind.JAIL));
        s.add(Space.property(11, "St. Charles Place", PINK, 140, 100, 10, 50, 150, 450, 625, 750));
        s.add(Space.utility(12, "Electric Company"));
        s.add(Space.property(13, "States Avenue", PINK, 140, 100, 10, 50, 150, 450, 625, 750));
        s.add(Space.property(14, "Virginia Avenue", PINK, 160, 100, 12, 60, 180, 500, 700, 900));
        s.add(Space.railroad(15, "Pennsylvania Railroad"));
        s.add(Space.property(16, "St. James Place", ORANGE, 180, 100, 14, 70, 200, 550, 750, 950));
        s.add(Space.special(17, "Community Chest", SpaceKind.COMMUNITY_CHEST));
        s.add(Space.property(18, "Tennessee Avenue", ORANGE, 180, 100, 14, 70, 200, 550, 750, 950));
        s.add(Space.property(19, "New York Avenue", ORANGE, 200, 100, 16, 80, 220, 600, 800, 1000));
        s.add(Space.special(20, "Free Parking", SpaceKind.FREE_PARKING));
        s.add(Space.property(21, "Kentucky Avenue", RED, 220, 150, 18, 90, 250, 700, 875, 1050));
        s.add(Space.special(22, "Chance", SpaceKind.CHANCE));
        s.add(Space.property(23, "Indiana Avenue", RED, 220, 150, 18, 90, 250, 700, 875, 1050));
        s.add(Space.property(24, "Illinois Avenue", RED, 240, 150, 20, 100, 300, 750, 925, 1100));
        s.add(Space.railroad(25, "B. & O. Railroad"));
        s.add(Space.property(26, "Atlantic Avenue", YELLOW, 260, 150, 22, 110, 330, 800, 975, 1150));
        s.add(Space.property(27, "Ventnor Avenue", YELLOW, 260, 150, 22, 110, 330, 800, 975, 1150));
        s.add(Space.utility(28, "Water Works"));
        s.add(Space.property(29, "Marvin Gardens", YELLOW, 280, 150, 24, 120, 360, 850, 1025, 1200));
        s.add(Space.special(30, "Go to Jail", SpaceKind.GO_TO_JAIL));
        s.add(Space.property(31, "Pacific Avenue", GREEN, 300, 200, 26, 130, 390, 900, 1100, 1275));
        s.add(Space.property(32, "North Carolina Avenue", GREEN, 300, 200, 26, 130, 390, 900, 1100, 1275));
        s.add(Space.special(33, "Community Chest", SpaceKind.COMMUNITY_CHEST));
        s.add(Space.property(34, "Pennsylvania Avenue", GREEN, 320, 200, 28, 150, 450, 1000, 1200, 1400));
        s.add(Space.railroad(35, "Short Line"));
        s.add(Space.special(36, "Chance", SpaceKind.CHANCE));
        s.add(Space.property(37, "Park Place", DARK_BLUE, 350, 200, 35, 175, 500, 1100, 1300, 1500));
        s.add(Space.tax(38, "Luxury Tax", 100));
        s.add(Space.property(39, "Boardwalk", DARK_BLUE, 400, 200, 50, 200, 600, 1400, 1700, 2000));
        SPACES = Collections.unmodifiableList(s);

        Map<ColorGroup, List<Space>> groups = new EnumMap<>(ColorGroup.class);
        for (ColorGroup g : ColorGroup.values()) {
            groups.put(g, SPACES.stream().filter(sp -> sp.color() == g).collect(Collectors.toUnmodifiableList()));
        }
        GROUPS = Collections.unmodifiableMap(groups);
    }

    private BoardCatalog() {
    }

    /** 全部 40 个格子，按位置排序 */
    public static List<Space> spaces() {
        return SPACES;
    }

    public static Space space(int index) {
        return SPACES.get(index);
    }

    /** 可持有的格子（地产/铁路/公用事业） */
    public static List<Space> ownableSpaces() {
        return SPACES.stream().filter(Space::ownable).collect(Collectors.toUnmodifiableList());
    }

    /** 同一颜色组的全部地产 */
    public static List<Space> group(ColorGroup color) {
        return GROUPS.get(color);
    }

    /**
     * 按名字查找可持有的格子（忽略大小写与首尾空白）。
     * 注意 "Chance"/"Community Chest" 有多个，它们都不可持有，这里只查可持有格子。
     */
    public static Optional<Space> findOwnable(String name) {
        if (name == null) return Optional.empty();
        String key = name.trim().toLowerCase(Locale.ROOT);
        return SPACES.stream()
                .filter(Space::ownable)
                .filter(sp -> sp.name().toLowerCase(Locale.ROOT).equals(key))
                .findFirst();
    }

    /** 从 from 出发向前扫描（可绕圈），返回第一个指定类型格子的位置 */
    public static int nextOfKind(int from, SpaceKind kind) {
        for (int step = 1; step <= SIZE; step++) {
            int idx = (from + step) % SIZE;
            if (SPACES.get(idx).kind() == kind) return idx;
        }
        throw new IllegalArgumentException("棋盘上没有该类型格子: " + kind);
    }
}
