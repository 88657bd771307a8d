package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.ColorGroup;
import com.monopolyhub.monopolyservice.games.monopoly.domain.enums.SpaceKind;
import com.monopolyhub.monopolyservice.games.monopoly.domain.rule.InvariantViolationException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 账本：现金收付 + 地产归属 + 建筑池。
 * - 只负责状态变更与不变量断言，规则校验（能不能建、钱够不够）由上层解析器完成；
 * - 建筑池：房屋 32 座、旅馆 12 座；建旅馆消耗 1 座旅馆并把 4 座房屋还回池中。
 */
public class Ledger {

    private final Map<Integer, Deed> deeds = new TreeMap<>();
    private final int houseTotal;
    private final int hotelTotal;
    private int housesRemaining;
    private int hotelsRemaining;

    public Ledger(int houseTotal, int hotelTotal) {
        this.houseTotal = houseTotal;
        this.hotelTotal = hotelTotal;
        this.housesRemaining = houseTotal;
        this.hotelsRemaining = hotelTotal;
        for (Space s : BoardCatalog.ownableSpaces()) {
            deeds.put(s.index(), new Deed(s.index()));
        }
    }

    private Ledger(Ledger other) {
        this.houseTotal = other.houseTotal;
        this.hotelTotal = other.hotelTotal;
        this.housesRemaining = other.housesRemaining;
        this.hotelsRemaining = other.hotelsRemaining;
        other.deeds.forEach((k, v) -> this.deeds.put(k, v.copy()));
    }

    // --------- 查询 ----------

    public Deed deed(int index) {
        Deed d = deeds.get(index);
        if (d == null) {
            throw new IllegalArgumentException("格子 " + index + " 不可持有");
        }
        return d;
    }

    /** 某玩家持有的全部地契（按棋盘位置排序） */
    public List<Deed> deedsOf(String playerName) {
        return deeds.values().stream().filter(d -> d.ownedBy(playerName)).collect(Collectors.toList());
    }

    /** 颜色组对应的地契 */
    public List<Deed> groupDeeds(ColorGroup color) {
        return BoardCatalog.group(color).stream().map(s -> deeds.get(s.index())).collect(Collectors.toList());
    }

    /** 是否持有整组颜色地产（垄断） */
    public boolean ownsGroup(String playerName, ColorGroup color) {
        return groupDeeds(color).stream().allMatch(d -> d.ownedBy(playerName));
    }

    public boolean groupHasBuildings(ColorGroup color) {
        return groupDeeds(color).stream().anyMatch(d -> d.getBuildings() > 0);
    }

    public boolean groupHasMortgage(ColorGroup color) {
        return groupDeeds(color).stream().anyMatch(Deed::isMortgaged);
    }

    /** 某玩家持有的某类格子数量（铁路/公用事业租金用） */
    public int countOwned(String playerName, SpaceKind kind) {
        return (int) deeds.values().stream()
                .filter(d -> d.ownedBy(playerName) && d.space().kind() == kind)
                .count();
    }

    public int housesRemaining() {
        return housesRemaining;
    }

    public int hotelsRemaining() {
        return hotelsRemaining;
    }

    // --------- 现金 ----------

    public void credit(Player player, int amount) {
        requireNonNegative(amount);
        player.setCash(player.getCash() + amount);
    }

    public void debit(Player player, int amount) {
        requireNonNegative(amount);
        player.setCash(player.getCash() - amount);
    }

    /** 玩家之间转账；to 为 null 表示付给银行 */
    public void transfer(Player from, Player to, int amount) {
        debit(from, amount);
        if (to != null) {
            credit(to, amount);
        }
    }

    // --------- 归属 ----------

    public void assign(Deed deed, String owner) {
        deed.setOwner(owner);
    }

    /** 地产收归银行：建筑回池，抵押解除 */
    public void releaseToBank(Deed deed) {
        if (deed.hasHotel()) {
            hotelsRemaining++;
        } else {
            housesRemaining += deed.getBuildings();
        }
        deed.setBuildings(0);
        deed.setMortgaged(false);
        deed.setOwner(null);
    }

    // --------- 建筑 ----------

    /** 加一级建筑：0~3 -> 加房屋；4 -> 升级为旅馆（4 座房屋回池） */
    public void addBuilding(Deed deed) {
        int level = deed.getBuildings();
        if (level < 4) {
            housesRemaining--;
        } else if (level == 4) {
            hotelsRemaining--;
            housesRemaining += 4;
        } else {
            throw new InvariantViolationException(deed.space().name() + " 已经是旅馆");
        }
        deed.setBuildings(level + 1);
    }

    /** 减一级建筑：旅馆 -> 4 座房屋（从池中取回 4 座） */
    public void removeBuilding(Deed deed) {
        int level = deed.getBuildings();
        if (level == 5) {
            hotelsRemaining++;
            housesRemaining -= 4;
        } else if (level > 0) {
            housesRemaining++;
        } else {
            throw new InvariantViolationException(deed.space().name() + " 没有建筑");
        }
        deed.setBuildings(level - 1);
    }

    // --------- 不变量 ----------

    /**
     * 断言账本与玩家状态满足全部不变量，违反即抛 {@link InvariantViolationException}。
     * 在每个动作提交前调用。
     */
    public void assertInvariants(List<Player> players) {
        Set<String> active = players.stream().filter(Player::active).map(Player::getName).collect(Collectors.toSet());
        int housesInPlay = 0;
        int hotelsInPlay = 0;
        for (Deed d : deeds.values()) {
            Space s = d.space();
            int b = d.getBuildings();
            if (b < 0 || b > 5) {
                throw new InvariantViolationException(s.name() + " 建筑数越界: " + b);
            }
            if (d.getOwner() != null && !active.contains(d.getOwner())) {
                throw new InvariantViolationException(s.name() + " 的持有人不是在局玩家: " + d.getOwner());
            }
            if (b > 0) {
                if (s.kind() != SpaceKind.PROPERTY || d.getOwner() == null || !ownsGroup(d.getOwner(), s.color())) {
                    throw new InvariantViolationException(s.name() + " 有建筑但不满足垄断条件");
                }
                if (d.isMortgaged()) {
                    throw new InvariantViolationException(s.name() + " 已抵押却有建筑");
                }
            }
            if (b == 5) hotelsInPlay++; else housesInPlay += b;
        }
        for (ColorGroup g : ColorGroup.values()) {
            List<Integer> levels = groupDeeds(g).stream().map(Deed::getBuildings).collect(Collectors.toList());
            int max = levels.stream().mapToInt(Integer::intValue).max().orElse(0);
            int min = levels.stream().mapToInt(Integer::intValue).min().orElse(0);
            if (max - min > 1) {
                throw new InvariantViolationException(g + " 建筑不均匀: " + levels);
            }
        }
        if (housesRemaining < 0 || hotelsRemaining < 0) {
            throw new InvariantViolationException("建筑池为负: houses=" + housesRemaining + ", hotels=" + hotelsRemaining);
        }
        if (housesInPlay + housesRemaining != houseTotal) {
            throw new InvariantViolationException("房屋对账失败: inPlay=" + housesInPlay + ", pool=" + housesRemaining);
        }
        if (hotelsInPlay + hotelsRemaining != hotelTotal) {
            throw new InvariantViolationException("旅馆对账失败: inPlay=" + hotelsInPlay + ", pool=" + hotelsRemaining);
        }
        for (Player p : players) {
            if (p.getPosition() < 0 || p.getPosition() >= BoardCatalog.SIZE) {
                throw new InvariantViolationException(p.getName() + " 位置越界: " + p.getPosition());
            }
            if (p.active() && p.getCash() < 0) {
                throw new InvariantViolationException(p.getName() + " 现金为负: " + p.getCash());
            }
            if (p.getJailTurns() < 0) {
                throw new InvariantViolationException(p.getName() + " 狱中回合数越界: " + p.getJailTurns());
            }
        }
    }

    public Ledger copy() {
        return new Ledger(this);
    }

    private static void requireNonNegative(int amount) {
        if (amount < 0) {
            throw new InvariantViolationException("金额不能为负: " + amount);
        }
    }
}
