package com.monopolyhub.monopolyservice.games.monopoly.domain.model;

import lombok.Data;

/**
 * 地契：一块可持有格子的归属记录。
 * owner 为 null 表示归银行；buildings 0~4 为房屋数，5 为旅馆。
 */
@Data
public class Deed {

    private final int index;
    private String owner;
    private boolean mortgaged;
    private int buildings;

    public Space space() {
        return BoardCatalog.space(index);
    }

    public boolean ownedBy(String playerName) {
        return owner != null && owner.equals(playerName);
    }

    public boolean hasHotel() {
        return buildings == 5;
    }

    public Deed copy() {
        Deed d = new Deed(index);
        d.owner = owner;
        d.mortgaged = mortgaged;
        d.buildings = buildings;
        return d;
    }
}
