package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.monopolyhub.monopolyservice.games.monopoly.domain.model.Space;

import java.util.List;

/** 棋盘目录中一个格子的静态信息 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpaceView(int position,
                        String name,
                        String kind,
                        String color,
                        Integer price,
                        Integer mortgageValue,
                        List<Integer> rents,
                        Integer houseCost,
                        Integer taxAmount) {

    public static SpaceView of(Space s) {
        boolean ownable = s.ownable();
        return new SpaceView(
                s.index(),
                s.name(),
                s.kind().name(),
                s.color() == null ? null : s.color().name(),
                ownable ? s.price() : null,
                ownable ? s.mortgageValue() : null,
                s.rents().isEmpty() ? null : s.rents(),
                s.houseCost() > 0 ? s.houseCost() : null,
                s.taxAmount() > 0 ? s.taxAmount() : null);
    }
}
