package com.monopolyhub.monopolyservice.games.monopoly.domain.dto;

import java.util.List;

/** 某位玩家的地产清单 */
public record PlayerPropertiesView(String player, List<PropertyView> properties, int totalProperties) {
}
