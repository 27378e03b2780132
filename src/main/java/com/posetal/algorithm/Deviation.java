package com.posetal.algorithm;

import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.order.Comparison;

/**
 * A unilateral change of {@code player} from {@code profile} to {@code alternative}, where
 * {@code comparison} is how the player ranks the original profile against the alternative.
 */
public record Deviation(Player player, ActionProfile profile, ActionProfile alternative, Comparison comparison) {
  @Override
  public String toString() {
    return "%s: %s %s %s".formatted(player.name(), profile, comparison, alternative);
  }
}
