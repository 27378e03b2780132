package com.posetal.output;

import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import java.util.Collection;
import java.util.stream.Collectors;

public final class Formatter {
  private Formatter() {}

  public static String format(ActionProfile profile, PosetalGame game) {
    return game.players().stream()
        .map(p -> "%s:%s".formatted(p.name(), profile.action(p).name()))
        .collect(Collectors.joining(",", "[", "]"));
  }

  public static String format(Collection<ActionProfile> profiles, PosetalGame game) {
    return profiles.stream().map(p -> format(p, game)).collect(Collectors.joining(" ", "{", "}"));
  }

  public static String format(Player player) {
    return "%s %s".formatted(player.name(), player.priority());
  }
}
