package com.posetal.output;

import com.posetal.model.ActionProfile;
import com.posetal.model.Player;
import com.posetal.model.PosetalGame;
import com.posetal.order.PreOrder;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.io.PrintStream;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Writes Hasse diagrams in Graphviz format, one node per equivalence class, higher elements on top. */
public final class DotWriter {
  private DotWriter() {}

  public static <E> void writeOrder(PreOrder<E> order, PrintStream writer) {
    writeOrder(order, String::valueOf, writer);
  }

  public static void writeInducedOrder(PosetalGame game, Player player, PrintStream writer) {
    PreOrder<ActionProfile> order = game.inducedOrder(player);
    writeOrder(order, profile -> Formatter.format(profile, game), writer);
  }

  public static <E> void writeOrder(PreOrder<E> order, Function<E, String> label, PrintStream writer) {
    List<? extends Set<E>> classes = order.equivalenceClasses();
    Object2IntMap<E> ids = new Object2IntOpenHashMap<>();
    for (int i = 0; i < classes.size(); i++) {
      for (E element : classes.get(i)) {
        ids.put(element, i);
      }
    }

    writer.append("digraph {\n");
    writer.append("rankdir=TB\n");
    for (int i = 0; i < classes.size(); i++) {
      String name = classes.get(i).stream().map(label).collect(Collectors.joining(" = "));
      writer.append("N_%d [label=\"%s\"]\n".formatted(i, name.replace("\"", "\\\"")));
    }
    order.coveringRelation().stream()
        .map(edge -> "N_%d -> N_%d\n".formatted(ids.getInt(edge.upper()), ids.getInt(edge.lower())))
        .distinct()
        .forEach(writer::append);
    writer.append("}\n");
  }
}
