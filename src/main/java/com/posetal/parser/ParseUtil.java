package com.posetal.parser;

import static java.util.Objects.requireNonNull;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.posetal.model.Metric;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

final class ParseUtil {
  private ParseUtil() {}

  static Stream<JsonElement> stream(JsonArray array) {
    return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
        Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
  }

  static Stream<String> strings(JsonArray array) {
    return stream(array).map(JsonElement::getAsString);
  }

  static Metric parseMetric(JsonElement element) {
    if (element.isJsonPrimitive()) {
      return Metric.of(element.getAsString());
    }
    JsonObject object = element.getAsJsonObject();
    String name = requireNonNull(object.getAsJsonPrimitive("name"), "Missing metric name").getAsString();
    var sense = object.getAsJsonPrimitive("sense");
    return sense == null ? Metric.of(name) : new Metric(name, Metric.Sense.parse(sense.getAsString()));
  }

  static JsonArray array(JsonObject object, String key, String context) {
    JsonArray array = object.getAsJsonArray(key);
    if (array == null) {
      throw new IllegalArgumentException("Missing %s for %s".formatted(key, context));
    }
    return array;
  }
}
