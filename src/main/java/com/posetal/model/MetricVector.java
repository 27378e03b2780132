package com.posetal.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** The values of one outcome, one per metric. */
public final class MetricVector {
    private final ImmutableMap<Metric, Double> values;

    private MetricVector(ImmutableMap<Metric, Double> values) {
        this.values = values;
    }

    public static MetricVector of(Map<Metric, ? extends Number> values) {
        ImmutableMap.Builder<Metric, Double> builder = ImmutableMap.builder();
        values.forEach((metric, value) -> builder.put(metric, value.doubleValue()));
        return new MetricVector(builder.buildOrThrow());
    }

    public static MetricVector of(Metric metric, double value) {
        return new MetricVector(ImmutableMap.of(metric, value));
    }

    public static MetricVector of(Metric first, double firstValue, Metric second, double secondValue) {
        return new MetricVector(ImmutableMap.of(first, firstValue, second, secondValue));
    }

    public static Builder builder() {
        return new Builder();
    }

    public double value(Metric metric) {
        Double value = values.get(metric);
        checkArgument(value != null, "No value for metric %s in %s", metric, this);
        return value;
    }

    public boolean covers(Set<Metric> metrics) {
        return values.keySet().containsAll(metrics);
    }

    public Set<Metric> metrics() {
        return values.keySet();
    }

    public Map<Metric, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof MetricVector that && values.equals(that.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> "%s=%s".formatted(e.getKey().name(), e.getValue()))
                .collect(Collectors.joining(",", "<", ">"));
    }

    public static final class Builder {
        private final ImmutableMap.Builder<Metric, Double> values = ImmutableMap.builder();

        private Builder() {}

        public Builder put(Metric metric, double value) {
            values.put(metric, value);
            return this;
        }

        public MetricVector build() {
            return new MetricVector(values.buildOrThrow());
        }
    }
}
