package com.posetal.model;

import static java.util.Objects.requireNonNull;

public record Action(String name) {
    public Action {
        requireNonNull(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
