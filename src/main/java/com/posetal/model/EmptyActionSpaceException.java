package com.posetal.model;

public class EmptyActionSpaceException extends InvalidGameException {
  public EmptyActionSpaceException(String player) {
    super("Player %s has no actions".formatted(player));
  }
}
