package com.posetal.model;

import com.posetal.PosetalException;

public class InvalidGameException extends PosetalException {
  public InvalidGameException(String message) {
    super(message);
  }

  public InvalidGameException(String message, Throwable cause) {
    super(message, cause);
  }
}
