package com.posetal;

public class PosetalException extends RuntimeException {
  public PosetalException(String message) {
    super(message);
  }

  public PosetalException(String message, Throwable cause) {
    super(message, cause);
  }
}
