package com.posetal.order;

import com.posetal.PosetalException;

public class NotAPartialOrderException extends PosetalException {
  public NotAPartialOrderException(String message) {
    super(message);
  }
}
