package com.posetal.order;

import com.posetal.PosetalException;

/** A relation refers to elements outside of its declared ground set. */
public class InvalidRelationException extends PosetalException {
  public InvalidRelationException(String message) {
    super(message);
  }
}
