package com.mk.fx.qa.vecro.endpoint;

import com.mk.fx.qa.vecro.common.ErrorKind;
import com.mk.fx.qa.vecro.common.VecroException;

/** The inbound payload could not be mapped to the expected request shape. */
public class RequestDecodeException extends VecroException {

  public RequestDecodeException(String message) {
    super(ErrorKind.DECODE, message);
  }

  public RequestDecodeException(String message, Throwable cause) {
    super(ErrorKind.DECODE, message, cause);
  }
}
