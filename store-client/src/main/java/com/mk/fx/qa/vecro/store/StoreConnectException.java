package com.mk.fx.qa.vecro.store;

import com.mk.fx.qa.vecro.common.ErrorKind;
import com.mk.fx.qa.vecro.common.VecroException;

/** The backing store could not be reached or refused the credentials at startup. */
public class StoreConnectException extends VecroException {

    public StoreConnectException(String message, Throwable cause) {
        super(ErrorKind.STORE_CONNECT, message, cause);
    }
}
