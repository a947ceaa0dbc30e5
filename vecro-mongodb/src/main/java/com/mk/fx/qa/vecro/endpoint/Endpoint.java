package com.mk.fx.qa.vecro.endpoint;

import com.mk.fx.qa.vecro.common.CallContext;

/** Transport-agnostic callable: a generic request in, a generic response out. */
@FunctionalInterface
public interface Endpoint {

  Object invoke(CallContext ctx, Object request);
}
