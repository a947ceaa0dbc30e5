package com.mk.fx.qa.vecro.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.vecro.cfg.ErrorResponse;
import com.mk.fx.qa.vecro.common.CallContext;
import com.mk.fx.qa.vecro.common.ErrorKind;
import com.mk.fx.qa.vecro.common.VecroException;
import com.mk.fx.qa.vecro.endpoint.Endpoint;
import com.mk.fx.qa.vecro.endpoint.RequestDecodeException;
import com.mk.fx.qa.vecro.service.WorkloadRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * Turns an {@link InboundCall} into an endpoint invocation and an encoded {@link
 * ServerResponse}.
 *
 * <p>This is the only place where error kinds become HTTP statuses. The {@link ServerFinalizer}
 * runs for every call, including failed ones, with the size of the bytes actually encoded.
 */
@Slf4j
public class WorkloadTransport {

  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
  private static final String JSON = MediaType.APPLICATION_JSON_VALUE;

  private final Endpoint endpoint;
  private final ObjectMapper mapper;
  private final Duration requestTimeout;
  private final ServerFinalizer finalizer;

  public WorkloadTransport(
      Endpoint endpoint, ObjectMapper mapper, Duration requestTimeout, ServerFinalizer finalizer) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
  }

  public ServerResponse handle(InboundCall call) {
    ServerResponse response = serve(call);
    finalizer.onResponse(call, response.status(), response.size());
    return response;
  }

  private ServerResponse serve(InboundCall call) {
    try {
      CallContext ctx =
          CallContext.background().withTimeout(requestTimeout).withCarrier(call.headers());
      WorkloadRequest request = decode(call);
      Object result = endpoint.invoke(ctx, request);
      return encode(HttpStatus.OK, result);
    } catch (VecroException e) {
      return encodeError(e);
    } catch (RuntimeException e) {
      log.error("Unhandled failure serving {} {}", call.method(), call.path(), e);
      return encode(
          HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse("Server Error", e.getMessage()));
    }
  }

  WorkloadRequest decode(InboundCall call) {
    if (!call.hasBody()) {
      return WorkloadRequest.empty();
    }
    try {
      return new WorkloadRequest(mapper.readValue(call.body(), PAYLOAD_TYPE));
    } catch (IOException e) {
      String reason = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
      throw new RequestDecodeException("Request body is not a JSON object: " + reason, e);
    }
  }

  private ServerResponse encodeError(VecroException e) {
    HttpStatus status = statusFor(e.getKind());
    if (e.getKind() == ErrorKind.DECODE) {
      log.debug("Rejected request: {}", e.getMessage());
    }
    return encode(status, new ErrorResponse(status.getReasonPhrase(), e.getMessage()));
  }

  static HttpStatus statusFor(ErrorKind kind) {
    return switch (kind) {
      case DECODE -> HttpStatus.BAD_REQUEST;
      case CANCELLED -> HttpStatus.GATEWAY_TIMEOUT;
      case STORE_OPERATION, STORE_CONNECT, CONFIGURATION -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private ServerResponse encode(HttpStatus status, Object body) {
    try {
      return new ServerResponse(status.value(), JSON, mapper.writeValueAsBytes(body));
    } catch (JsonProcessingException e) {
      log.error("Failed to encode {} response", status.value(), e);
      byte[] fallback =
          "{\"error\":\"Server Error\",\"details\":\"response encoding failed\"}"
              .getBytes(StandardCharsets.UTF_8);
      return new ServerResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), JSON, fallback);
    }
  }
}
