package com.mk.fx.qa.vecro.resource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.vecro.transport.InboundCall;
import com.mk.fx.qa.vecro.transport.ServerResponse;
import com.mk.fx.qa.vecro.transport.WorkloadTransport;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = WorkloadController.class)
@Import(GlobalExceptionHandler.class)
class WorkloadControllerTest {

  private static final String OK_BODY =
      "{\"success\":true,\"reads\":1,\"writes\":0,\"readBytes\":7,\"writeBytes\":0,\"totalBytes\":7}";

  @Autowired MockMvc mvc;

  @MockBean WorkloadTransport transport;

  private static ServerResponse json(int status, String body) {
    return new ServerResponse(
        status, MediaType.APPLICATION_JSON_VALUE, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void get_isHandedToTransportAndResponseWrittenVerbatim() throws Exception {
    when(transport.handle(any())).thenReturn(json(200, OK_BODY));

    mvc.perform(get("/").header("traceparent", "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.totalBytes").value(7));

    ArgumentCaptor<InboundCall> captor = ArgumentCaptor.forClass(InboundCall.class);
    verify(transport).handle(captor.capture());
    InboundCall call = captor.getValue();
    assertEquals("GET", call.method());
    assertEquals("/", call.path());
    assertFalse(call.hasBody());
    assertEquals(
        "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01", call.headers().get("Traceparent"));
  }

  @Test
  void post_forwardsRawBody() throws Exception {
    when(transport.handle(any())).thenReturn(json(200, OK_BODY));

    mvc.perform(post("/").contentType(MediaType.APPLICATION_JSON).content("{\"client\":\"bench\"}"))
        .andExpect(status().isOk());

    ArgumentCaptor<InboundCall> captor = ArgumentCaptor.forClass(InboundCall.class);
    verify(transport).handle(captor.capture());
    assertEquals("POST", captor.getValue().method());
    assertEquals("{\"client\":\"bench\"}", new String(captor.getValue().body(), StandardCharsets.UTF_8));
  }

  @Test
  void transportErrorStatus_isPassedThrough() throws Exception {
    when(transport.handle(any()))
        .thenReturn(json(504, "{\"error\":\"Gateway Timeout\",\"details\":\"deadline exceeded\"}"));

    mvc.perform(get("/"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.error").value("Gateway Timeout"))
        .andExpect(jsonPath("$.details").value("deadline exceeded"));
  }

  @Test
  void unexpectedFailure_isHandledByAdvice() throws Exception {
    when(transport.handle(any())).thenThrow(new IllegalStateException("kaboom"));

    mvc.perform(get("/"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Server Error"))
        .andExpect(jsonPath("$.details").value("kaboom"));
  }

  @Test
  void unsupportedMethod_isRejectedBeforeTransport() throws Exception {
    mvc.perform(delete("/"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.error").value("Method Not Allowed"));

    verifyNoInteractions(transport);
  }

  @Test
  void unknownPath_isNotFoundWithoutReachingTransport() throws Exception {
    mvc.perform(get("/favicon.ico"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));

    verifyNoInteractions(transport);
  }
}
