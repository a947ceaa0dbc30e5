package com.mk.fx.qa.vecro.resource;

import com.mk.fx.qa.vecro.transport.InboundCall;
import com.mk.fx.qa.vecro.transport.ServerResponse;
import com.mk.fx.qa.vecro.transport.WorkloadTransport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Workload", description = "Runs the configured store workload once per request")
@RestController
@RequiredArgsConstructor
public class WorkloadController {

  private final WorkloadTransport transport;

  @Operation(
      summary = "Run workload",
      description =
          "Issues the configured number of reads then writes against the backing store and"
              + " returns the counts and bytes moved.")
  @RequestMapping(
      value = "/",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<byte[]> run(
      HttpServletRequest request, @RequestBody(required = false) byte[] body) {
    InboundCall call =
        new InboundCall(request.getMethod(), request.getRequestURI(), headersOf(request), body);
    ServerResponse response = transport.handle(call);
    return ResponseEntity.status(response.status())
        .contentType(MediaType.parseMediaType(response.contentType()))
        .body(response.body());
  }

  private static Map<String, String> headersOf(HttpServletRequest request) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.putIfAbsent(name, request.getHeader(name));
    }
    return headers;
  }
}
