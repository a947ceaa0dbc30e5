package com.mk.fx.qa.vecro.cfg;

import com.mk.fx.qa.vecro.utils.ListenAddress;
import java.net.InetAddress;
import java.net.UnknownHostException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Binds the embedded server to {@code vecro.listen-address}. */
@Slf4j
@Configuration
public class WebServerCfg {

  @Bean
  public WebServerFactoryCustomizer<ConfigurableWebServerFactory> listenAddressCustomizer(
      VecroSettings settings) {
    return factory -> bind(factory, settings.listenAddress());
  }

  /** An unresolvable host falls back to {@link ListenAddress#DEFAULT}. */
  static ListenAddress bind(ConfigurableWebServerFactory factory, ListenAddress address) {
    ListenAddress effective = address;
    InetAddress inet = null;
    if (address.host() != null) {
      try {
        inet = InetAddress.getByName(address.host());
      } catch (UnknownHostException e) {
        log.warn("Cannot resolve listen host '{}', using {}", address.host(), ListenAddress.DEFAULT);
        effective = ListenAddress.DEFAULT;
      }
    }
    factory.setPort(effective.port());
    if (inet != null) {
      factory.setAddress(inet);
    }
    log.info("msg=HTTP addr={}", effective);
    return effective;
  }
}
