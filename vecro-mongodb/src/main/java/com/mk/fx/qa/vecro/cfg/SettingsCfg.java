package com.mk.fx.qa.vecro.cfg;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SettingsCfg {

  @Bean
  public VecroSettings vecroSettings(VecroProperties properties) {
    return VecroSettings.resolve(properties);
  }
}
