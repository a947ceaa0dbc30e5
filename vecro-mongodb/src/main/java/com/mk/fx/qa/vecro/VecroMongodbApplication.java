package com.mk.fx.qa.vecro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class VecroMongodbApplication {

  public static void main(String[] args) {
    SpringApplication.run(VecroMongodbApplication.class, args);
  }
}
