package com.mk.fx.qa.vecro.cfg;

import com.mk.fx.qa.vecro.store.MongoConnector;
import com.mk.fx.qa.vecro.store.MongoStoreGateway;
import com.mk.fx.qa.vecro.store.StoreGateway;
import com.mongodb.client.MongoClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connects to the backing store at startup. An unreachable store fails context startup with a
 * {@link com.mk.fx.qa.vecro.store.StoreConnectException}.
 */
@Configuration
public class StoreCfg {

  @Bean(destroyMethod = "close")
  public MongoClient mongoClient(VecroSettings settings) {
    return MongoConnector.connect(settings.store());
  }

  @Bean
  public StoreGateway storeGateway(MongoClient client, VecroSettings settings) {
    return MongoStoreGateway.open(client, settings.store());
  }
}
