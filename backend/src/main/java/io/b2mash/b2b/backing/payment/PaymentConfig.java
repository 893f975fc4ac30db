package io.b2mash.b2b.backing.payment;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PaymentConfig {

  /** Runs blocking gateway calls off the request thread. */
  @Bean(name = "paymentTaskExecutor")
  public Executor paymentTaskExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("payment-");
    executor.initialize();
    return executor;
  }
}
