package com.scholary.medforce.config;

import com.scholary.medforce.session.SessionProperties;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads used by duplex sessions.
 *
 * <p>Outbound frames for every connection are drained on one small shared pool; each connection's
 * outbox keeps at most one drain in flight on it. Recognition engines get a dedicated daemon
 * thread each, so a blocking transcription call never holds up a socket.
 */
@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class AsyncConfig {

  @Bean(name = "outboundExecutor")
  public Executor outboundExecutor(SessionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.outboundThreads());
    executor.setMaxPoolSize(properties.outboundThreads());
    executor.setThreadNamePrefix("ws-out-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  @Bean(name = "engineThreadFactory")
  public ThreadFactory engineThreadFactory() {
    CustomizableThreadFactory factory = new CustomizableThreadFactory("stt-");
    factory.setDaemon(true);
    return factory;
  }
}
