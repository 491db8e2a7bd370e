package dev.remedia.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Thread pools for search runs.
 *
 * <p>Backend calls and run producers get separate pools so a burst of runs waiting on their
 * backends can never occupy the threads those backends need.
 */
@Configuration
public class SearchExecutorConfig {

  @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(
      @Value("${remedia.executor.search-threads:8}") int threads) {
    return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("search-"));
  }

  @Bean(name = "runExecutor", destroyMethod = "shutdownNow")
  public ExecutorService runExecutor(@Value("${remedia.executor.run-threads:4}") int threads) {
    return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("run-"));
  }
}
