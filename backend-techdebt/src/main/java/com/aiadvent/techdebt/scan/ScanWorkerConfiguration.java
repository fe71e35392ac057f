package com.aiadvent.techdebt.scan;

import com.aiadvent.techdebt.config.TechDebtProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/** Bounded pool that runs per-file analysis; sized by {@code techdebt.worker.max-concurrency}. */
@Configuration
@EnableConfigurationProperties(TechDebtProperties.class)
public class ScanWorkerConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ScanWorkerConfiguration.class);

  public static final String EXECUTOR_BEAN = "scanWorkerExecutor";
  static final String DEFAULT_THREAD_PREFIX = "techdebt-scan-";

  @Bean(name = EXECUTOR_BEAN, destroyMethod = "shutdown")
  public ExecutorService scanWorkerExecutor(TechDebtProperties properties) {
    TechDebtProperties.Worker worker = properties.getWorker();
    log.info(
        "techdebt.worker.pool concurrency={} fileTimeout={} threadPrefix={}",
        worker.getMaxConcurrency(),
        worker.getFileTimeout(),
        worker.getThreadNamePrefix());
    return newWorkerPool(worker.getMaxConcurrency(), worker.getThreadNamePrefix());
  }

  static ExecutorService newWorkerPool(int concurrency) {
    return newWorkerPool(concurrency, DEFAULT_THREAD_PREFIX);
  }

  static ExecutorService newWorkerPool(int concurrency, String threadNamePrefix) {
    return Executors.newFixedThreadPool(
        Math.max(1, concurrency), new ScanThreadFactory(threadNamePrefix));
  }

  /** Daemon threads named {@code <prefix><n>}. */
  static final class ScanThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger index = new AtomicInteger();

    ScanThreadFactory(String prefix) {
      this.prefix = StringUtils.hasText(prefix) ? prefix : DEFAULT_THREAD_PREFIX;
    }

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, prefix + index.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
