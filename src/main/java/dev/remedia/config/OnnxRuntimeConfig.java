package dev.remedia.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Sizes the ONNX Runtime thread pools used by the query embedding model.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, and the embedding model's static initializer creates it. Running as a {@link
 * BeanFactoryPostProcessor} guarantees the options below are applied before that bean exists.
 *
 * <p>Query embedding runs once per query on the search pool, so the defaults are small and spinning
 * is off: {@code remedia.onnx.intra-op-threads} (2) and {@code remedia.onnx.inter-op-threads} (1).
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 2;
  private int interOpThreads = 1;

  @Override
  public void setEnvironment(Environment environment) {
    intraOpThreads = environment.getProperty("remedia.onnx.intra-op-threads", Integer.class, 2);
    interOpThreads = environment.getProperty("remedia.onnx.inter-op-threads", Integer.class, 1);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "remedia", threadingOptions);

      log.info(
          "ONNX Runtime initialized for query embedding: intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized; thread settings not applied: {}",
          e.getMessage());
    }
  }
}
