package com.tektonqueue.spring;

import com.tektonqueue.adapter.spring.TektonQueueAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Imports {@link TektonQueueAutoConfiguration} so an application gets the
 * PipelineRun defaulter and its policy store.
 * <p>
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTektonQueue
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TektonQueueAutoConfiguration.class)
public @interface EnableTektonQueue {
}
