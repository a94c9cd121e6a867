// Namespace
package com.gnovoa.gridiron;

// Imports
import com.gnovoa.gridiron.config.TensorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(TensorProperties.class)
public class GridironTensorsApplication {

  public static void main(String[] args) {
    SpringApplication.run(GridironTensorsApplication.class, args);
  }
}
