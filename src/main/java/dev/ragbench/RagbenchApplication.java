package dev.ragbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the evaluation harness.
 *
 * <p>Runs one command (see {@code dev.ragbench.cli}) without a web server and exits with the code
 * the command reported.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RagbenchApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(RagbenchApplication.class, args)));
  }
}
