package org.cim.location;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the event-sourced location server.
 */
@SpringBootApplication
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class LocationServerApplication {

  /**
   * Application entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(LocationServerApplication.class, args);
  }
}
