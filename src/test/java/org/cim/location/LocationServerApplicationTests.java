package org.cim.location;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Basic application context test.
 */
@SpringBootTest
@ActiveProfiles("it")
class LocationServerApplicationTests {

  @Test
  void contextLoads() {
    // This test verifies that the application context loads successfully
  }
}
