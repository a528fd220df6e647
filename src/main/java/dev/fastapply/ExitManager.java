package dev.fastapply;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Ends the process once the startup reconcile finished.
 * Separated to allow mocking in tests and avoid killing the test runner.
 */
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ApplicationContext context;

  public void exit(int status) {
    if (!isTest()) {
      // Closing the context first flushes session state and stops the timers
      System.exit(SpringApplication.exit(context, () -> status));
    }
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire");
  }
}
