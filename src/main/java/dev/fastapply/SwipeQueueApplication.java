package dev.fastapply;

import dev.fastapply.config.SwipeQueueProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class SwipeQueueApplication implements CommandLineRunner {

    private final ReconcileRunner reconcileRunner;
    private final ExitManager exitManager;
    private final SwipeQueueProperties properties;

    public static void main(String[] args) {
        SpringApplication.run(SwipeQueueApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!properties.isReconcileOnStartup()) {
            log.info("Startup reconcile disabled, session stays open");
            return;
        }

        try {
            reconcileRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Swipe Queue failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
