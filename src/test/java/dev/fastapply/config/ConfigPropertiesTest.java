package dev.fastapply.config;

import dev.fastapply.ExitManager;
import dev.fastapply.ReconcileRunner;
import dev.fastapply.session.QueueSession;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private ReconcileRunner reconcileRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private SwipeQueueProperties properties;

  @Autowired
  private QueueSession queueSession;

  @Test
  void shouldLoadSwipeQueueProperties() {
    assertThat(properties.getNamespace()).isEqualTo("test");
    assertThat(properties.getKnownProfiles()).containsExactly("profile-1", "profile-2");
    assertThat(properties.isSyncOnInitialize()).isFalse();
  }

  @Test
  void shouldKeepDefaultsNotOverridden() {
    assertThat(properties.getDebounce()).isEqualTo(Duration.ofMinutes(2));
    assertThat(properties.getMaxBatchSize()).isEqualTo(25);
    assertThat(properties.getMaxRetries()).isEqualTo(3);
    assertThat(properties.getSnapshot().getCapacity()).isEqualTo(500);
  }

  @Test
  void shouldLoadHttpSettings() {
    assertThat(properties.getHttp().getMaxAttempts()).isEqualTo(2);
    assertThat(properties.getHttp().getInitialBackoff()).isEqualTo(Duration.ofMillis(10));
  }

  @Test
  void shouldOpenSessionInConfiguredNamespace() {
    assertThat(queueSession.getStorage().getNamespace()).isEqualTo("test");
    assertThat(queueSession.getQueueManager().getPendingUrlsCount()).isZero();
    assertThat(queueSession.getGuard().getActiveProfile()).isEmpty();
  }
}
