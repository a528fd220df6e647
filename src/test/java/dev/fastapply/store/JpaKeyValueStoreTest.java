package dev.fastapply.store;

import dev.fastapply.ExitManager;
import dev.fastapply.ReconcileRunner;
import dev.fastapply.config.SwipeQueueProperties;
import dev.fastapply.repository.KeyValueRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaKeyValueStore.class)
@EnableConfigurationProperties(SwipeQueueProperties.class)
@ActiveProfiles("test")
class JpaKeyValueStoreTest {

    @MockitoBean
    private ReconcileRunner reconcileRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private JpaKeyValueStore store;

    @Autowired
    private KeyValueRepository repository;

    @Test
    @DisplayName("Should insert then overwrite a value")
    void shouldInsertThenOverwrite() {
        store.put("default:automation_profile_map", "{}");
        store.put("default:automation_profile_map", "{\"p1\":{}}");

        assertThat(store.get("default:automation_profile_map")).contains("{\"p1\":{}}");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return empty for unknown keys")
    void shouldReturnEmptyForUnknownKeys() {
        assertThat(store.get("default:missing")).isEmpty();
    }

    @Test
    @DisplayName("Should remove a single key")
    void shouldRemoveSingleKey() {
        store.put("default:a", "1");
        store.put("default:b", "2");

        store.remove("default:a");

        assertThat(store.get("default:a")).isEmpty();
        assertThat(store.get("default:b")).contains("2");
    }

    @Test
    @DisplayName("Should remove every key of a namespace")
    void shouldRemoveByPrefix() {
        store.put("alice:a", "1");
        store.put("alice:b", "2");
        store.put("bob:a", "3");

        store.removeByPrefix("alice:");

        assertThat(repository.findByStorageKeyStartingWith("alice:")).isEmpty();
        assertThat(store.get("bob:a")).contains("3");
    }
}
