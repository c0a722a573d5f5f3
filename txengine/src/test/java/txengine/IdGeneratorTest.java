package txengine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdGenerator")
class IdGeneratorTest {

    @Test
    @DisplayName("should format ids as prefix, millis and suffix")
    void shouldFormatIds() {
        String id = IdGenerator.next(IdGenerator.TRANSACTION);

        assertThat(id).matches("txn_\\d+_[0-9a-z]+");
    }

    @Test
    @DisplayName("should not repeat within a burst")
    void shouldBeUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(IdGenerator.next(IdGenerator.ROLLBACK_POINT));
        }

        assertThat(ids).hasSize(10_000);
    }
}
