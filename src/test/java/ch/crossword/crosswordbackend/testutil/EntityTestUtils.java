package ch.crossword.crosswordbackend.testutil;

import ch.crossword.crosswordbackend.domain.common.BaseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;

/**
 * Gives unsaved entities the id JPA would generate on persist.
 */
public final class EntityTestUtils {

    private EntityTestUtils() {
        // utility class
    }

    public static void setId(BaseEntity entity, UUID id) {
        ReflectionTestUtils.setField(entity, BaseEntity.class, "id", id, UUID.class);
    }

    /**
     * Assigns a random id and returns the entity, for inline use in fixtures.
     */
    public static <T extends BaseEntity> T withRandomId(T entity) {
        setId(entity, UUID.randomUUID());
        return entity;
    }
}
