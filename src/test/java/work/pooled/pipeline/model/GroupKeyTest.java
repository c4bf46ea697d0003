package work.pooled.pipeline.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.pooled.pipeline.error.ConfigurationException;
import work.pooled.pipeline.error.ErrorCode;

class GroupKeyTest {
    private static final List<Field> WELL_KEY = List.of(Field.BATCH, Field.PLATE, Field.WELL);

    @Test
    void equalityIsByFieldsAndValues() {
        var a = GroupKey.of(WELL_KEY, List.of("B1", "P1", "A1"));
        var b = GroupKey.of(WELL_KEY, List.of("B1", "P1", "A1"));
        var c = GroupKey.of(List.of(Field.BATCH, Field.PLATE, Field.SITE), List.of("B1", "P1", "A1"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void projectionDropsFieldsInRequestedOrder() {
        var fine = GroupKey.of(WELL_KEY, List.of("B1", "P1", "A1"));
        var coarse = fine.project(List.of(Field.BATCH, Field.PLATE));
        assertEquals(GroupKey.of(List.of(Field.BATCH, Field.PLATE), List.of("B1", "P1")), coarse);
    }

    @Test
    void projectionCannotAddFields() {
        var key = GroupKey.of(List.of(Field.BATCH, Field.PLATE), List.of("B1", "P1"));
        var ex = assertThrows(ConfigurationException.class, () -> key.project(List.of(Field.BATCH, Field.WELL)));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.code());
    }

    @Test
    void ordersValuesNaturally() {
        var p2 = GroupKey.of(List.of(Field.PLATE), List.of("P2"));
        var p10 = GroupKey.of(List.of(Field.PLATE), List.of("P10"));
        assertTrue(p2.compareTo(p10) < 0);
    }

    @Test
    void labelIsFileSystemSafe() {
        var key = GroupKey.of(WELL_KEY, List.of("batch 1", "P/1", "A1"));
        assertEquals("batch_1-P_1-A1", key.label());
        assertEquals(Map.of("batch", "batch 1", "plate", "P/1", "well", "A1"), key.asMap());
    }

    @Test
    void rejectsMismatchedArity() {
        assertThrows(IllegalArgumentException.class, () -> GroupKey.of(WELL_KEY, List.of("B1")));
    }
}
