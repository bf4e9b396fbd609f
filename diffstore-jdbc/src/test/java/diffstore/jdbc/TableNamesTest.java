package diffstore.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("diff_entry", TableNames.validate("diff_entry"));
        assertEquals("MyTable", TableNames.validate("MyTable"));
        assertEquals("entries123", TableNames.validate("entries123"));
    }

    @Test
    void defaultTableConstants() {
        assertEquals("diff_region", TableNames.DEFAULT_REGION_TABLE);
        assertEquals("diff_entry", TableNames.DEFAULT_ENTRY_TABLE);
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void emptyTableNameThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    }

    @Test
    void tableNameStartingWithDigitThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    }

    @Test
    void tableNameWithSpecialCharsThrows() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my-table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my.table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
    }
}
