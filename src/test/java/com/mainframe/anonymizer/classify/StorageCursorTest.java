package com.mainframe.anonymizer.classify;

import org.junit.jupiter.api.Test;

import com.mainframe.anonymizer.model.PictureClause;
import com.mainframe.anonymizer.model.UsageType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for data item offsets.
 */
class StorageCursorTest {

    @Test
    void testSequentialOffsets() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "REC");
        cursor.open(5, "FIELD-A");
        cursor.describe(PictureClause.parse("X(10)"), null);
        cursor.open(5, "FIELD-B");
        cursor.describe(PictureClause.parse("9(5)"), null);
        cursor.open(5, "FIELD-C");
        cursor.closeAll();

        assertThat(cursor.positionOf("FIELD-A")).isEqualTo(0);
        assertThat(cursor.positionOf("FIELD-B")).isEqualTo(10);
        assertThat(cursor.positionOf("field-c")).isEqualTo(15);
    }

    @Test
    void testRedefinesTakesTargetOffsetAndRestoresCursor() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "REC");
        cursor.open(5, "NAME");
        cursor.describe(PictureClause.parse("X(20)"), null);
        cursor.open(5, "CODE");
        cursor.describe(PictureClause.parse("X(5)"), null);
        cursor.open(5, "NAME-ALT");
        int declared = cursor.redefine("NAME");
        cursor.describe(PictureClause.parse("X(4)"), null);
        cursor.open(5, "NEXT");

        assertThat(declared).isEqualTo(25);
        assertThat(cursor.positionOf("NAME-ALT")).isEqualTo(0);
        assertThat(cursor.positionOf("NEXT")).isEqualTo(25);
    }

    @Test
    void testRedefinesOfUnknownTargetKeepsSequentialOffset() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "REC");
        cursor.open(5, "A");
        cursor.describe(PictureClause.parse("X(3)"), null);
        cursor.open(5, "B");
        cursor.redefine("NOWHERE");

        assertThat(cursor.positionOf("B")).isEqualTo(3);
    }

    @Test
    void testOccursMultipliesSize() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "TABLE");
        cursor.open(5, "ITEM");
        cursor.describe(PictureClause.parse("X(3)"), null);
        cursor.occurs(4);
        cursor.open(5, "AFTER");

        assertThat(cursor.positionOf("AFTER")).isEqualTo(12);
    }

    @Test
    void testGroupSizeIsSumOfChildren() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "REC");
        cursor.open(5, "GROUP");
        cursor.occurs(2);
        cursor.open(10, "PART-1");
        cursor.describe(PictureClause.parse("X(2)"), null);
        cursor.open(10, "PART-2");
        cursor.describe(PictureClause.parse("9(3)"), UsageType.PACKED_DECIMAL);
        cursor.open(5, "TAIL");

        // group of 2 + 2 bytes, twice
        assertThat(cursor.positionOf("TAIL")).isEqualTo(8);
    }

    @Test
    void testLevelOneStartsNewRecord() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "FIRST");
        cursor.open(5, "X1");
        cursor.describe(PictureClause.parse("X(50)"), null);
        cursor.open(1, "SECOND");

        assertThat(cursor.positionOf("SECOND")).isEqualTo(0);
        assertThat(cursor.depth()).isEqualTo(1);
    }

    @Test
    void testFirstDeclarationWins() {
        StorageCursor cursor = new StorageCursor();

        cursor.open(1, "REC-A");
        cursor.open(5, "DUP");
        cursor.describe(PictureClause.parse("X"), null);
        cursor.open(5, "OTHER");
        cursor.describe(PictureClause.parse("X"), null);
        cursor.open(5, "DUP");

        assertThat(cursor.positionOf("DUP")).isEqualTo(0);
    }

    @Test
    void testByteLengthWithoutPicture() {
        assertThat(StorageCursor.calculateByteLength(null, UsageType.COMP_1)).isEqualTo(4);
        assertThat(StorageCursor.calculateByteLength(null, UsageType.COMP_2)).isEqualTo(8);
        assertThat(StorageCursor.calculateByteLength(null, UsageType.POINTER)).isEqualTo(4);
        assertThat(StorageCursor.calculateByteLength(null, null)).isZero();
    }
}
