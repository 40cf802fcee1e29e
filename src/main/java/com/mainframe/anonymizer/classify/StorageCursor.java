package com.mainframe.anonymizer.classify;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.mainframe.anonymizer.model.PictureClause;
import com.mainframe.anonymizer.model.UsageType;

/**
 * Tracks the level-number stack of a DATA DIVISION and the byte offset of every data
 * item within its 01/77 record.
 *
 * Offsets are computed as the entries close: an elementary item takes its PICTURE/USAGE
 * size, a group the size of its children, both multiplied by OCCURS. A REDEFINES entry is
 * laid at its target's offset and, once closed, leaves the cursor where it was before the
 * entry was opened.
 */
public class StorageCursor {

    private final Deque<LevelEntry> stack = new ArrayDeque<>();
    private final Map<String, Integer> positions = new LinkedHashMap<>();
    private int cursor = 0;

    /**
     * Opens a data item of the given level, closing every open item of the same or a
     * deeper level first. Level 01 and 77 items start a new record at offset 0.
     *
     * @return the offset assigned to the item
     */
    public int open(int level, String name) {
        if (level == 1 || level == 77) {
            closeAll();
            cursor = 0;
        } else {
            adjustStackForLevel(level);
        }

        LevelEntry entry = new LevelEntry(level, name, cursor);
        stack.push(entry);
        record(name, entry.start);
        return entry.start;
    }

    /**
     * Turns the innermost open item into an overlay of {@code target}. When the target's
     * offset is unknown the item keeps its sequential offset.
     *
     * @return the offset the item had before the overlay was applied
     */
    public int redefine(String target) {
        LevelEntry entry = stack.peek();
        if (entry == null) {
            return cursor;
        }
        int declared = entry.start;
        entry.overlay = true;
        entry.savedCursor = declared;

        Integer targetOffset = positionOf(target);
        if (targetOffset != null) {
            entry.start = targetOffset;
            cursor = targetOffset;
            if (entry.name != null) {
                positions.put(key(entry.name), targetOffset);
            }
        }
        return declared;
    }

    public void describe(PictureClause picture, UsageType usage) {
        LevelEntry entry = stack.peek();
        if (entry == null) {
            return;
        }
        if (picture != null) {
            entry.picture = picture;
        }
        if (usage != null) {
            entry.usage = usage;
        }
    }

    public void occurs(int times) {
        LevelEntry entry = stack.peek();
        if (entry != null && times > 0) {
            entry.occurs = times;
        }
    }

    public void closeAll() {
        while (!stack.isEmpty()) {
            close(stack.pop());
        }
    }

    public int depth() {
        return stack.size();
    }

    public Integer positionOf(String name) {
        return name == null ? null : positions.get(key(name));
    }

    public Map<String, Integer> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    private void adjustStackForLevel(int level) {
        while (!stack.isEmpty() && stack.peek().level >= level) {
            close(stack.pop());
        }
    }

    private void close(LevelEntry entry) {
        boolean elementary = entry.picture != null || entry.usage != null;
        int single = elementary ? calculateByteLength(entry.picture, entry.usage) : cursor - entry.start;
        int end = entry.start + Math.max(0, single) * entry.occurs;
        cursor = entry.overlay ? entry.savedCursor : end;
    }

    /**
     * Byte length for a single occurrence of an elementary item.
     */
    static int calculateByteLength(PictureClause picture, UsageType usage) {
        UsageType effective = (usage == null) ? UsageType.DISPLAY : usage;
        if (picture == null) {
            return switch (effective) {
                case COMP_1, COMP_5, BINARY, POINTER, INDEX -> 4;
                case COMP_2 -> 8;
                default -> 0;
            };
        }
        return picture.getByteLength(effective);
    }

    private void record(String name, int offset) {
        if (name != null) {
            positions.putIfAbsent(key(name), offset);
        }
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private static final class LevelEntry {
        private final int level;
        private final String name;
        private int start;
        private int occurs = 1;
        private boolean overlay;
        private int savedCursor;
        private PictureClause picture;
        private UsageType usage;

        private LevelEntry(int level, String name, int start) {
            this.level = level;
            this.name = name;
            this.start = start;
        }
    }
}
