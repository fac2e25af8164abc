package com.example.pageviews;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Accumulates a {@link StringDictionaryColumn}: an int index vector plus a UTF-8 dictionary
 * vector. Keys are handed out in first-seen order.
 *
 * Until {@link #build()} is called the builder owns both vectors and {@link #close()} releases
 * them; afterwards they belong to the built column.
 */
final class StringDictionaryBuilder implements AutoCloseable {

    private final Field field;
    private final int maxEntries;
    private final Map<String, Integer> ids = new HashMap<>();
    private final IntVector keys;
    private final VarCharVector values;
    private int rows;
    private boolean built;

    /**
     * @param field a dictionary encoded field; its name labels overflow errors
     */
    StringDictionaryBuilder(Field field, int maxEntries, BufferAllocator allocator) {
        this.field = field;
        this.maxEntries = maxEntries;
        this.keys = new IntVector(field, allocator);
        this.values = new VarCharVector(Field.notNullable(field.getName(), ArrowType.Utf8.INSTANCE), allocator);
    }

    void allocateNew() {
        keys.allocateNew();
        values.allocateNew();
    }

    /**
     * Appends {@code value} (which may be null) as the next row.
     *
     * @return the key stored for the row, or {@link StringDictionaryColumn#NULL_KEY}
     * @throws ChunkEncodingException if a new value would exceed the dictionary bound
     */
    int add(String value) {
        if (value == null) {
            keys.setNull(rows++);
            return StringDictionaryColumn.NULL_KEY;
        }
        int key = intern(value);
        keys.setSafe(rows++, key);
        return key;
    }

    private int intern(String value) {
        Integer id = ids.get(value);
        if (id != null) {
            return id;
        }
        int next = ids.size();
        if (next >= maxEntries) {
            throw new ChunkEncodingException("Dictionary for column " + field.getName() + " is full at "
                    + maxEntries + " entries");
        }
        values.setSafe(next, value.getBytes(StandardCharsets.UTF_8));
        ids.put(value, next);
        return next;
    }

    StringDictionaryColumn build() {
        keys.setValueCount(rows);
        values.setValueCount(ids.size());
        built = true;
        return new StringDictionaryColumn(keys, new Dictionary(values, field.getDictionary()));
    }

    @Override
    public void close() {
        if (!built) {
            keys.close();
            values.close();
        }
    }
}
