package com.example.pageviews;

import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dictionary encoded string column. Each distinct value is stored once in the dictionary vector;
 * each row of the index vector holds a key into it, or null.
 */
public final class StringDictionaryColumn {

    /** Key reported by {@link #getKey(int)} for a null row. */
    public static final int NULL_KEY = -1;

    private final IntVector keys;
    private final Dictionary dictionary;
    private final VarCharVector values;

    StringDictionaryColumn(IntVector keys, Dictionary dictionary) {
        this.keys = keys;
        this.dictionary = dictionary;
        this.values = (VarCharVector) dictionary.getVector();
    }

    public int size() {
        return keys.getValueCount();
    }

    public int getKey(int row) {
        return keys.isNull(row) ? NULL_KEY : keys.get(row);
    }

    public boolean isNull(int row) {
        return keys.isNull(row);
    }

    /** @return the decoded value of {@code row}, or null */
    public String get(int row) {
        return keys.isNull(row) ? null : value(keys.get(row));
    }

    public List<String> getDictionary() {
        List<String> out = new ArrayList<>(values.getValueCount());
        for (int i = 0; i < values.getValueCount(); i++) {
            out.add(value(i));
        }
        return Collections.unmodifiableList(out);
    }

    public int[] getKeys() {
        int[] out = new int[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getKey(i);
        }
        return out;
    }

    public IntVector getIndexVector() {
        return keys;
    }

    public Dictionary getArrowDictionary() {
        return dictionary;
    }

    private String value(int key) {
        return new String(values.get(key), StandardCharsets.UTF_8);
    }
}
