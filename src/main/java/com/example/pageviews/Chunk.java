package com.example.pageviews;

import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A batch of pageviews stored column by column in an Arrow {@link VectorSchemaRoot}. Row
 * {@code i} of every column describes the same record. The three string columns other than
 * {@code page_title} are dictionary encoded; their dictionaries are available from
 * {@link #getDictionaryProvider()}.
 *
 * Chunks are not modified once built. Closing a chunk releases its Arrow buffers.
 */
public final class Chunk implements AutoCloseable {

    public static final List<String> COLUMN_NAMES =
            List.of("domain_code", "page_title", "views", "language", "domain", "mobile");

    static final Field DOMAIN_CODE = dictionaryField("domain_code", 0, false);
    static final Field PAGE_TITLE = Field.notNullable("page_title", ArrowType.Utf8.INSTANCE);
    static final Field VIEWS = Field.notNullable("views", new ArrowType.Int(32, false));
    static final Field LANGUAGE = dictionaryField("language", 1, false);
    static final Field DOMAIN = dictionaryField("domain", 2, true);
    static final Field MOBILE = Field.notNullable("mobile", ArrowType.Bool.INSTANCE);

    public static final Schema SCHEMA = new Schema(List.of(DOMAIN_CODE, PAGE_TITLE, VIEWS, LANGUAGE, DOMAIN, MOBILE));

    private final StringDictionaryColumn domainCodes;
    private final VarCharVector pageTitles;
    private final UInt4Vector views;
    private final StringDictionaryColumn languages;
    private final StringDictionaryColumn domains;
    private final BitVector mobile;
    private final VectorSchemaRoot root;
    private final DictionaryProvider.MapDictionaryProvider dictionaries;

    Chunk(StringDictionaryColumn domainCodes,
          VarCharVector pageTitles,
          UInt4Vector views,
          StringDictionaryColumn languages,
          StringDictionaryColumn domains,
          BitVector mobile,
          int rows) {
        this.domainCodes = domainCodes;
        this.pageTitles = pageTitles;
        this.views = views;
        this.languages = languages;
        this.domains = domains;
        this.mobile = mobile;
        List<FieldVector> vectors = List.of(domainCodes.getIndexVector(), pageTitles, views,
                languages.getIndexVector(), domains.getIndexVector(), mobile);
        this.root = new VectorSchemaRoot(SCHEMA.getFields(), vectors);
        root.setRowCount(rows);
        this.dictionaries = new DictionaryProvider.MapDictionaryProvider(domainCodes.getArrowDictionary(),
                languages.getArrowDictionary(), domains.getArrowDictionary());
    }

    private static Field dictionaryField(String name, long id, boolean nullable) {
        ArrowType.Int index = new ArrowType.Int(32, true);
        return new Field(name, new FieldType(nullable, index, new DictionaryEncoding(id, false, index)), null);
    }

    public int size() {
        return root.getRowCount();
    }

    public VectorSchemaRoot getVectorSchemaRoot() {
        return root;
    }

    public DictionaryProvider getDictionaryProvider() {
        return dictionaries;
    }

    public StringDictionaryColumn getDomainCodes() {
        return domainCodes;
    }

    public StringDictionaryColumn getLanguages() {
        return languages;
    }

    public StringDictionaryColumn getDomains() {
        return domains;
    }

    public String getDomainCode(int row) {
        return domainCodes.get(row);
    }

    public String getPageTitle(int row) {
        return new String(pageTitles.get(row), StandardCharsets.UTF_8);
    }

    public long getViews(int row) {
        return Integer.toUnsignedLong(views.get(row));
    }

    public String getLanguage(int row) {
        return languages.get(row);
    }

    public String getDomain(int row) {
        return domains.get(row);
    }

    public boolean isMobile(int row) {
        return mobile.get(row) != 0;
    }

    /** Values of {@code row} in {@link #COLUMN_NAMES} order; a missing domain is null. */
    public Object[] getRow(int row) {
        return new Object[]{
                getDomainCode(row), getPageTitle(row), getViews(row), getLanguage(row), getDomain(row), isMobile(row)
        };
    }

    @Override
    public void close() {
        root.close();
        domainCodes.getArrowDictionary().getVector().close();
        languages.getArrowDictionary().getVector().close();
        domains.getArrowDictionary().getVector().close();
    }
}
