package org.broadinstitute.varspace.annotation;

import org.broadinstitute.varspace.exceptions.AnnotationProviderException;
import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.table.Table;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.broadinstitute.varspace.testutils.TableTestUtils;
import org.broadinstitute.varspace.utils.config.ConfigFactory;
import org.broadinstitute.varspace.utils.config.WorkspaceConfig;
import org.broadinstitute.varspace.variant.KeyColumnMapping;
import org.broadinstitute.varspace.variant.VariantKey;
import org.broadinstitute.varspace.workspace.FileStore;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ApplyEngineUnitTest extends BaseTest {

    private static final String K1 = "6-100-G-A";
    private static final String K2 = "6-200-C-T";

    private Path root;
    private FileStore store;
    private RecordingProvider provider;
    private AnnotationProviderRegistry registry;

    /**
     * Answers from a fixed map and remembers every call. Variants listed in {@code unavailable} fail
     * individually; after {@code failAfter} calls every call fails systemically.
     */
    private static final class RecordingProvider implements AnnotationProvider {
        private final Map<VariantKey, Annotation> answers = new HashMap<>();
        private final List<VariantKey> unavailable = new ArrayList<>();
        private final List<VariantKey> calls = new ArrayList<>();
        private final List<String> transcripts = new ArrayList<>();
        private int failAfter = Integer.MAX_VALUE;
        private boolean closed;

        RecordingProvider answer(final String key, final double score) {
            answers.put(VariantKey.parse(key).get(), Annotation.of("score", score));
            return this;
        }

        @Override
        public String getName() {
            return "recording";
        }

        @Override
        public List<String> getOutputColumns() {
            return Collections.singletonList("score");
        }

        @Override
        public Annotation annotate(final VariantKey key, final String transcript) {
            if (calls.size() >= failAfter) {
                throw new AnnotationProviderException.SystemicProviderFailure(getName(), "credentials rejected");
            }
            calls.add(key);
            transcripts.add(transcript);
            if (unavailable.contains(key)) {
                throw new AnnotationProviderException.ProviderUnavailable(getName(), "timed out");
            }
            return answers.getOrDefault(key, Annotation.na());
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @BeforeMethod
    public void setUp() {
        root = createTempDir("apply");
        store = TableTestUtils.newStore(root);
        provider = new RecordingProvider().answer(K1, 0.73).answer(K2, 0.1);
        registry = new AnnotationProviderRegistry().register(AnnotationTool.CADD, provider);
    }

    private void writeSource(final String... keys) {
        final String[][] rows = new String[keys.length][];
        for (int i = 0; i < keys.length; i++) {
            rows[i] = new String[] {keys[i], "row" + i};
        }
        TableTestUtils.writeTable(root, "merged.csv", TableTestUtils.table(Arrays.asList("gen_pos", "Note"), rows));
    }

    private static WorkspaceConfig config(final String key, final String value) {
        return ConfigFactory.getInstance().create(WorkspaceConfig.class, Collections.singletonMap(key, value));
    }

    @Test
    public void testUnscoredVariantGetsNA() {
        writeSource(K1, "6-999-T-C");
        final ApplyResult result = new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);

        Assert.assertEquals(result.getFileId(), "annotated.csv");
        Assert.assertEquals(result.getResolved(), 1);
        Assert.assertEquals(result.getUnresolved(), 1);
        final Table annotated = TableTestUtils.readTable(root, "annotated.csv");
        Assert.assertEquals(annotated.header(), Arrays.asList("gen_pos", "Note", "score_cadd"));
        Assert.assertEquals(TableTestUtils.column(annotated, "score_cadd"), Arrays.asList("0.73", "NA"));
        Assert.assertEquals(TableTestUtils.column(annotated, "Note"), Arrays.asList("row0", "row1"));
    }

    @Test
    public void testEachDistinctVariantIsScoredOnce() {
        writeSource(K1, K2, "chr6-100-g-a", K1, K2);
        final ApplyResult result = new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);

        Assert.assertEquals(provider.calls.size(), 2);
        Assert.assertEquals(result.getResolved(), 5);
        Assert.assertEquals(TableTestUtils.column(TableTestUtils.readTable(root, "annotated.csv"), "score_cadd"),
                Arrays.asList("0.73", "0.1", "0.73", "0.73", "0.1"));
    }

    @Test
    public void testNAAnswersAreCachedToo() {
        writeSource("6-999-T-C", "6-999-T-C");
        new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);
        Assert.assertEquals(provider.calls.size(), 1);
    }

    @Test
    public void testRowsWithoutKeyAreNotSentToTheProvider() {
        writeSource("", "not a key", K1);
        final ApplyResult result = new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);
        Assert.assertEquals(provider.calls, Collections.singletonList(VariantKey.parse(K1).get()));
        Assert.assertEquals(result.getUnresolved(), 2);
        Assert.assertNull(provider.transcripts.get(0));
    }

    @Test
    public void testUnavailableVariantGetsNAAndRunContinues() {
        provider.unavailable.add(VariantKey.parse(K1).get());
        writeSource(K1, K2);
        final ApplyResult result = new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);
        Assert.assertEquals(result.getResolved(), 1);
        Assert.assertEquals(TableTestUtils.column(TableTestUtils.readTable(root, "annotated.csv"), "score_cadd"), Arrays.asList("NA", "0.1"));
    }

    @Test
    public void testSystemicFailureWritesNothing() {
        provider.failAfter = 1;
        writeSource(K1, K2);
        Assert.assertThrows(AnnotationProviderException.SystemicProviderFailure.class,
                () -> new ApplyEngine(store, registry).applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false));
        Assert.assertFalse(store.exists("annotated.csv"));
        Assert.assertEquals(store.list(""), Collections.singletonList("merged.csv"));
    }

    @Test
    public void testMaxEntriesCapsProviderCalls() {
        writeSource(K1, K2, K1);
        final ApplyEngine engine = new ApplyEngine(store, registry, KeyColumnMapping.mergedOutput(), null,
                config("annotation_max_entries", "1"));
        final ApplyResult result = engine.applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);

        Assert.assertEquals(provider.calls.size(), 1);
        Assert.assertEquals(result.getResolved(), 2);
        Assert.assertEquals(result.getUnresolved(), 1);
        Assert.assertEquals(TableTestUtils.column(TableTestUtils.readTable(root, "annotated.csv"), "score_cadd"),
                Arrays.asList("0.73", "NA", "0.73"));
    }

    @Test
    public void testNAValueIsConfigurable() {
        writeSource("6-999-T-C");
        new ApplyEngine(store, registry, KeyColumnMapping.mergedOutput(), null, config("na_value", "."))
                .applyAnnotation("annotated.csv", AnnotationTool.CADD, "merged.csv", false);
        Assert.assertEquals(TableTestUtils.column(TableTestUtils.readTable(root, "annotated.csv"), "score_cadd"),
                Collections.singletonList("."));
    }

    @Test
    public void testAnnotatingTwiceAppendsDistinctColumns() {
        writeSource(K1);
        final ApplyEngine engine = new ApplyEngine(store, registry);
        engine.applyAnnotation("once.csv", AnnotationTool.CADD, "merged.csv", false);
        engine.applyAnnotation("twice.csv", AnnotationTool.CADD, "once.csv", false);
        Assert.assertEquals(TableTestUtils.readTable(root, "twice.csv").header(),
                Arrays.asList("gen_pos", "Note", "score_cadd", "score_cadd_1"));
    }

    @Test
    public void testAppendedColumnNames() {
        Assert.assertEquals(ApplyEngine.appendedColumnNames(Arrays.asList("gen_pos", "DS_AG_spliceai", "DS_AG_spliceai_1"),
                Arrays.asList("DS_AG", "DS_AL"), AnnotationTool.SPLICEAI),
                Arrays.asList("DS_AG_spliceai_2", "DS_AL_spliceai"));
    }

    @Test
    public void testInvalidRequests() {
        writeSource(K1);
        final ApplyEngine engine = new ApplyEngine(store, registry);
        Assert.assertThrows(UserException.ValidationError.class,
                () -> engine.applyAnnotation("a.csv", AnnotationTool.SPLICEAI, "merged.csv", false));
        Assert.assertThrows(UserException.InvalidExtension.class,
                () -> engine.applyAnnotation("a.tsv", AnnotationTool.CADD, "merged.csv", false));
        Assert.assertThrows(UserException.PathConflict.class,
                () -> engine.applyAnnotation("merged.csv", AnnotationTool.CADD, "merged.csv", false));
        Assert.assertThrows(UserException.NotFound.class,
                () -> engine.applyAnnotation("a.csv", AnnotationTool.CADD, "absent.csv", false));
        TableTestUtils.writeTable(root, "nokey.csv", TableTestUtils.singleColumn("Gene", "BRCA1"));
        Assert.assertThrows(UserException.ValidationError.class,
                () -> engine.applyAnnotation("a.csv", AnnotationTool.CADD, "nokey.csv", false));
        Assert.assertTrue(provider.calls.isEmpty());
    }

    @Test
    public void testAnnotatingInPlaceWithOverride() {
        writeSource(K1);
        new ApplyEngine(store, registry).applyAnnotation("merged.csv", AnnotationTool.CADD, "merged.csv", true);
        Assert.assertEquals(TableTestUtils.column(TableTestUtils.readTable(root, "merged.csv"), "score_cadd"),
                Collections.singletonList("0.73"));
    }

    @Test
    public void testRegistry() {
        Assert.assertEquals(registry.getRegisteredTools(), Collections.singleton(AnnotationTool.CADD));
        final RecordingProvider replacement = new RecordingProvider();
        registry.register(AnnotationTool.CADD, replacement);
        Assert.assertTrue(provider.closed);
        Assert.assertSame(registry.get(AnnotationTool.CADD), replacement);
        Assert.assertThrows(UserException.ValidationError.class, () -> registry.get(AnnotationTool.ALPHAMISSENSE));
    }
}
