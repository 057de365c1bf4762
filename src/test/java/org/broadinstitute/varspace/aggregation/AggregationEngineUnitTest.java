package org.broadinstitute.varspace.aggregation;

import org.broadinstitute.varspace.exceptions.UserException;
import org.broadinstitute.varspace.query.FilterOperator;
import org.broadinstitute.varspace.query.FilterSpec;
import org.broadinstitute.varspace.testutils.BaseTest;
import org.broadinstitute.varspace.testutils.TableTestUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;

public final class AggregationEngineUnitTest extends BaseTest {

    private AggregationEngine engine;

    @BeforeMethod
    public void setUp() {
        final Path root = createTempDir("aggregation");
        TableTestUtils.writeTable(root, "scores.csv", TableTestUtils.table(Arrays.asList("Gene", "Score", "Empty"),
                new String[] {"BRCA1", "1", ""},
                new String[] {"BRCA2", "2", ""},
                new String[] {"TP53", "x", ""},
                new String[] {"EGFR", "4", ""}));
        engine = new AggregationEngine(TableTestUtils.newStore(root));
    }

    @DataProvider(name = "actions")
    public Object[][] actions() {
        return new Object[][] {
                {AggregationAction.SUM, 7.0},
                {AggregationAction.AVG, 7.0 / 3},
                {AggregationAction.MIN, 1.0},
                {AggregationAction.MAX, 4.0},
        };
    }

    @Test(dataProvider = "actions")
    public void testNumericActionsSkipNonNumericCells(final AggregationAction action, final double expected) {
        final AggregationResult result = engine.computeAggregation("scores.csv", "Score", action, FilterSpec.none());
        assertEqualsDoubleSmart(result.getValue().getAsDouble(), expected);
        Assert.assertEquals(result.getSkipped(), 1);
        Assert.assertEquals(result.getMatched(), 4);
        Assert.assertEquals(result.getNumericCount() + result.getSkipped(), result.getMatched());
    }

    @Test
    public void testAverageIsRoughlyTwoAndAThird() {
        final AggregationResult avg = engine.computeAggregation("scores.csv", "Score", AggregationAction.AVG, FilterSpec.none());
        Assert.assertEquals(avg.getValue().getAsDouble(), 2.333, 0.001);
    }

    @Test
    public void testCountIncludesEveryMatchingRow() {
        final AggregationResult count = engine.computeAggregation("scores.csv", "Score", AggregationAction.COUNT, FilterSpec.none());
        Assert.assertEquals(count.format("NA"), "4");
        Assert.assertEquals(count.getSkipped(), 0);
        Assert.assertEquals(count.getNumericCount(), 4);
    }

    @Test
    public void testAggregatesOverTheFilterNotAPage() {
        final FilterSpec filter = FilterSpec.where("Gene", FilterOperator.CONTAINS, "brca");
        final AggregationResult sum = engine.computeAggregation("scores.csv", "Score", AggregationAction.SUM, filter);
        Assert.assertEquals(sum.format("NA"), "3");
        Assert.assertEquals(sum.getMatched(), 2);
    }

    @Test
    public void testNoNumericCellsIsNA() {
        final AggregationResult result = engine.computeAggregation("scores.csv", "Empty", AggregationAction.MAX, FilterSpec.none());
        Assert.assertTrue(result.isNA());
        Assert.assertEquals(result.format("NA"), "NA");
        Assert.assertEquals(result.getSkipped(), 4);

        final AggregationResult nothingMatched = engine.computeAggregation("scores.csv", "Score", AggregationAction.SUM,
                FilterSpec.where("Gene", FilterOperator.EQUALS, "KRAS"));
        Assert.assertTrue(nothingMatched.isNA());
        Assert.assertEquals(nothingMatched.getMatched(), 0);
    }

    @Test
    public void testFormat() {
        Assert.assertEquals(engine.computeAggregation("scores.csv", "Score", AggregationAction.SUM, FilterSpec.none()).format("NA"), "7");
        Assert.assertEquals(engine.computeAggregation("scores.csv", "Score", AggregationAction.AVG, FilterSpec.none()).format("NA"),
                Double.toString(7.0 / 3));
    }

    @Test
    public void testNoneCannotBeComputed() {
        Assert.assertThrows(UserException.ValidationError.class,
                () -> engine.computeAggregation("scores.csv", "Score", AggregationAction.NONE, FilterSpec.none()));
    }

    @Test
    public void testUnknownColumnAndFile() {
        Assert.assertThrows(UserException.ValidationError.class,
                () -> engine.computeAggregation("scores.csv", "Missing", AggregationAction.SUM, FilterSpec.none()));
        Assert.assertThrows(UserException.NotFound.class,
                () -> engine.computeAggregation("absent.csv", "Score", AggregationAction.SUM, FilterSpec.none()));
    }

    @Test
    public void testComputeAll() {
        final AggregationSpec spec = AggregationSpec.empty()
                .with("Score", AggregationAction.MAX)
                .with("Gene", AggregationAction.COUNT)
                .with("Empty", AggregationAction.SUM)
                .with("Empty", AggregationAction.NONE);

        final AggregationSpec computed = engine.computeAll("scores.csv", spec, FilterSpec.none());

        Assert.assertEquals(computed.entries().keySet(), new LinkedHashSet<>(Arrays.asList("Score", "Gene")));
        Assert.assertEquals(computed.getResult("Score").get().format("NA"), "4");
        Assert.assertEquals(computed.getResult("Gene").get().format("NA"), "4");
        Assert.assertFalse(spec.getResult("Score").isPresent());
        Assert.assertFalse(computed.with("Score", AggregationAction.MIN).getResult("Score").isPresent());
    }

    @Test
    public void testActionNames() {
        Assert.assertEquals(AggregationAction.fromName("avg"), AggregationAction.AVG);
        Assert.assertEquals(AggregationAction.fromName(" Count "), AggregationAction.COUNT);
        Assert.assertTrue(AggregationAction.MIN.isNumeric());
        Assert.assertFalse(AggregationAction.COUNT.isNumeric());
        Assert.assertThrows(UserException.ValidationError.class, () -> AggregationAction.fromName("median"));
    }
}
