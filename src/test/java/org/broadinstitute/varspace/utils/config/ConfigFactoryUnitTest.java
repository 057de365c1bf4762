package org.broadinstitute.varspace.utils.config;

import org.broadinstitute.varspace.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public final class ConfigFactoryUnitTest extends BaseTest {

    @Test
    public void testBundledDefaults() {
        final WorkspaceConfig config = ConfigFactory.getInstance().create(WorkspaceConfig.class);
        Assert.assertEquals(config.table_extension(), ".csv");
        Assert.assertEquals(config.default_rows_per_page(), 100);
        Assert.assertEquals(config.lock_read_wait_millis(), 30000L);
        Assert.assertEquals(config.lock_write_wait_millis(), 0L);
        Assert.assertEquals(config.na_value(), "NA");
        Assert.assertEquals(config.annotation_max_entries(), Integer.MAX_VALUE);
        Assert.assertEquals(config.liftover_contig_prefix(), "chr");
    }

    @Test
    public void testImportsOverrideDefaults() {
        final Map<String, String> overrides = new HashMap<>();
        overrides.put("na_value", ".");
        overrides.put("annotation_max_entries", "10");
        final WorkspaceConfig config = ConfigFactory.getInstance().create(WorkspaceConfig.class, overrides);
        Assert.assertEquals(config.na_value(), ".");
        Assert.assertEquals(config.annotation_max_entries(), 10);
        Assert.assertEquals(config.table_extension(), ".csv");
    }

    @Test
    public void testConfigFileNamedByPathVariable() throws IOException {
        final Path file = createTempDir("config").resolve("custom.properties");
        Files.write(file, Arrays.asList("workspace_root = /data/ws", "lock_read_wait_millis = 5"), StandardCharsets.UTF_8);
        final String previous = org.aeonbits.owner.ConfigFactory.getProperty(WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME);
        org.aeonbits.owner.ConfigFactory.setProperty(WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME, file.toString());
        try {
            final WorkspaceConfig config = ConfigFactory.getInstance().create(WorkspaceConfig.class);
            Assert.assertEquals(config.workspace_root(), "/data/ws");
            Assert.assertEquals(config.lock_read_wait_millis(), 5L);
            Assert.assertEquals(config.na_value(), "NA");
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME,
                    previous == null ? ConfigFactory.NO_PATH_VARIABLE_VALUE : previous);
        }
    }

    @Test
    public void testSourcesPathVariables() {
        Assert.assertEquals(ConfigFactory.getInstance().getSourcesAnnotationPathVariables(WorkspaceConfig.class),
                Collections.singletonList(WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME));
    }

    @Test
    public void testCachedInstanceIsShared() {
        Assert.assertSame(ConfigFactory.getInstance().getWorkspaceConfig(), ConfigFactory.getInstance().getWorkspaceConfig());
    }
}
