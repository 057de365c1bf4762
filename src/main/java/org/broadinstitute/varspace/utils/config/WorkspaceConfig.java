package org.broadinstitute.varspace.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration for the workspace engine.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:WorkspaceConfig.properties",
 *        3)   "classpath:org/broadinstitute/varspace/utils/config/WorkspaceConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + WorkspaceConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "file:WorkspaceConfig.properties",
        "classpath:org/broadinstitute/varspace/utils/config/WorkspaceConfig.properties"
})
public interface WorkspaceConfig extends Mutable, Accessible {

    /**
     * Name of the variable that may point to a configuration file overriding the bundled defaults.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "WorkspaceConfig.pathToConfig";

    // ----------------------------------------------------------
    // Workspace Options:
    // ----------------------------------------------------------

    @Key("workspace_root")
    @DefaultValue("workspace")
    String workspace_root();

    /**
     * Extension required for files written by merge and apply.
     */
    @Key("table_extension")
    @DefaultValue(".csv")
    String table_extension();

    @Key("default_rows_per_page")
    @DefaultValue("100")
    int default_rows_per_page();

    // ----------------------------------------------------------
    // Locking Options:
    // ----------------------------------------------------------

    @Key("lock_read_wait_millis")
    @DefaultValue("30000")
    long lock_read_wait_millis();

    /**
     * How long a mutation waits for a busy file; 0 fails fast.
     */
    @Key("lock_write_wait_millis")
    @DefaultValue("0")
    long lock_write_wait_millis();

    // ----------------------------------------------------------
    // Annotation Options:
    // ----------------------------------------------------------

    /**
     * Sentinel written into score cells that could not be resolved.
     */
    @Key("na_value")
    @DefaultValue("NA")
    String na_value();

    /**
     * Maximum number of rows sent to an annotation provider in one run.
     */
    @Key("annotation_max_entries")
    @DefaultValue("2147483647")
    int annotation_max_entries();

    /**
     * Number of distinct variants whose annotations are kept for reuse during one apply run.
     */
    @Key("annotation_cache_size")
    @DefaultValue("100000")
    int annotation_cache_size();

    @Key("liftover_contig_prefix")
    @DefaultValue("chr")
    String liftover_contig_prefix();
}
