package net.synchro.util.config;

/**
 * A source of configuration values.
 * Keys are hierarchical dot-delimited lowercase names, such as
 * "synchro.parser.maxTrees"; absent values are reported as null.
 */
public interface Configuration {

    Configuration NULL = new DynamicConfiguration();

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
