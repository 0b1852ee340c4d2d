/**
 * Configuration layer: embedded defaults, YAML loading, precedence merging and the composition root that turns a
 * {@link ca.gc.cra.xlog.config.ServeConfig} into a runnable {@link ca.gc.cra.xlog.application.pipeline.IngestServer}.
 */
package ca.gc.cra.xlog.config;
