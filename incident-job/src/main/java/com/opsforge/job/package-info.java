/**
 * Batch job that runs incident documents through the OpsForge analytics core.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.opsforge.job.IncidentBatchJob}: main entry point</li>
 * <li>{@link com.opsforge.job.IncidentBatchProcessor}: concurrent,
 * failure-isolated processing</li>
 * <li>{@link com.opsforge.job.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.opsforge.job;
