/**
 * Batch execution across weather sources.
 *
 * <p>A batch runs in three steps:
 * <pre>
 * Pre-resolve coordinates (once) → Dispatch sources (parallel or serial) → Join in source order
 * </pre>
 *
 * <p>Each source call runs on a bounded worker pool and has its own deadline. A timeout
 * cancels that call only and is reported as a {@code "timeout"} observation. There are
 * no retries. The geocode cache is written before dispatch and only read afterwards.
 *
 * @see fr.lapetina.weather.aggregator.orchestration.FetchOrchestrator
 */
package fr.lapetina.weather.aggregator.orchestration;
