/**
 * Session ingestion: raw record normalization, the deterministic synthetic
 * fallback and asynchronous acquisition with a staleness guard.
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.ingest;
