/**
 * HTTP dashboard service for Cutline Sight.
 *
 * <p>
 * Wires the core engine to an HTTP event feed and serves snapshots, CSV
 * exports and health probes over the JDK HTTP server.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.cutlinesight.service.CutlineSightService}: main entry point</li>
 * <li>{@link com.cutlinesight.service.DashboardServer}: HTTP endpoints</li>
 * <li>{@link com.cutlinesight.service.HttpEventFeed}: feed client</li>
 * <li>{@link com.cutlinesight.service.ServiceConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cutlinesight.service;
