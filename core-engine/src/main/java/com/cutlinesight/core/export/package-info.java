/**
 * Export of the filtered event list.
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.export;
