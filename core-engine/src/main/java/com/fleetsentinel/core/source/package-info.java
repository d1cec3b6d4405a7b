/**
 * The seam between the engine and the metric store.
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.source;
