/**
 * Window statistics shared by the statistical detectors.
 *
 * @since 1.0.0
 */
package com.fleetsentinel.core.stats;
