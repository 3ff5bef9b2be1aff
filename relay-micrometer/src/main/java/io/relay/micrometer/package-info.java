/**
 * Micrometer bridge for {@link io.relay.spi.MetricsExporter}.
 */
package io.relay.micrometer;
