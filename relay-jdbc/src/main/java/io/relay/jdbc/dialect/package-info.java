/**
 * Database dialects, discovered through {@link java.util.ServiceLoader}.
 *
 * @see io.relay.jdbc.dialect.Dialects#detect
 */
package io.relay.jdbc.dialect;
